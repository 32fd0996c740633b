package madn.core.ingest;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import madn.core.model.AnalyzerReport;
import madn.core.model.DiagnosticHypothesis;
import madn.core.model.Evidence;
import madn.core.model.EvidenceStrength;
import madn.core.model.EvidenceType;
import madn.core.model.Finding;
import madn.core.model.ParseError;
import madn.core.model.Probabilities;
import madn.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class AnalyzerReportParser {
    private static final Logger log = LoggerFactory.getLogger(AnalyzerReportParser.class);
    private static final Set<String> TRUTHY = Set.of("true", "yes", "positive");

    private final ObjectMapper objectMapper;

    public AnalyzerReportParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, AnalyzerReport> parseAll(Map<String, JsonNode> raw) {
        Map<String, AnalyzerReport> reports = new LinkedHashMap<>();
        if (raw == null) {
            return reports;
        }
        raw.forEach((analyzer, node) -> reports.put(analyzer, parse(analyzer, node)));
        return reports;
    }

    public AnalyzerReport parse(String analyzer, JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return fallback(analyzer, ParseError.Kind.EMPTY_INPUT, "no report supplied");
        }
        if (raw.isTextual()) {
            return parseText(analyzer, raw.asText());
        }
        if (!raw.isObject()) {
            return fallback(analyzer, ParseError.Kind.INVALID_FIELD, "report is a " + raw.getNodeType());
        }
        return decode(analyzer, raw);
    }

    public AnalyzerReport parseText(String analyzer, String text) {
        if (text == null || text.isBlank()) {
            return fallback(analyzer, ParseError.Kind.EMPTY_INPUT, "empty report text");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start == -1 || end <= start) {
            return fallback(analyzer, ParseError.Kind.NO_STRUCTURED_PAYLOAD, "no embedded JSON object");
        }
        try {
            return decode(analyzer, objectMapper.readTree(text.substring(start, end + 1)));
        } catch (JsonProcessingException e) {
            return fallback(analyzer, ParseError.Kind.INVALID_JSON, malformedAt(e.getLocation()));
        }
    }

    private AnalyzerReport decode(String analyzer, JsonNode node) {
        boolean definitive = node.path("is_definitive").asBoolean(false)
                || "confirmed".equalsIgnoreCase(node.path("diagnostic_certainty").asText(""));
        JsonNode top = node.path("top_diagnosis");
        return new AnalyzerReport(
                analyzer,
                diagnoses(analyzer, node.path("diagnoses")),
                probability(analyzer, "confidence", node.path("confidence"), 0.0),
                findings(node.path("findings")),
                hypotheses(analyzer, node.path("hypotheses")),
                strings(node.has("alerts") ? node.path("alerts") : node.path("flags")),
                definitive,
                top.isTextual() ? top.asText() : null,
                null
        );
    }

    private Map<String, Double> diagnoses(String analyzer, JsonNode node) {
        Map<String, Double> diagnoses = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getKey().isBlank()) {
                continue;
            }
            diagnoses.put(entry.getKey(), probability(analyzer, entry.getKey(), entry.getValue(), 0.0));
        }
        return diagnoses;
    }

    private List<Finding> findings(JsonNode node) {
        List<Finding> findings = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual()) {
                findings.add(Finding.present(item.asText(), Severity.MODERATE, ""));
                continue;
            }
            if (!item.isObject()) {
                continue;
            }
            findings.add(new Finding(
                    item.path("name").asText("Unknown"),
                    item.path("present").asBoolean(true),
                    evidence(item.path("evidence")),
                    enumValue(Severity.class, item.path("severity"), Severity.MODERATE),
                    item.path("clinical_significance").asText("")
            ));
        }
        return findings;
    }

    private List<DiagnosticHypothesis> hypotheses(String analyzer, JsonNode node) {
        List<DiagnosticHypothesis> hypotheses = new ArrayList<>();
        for (JsonNode item : node) {
            String diagnosis = item.path("diagnosis").asText("");
            if (diagnosis.isBlank()) {
                continue;
            }
            JsonNode icd = item.path("icd10_code");
            hypotheses.add(new DiagnosticHypothesis(
                    diagnosis,
                    icd.isTextual() ? icd.asText() : null,
                    probability(analyzer, diagnosis, item.path("probability"), 0.0),
                    evidence(item.path("supporting_evidence")),
                    evidence(item.path("opposing_evidence")),
                    strings(item.path("criteria_met")),
                    strings(item.path("criteria_not_met")),
                    strings(item.path("differential_diagnoses")),
                    strings(item.path("recommended_workup")),
                    enumValue(Severity.class, item.path("urgency"), Severity.MODERATE)
            ));
        }
        return hypotheses;
    }

    private List<Evidence> evidence(JsonNode node) {
        List<Evidence> evidence = new ArrayList<>();
        for (JsonNode item : node) {
            EvidenceType type = evidenceType(item.path("type").asText(""));
            if (type == null) {
                log.debug("event=evidence_skipped reason=unknown_type type={}", item.path("type").asText(""));
                continue;
            }
            evidence.add(new Evidence(
                    type,
                    item.path("description").asText(""),
                    textOrNull(item.path("value")),
                    textOrNull(item.path("normal_range")),
                    item.path("is_abnormal").asBoolean(false),
                    enumValue(EvidenceStrength.class, item.path("strength"), EvidenceStrength.MODERATE),
                    item.path("source").asText("")
            ));
        }
        return evidence;
    }

    private double probability(String analyzer, String field, JsonNode value, double fallback) {
        double parsed;
        if (value.isNumber()) {
            parsed = value.asDouble();
        } else if (value.isBoolean()) {
            parsed = value.asBoolean() ? 1.0 : 0.0;
        } else if (value.isTextual()) {
            String text = value.asText().trim();
            try {
                parsed = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                parsed = TRUTHY.contains(text.toLowerCase(Locale.ROOT)) ? 1.0 : 0.0;
            }
        } else {
            return fallback;
        }
        if (Double.isNaN(parsed) || parsed < 0.0 || parsed > 1.0) {
            log.warn("event=report_value_clamped analyzer={} field={} value={}", analyzer, field, parsed);
            return Double.isNaN(parsed) ? fallback : Probabilities.clamp(parsed, 0.0, 1.0);
        }
        return parsed;
    }

    private static EvidenceType evidenceType(String raw) {
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "imaging":
                return EvidenceType.IMAGING;
            case "ecg":
                return EvidenceType.ECG;
            case "lab":
            case "laboratory":
                return EvidenceType.LAB;
            case "symptom":
                return EvidenceType.SYMPTOM;
            case "vital":
            case "vital_sign":
                return EvidenceType.VITAL_SIGN;
            case "exam":
            case "physical_exam":
                return EvidenceType.PHYSICAL_EXAM;
            case "history":
                return EvidenceType.HISTORY;
            default:
                return null;
        }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, JsonNode node, E fallback) {
        if (!node.isTextual()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, node.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode value : node) {
            if (value.isValueNode() && !value.asText().isBlank()) {
                values.add(value.asText());
            }
        }
        return values;
    }

    private static String textOrNull(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    // Jackson messages quote the offending token; only the position may leave this class
    static String malformedAt(JsonLocation location) {
        if (location == null) {
            return "malformed JSON payload";
        }
        return "malformed JSON payload at line " + location.getLineNr() + " column " + location.getColumnNr();
    }

    private static AnalyzerReport fallback(String analyzer, ParseError.Kind kind, String message) {
        log.warn("event=report_parse_failed analyzer={} kind={} message={}", analyzer, kind, message);
        return AnalyzerReport.defaultFor(analyzer, new ParseError(kind, message));
    }
}

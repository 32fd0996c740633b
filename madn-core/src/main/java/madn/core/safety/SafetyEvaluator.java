package madn.core.safety;

import madn.core.model.AnalyzerReport;
import madn.core.model.Probabilities;
import madn.core.tables.ClinicalTables;
import madn.core.tables.DiagnosisNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

@Component
public class SafetyEvaluator {
    static final double SIGNIFICANT_PROBABILITY = 0.3;
    static final double CONTRADICTION_SPREAD = 0.4;
    static final double LOW_CONFIDENCE = 0.4;
    static final double HIGH_RELIABILITY = 0.6;

    private final ClinicalTables tables;
    private final CriticalConditionScanner scanner;

    public SafetyEvaluator(ClinicalTables tables, CriticalConditionScanner scanner) {
        this.tables = tables;
        this.scanner = scanner;
    }

    public SafetyAssessment evaluate(Map<String, AnalyzerReport> reports) {
        if (reports == null || reports.isEmpty()) {
            return noData();
        }
        SortedMap<String, AnalyzerReport> ordered = new TreeMap<>(reports);

        List<CriticalAlert> alerts = scanner.scan(ordered);
        List<Contradiction> contradictions = contradictions(ordered);
        CalibrationSummary calibration = calibration(ordered);
        List<String> missing = missingData(ordered);

        RiskTier risk = riskTier(alerts, contradictions, calibration);
        HumanReviewDecision review = humanReview(risk, alerts, contradictions, missing);

        return new SafetyAssessment(
                risk,
                alerts,
                contradictions,
                calibration,
                missing,
                review,
                contraindications(ordered, alerts),
                flags(ordered, risk, alerts),
                SafetyAssessment.DISCLAIMER
        );
    }

    List<Contradiction> contradictions(SortedMap<String, AnalyzerReport> reports) {
        DiagnosisNormalizer normalizer = tables.normalizer();
        Map<String, String> names = new TreeMap<>();
        Map<String, SortedMap<String, Double>> byDiagnosis = new TreeMap<>();
        reports.forEach((analyzer, report) -> report.diagnoses().forEach((name, probability) -> {
            String key = normalizer.key(name);
            names.putIfAbsent(key, normalizer.canonicalName(name));
            byDiagnosis.computeIfAbsent(key, k -> new TreeMap<>()).merge(analyzer, probability, Math::max);
        }));

        List<Contradiction> contradictions = new ArrayList<>();
        byDiagnosis.forEach((key, probabilities) -> {
            if (probabilities.size() < 2) {
                return;
            }
            double max = probabilities.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            double min = probabilities.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            if (max <= SIGNIFICANT_PROBABILITY) {
                return;
            }
            double spread = Probabilities.round(max - min, 4);
            if (spread > CONTRADICTION_SPREAD) {
                contradictions.add(new Contradiction(
                        names.get(key),
                        probabilities,
                        spread,
                        "Requires additional clinical correlation"
                ));
            }
        });
        return contradictions;
    }

    static CalibrationSummary calibration(SortedMap<String, AnalyzerReport> reports) {
        List<String> low = new ArrayList<>();
        double sum = 0.0;
        for (AnalyzerReport report : reports.values()) {
            sum += report.confidence();
            if (report.confidence() < LOW_CONFIDENCE) {
                low.add(report.analyzer());
            }
        }
        double average = Probabilities.round(sum / reports.size(), 3);
        CalibrationSummary.Reliability reliability;
        if (average >= HIGH_RELIABILITY) {
            reliability = CalibrationSummary.Reliability.HIGH;
        } else if (average >= LOW_CONFIDENCE) {
            reliability = CalibrationSummary.Reliability.MODERATE;
        } else {
            reliability = CalibrationSummary.Reliability.LOW;
        }
        return new CalibrationSummary(average, reliability, low);
    }

    static List<String> missingData(SortedMap<String, AnalyzerReport> reports) {
        return reports.values().stream()
                .filter(r -> r.reportsIncompleteData() || r.malformed())
                .map(AnalyzerReport::analyzer)
                .toList();
    }

    static RiskTier riskTier(
            List<CriticalAlert> alerts,
            List<Contradiction> contradictions,
            CalibrationSummary calibration
    ) {
        if (alerts.stream().anyMatch(CriticalAlert::timeCritical)) {
            return RiskTier.CRITICAL;
        }
        if (!alerts.isEmpty()) {
            return RiskTier.HIGH;
        }
        if (contradictions.size() > 1 || calibration.reliability() == CalibrationSummary.Reliability.LOW) {
            return RiskTier.MODERATE;
        }
        return RiskTier.LOW;
    }

    static HumanReviewDecision humanReview(
            RiskTier risk,
            List<CriticalAlert> alerts,
            List<Contradiction> contradictions,
            List<String> missing
    ) {
        List<String> reasons = new ArrayList<>();
        switch (risk) {
            case CRITICAL:
            case HIGH:
                reasons.add("Critical or high-risk findings present");
                break;
            case MODERATE:
            case LOW:
                break;
            default:
                throw new IllegalStateException("Unhandled risk tier: " + risk);
        }
        if (!alerts.isEmpty()) {
            reasons.add("Critical conditions detected: "
                    + alerts.stream().map(CriticalAlert::condition).toList());
        }
        if (contradictions.size() > 1) {
            reasons.add("Significant disagreement between specialist analyzers");
        }
        if (missing.size() > 1) {
            reasons.add("Insufficient data for multiple analyzers: " + missing);
        }
        return new HumanReviewDecision(!reasons.isEmpty(), reasons);
    }

    private List<String> contraindications(SortedMap<String, AnalyzerReport> reports, List<CriticalAlert> alerts) {
        Set<String> conditions = new LinkedHashSet<>();
        alerts.forEach(alert -> conditions.add(alert.condition()));
        reports.values().forEach(report -> report.diagnoses().forEach((name, probability) -> {
            if (probability > SIGNIFICANT_PROBABILITY) {
                conditions.add(tables.normalizer().canonicalName(name));
            }
        }));
        Set<String> warnings = new LinkedHashSet<>();
        conditions.forEach(condition -> warnings.addAll(tables.contraindicationsFor(condition)));
        return List.copyOf(warnings);
    }

    private static List<String> flags(
            SortedMap<String, AnalyzerReport> reports,
            RiskTier risk,
            List<CriticalAlert> alerts
    ) {
        List<String> flags = new ArrayList<>();
        if (risk == RiskTier.CRITICAL) {
            flags.add("CRITICAL: Immediate clinical attention required");
        }
        for (CriticalAlert alert : alerts) {
            flags.add("CRITICAL: " + alert.condition() + " - " + alert.requiredAction());
        }
        Map<String, String> parseErrors = new LinkedHashMap<>();
        reports.forEach((analyzer, report) -> {
            if (report.malformed()) {
                parseErrors.put(analyzer, report.parseError().kind().name());
            }
        });
        parseErrors.forEach((analyzer, kind) ->
                flags.add("WARNING: report from " + analyzer + " was unreadable (" + kind + ")"));
        return flags;
    }

    private static SafetyAssessment noData() {
        return new SafetyAssessment(
                RiskTier.HIGH,
                List.of(),
                List.of(),
                CalibrationSummary.unknown(),
                List.of(),
                new HumanReviewDecision(true, List.of("No analyzer reports provided for safety evaluation")),
                List.of(),
                List.of("NO_DATA_PROVIDED"),
                SafetyAssessment.DISCLAIMER
        );
    }
}

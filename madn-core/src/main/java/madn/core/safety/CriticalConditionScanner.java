package madn.core.safety;

import madn.core.model.AnalyzerReport;
import madn.core.model.DiagnosticHypothesis;
import madn.core.model.Evidence;
import madn.core.model.Finding;
import madn.core.tables.ClinicalTables;
import madn.core.tables.CriticalCondition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// whole-word keyword match, at most one alert per condition
@Component
public class CriticalConditionScanner {
    private final ClinicalTables tables;
    private final NegationDetector negationDetector;
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public CriticalConditionScanner(ClinicalTables tables, NegationDetector negationDetector) {
        this.tables = tables;
        this.negationDetector = negationDetector;
    }

    public List<CriticalAlert> scan(Map<String, AnalyzerReport> reports) {
        SortedMap<String, String> texts = new TreeMap<>();
        reports.forEach((analyzer, report) -> texts.put(analyzer, searchableText(report)));

        List<CriticalAlert> alerts = new ArrayList<>();
        for (CriticalCondition condition : tables.criticalConditions()) {
            String matchedKeyword = null;
            Set<String> sources = new LinkedHashSet<>();
            boolean allNegated = true;
            for (String keyword : condition.keywords()) {
                Pattern pattern = patternFor(keyword);
                for (Map.Entry<String, String> entry : texts.entrySet()) {
                    Matcher matcher = pattern.matcher(entry.getValue());
                    while (matcher.find()) {
                        if (matchedKeyword == null) {
                            matchedKeyword = keyword;
                        }
                        sources.add(entry.getKey());
                        if (!negationDetector.isNegated(entry.getValue(), matcher.start())) {
                            allNegated = false;
                        }
                    }
                }
            }
            if (matchedKeyword != null) {
                alerts.add(new CriticalAlert(
                        condition.condition(),
                        matchedKeyword,
                        condition.action(),
                        condition.timeCritical(),
                        List.copyOf(sources),
                        allNegated
                ));
            }
        }
        return alerts;
    }

    static String searchableText(AnalyzerReport report) {
        StringBuilder text = new StringBuilder();
        report.diagnoses().keySet().forEach(name -> append(text, name));
        report.primaryImpression().ifPresent(name -> append(text, name));
        for (Finding finding : report.findings()) {
            append(text, finding.name());
            append(text, finding.clinicalSignificance());
            finding.evidence().forEach(e -> append(text, e.description()));
        }
        for (DiagnosticHypothesis hypothesis : report.hypotheses()) {
            append(text, hypothesis.diagnosis());
            hypothesis.supportingEvidence().stream().map(Evidence::description).forEach(d -> append(text, d));
        }
        report.alerts().forEach(alert -> append(text, alert));
        return text.toString().toLowerCase(Locale.ROOT);
    }

    private static void append(StringBuilder text, String value) {
        if (value != null && !value.isBlank()) {
            text.append(value).append(". ");
        }
    }

    private Pattern patternFor(String keyword) {
        return patterns.computeIfAbsent(keyword, k -> Pattern.compile(
                "(?<![a-z0-9])" + Pattern.quote(k.toLowerCase(Locale.ROOT)) + "(?![a-z0-9])"));
    }
}

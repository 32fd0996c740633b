package madn.core.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record AnalyzerReport(
        String analyzer,
        Map<String, Double> diagnoses,
        double confidence,
        List<Finding> findings,
        List<DiagnosticHypothesis> hypotheses,
        List<String> alerts,
        boolean definitive,
        String topDiagnosis,
        ParseError parseError
) {
    public static final String INCOMPLETE_DATA = "INCOMPLETE_DATA";

    public AnalyzerReport {
        Objects.requireNonNull(analyzer, "analyzer");
        Map<String, Double> copy = new LinkedHashMap<>();
        if (diagnoses != null) {
            diagnoses.forEach((name, probability) -> {
                Objects.requireNonNull(probability, "probability of " + name);
                copy.put(name, Probabilities.requireUnit("probability of " + name, probability));
            });
        }
        diagnoses = Collections.unmodifiableMap(copy);
        Probabilities.requireUnit("confidence", confidence);
        findings = findings == null ? List.of() : List.copyOf(findings);
        hypotheses = hypotheses == null ? List.of() : List.copyOf(hypotheses);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    public static AnalyzerReport defaultFor(String analyzer, ParseError error) {
        return new AnalyzerReport(analyzer, Map.of(), 0.0, List.of(), List.of(), List.of(), false, null, error);
    }

    public static AnalyzerReport of(String analyzer, Map<String, Double> diagnoses, double confidence) {
        return new AnalyzerReport(analyzer, diagnoses, confidence, List.of(), List.of(), List.of(), false, null, null);
    }

    public boolean malformed() {
        return parseError != null;
    }

    // ties resolve to the lexically smaller name
    public Optional<Map.Entry<String, Double>> topEntry() {
        return diagnoses.entrySet().stream()
                .min(Comparator.<Map.Entry<String, Double>>comparingDouble(Map.Entry::getValue).reversed()
                        .thenComparing(Map.Entry::getKey));
    }

    public Optional<String> primaryImpression() {
        if (topDiagnosis != null && !topDiagnosis.isBlank()) {
            return Optional.of(topDiagnosis);
        }
        return topEntry().map(Map.Entry::getKey);
    }

    public Optional<DiagnosticHypothesis> topHypothesis() {
        return hypotheses.stream().max(Comparator.comparingDouble(DiagnosticHypothesis::probability));
    }

    public List<Finding> criticalFindings() {
        return findings.stream().filter(f -> f.severity() == Severity.CRITICAL).toList();
    }

    public boolean hasCriticalFlags() {
        return !alerts.isEmpty() || !criticalFindings().isEmpty();
    }

    public boolean reportsIncompleteData() {
        return alerts.stream().anyMatch(a -> a.toUpperCase(Locale.ROOT).contains("INCOMPLETE"));
    }
}

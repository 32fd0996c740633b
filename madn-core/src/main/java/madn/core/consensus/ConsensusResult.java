package madn.core.consensus;

import madn.core.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ConsensusResult(
        String label,
        double probability,
        double confidence,
        double agreementScore,
        List<String> supportingAnalyzers,
        List<DifferentialDiagnosis> differentials,
        DiagnosticCertainty certainty,
        Severity urgency,
        Map<String, Double> mergedLabels,
        List<String> analyzersUsed,
        Map<String, Double> analyzerConfidences,
        String confirmedBy,
        List<String> flags
) {
    public static final String NO_DIAGNOSIS = "No diagnosis - insufficient data";
    public static final String NO_SIGNIFICANT_DIAGNOSIS = "No significant diagnosis identified";

    public ConsensusResult {
        supportingAnalyzers = List.copyOf(supportingAnalyzers);
        differentials = List.copyOf(differentials);
        mergedLabels = Collections.unmodifiableMap(new LinkedHashMap<>(mergedLabels));
        analyzersUsed = List.copyOf(analyzersUsed);
        analyzerConfidences = Collections.unmodifiableMap(new LinkedHashMap<>(analyzerConfidences));
        flags = List.copyOf(flags);
    }

    public static ConsensusResult insufficientData() {
        return new ConsensusResult(NO_DIAGNOSIS, 0.0, 0.0, 0.0, List.of(), List.of(),
                DiagnosticCertainty.UNCERTAIN, Severity.MODERATE, Map.of(), List.of(), Map.of(), null, List.of());
    }

    public boolean definitive() {
        return certainty == DiagnosticCertainty.CONFIRMED;
    }

    public List<String> differentialNames() {
        return differentials.stream().map(DifferentialDiagnosis::diagnosis).toList();
    }
}

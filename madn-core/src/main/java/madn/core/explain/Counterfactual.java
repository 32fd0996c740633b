package madn.core.explain;

import java.util.List;

public record Counterfactual(
        String currentDiagnosis,
        String alternativeDiagnosis,
        double alternativeProbability,
        List<String> missingEvidence,
        List<String> contradictingEvidence
) {
    public Counterfactual {
        missingEvidence = List.copyOf(missingEvidence);
        contradictingEvidence = List.copyOf(contradictingEvidence);
    }
}

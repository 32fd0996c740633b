package madn.core.explain;

import java.util.List;

public record ConfidenceDecomposition(
        double baseConfidence,
        double evidenceBoost,
        double agreementBoost,
        List<String> penaltyFactors,
        double finalConfidence,
        String calibrationNote
) {
    public ConfidenceDecomposition {
        penaltyFactors = List.copyOf(penaltyFactors);
    }
}

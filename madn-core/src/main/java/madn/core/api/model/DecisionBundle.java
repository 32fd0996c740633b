package madn.core.api.model;

import madn.core.consensus.ConsensusResult;
import madn.core.explain.ExplanationBundle;
import madn.core.safety.SafetyAssessment;

import java.util.List;

public record DecisionBundle(
        String caseId,
        ConsensusResult consensus,
        SafetyAssessment safety,
        ExplanationBundle explanation,
        String auditId,
        List<String> warnings,
        long processingMs
) {
    public DecisionBundle {
        warnings = List.copyOf(warnings);
    }
}

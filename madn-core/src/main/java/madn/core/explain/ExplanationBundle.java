package madn.core.explain;

import madn.core.consensus.DiagnosticCertainty;

import java.util.List;

public record ExplanationBundle(
        String diagnosis,
        double confidence,
        DiagnosticCertainty certainty,
        List<EvidenceAttribution> attributions,
        List<ReasoningStep> reasoningChain,
        ConfidenceDecomposition confidenceDecomposition,
        List<Counterfactual> counterfactuals,
        String oneLineExplanation,
        String detailedExplanation
) {
    public ExplanationBundle {
        attributions = List.copyOf(attributions);
        reasoningChain = List.copyOf(reasoningChain);
        counterfactuals = List.copyOf(counterfactuals);
    }
}

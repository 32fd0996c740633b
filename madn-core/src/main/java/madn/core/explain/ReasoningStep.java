package madn.core.explain;

import java.util.List;

public record ReasoningStep(
        int stepNumber,
        String analyzer,
        Action action,
        String description,
        List<String> evidenceUsed,
        String conclusion,
        double confidenceDelta,
        double runningConfidence
) {
    public enum Action {
        CONFIRMED,
        SUPPORTED,
        EVALUATED
    }

    public ReasoningStep {
        evidenceUsed = List.copyOf(evidenceUsed);
    }
}

package madn.core.orchestrator;

import madn.core.explain.ExplanationBundle;
import madn.core.safety.SafetyAssessment;

import java.util.List;
import java.util.Map;

/**
 * {@code explanation} is null when the compiler failed; {@code failures} maps
 * the failed stage to its error message.
 */
public record OrchestrationResult(
        SafetyAssessment safety,
        ExplanationBundle explanation,
        List<String> warnings,
        Map<String, String> failures
) {
    public OrchestrationResult {
        warnings = List.copyOf(warnings);
        failures = Map.copyOf(failures);
    }
}

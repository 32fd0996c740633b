package madn.core.safety;

import madn.core.policy.ClinicalDisclaimerPolicy;

import java.util.List;

public record SafetyAssessment(
        RiskTier riskTier,
        List<CriticalAlert> criticalAlerts,
        List<Contradiction> contradictions,
        CalibrationSummary calibration,
        List<String> missingDataAnalyzers,
        HumanReviewDecision humanReview,
        List<String> contraindications,
        List<String> flags,
        String disclaimer
) {
    public static final String DISCLAIMER = ClinicalDisclaimerPolicy.DISCLAIMER;

    public SafetyAssessment {
        criticalAlerts = List.copyOf(criticalAlerts);
        contradictions = List.copyOf(contradictions);
        missingDataAnalyzers = List.copyOf(missingDataAnalyzers);
        contraindications = List.copyOf(contraindications);
        flags = List.copyOf(flags);
    }

    /**
     * Used when the evaluator itself failed: nothing was checked, so the case
     * goes to a human.
     */
    public static SafetyAssessment failSafe(String reason) {
        return new SafetyAssessment(
                RiskTier.HIGH,
                List.of(),
                List.of(),
                CalibrationSummary.unknown(),
                List.of(),
                new HumanReviewDecision(true, List.of("Safety evaluation unavailable: " + reason)),
                List.of(),
                List.of("SAFETY_EVALUATION_FAILED"),
                DISCLAIMER
        );
    }

    public boolean humanReviewRequired() {
        return humanReview.required();
    }
}

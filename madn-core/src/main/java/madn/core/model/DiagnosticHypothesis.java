package madn.core.model;

import java.util.List;

public record DiagnosticHypothesis(
        String diagnosis,
        String icd10Code,
        double probability,
        List<Evidence> supportingEvidence,
        List<Evidence> opposingEvidence,
        List<String> criteriaMet,
        List<String> criteriaNotMet,
        List<String> differentialDiagnoses,
        List<String> recommendedWorkup,
        Severity urgency
) {
    public DiagnosticHypothesis {
        if (diagnosis == null || diagnosis.isBlank()) {
            throw new IllegalArgumentException("diagnosis must not be blank");
        }
        Probabilities.requireUnit("probability", probability);
        supportingEvidence = copy(supportingEvidence);
        opposingEvidence = copy(opposingEvidence);
        criteriaMet = copy(criteriaMet);
        criteriaNotMet = copy(criteriaNotMet);
        differentialDiagnoses = copy(differentialDiagnoses);
        recommendedWorkup = copy(recommendedWorkup);
        urgency = urgency == null ? Severity.MODERATE : urgency;
    }

    public static DiagnosticHypothesis of(String diagnosis, double probability) {
        return new DiagnosticHypothesis(diagnosis, null, probability,
                null, null, null, null, null, null, null);
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}

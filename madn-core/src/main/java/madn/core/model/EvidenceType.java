package madn.core.model;

public enum EvidenceType {
    IMAGING,
    ECG,
    LAB,
    SYMPTOM,
    VITAL_SIGN,
    PHYSICAL_EXAM,
    HISTORY
}

package madn.core.model;

public enum EvidenceStrength {
    DEFINITIVE,
    STRONG,
    MODERATE,
    WEAK,
    ABSENT
}

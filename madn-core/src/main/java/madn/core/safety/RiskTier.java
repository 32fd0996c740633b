package madn.core.safety;

public enum RiskTier {
    CRITICAL,
    HIGH,
    MODERATE,
    LOW
}

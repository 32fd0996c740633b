package madn.core.model;

// most severe first; declaration order is the ranking
public enum Severity {
    CRITICAL,
    HIGH,
    MODERATE,
    LOW,
    NORMAL;

    public boolean atLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }
}

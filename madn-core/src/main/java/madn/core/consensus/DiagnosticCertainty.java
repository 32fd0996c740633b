package madn.core.consensus;

public enum DiagnosticCertainty {
    CONFIRMED,
    PROBABLE,
    POSSIBLE,
    UNCERTAIN;

    public static DiagnosticCertainty fromConfidence(double confidence) {
        if (confidence >= 0.8) {
            return PROBABLE;
        }
        if (confidence >= 0.5) {
            return POSSIBLE;
        }
        return UNCERTAIN;
    }
}

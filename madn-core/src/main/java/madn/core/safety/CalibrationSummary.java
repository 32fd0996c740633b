package madn.core.safety;

import java.util.List;

public record CalibrationSummary(
        double averageConfidence,
        Reliability reliability,
        List<String> lowConfidenceAnalyzers
) {
    public enum Reliability {
        HIGH,
        MODERATE,
        LOW,
        UNKNOWN
    }

    public CalibrationSummary {
        lowConfidenceAnalyzers = List.copyOf(lowConfidenceAnalyzers);
    }

    public static CalibrationSummary unknown() {
        return new CalibrationSummary(0.0, Reliability.UNKNOWN, List.of());
    }
}

package madn.core.tables;

import java.util.List;

public record CounterfactualEvidence(List<String> required, List<String> contradicts) {
    public static final CounterfactualEvidence GENERIC =
            new CounterfactualEvidence(List.of("Specific diagnostic criteria"), List.of());

    public CounterfactualEvidence {
        required = List.copyOf(required);
        contradicts = List.copyOf(contradicts);
    }
}

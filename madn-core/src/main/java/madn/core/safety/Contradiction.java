package madn.core.safety;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Contradiction(
        String diagnosis,
        Map<String, Double> analyzerProbabilities,
        double spread,
        String recommendation
) {
    public Contradiction {
        analyzerProbabilities = Collections.unmodifiableMap(new LinkedHashMap<>(analyzerProbabilities));
    }
}

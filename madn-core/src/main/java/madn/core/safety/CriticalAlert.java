package madn.core.safety;

import java.util.List;

/**
 * A must-not-miss condition found in analyzer text. {@code negatedContext} is
 * informational only: a negated mention still raises the alert.
 */
public record CriticalAlert(
        String condition,
        String matchedKeyword,
        String requiredAction,
        boolean timeCritical,
        List<String> sourceAnalyzers,
        boolean negatedContext
) {
    public CriticalAlert {
        sourceAnalyzers = List.copyOf(sourceAnalyzers);
    }
}

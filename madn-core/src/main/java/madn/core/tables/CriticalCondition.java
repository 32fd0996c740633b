package madn.core.tables;

import java.util.List;

public record CriticalCondition(
        String condition,
        List<String> keywords,
        String action,
        boolean timeCritical
) {
    public CriticalCondition {
        keywords = List.copyOf(keywords);
    }
}

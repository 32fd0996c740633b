package madn.core.tables;

import madn.core.model.Severity;

import java.util.List;
import java.util.Locale;

public record UrgencyKeywords(List<String> critical, List<String> high) {
    public UrgencyKeywords {
        critical = List.copyOf(critical);
        high = List.copyOf(high);
    }

    public Severity classify(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (critical.stream().anyMatch(lower::contains)) {
            return Severity.CRITICAL;
        }
        if (high.stream().anyMatch(lower::contains)) {
            return Severity.HIGH;
        }
        return Severity.MODERATE;
    }
}

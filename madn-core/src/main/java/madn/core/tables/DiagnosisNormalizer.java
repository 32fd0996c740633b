package madn.core.tables;

import java.util.List;
import java.util.Locale;

public class DiagnosisNormalizer {
    private final List<AliasRule> rules;

    public DiagnosisNormalizer(List<AliasRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public String canonicalName(String diagnosis) {
        String trimmed = diagnosis == null ? "" : diagnosis.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (AliasRule rule : rules) {
            if (rule.matches(lower)) {
                return rule.canonical();
            }
        }
        return trimmed;
    }

    public String key(String diagnosis) {
        return canonicalName(diagnosis).toLowerCase(Locale.ROOT);
    }

    public boolean sameDiagnosis(String left, String right) {
        return key(left).equals(key(right));
    }

    public record AliasRule(String canonical, List<List<String>> contains, List<String> exact) {
        public AliasRule {
            contains = contains.stream().map(List::copyOf).toList();
            exact = List.copyOf(exact);
        }

        boolean matches(String lower) {
            if (exact.contains(lower)) {
                return true;
            }
            for (List<String> tokens : contains) {
                if (tokens.stream().allMatch(lower::contains)) {
                    return true;
                }
            }
            return false;
        }
    }
}

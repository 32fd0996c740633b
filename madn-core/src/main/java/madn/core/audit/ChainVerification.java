package madn.core.audit;

public record ChainVerification(
        String segment,
        boolean valid,
        int entries,
        Integer brokenAtEntry,
        String message
) {}

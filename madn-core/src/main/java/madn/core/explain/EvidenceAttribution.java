package madn.core.explain;

import madn.core.model.Severity;

public record EvidenceAttribution(
        String sourceAnalyzer,
        String finding,
        Severity severity,
        ContributionTier contribution,
        double weight,
        String reasoning
) {}

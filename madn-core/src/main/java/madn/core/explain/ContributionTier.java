package madn.core.explain;

public enum ContributionTier {
    DECISIVE,
    STRONG,
    MODERATE,
    WEAK,
    NEUTRAL,
    OPPOSING
}

package madn.core.model;

import java.util.Objects;

public record Evidence(
        EvidenceType type,
        String description,
        String value,
        String normalRange,
        boolean abnormal,
        EvidenceStrength strength,
        String source
) {
    public Evidence {
        Objects.requireNonNull(type, "type");
        description = description == null ? "" : description;
        strength = strength == null ? EvidenceStrength.MODERATE : strength;
        source = source == null ? "" : source;
    }

    public static Evidence of(EvidenceType type, String description, EvidenceStrength strength) {
        return new Evidence(type, description, null, null, false, strength, "");
    }
}

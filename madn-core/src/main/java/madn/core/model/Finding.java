package madn.core.model;

import java.util.List;

public record Finding(
        String name,
        boolean present,
        List<Evidence> evidence,
        Severity severity,
        String clinicalSignificance
) {
    public Finding {
        name = name == null ? "Unknown" : name;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        severity = severity == null ? Severity.NORMAL : severity;
        clinicalSignificance = clinicalSignificance == null ? "" : clinicalSignificance;
    }

    public static Finding present(String name, Severity severity, String clinicalSignificance) {
        return new Finding(name, true, List.of(), severity, clinicalSignificance);
    }
}

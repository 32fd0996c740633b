package madn.core.audit;

import java.util.List;

public record ComplianceExport(
        String exportTimestamp,
        String from,
        String to,
        int entriesCount,
        List<AuditEntry> entries
) {
    public ComplianceExport {
        entries = List.copyOf(entries);
    }
}

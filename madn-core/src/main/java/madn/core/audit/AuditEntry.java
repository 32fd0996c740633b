package madn.core.audit;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One ledger line. {@code entryHash} covers every other field, including
 * {@code previousHash}.
 */
public record AuditEntry(
        String auditId,
        String timestamp,
        AuditEventType eventType,
        String caseId,
        String inputHash,
        JsonNode payload,
        String previousHash,
        String entryHash
) {}

package madn.core.audit;

public class AuditLedgerException extends RuntimeException {
    public AuditLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}

package madn.core.audit;

import java.util.Locale;

public enum AuditEventType {
    DIAGNOSIS,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AuditEventType fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}

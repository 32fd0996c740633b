package madn.core.model;

public record ParseError(Kind kind, String message) {
    public enum Kind {
        EMPTY_INPUT,
        NO_STRUCTURED_PAYLOAD,
        INVALID_JSON,
        INVALID_FIELD
    }
}

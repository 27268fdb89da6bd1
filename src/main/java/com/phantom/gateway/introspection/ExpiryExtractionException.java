package com.phantom.gateway.introspection;

/**
 * Thrown when the expiry of a compact token cannot be determined.
 */
public class ExpiryExtractionException extends Exception {

    public enum Reason {
        NOT_COMPACT,
        PAYLOAD_NOT_DECODABLE,
        PAYLOAD_NOT_PARSEABLE,
        MISSING_EXPIRATION,
        UNSUPPORTED_EXPIRATION_TYPE
    }

    private final Reason reason;

    public ExpiryExtractionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExpiryExtractionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

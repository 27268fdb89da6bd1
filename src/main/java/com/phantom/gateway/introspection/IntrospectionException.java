package com.phantom.gateway.introspection;

/**
 * Introspection call failed: the endpoint could not be reached in time, or
 * answered with a non-success status.
 */
public class IntrospectionException extends RuntimeException {

    public enum Kind {
        /** Connection failure or timeout */
        TRANSPORT,
        /** Endpoint answered with a non-200 status */
        STATUS
    }

    private final Kind kind;
    private final int status;

    private IntrospectionException(Kind kind, int status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public static IntrospectionException transport(String message, Throwable cause) {
        return new IntrospectionException(Kind.TRANSPORT, 0, message, cause);
    }

    public static IntrospectionException status(int status, String bodyExcerpt) {
        return new IntrospectionException(Kind.STATUS, status,
            "introspection status " + status + ": " + bodyExcerpt, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * HTTP status of a {@link Kind#STATUS} failure, 0 otherwise
     */
    public int getStatus() {
        return status;
    }
}

package com.gbu.courseplatform.exception;

/**
 * A request that is well-formed but breaks a business rule. Mapped to 400.
 */
public class BusinessException extends RuntimeException {

    private final String kind;

    public BusinessException(String message) {
        this("BAD_REQUEST", message);
    }

    protected BusinessException(String kind, String message) {
        super(message);
        this.kind = kind;
    }

    /** Stable machine-readable error kind returned to clients. */
    public String getKind() {
        return kind;
    }
}

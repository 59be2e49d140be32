package com.streamfirst.lazymint.domain;

import java.util.Objects;

/**
 * Thrown when a mutating or reading operation is refused. The operation that threw it has had no
 * observable effect.
 */
public class OperationRejectedException extends RuntimeException {

    private final ErrorCode code;

    public OperationRejectedException(ErrorCode code) {
        this(code, code.message(), null);
    }

    public OperationRejectedException(ErrorCode code, String detail) {
        this(code, code.message() + " (" + detail + ")", null);
    }

    public OperationRejectedException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "Error code cannot be null");
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCode.Category getCategory() {
        return code.category();
    }
}

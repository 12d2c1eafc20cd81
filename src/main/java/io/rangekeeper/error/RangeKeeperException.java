package io.rangekeeper.error;

import io.rangekeeper.model.ErrorKind;

public class RangeKeeperException extends RuntimeException {
    private final ErrorKind kind;

    public RangeKeeperException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RangeKeeperException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}

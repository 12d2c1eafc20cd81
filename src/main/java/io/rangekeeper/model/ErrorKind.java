package io.rangekeeper.model;

public enum ErrorKind {
    ALREADY_RUNNING(false),
    NOT_RUNNING(false),
    IN_PROGRESS(true),
    NOT_OWNER(false),
    NOT_FOUND(false),
    INVALID_REQUEST(false),
    EXTENSION_LIMIT_REACHED(false),
    LIFETIME_CAP_REACHED(false),
    PROVISIONER_UNAVAILABLE(true),
    PROVISIONER_REJECTED(false),
    DUPLICATE_BINDING(false),
    CREDENTIAL_NOT_FOUND(false),
    STORE_UNAVAILABLE(true),
    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}

package io.rangekeeper.error;

public class ProvisionerException extends Exception {
    private final boolean transientFailure;

    public ProvisionerException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ProvisionerException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static ProvisionerException transientFailure(String message, Throwable cause) {
        return new ProvisionerException(message, true, cause);
    }

    public static ProvisionerException rejected(String message) {
        return new ProvisionerException(message, false);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}

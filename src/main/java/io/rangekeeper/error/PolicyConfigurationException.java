package io.rangekeeper.error;

public class PolicyConfigurationException extends RuntimeException {
    public PolicyConfigurationException(String message) {
        super(message);
    }
}

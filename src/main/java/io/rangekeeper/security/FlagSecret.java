package io.rangekeeper.security;

// toString is redacted so the value cannot reach a log line.
public record FlagSecret(String value) {
    public FlagSecret {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("flag value must not be blank");
        }
    }

    public String redacted() {
        return FlagRedactor.redact(value);
    }

    @Override
    public String toString() {
        return "FlagSecret[" + redacted() + "]";
    }
}

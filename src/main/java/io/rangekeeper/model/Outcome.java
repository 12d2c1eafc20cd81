package io.rangekeeper.model;

public record Outcome<T>(T value, ErrorKind error, String message) {
    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(value, null, null);
    }

    public static <T> Outcome<T> failed(ErrorKind error, String message) {
        return new Outcome<>(null, error, message);
    }

    public boolean isOk() {
        return error == null;
    }
}

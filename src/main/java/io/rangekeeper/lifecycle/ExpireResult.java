package io.rangekeeper.lifecycle;

public enum ExpireResult {
    EXPIRED,
    NOT_DUE,
    SKIPPED,
    TEARDOWN_FAILED
}

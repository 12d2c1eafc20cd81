package io.rangekeeper.model;

public enum StopReason {
    MANUAL,
    AUTO
}

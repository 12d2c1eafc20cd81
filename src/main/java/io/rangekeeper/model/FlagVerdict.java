package io.rangekeeper.model;

public enum FlagVerdict {
    ACCEPTED,
    REJECTED
}

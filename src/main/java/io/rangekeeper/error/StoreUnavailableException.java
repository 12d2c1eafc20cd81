package io.rangekeeper.error;

import io.rangekeeper.model.ErrorKind;

public class StoreUnavailableException extends RangeKeeperException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}

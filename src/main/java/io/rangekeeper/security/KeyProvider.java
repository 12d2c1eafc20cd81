package io.rangekeeper.security;

import javax.crypto.SecretKey;
import java.util.Optional;

public interface KeyProvider {

    // Id and key are read together so a rotation can never pair one key's id with another's material.
    ActiveKey current();

    default int currentKeyId() {
        return current().keyId();
    }

    Optional<SecretKey> key(int keyId);

    int rotate();

    KeyringStatus status();

    record ActiveKey(int keyId, SecretKey key) {
    }

    record KeyringStatus(int activeKeyId, int totalKeys, String location) {
    }
}

package io.rangekeeper.model;

public record CredentialRecord(
        String instanceId,
        String ciphertext,
        int keyId,
        long createdAtMs
) {
}

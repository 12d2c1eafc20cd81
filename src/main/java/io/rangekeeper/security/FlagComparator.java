package io.rangekeeper.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

// Both sides are hashed first, so timing depends on neither length nor content.
public final class FlagComparator {
    private static final String DECOY = "rangekeeper-decoy-flag";

    private FlagComparator() {
    }

    public static boolean matches(String expected, String submitted) {
        byte[] a = digest(expected == null ? "" : expected);
        byte[] b = digest(submitted == null ? "" : submitted);
        return MessageDigest.isEqual(a, b) && expected != null;
    }

    public static boolean decoy(String submitted) {
        byte[] a = digest(DECOY);
        byte[] b = digest(submitted == null ? "" : submitted);
        MessageDigest.isEqual(a, b);
        return false;
    }

    private static byte[] digest(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

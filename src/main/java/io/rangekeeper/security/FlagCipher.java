package io.rangekeeper.security;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM sealing of flag plaintexts. The instance id is bound in as associated data,
 * so a ciphertext copied onto another instance's row fails authentication.
 */
public final class FlagCipher {
    public static final String CIPHERTEXT_PREFIX = "gcm1:";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;

    private final SecureRandom secureRandom;

    public FlagCipher() {
        this(new SecureRandom());
    }

    public FlagCipher(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public String encrypt(SecretKey key, String instanceId, String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Cannot encrypt an empty flag");
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(instanceId.getBytes(StandardCharsets.UTF_8));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer out = ByteBuffer.allocate(iv.length + sealed.length);
            out.put(iv).put(sealed);
            return CIPHERTEXT_PREFIX + Base64.getEncoder().encodeToString(out.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt flag", e);
        }
    }

    public String decrypt(SecretKey key, String instanceId, String ciphertext) throws GeneralSecurityException {
        if (ciphertext == null || !ciphertext.startsWith(CIPHERTEXT_PREFIX)) {
            throw new GeneralSecurityException("Unrecognized ciphertext format");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(ciphertext.substring(CIPHERTEXT_PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Ciphertext is not valid base64", e);
        }
        if (raw.length < GCM_IV_BYTES + GCM_TAG_BITS / 8) {
            throw new GeneralSecurityException("Ciphertext too short");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, raw, 0, GCM_IV_BYTES));
        cipher.updateAAD(instanceId.getBytes(StandardCharsets.UTF_8));
        byte[] plain = cipher.doFinal(raw, GCM_IV_BYTES, raw.length - GCM_IV_BYTES);
        return new String(plain, StandardCharsets.UTF_8);
    }
}

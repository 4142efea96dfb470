package com.rex.gate.auth;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PBKDF2-HMAC-SHA256 password hashing
 *
 * HASH = PBKDF2(SHA256, password, salt, 120000 iterations, 32 bytes)
 */
public class PasswordHasher {

    public static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    public static final int ITERATIONS = 120000;
    public static final int SALT_LENGTH = 16;
    public static final int KEY_LENGTH = 32;

    private final SecureRandom mRandom;

    public PasswordHasher() {
        this(new SecureRandom());
    }

    public PasswordHasher(SecureRandom random) {
        mRandom = random;
    }

    public byte[] newSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        mRandom.nextBytes(salt);
        return salt;
    }

    public byte[] hash(String password, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, ITERATIONS, KEY_LENGTH * 8);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM)
                    .generateSecret(spec)
                    .getEncoded();
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("PBKDF2 not available", ex);
        } finally {
            spec.clearPassword();
        }
    }

    public String hash64(String password, byte[] salt) {
        return Base64.getEncoder().encodeToString(hash(password, salt));
    }

    /**
     * Compare in constant time, the stored hash and salt are both base64 encoded
     */
    public boolean matches(String password, String salt64, String hash64) {
        byte[] salt;
        byte[] expected;
        try {
            salt = Base64.getDecoder().decode(salt64);
            expected = Base64.getDecoder().decode(hash64);
        } catch (IllegalArgumentException ex) {
            return false;
        }
        return MessageDigest.isEqual(expected, hash(password, salt));
    }

    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}

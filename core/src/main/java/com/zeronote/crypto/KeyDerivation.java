package com.zeronote.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Two-step derivation: PBKDF2-HMAC-SHA256 turns a password into a {@link MasterKey}, then
 * HKDF-SHA256 with a fixed zero salt and a domain label turns the master key into a
 * {@link Kek}. Both steps are deterministic.
 */
public final class KeyDerivation {

    public static final int DEFAULT_ITERATIONS = 600_000;
    public static final int SALT_LENGTH = 32;

    private static final byte[] HKDF_SALT = new byte[32];

    private final int iterations;

    public KeyDerivation() {
        this(DEFAULT_ITERATIONS);
    }

    /** Lower iteration counts are for tests only. */
    public KeyDerivation(int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
    }

    public int iterations() {
        return iterations;
    }

    public byte[] newSalt() {
        return CryptoRandom.bytes(SALT_LENGTH);
    }

    public MasterKey deriveMasterKey(String password, byte[] salt) {
        return deriveMasterKey(password, salt, iterations);
    }

    public MasterKey deriveMasterKey(String password, byte[] salt, int rounds) {
        byte[] key = pbkdf2(PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(password.toCharArray()), salt, rounds);
        try {
            return new MasterKey(key);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    public Kek deriveKek(MasterKey masterKey, String label) {
        byte[] key = expand(masterKey, label, KeyMaterial.KEY_LENGTH);
        try {
            return new Kek(key);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /** Raw HKDF output, used where the result is a verifier rather than a key. */
    public byte[] expand(KeyMaterial ikm, String label, int length) {
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(ikm.raw(), HKDF_SALT, label.getBytes(StandardCharsets.UTF_8)));
        byte[] out = new byte[length];
        hkdf.generateBytes(out, 0, length);
        return out;
    }

    byte[] pbkdf2(byte[] secret, byte[] salt, int rounds) {
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        generator.init(secret, salt, rounds);
        try {
            return ((KeyParameter) generator.generateDerivedParameters(KeyMaterial.KEY_LENGTH * 8)).getKey();
        } finally {
            Arrays.fill(secret, (byte) 0);
        }
    }
}

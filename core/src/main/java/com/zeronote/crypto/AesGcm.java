package com.zeronote.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Security;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import com.zeronote.error.IntegrityFailureException;

/**
 * AES-256-GCM with a fresh 96-bit nonce per call. The 128-bit tag is split off the
 * ciphertext so {@link EncryptedBlob} carries it as its own field.
 *
 * <p>Thread-safe: a new {@link Cipher} is created for every call.
 */
public final class AesGcm {

    public static final String ALGORITHM = "AES-256-GCM";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_SIZE = 12;
    private static final int TAG_SIZE = 16;

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public EncryptedBlob encrypt(byte[] plaintext, KeyMaterial key) {
        byte[] iv = CryptoRandom.bytes(IV_SIZE);
        byte[] sealed = run(Cipher.ENCRYPT_MODE, key, iv, plaintext);

        int bodyLength = sealed.length - TAG_SIZE;
        byte[] ciphertext = new byte[bodyLength];
        byte[] tag = new byte[TAG_SIZE];
        System.arraycopy(sealed, 0, ciphertext, 0, bodyLength);
        System.arraycopy(sealed, bodyLength, tag, 0, TAG_SIZE);
        return new EncryptedBlob(iv, ciphertext, tag, ALGORITHM);
    }

    public EncryptedBlob encrypt(String plaintext, KeyMaterial key) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
    }

    /**
     * @throws IntegrityFailureException if the tag does not verify, whether because a byte was
     *                                   flipped or because the key is not the one that sealed it
     */
    public byte[] decrypt(EncryptedBlob blob, KeyMaterial key) {
        if (!ALGORITHM.equals(blob.algorithm())
                || blob.iv() == null || blob.iv().length != IV_SIZE
                || blob.tag() == null || blob.tag().length != TAG_SIZE
                || blob.ciphertext() == null) {
            throw new IntegrityFailureException("Malformed encrypted blob", null);
        }
        byte[] sealed = new byte[blob.ciphertext().length + TAG_SIZE];
        System.arraycopy(blob.ciphertext(), 0, sealed, 0, blob.ciphertext().length);
        System.arraycopy(blob.tag(), 0, sealed, blob.ciphertext().length, TAG_SIZE);
        return run(Cipher.DECRYPT_MODE, key, blob.iv(), sealed);
    }

    public String decryptString(EncryptedBlob blob, KeyMaterial key) {
        return new String(decrypt(blob, key), StandardCharsets.UTF_8);
    }

    private static byte[] run(int mode, KeyMaterial key, byte[] iv, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(mode, new SecretKeySpec(key.raw(), "AES"), new GCMParameterSpec(TAG_SIZE * 8, iv));
            return cipher.doFinal(input);
        } catch (BadPaddingException e) {
            throw new IntegrityFailureException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM is not available", e);
        }
    }
}

package com.zeronote.crypto;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;

/**
 * Output of {@link AesGcm}: nonce, ciphertext and the detached 128-bit tag.
 * Byte arrays serialize as Base64.
 */
public record EncryptedBlob(byte[] iv, byte[] ciphertext, byte[] tag, String algorithm)
        implements CipherEnvelope {

    @Override
    public <R> R fold(Function<EncryptedBlob, R> onEncrypted, Function<WrappedKey, R> onWrapped) {
        return onEncrypted.apply(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncryptedBlob other)) return false;
        return Arrays.equals(iv, other.iv)
                && Arrays.equals(ciphertext, other.ciphertext)
                && Arrays.equals(tag, other.tag)
                && Objects.equals(algorithm, other.algorithm);
    }

    @Override
    public int hashCode() {
        int result = Objects.hashCode(algorithm);
        result = 31 * result + Arrays.hashCode(iv);
        result = 31 * result + Arrays.hashCode(ciphertext);
        result = 31 * result + Arrays.hashCode(tag);
        return result;
    }

    @Override
    public String toString() {
        return "EncryptedBlob[" + algorithm + ", " + ciphertext.length + " bytes]";
    }
}

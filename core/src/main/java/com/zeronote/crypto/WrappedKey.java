package com.zeronote.crypto;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;

/** Output of {@link KeyWrap}: an RFC 3394 wrapped key. */
public record WrappedKey(byte[] wrappedKey, String algorithm) implements CipherEnvelope {

    @Override
    public <R> R fold(Function<EncryptedBlob, R> onEncrypted, Function<WrappedKey, R> onWrapped) {
        return onWrapped.apply(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WrappedKey other)) return false;
        return Arrays.equals(wrappedKey, other.wrappedKey) && Objects.equals(algorithm, other.algorithm);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(algorithm) + Arrays.hashCode(wrappedKey);
    }

    @Override
    public String toString() {
        return "WrappedKey[" + algorithm + "]";
    }
}

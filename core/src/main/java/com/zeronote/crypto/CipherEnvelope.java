package com.zeronote.crypto;

import java.util.function.Function;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Every opaque payload the core persists or syncs is one of two shapes: an authenticated
 * ciphertext or a wrapped key. The JSON form carries a {@code type} discriminator so a stored
 * blob can never be mistaken for the other shape.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EncryptedBlob.class, name = "encrypted"),
        @JsonSubTypes.Type(value = WrappedKey.class, name = "wrapped")
})
public sealed interface CipherEnvelope permits EncryptedBlob, WrappedKey {

    String algorithm();

    <R> R fold(Function<EncryptedBlob, R> onEncrypted, Function<WrappedKey, R> onWrapped);

    /** Stored size in bytes, counting nonce and tag for ciphertexts. */
    default int byteLength() {
        return fold(
                blob -> blob.iv().length + blob.ciphertext().length + blob.tag().length,
                wrapped -> wrapped.wrappedKey().length);
    }
}

package com.phonetic.matching.encoder;

/**
 * A phonetic encoder: maps a word or name to a code approximating its pronunciation.
 * Implementations are immutable and safe to share between threads.
 */
public interface Encoder {

    /**
     * Encodes a value. Never fails on well-formed strings; empty or unusable input yields the
     * encoder's empty code.
     *
     * @param value the value to encode, not null
     * @return the phonetic code
     */
    String encode(String value);

    /**
     * Whether both values encode to the same code.
     */
    default boolean isEncodedEquals(String first, String second) {
        return encode(first).equals(encode(second));
    }

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}

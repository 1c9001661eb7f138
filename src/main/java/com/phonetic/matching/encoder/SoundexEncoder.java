package com.phonetic.matching.encoder;

/**
 * Encoders of the Soundex family, whose codes can be compared position by position.
 */
public interface SoundexEncoder extends Encoder {

    /**
     * Number of positions at which the codes of both values hold the same character.
     * Ranges from 0 (no similarity) to the code length (best).
     */
    default int difference(String first, String second) {
        return SoundexUtils.difference(this, first, second);
    }
}

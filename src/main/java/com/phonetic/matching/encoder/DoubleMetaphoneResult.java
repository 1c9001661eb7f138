package com.phonetic.matching.encoder;

import java.util.Objects;

/**
 * Primary and alternate Double Metaphone codes of one value.
 */
public record DoubleMetaphoneResult(String primary, String alternate) {

    public DoubleMetaphoneResult {
        Objects.requireNonNull(primary, "primary");
        Objects.requireNonNull(alternate, "alternate");
    }
}

package com.libragraph.boxes.core;

import com.libragraph.boxes.core.label.AtomLabel;
import com.libragraph.boxes.types.AtomSign;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A label with a signed count. Raw terms may repeat labels or carry zero counts;
 * the terms a {@link Box} reports are netted and nonzero.
 */
public record Term(AtomLabel label, BigInteger count) {

    public Term {
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(count, "count cannot be null");
    }

    /**
     * A single atom.
     */
    public static Term of(AtomLabel label, AtomSign sign) {
        return new Term(label, sign.count());
    }

    public static Term of(AtomLabel label, long count) {
        return new Term(label, BigInteger.valueOf(count));
    }
}

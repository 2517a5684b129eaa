package com.libragraph.boxes.core;

import com.libragraph.boxes.core.label.AtomLabel;
import com.libragraph.boxes.core.label.CanonicalKey;
import com.libragraph.boxes.core.label.KeyEntry;
import com.libragraph.boxes.core.label.NestedKey;
import com.libragraph.boxes.core.multiset.SignedMultiset;
import com.libragraph.boxes.core.text.BoxWriter;
import com.libragraph.boxes.types.AtomSign;
import com.libragraph.boxes.util.ContentHash;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable, canonical signed multiset of atoms.
 *
 * <p>An atom and its oppositely signed partner annihilate, so a box stores only the net
 * count per canonical key, never zero. Atom labels may themselves be boxes. Two boxes are
 * equal exactly when their key-to-count mappings are identical; construction order never
 * matters.
 *
 * <p>Operators delegate to {@link BoxAlgebra#standard()}. Boxes are safe to share across
 * threads.
 */
public final class Box {

    private static final Box EMPTY = new Box(new SignedMultiset(), Map.of());

    private final SignedMultiset counts;
    private final Map<CanonicalKey, AtomLabel> labels;
    private final NestedKey key;
    private final int depth;

    /**
     * Takes ownership of {@code counts}, which must already be netted.
     */
    Box(SignedMultiset counts, Map<CanonicalKey, AtomLabel> labels) {
        Map<CanonicalKey, AtomLabel> kept = new HashMap<>();
        int maxLabelDepth = 0;
        for (KeyEntry entry : counts.iterate()) {
            AtomLabel label = labels.get(entry.key());
            if (label == null) {
                throw new IllegalStateException("No label for key " + entry.key());
            }
            kept.put(entry.key(), label);
            maxLabelDepth = Math.max(maxLabelDepth, label.depth());
        }
        this.counts = counts;
        this.labels = Collections.unmodifiableMap(kept);
        this.key = counts.toKey();
        this.depth = maxLabelDepth;
    }

    // --- Constructors ---

    /**
     * The neutral element, denoting 0.
     */
    public static Box empty() {
        return EMPTY;
    }

    /**
     * {@code unit(PLUS)} denotes 1, {@code unit(MINUS)} denotes -1.
     */
    public static Box unit(AtomSign sign) {
        return BoxAlgebra.standard().unit(sign);
    }

    public static Box fromLabel(AtomLabel label, AtomSign sign) {
        return BoxAlgebra.standard().fromLabel(label, sign);
    }

    /**
     * The integer {@code n}: {@code |n|} unit atoms of the sign of {@code n}.
     */
    public static Box of(BigInteger n) {
        return BoxAlgebra.standard().integer(n);
    }

    public static Box of(long n) {
        return of(BigInteger.valueOf(n));
    }

    /**
     * The box whose single atom is labelled by the box 1. Its powers are the boxes
     * labelled 2, 3, ...
     */
    public static Box alpha() {
        return BoxAlgebra.standard().alpha();
    }

    // --- Operators ---

    public static Box negate(Box a) {
        return BoxAlgebra.standard().negate(a);
    }

    public static Box sum(Box a, Box b) {
        return BoxAlgebra.standard().sum(a, b);
    }

    public static Box product(Box a, Box b) {
        return BoxAlgebra.standard().product(a, b);
    }

    public Box negate() {
        return BoxAlgebra.standard().negate(this);
    }

    public Box add(Box other) {
        return BoxAlgebra.standard().sum(this, other);
    }

    public Box subtract(Box other) {
        return BoxAlgebra.standard().subtract(this, other);
    }

    public Box multiply(Box other) {
        return BoxAlgebra.standard().product(this, other);
    }

    public Box pow(int exponent) {
        return BoxAlgebra.standard().pow(this, exponent);
    }

    /**
     * A singleton box whose atom is labelled by this box.
     */
    public Box wrap(AtomSign sign) {
        return BoxAlgebra.standard().wrap(this, sign);
    }

    /**
     * The integer this box denotes once label distinctions are erased: the sum of all counts.
     */
    public BigInteger evaluate() {
        return counts.total();
    }

    // --- Canonical state ---

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Number of distinct keys.
     */
    public int size() {
        return counts.size();
    }

    /**
     * True for boxes made only of unit atoms, the plain integers.
     */
    public boolean isInteger() {
        return counts.isEmpty()
                || (counts.size() == 1 && counts.contains(AtomLabel.UNIT.key()));
    }

    /**
     * Net count of {@code label}, zero if absent. The label is normalized before lookup, so
     * a nested label holding only {@code +x} counts as {@code x}, and a nested empty box as unit.
     */
    public BigInteger count(AtomLabel label) {
        return counts.count(Canonicalizer.normalize(label).key());
    }

    /**
     * Netted terms in ascending key order.
     */
    public List<Term> terms() {
        List<Term> out = new ArrayList<>(counts.size());
        for (KeyEntry entry : counts.iterate()) {
            out.add(new Term(labels.get(entry.key()), entry.count()));
        }
        return out;
    }

    public Iterable<KeyEntry> entries() {
        return counts.iterate();
    }

    public NestedKey canonicalKey() {
        return key;
    }

    public ContentHash hash() {
        return key.hash();
    }

    /**
     * Deepest label nesting; 0 when every label is primitive.
     */
    public int depth() {
        return depth;
    }

    SignedMultiset countsCopy() {
        return counts.copy();
    }

    Map<CanonicalKey, AtomLabel> labelMap() {
        return labels;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Box other)) return false;
        return key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    /**
     * The text form when it fits the configured rendering limit, otherwise a summary.
     */
    @Override
    public String toString() {
        BoxWriter writer = BoxWriter.standard();
        if (writer.fits(this)) {
            return writer.write(this);
        }
        return "Box[" + key.hash().shortHex() + ", " + counts.size() + " keys, depth " + depth + "]";
    }
}

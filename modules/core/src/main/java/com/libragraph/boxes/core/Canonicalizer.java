package com.libragraph.boxes.core;

import com.libragraph.boxes.core.config.BoxesConfig;
import com.libragraph.boxes.core.label.AtomLabel;
import com.libragraph.boxes.core.label.CanonicalKey;
import com.libragraph.boxes.core.multiset.SignedMultiset;
import org.jboss.logging.Logger;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw {@code (label, count)} terms into the unique canonical {@link Box}.
 *
 * <p>Labels are normalized first (nested content is already canonical, so only the
 * label normal form remains), then counts are netted per canonical key and zero entries
 * dropped. The only place boxes are created.
 *
 * <p>Label normal form: a nested empty box is the unit label, and a nested box holding
 * exactly one non-unit primitive atom with count +1 is that primitive. This makes
 * {@link #labelFor(Box)} and {@link #exponentOf(AtomLabel)} inverse bijections, which
 * {@link BoxAlgebra#product(Box, Box)} relies on.
 */
public final class Canonicalizer {

    private static final Logger log = Logger.getLogger(Canonicalizer.class);

    private final int maxDepth;

    public Canonicalizer(BoxesConfig config) {
        this.maxDepth = Objects.requireNonNull(config, "config cannot be null").maxDepth();
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * @throws InvalidStructureException if any label nests deeper than the maximum
     */
    public Box canonicalize(Iterable<Term> terms) {
        Objects.requireNonNull(terms, "terms cannot be null");
        SignedMultiset counts = new SignedMultiset();
        Map<CanonicalKey, AtomLabel> labels = new HashMap<>();
        int raw = 0;
        for (Term term : terms) {
            AtomLabel label = normalize(term.label());
            if (label.depth() > maxDepth) {
                throw InvalidStructureException.tooDeep(label.depth(), maxDepth);
            }
            CanonicalKey key = label.key();
            counts.insert(key, term.count());
            labels.putIfAbsent(key, label);
            raw++;
        }
        log.tracef("Canonicalized %d raw terms into %d entries", raw, counts.size());
        return assemble(counts, labels);
    }

    /**
     * Idempotent: the result equals {@code box}.
     */
    public Box canonicalize(Box box) {
        return canonicalize(box.terms());
    }

    /**
     * Wraps an already netted multiset. {@code labels} must cover every key in
     * {@code counts}; extra labels are dropped.
     */
    Box assemble(SignedMultiset counts, Map<CanonicalKey, AtomLabel> labels) {
        return counts.isEmpty() ? Box.empty() : new Box(counts, labels);
    }

    public static AtomLabel normalize(AtomLabel label) {
        Objects.requireNonNull(label, "label cannot be null");
        if (label instanceof AtomLabel.Nested nested) {
            return labelFor(nested.content());
        }
        return label;
    }

    /**
     * The label whose exponent is {@code exponent}.
     */
    public static AtomLabel labelFor(Box exponent) {
        if (exponent.isEmpty()) {
            return AtomLabel.UNIT;
        }
        if (exponent.size() == 1) {
            Term only = exponent.terms().get(0);
            if (only.count().equals(BigInteger.ONE)
                    && only.label() instanceof AtomLabel.Primitive primitive
                    && !primitive.isUnit()) {
                return primitive;
            }
        }
        return new AtomLabel.Nested(exponent);
    }

    /**
     * The box a label contributes when atoms are multiplied: unit is {@code {}},
     * a primitive {@code x} is {@code {+x}}, a nested label is its content.
     */
    public static Box exponentOf(AtomLabel label) {
        AtomLabel normal = normalize(label);
        if (normal.isUnit()) {
            return Box.empty();
        }
        if (normal instanceof AtomLabel.Nested nested) {
            return nested.content();
        }
        SignedMultiset counts = new SignedMultiset();
        counts.insert(normal.key(), BigInteger.ONE);
        return new Box(counts, Map.of(normal.key(), normal));
    }
}

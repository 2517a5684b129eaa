package com.libragraph.boxes.core;

import com.libragraph.boxes.core.config.BoxesConfig;
import com.libragraph.boxes.core.label.AtomLabel;
import com.libragraph.boxes.core.label.CanonicalKey;
import com.libragraph.boxes.core.multiset.SignedMultiset;
import com.libragraph.boxes.types.AtomSign;
import org.jboss.logging.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The box operators: negate, sum, product, evaluate, and the constructors built on them.
 *
 * <p>Every operator is a pure function of canonical inputs and never fails on them.
 * Sum merges by canonical key, so equal keys of opposite sign annihilate. Product pairs
 * every atom of one operand with every atom of the other; a pair's count is the product
 * of counts and its label is the label whose exponent is the sum of the two labels'
 * exponents (see {@link Canonicalizer#exponentOf(AtomLabel)}). That makes the unit label
 * the identity and keeps product commutative, associative and distributive over sum.
 */
public final class BoxAlgebra {

    private static final Logger log = Logger.getLogger(BoxAlgebra.class);

    private static final class Holder {
        static final BoxAlgebra STANDARD = new BoxAlgebra(BoxesConfig.load());
    }

    private final BoxesConfig config;
    private final Canonicalizer canonicalizer;
    private final BoxCache cache;

    public BoxAlgebra(BoxesConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.canonicalizer = new Canonicalizer(config);
        this.cache = new BoxCache(config.cacheMaxEntries());
    }

    /**
     * Shared instance configured from MicroProfile Config on first use.
     */
    public static BoxAlgebra standard() {
        return Holder.STANDARD;
    }

    public BoxesConfig config() {
        return config;
    }

    public Canonicalizer canonicalizer() {
        return canonicalizer;
    }

    public BoxCache cache() {
        return cache;
    }

    // --- Constructors ---

    public Box unit(AtomSign sign) {
        return fromLabel(AtomLabel.UNIT, sign);
    }

    /**
     * @throws InvalidStructureException if the label nests deeper than the maximum
     */
    public Box fromLabel(AtomLabel label, AtomSign sign) {
        Objects.requireNonNull(sign, "sign cannot be null");
        return canonicalizer.canonicalize(List.of(Term.of(label, sign)));
    }

    public Box integer(BigInteger n) {
        Objects.requireNonNull(n, "n cannot be null");
        return canonicalizer.canonicalize(List.of(new Term(AtomLabel.UNIT, n)));
    }

    public Box wrap(Box content, AtomSign sign) {
        return fromLabel(AtomLabel.nested(content), sign);
    }

    public Box alpha() {
        return wrap(unit(AtomSign.PLUS), AtomSign.PLUS);
    }

    // --- Operators ---

    public Box negate(Box a) {
        Objects.requireNonNull(a, "a cannot be null");
        if (a.isEmpty()) return a;
        SignedMultiset counts = a.countsCopy();
        counts.negateAll();
        return canonicalizer.assemble(counts, a.labelMap());
    }

    public Box sum(Box a, Box b) {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(b, "b cannot be null");
        if (a.isEmpty()) return b;
        if (b.isEmpty()) return a;
        return cache.computeIfAbsent(BoxCache.Op.SUM, a, b, () -> merge(a, b));
    }

    public Box subtract(Box a, Box b) {
        return sum(a, negate(b));
    }

    public Box product(Box a, Box b) {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(b, "b cannot be null");
        if (a.isEmpty() || b.isEmpty()) return Box.empty();
        return cache.computeIfAbsent(BoxCache.Op.PRODUCT, a, b, () -> multiply(a, b));
    }

    /**
     * {@code a} multiplied by itself {@code exponent} times; {@code pow(a, 0)} is 1.
     */
    public Box pow(Box a, int exponent) {
        Objects.requireNonNull(a, "a cannot be null");
        if (exponent < 0) {
            throw new IllegalArgumentException("exponent must be >= 0, got: " + exponent);
        }
        Box result = unit(AtomSign.PLUS);
        Box base = a;
        int e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = product(result, base);
            }
            e >>= 1;
            if (e > 0) {
                base = product(base, base);
            }
        }
        return result;
    }

    public BigInteger evaluate(Box a) {
        return Objects.requireNonNull(a, "a cannot be null").evaluate();
    }

    /**
     * Label of the atom produced by multiplying an atom labelled {@code x} with one
     * labelled {@code y}.
     */
    public AtomLabel combine(AtomLabel x, AtomLabel y) {
        AtomLabel nx = Canonicalizer.normalize(x);
        AtomLabel ny = Canonicalizer.normalize(y);
        if (nx.isUnit()) return ny;
        if (ny.isUnit()) return nx;
        return Canonicalizer.labelFor(sum(Canonicalizer.exponentOf(nx), Canonicalizer.exponentOf(ny)));
    }

    private Box merge(Box a, Box b) {
        SignedMultiset counts = a.countsCopy();
        SignedMultiset other = b.countsCopy();
        counts.merge(other);
        Map<CanonicalKey, AtomLabel> labels = new HashMap<>(a.labelMap());
        b.labelMap().forEach(labels::putIfAbsent);
        Box result = canonicalizer.assemble(counts, labels);
        log.tracef("Sum of %d and %d keys has %d keys", a.size(), b.size(), result.size());
        return result;
    }

    private Box multiply(Box a, Box b) {
        if (b.isInteger()) return scale(a, b.evaluate());
        if (a.isInteger()) return scale(b, a.evaluate());

        List<Term> raw = new ArrayList<>(a.size() * b.size());
        for (Term ta : a.terms()) {
            for (Term tb : b.terms()) {
                raw.add(new Term(combine(ta.label(), tb.label()), ta.count().multiply(tb.count())));
            }
        }
        Box result = canonicalizer.canonicalize(raw);
        log.tracef("Product of %d and %d keys has %d keys", a.size(), b.size(), result.size());
        return result;
    }

    private Box scale(Box a, BigInteger factor) {
        SignedMultiset counts = a.countsCopy();
        counts.scaleEachLabel(factor);
        return canonicalizer.assemble(counts, a.labelMap());
    }
}

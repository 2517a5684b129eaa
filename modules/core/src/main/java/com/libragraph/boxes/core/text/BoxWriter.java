package com.libragraph.boxes.core.text;

import com.libragraph.boxes.core.Box;
import com.libragraph.boxes.core.BoxAlgebra;
import com.libragraph.boxes.core.Term;
import com.libragraph.boxes.core.label.AtomLabel;
import com.libragraph.boxes.types.AtomSign;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Renders a box as {@code {+unit, +unit, -x}}: one signed atom per unit of count, in
 * ascending canonical key order, nested labels rendered recursively.
 *
 * <p>{@link #write(Box)} always renders the exact text, however large. Text grows with the
 * counts, so {@link #fits(Box)} tells debug views such as {@link Box#toString()} whether a
 * box stays within the configured number of atoms.
 */
public final class BoxWriter {

    private final long maxAtoms;

    public BoxWriter(int maxRenderedAtoms) {
        if (maxRenderedAtoms < 1) {
            throw new IllegalArgumentException("maxRenderedAtoms must be >= 1, got: " + maxRenderedAtoms);
        }
        this.maxAtoms = maxRenderedAtoms;
    }

    public static BoxWriter standard() {
        return new BoxWriter(BoxAlgebra.standard().config().maxRenderedAtoms());
    }

    public static String serialize(Box box) {
        return standard().write(box);
    }

    public boolean fits(Box box) {
        return atomCount(box, maxAtoms) <= maxAtoms;
    }

    public String write(Box box) {
        Objects.requireNonNull(box, "box cannot be null");
        StringBuilder sb = new StringBuilder();
        append(box, sb);
        return sb.toString();
    }

    private static void append(Box box, StringBuilder sb) {
        sb.append('{');
        boolean first = true;
        for (Term term : box.terms()) {
            char sign = AtomSign.of(term.count()).symbol();
            long repeat = term.count().abs().longValueExact();
            for (long i = 0; i < repeat; i++) {
                if (!first) sb.append(", ");
                first = false;
                sb.append(sign);
                appendLabel(term.label(), sb);
            }
        }
        sb.append('}');
    }

    private static void appendLabel(AtomLabel label, StringBuilder sb) {
        if (label instanceof AtomLabel.Nested nested) {
            append(nested.content(), sb);
        } else {
            sb.append(((AtomLabel.Primitive) label).token());
        }
    }

    /**
     * Atoms the text form contains, nested ones included; stops counting once past {@code cap}.
     */
    static long atomCount(Box box, long cap) {
        BigInteger limit = BigInteger.valueOf(cap);
        BigInteger total = BigInteger.ZERO;
        for (Term term : box.terms()) {
            long perAtom = 1;
            if (term.label() instanceof AtomLabel.Nested nested) {
                perAtom += atomCount(nested.content(), cap);
            }
            total = total.add(term.count().abs().multiply(BigInteger.valueOf(perAtom)));
            if (total.compareTo(limit) > 0) {
                return cap + 1;
            }
        }
        return total.longValueExact();
    }
}

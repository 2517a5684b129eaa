package com.libragraph.boxes.core;

import com.libragraph.boxes.core.config.BoxesConfig;
import com.libragraph.boxes.core.label.AtomLabel;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.libragraph.boxes.types.AtomSign.MINUS;
import static com.libragraph.boxes.types.AtomSign.PLUS;
import static org.assertj.core.api.Assertions.*;

class CanonicalizerTest {

    private static final AtomLabel X = AtomLabel.primitive("x");
    private static final AtomLabel Y = AtomLabel.primitive("y");

    private final Canonicalizer canonicalizer = new Canonicalizer(BoxesConfig.defaults());

    @Test
    void netsCountsPerKeyAndDropsZeros() {
        Box box = canonicalizer.canonicalize(List.of(
                Term.of(X, 3),
                Term.of(Y, 0),
                Term.of(AtomLabel.UNIT, PLUS),
                Term.of(X, -3),
                Term.of(AtomLabel.UNIT, PLUS)));

        assertThat(box).isEqualTo(Box.of(2));
        assertThat(box.count(X)).isZero();
        assertThat(box.count(Y)).isZero();
    }

    @Test
    void orderOfRawTermsIsIrrelevant() {
        List<Term> terms = new ArrayList<>(List.of(
                Term.of(X, 2),
                Term.of(Y, MINUS),
                Term.of(AtomLabel.nested(Box.of(3)), PLUS),
                Term.of(AtomLabel.UNIT, 5)));
        Box first = canonicalizer.canonicalize(terms);
        Collections.reverse(terms);
        Box reversed = canonicalizer.canonicalize(terms);

        assertThat(reversed).isEqualTo(first);
        assertThat(reversed.terms()).isEqualTo(first.terms());
    }

    @Test
    void canonicalizationIsIdempotent() {
        for (Box b : BoxSamples.generate(11L, 12)) {
            Box once = canonicalizer.canonicalize(b);
            assertThat(once).isEqualTo(b);
            assertThat(canonicalizer.canonicalize(once)).isEqualTo(once);
        }
    }

    @Test
    void emptyInputGivesEmptyBox() {
        assertThat(canonicalizer.canonicalize(List.of())).isSameAs(Box.empty());
        assertThat(canonicalizer.canonicalize(List.of(Term.of(X, 0)))).isSameAs(Box.empty());
    }

    @Test
    void nestedEmptyNormalizesToUnit() {
        assertThat(Canonicalizer.normalize(AtomLabel.nested(Box.empty()))).isEqualTo(AtomLabel.UNIT);
        assertThat(Box.fromLabel(AtomLabel.nested(Box.empty()), PLUS)).isEqualTo(Box.of(1));
    }

    @Test
    void nestedSinglePrimitiveNormalizesToPrimitive() {
        AtomLabel wrappedX = AtomLabel.nested(Box.fromLabel(X, PLUS));

        assertThat(Canonicalizer.normalize(wrappedX)).isEqualTo(X);
    }

    @Test
    void otherNestedLabelsStayNested() {
        List<Box> contents = List.of(
                Box.of(1),
                Box.fromLabel(X, MINUS),
                Box.of(2).multiply(Box.fromLabel(X, PLUS)),
                Box.fromLabel(X, PLUS).add(Box.fromLabel(Y, PLUS)),
                Box.alpha());
        for (Box content : contents) {
            assertThat(Canonicalizer.normalize(AtomLabel.nested(content)))
                    .isEqualTo(AtomLabel.nested(content));
        }
    }

    @Test
    void exponentAndLabelAreInverse() {
        for (Box b : BoxSamples.generate(5L, 12)) {
            assertThat(Canonicalizer.exponentOf(Canonicalizer.labelFor(b))).isEqualTo(b);
        }
        for (AtomLabel label : List.of(AtomLabel.UNIT, X, AtomLabel.nested(Box.of(4)))) {
            assertThat(Canonicalizer.labelFor(Canonicalizer.exponentOf(label))).isEqualTo(label);
        }
    }

    @Test
    void rejectsNestingBeyondMaximum() {
        Canonicalizer shallow = new Canonicalizer(new BoxesConfig(1, 0, 100));
        Box alpha = shallow.canonicalize(List.of(Term.of(AtomLabel.nested(Box.of(1)), PLUS)));

        assertThat(alpha.depth()).isEqualTo(1);
        assertThatThrownBy(() -> shallow.canonicalize(List.of(Term.of(AtomLabel.nested(alpha), PLUS))))
                .isInstanceOf(InvalidStructureException.class)
                .hasMessageContaining("exceeds maximum 1");
    }

    @Test
    void countsAreExact() {
        BigInteger big = new BigInteger("123456789012345678901234567890");
        Box box = canonicalizer.canonicalize(List.of(
                new Term(X, big), new Term(X, big), new Term(X, BigInteger.ONE)));

        assertThat(box.count(X)).isEqualTo(big.add(big).add(BigInteger.ONE));
    }
}

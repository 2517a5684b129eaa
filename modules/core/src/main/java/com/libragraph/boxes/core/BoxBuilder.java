package com.libragraph.boxes.core;

import com.libragraph.boxes.core.label.AtomLabel;
import com.libragraph.boxes.types.AtomSign;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable draft of a box whose atoms may be labelled by other drafts.
 *
 * <p>Drafts can reference each other freely, including in cycles; {@link #build()}
 * validates the graph and rejects cycles with {@link InvalidStructureException}.
 * A draft referenced from several places is built once and shared.
 *
 * <pre>{@code
 * BoxBuilder two = new BoxBuilder().add(AtomLabel.UNIT, 2);
 * Box box = new BoxBuilder().addNested(two, AtomSign.PLUS).add("x", AtomSign.MINUS).build();
 * }</pre>
 */
public final class BoxBuilder {

    private record Entry(AtomLabel label, BoxBuilder draft, BigInteger count) {}

    private final List<Entry> entries = new ArrayList<>();

    public BoxBuilder add(AtomLabel label, AtomSign sign) {
        return add(label, sign.count());
    }

    public BoxBuilder add(AtomLabel label, long count) {
        return add(label, BigInteger.valueOf(count));
    }

    public BoxBuilder add(AtomLabel label, BigInteger count) {
        entries.add(new Entry(
                Objects.requireNonNull(label, "label cannot be null"),
                null,
                Objects.requireNonNull(count, "count cannot be null")));
        return this;
    }

    public BoxBuilder add(String token, AtomSign sign) {
        return add(AtomLabel.primitive(token), sign);
    }

    public BoxBuilder addNested(Box content, AtomSign sign) {
        return add(AtomLabel.nested(content), sign);
    }

    public BoxBuilder addNested(BoxBuilder draft, AtomSign sign) {
        return addNested(draft, sign.count());
    }

    public BoxBuilder addNested(BoxBuilder draft, BigInteger count) {
        entries.add(new Entry(
                null,
                Objects.requireNonNull(draft, "draft cannot be null"),
                Objects.requireNonNull(count, "count cannot be null")));
        return this;
    }

    /**
     * Builds with {@link BoxAlgebra#standard()}'s canonicalizer.
     */
    public Box build() {
        return build(BoxAlgebra.standard().canonicalizer());
    }

    /**
     * @throws InvalidStructureException if the draft graph has a cycle or nests too deep
     */
    public Box build(Canonicalizer canonicalizer) {
        Objects.requireNonNull(canonicalizer, "canonicalizer cannot be null");
        return resolve(this, canonicalizer, new IdentityHashMap<>(),
                Collections.newSetFromMap(new IdentityHashMap<>()), 0);
    }

    private static Box resolve(BoxBuilder draft, Canonicalizer canonicalizer,
                               Map<BoxBuilder, Box> built, Set<BoxBuilder> onPath, int depth) {
        Box done = built.get(draft);
        if (done != null) return done;
        if (!onPath.add(draft)) {
            throw InvalidStructureException.cycle();
        }
        // Checked here as well so a long draft chain fails before the stack does
        if (depth > canonicalizer.maxDepth()) {
            throw InvalidStructureException.tooDeep(depth, canonicalizer.maxDepth());
        }

        List<Term> terms = new ArrayList<>(draft.entries.size());
        for (Entry entry : draft.entries) {
            AtomLabel label = entry.draft() != null
                    ? AtomLabel.nested(resolve(entry.draft(), canonicalizer, built, onPath, depth + 1))
                    : entry.label();
            terms.add(new Term(label, entry.count()));
        }
        Box box = canonicalizer.canonicalize(terms);

        onPath.remove(draft);
        built.put(draft, box);
        return box;
    }
}

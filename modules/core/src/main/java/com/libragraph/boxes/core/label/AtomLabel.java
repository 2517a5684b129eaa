package com.libragraph.boxes.core.label;

import com.libragraph.boxes.core.Box;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identity of an atom: either an opaque primitive token or a nested box.
 *
 * <p>Two labels are the same atom identity exactly when their {@link #key() canonical keys}
 * are equal. Nested labels compare by the structure of their content, never by reference.
 */
public sealed interface AtomLabel permits AtomLabel.Primitive, AtomLabel.Nested {

    /**
     * The one primitive used to build plain integers. {@code Box.unit(PLUS)} denotes 1.
     */
    Primitive UNIT = new Primitive("unit");

    CanonicalKey key();

    /**
     * Nesting depth: 0 for primitives, one more than the content for nested labels.
     */
    int depth();

    default boolean isUnit() {
        return UNIT.equals(this);
    }

    static Primitive primitive(String token) {
        return new Primitive(token);
    }

    static Nested nested(Box content) {
        return new Nested(content);
    }

    /**
     * An opaque symbol. Tokens are non-empty and limited to {@code [A-Za-z0-9_.']}
     * so they never collide with the text form's punctuation.
     */
    record Primitive(String token) implements AtomLabel {
        private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_.']+");

        public Primitive {
            Objects.requireNonNull(token, "token cannot be null");
            if (!TOKEN.matcher(token).matches()) {
                throw new IllegalArgumentException("Invalid primitive token: '" + token + "'");
            }
        }

        public static boolean isValidToken(String token) {
            return token != null && TOKEN.matcher(token).matches();
        }

        @Override
        public CanonicalKey key() {
            return new PrimitiveKey(token);
        }

        @Override
        public int depth() {
            return 0;
        }

        @Override
        public String toString() {
            return token;
        }
    }

    /**
     * A label whose identity is the content of another, already canonical box.
     */
    record Nested(Box content) implements AtomLabel {

        public Nested {
            Objects.requireNonNull(content, "content cannot be null");
        }

        @Override
        public CanonicalKey key() {
            return content.canonicalKey();
        }

        @Override
        public int depth() {
            return content.depth() + 1;
        }

        @Override
        public String toString() {
            return content.toString();
        }
    }
}

package com.libragraph.boxes.core.text;

import com.libragraph.boxes.core.Box;
import com.libragraph.boxes.core.BoxAlgebra;
import com.libragraph.boxes.core.Canonicalizer;
import com.libragraph.boxes.core.InvalidStructureException;
import com.libragraph.boxes.core.Term;
import com.libragraph.boxes.core.label.AtomLabel;
import com.libragraph.boxes.types.AtomSign;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the text form written by {@link BoxWriter}.
 *
 * <pre>
 * box   := '{' [ atom ( ',' atom )* ] '}'
 * atom  := ( '+' | '-' ) label
 * label := token | box
 * token := [A-Za-z0-9_.']+
 * </pre>
 *
 * Whitespace is allowed between tokens. Atoms may appear in any order and repeat; the
 * result is canonicalized, so {@code parse(write(b)).equals(b)} for every box.
 *
 * <p>The nesting limit applies to the braces as written, before labels are normalized.
 * Text such as {@code {+{+{+{+x}}}}} collapses to {@code {+x}} but is still rejected when
 * its braces go deeper than the limit. Written boxes never nest deeper than their own
 * depth, so this never affects text produced by {@link BoxWriter}.
 */
public final class BoxParser {

    private static final Logger log = Logger.getLogger(BoxParser.class);

    private final Canonicalizer canonicalizer;

    public BoxParser(Canonicalizer canonicalizer) {
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer cannot be null");
    }

    public static BoxParser standard() {
        return new BoxParser(BoxAlgebra.standard().canonicalizer());
    }

    public static Box parse(String text) {
        return standard().read(text);
    }

    /**
     * @throws ParseException on malformed text or nesting deeper than the maximum
     */
    public Box read(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        Cursor cursor = new Cursor(text);
        cursor.skipWhitespace();
        Box box = cursor.box(0);
        cursor.skipWhitespace();
        if (!cursor.atEnd()) {
            throw cursor.error("unexpected trailing input '" + cursor.peek() + "'");
        }
        return box;
    }

    private final class Cursor {
        private final String text;
        private int pos = 0;

        Cursor(String text) {
            this.text = text;
        }

        Box box(int depth) {
            int start = pos;
            expect('{');
            List<Term> terms = new ArrayList<>();
            skipWhitespace();
            if (!atEnd() && peek() == '}') {
                pos++;
                return build(terms, start);
            }
            while (true) {
                skipWhitespace();
                terms.add(atom(depth));
                skipWhitespace();
                if (atEnd()) {
                    throw error("unterminated box, expected ',' or '}'");
                }
                char c = peek();
                if (c == ',') {
                    pos++;
                } else if (c == '}') {
                    pos++;
                    return build(terms, start);
                } else {
                    throw error("expected ',' or '}' but found '" + c + "'");
                }
            }
        }

        private Term atom(int depth) {
            if (atEnd()) {
                throw error("expected '+' or '-' but input ended");
            }
            char c = peek();
            if (c != '+' && c != '-') {
                throw error("expected '+' or '-' but found '" + c + "'");
            }
            AtomSign sign = AtomSign.fromSymbol(c);
            pos++;
            skipWhitespace();
            return Term.of(label(depth), sign);
        }

        private AtomLabel label(int depth) {
            if (!atEnd() && peek() == '{') {
                if (depth + 1 > canonicalizer.maxDepth()) {
                    throw error("nesting deeper than " + canonicalizer.maxDepth());
                }
                return AtomLabel.nested(box(depth + 1));
            }
            int start = pos;
            while (!atEnd() && isTokenChar(peek())) {
                pos++;
            }
            if (start == pos) {
                throw atEnd() ? error("expected label but input ended")
                        : error("expected label but found '" + peek() + "'");
            }
            return AtomLabel.primitive(text.substring(start, pos));
        }

        private Box build(List<Term> terms, int start) {
            try {
                return canonicalizer.canonicalize(terms);
            } catch (InvalidStructureException e) {
                throw new ParseException(start, e.getMessage(), e);
            }
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        private void expect(char c) {
            if (atEnd()) {
                throw error("expected '" + c + "' but input ended");
            }
            if (peek() != c) {
                throw error("expected '" + c + "' but found '" + peek() + "'");
            }
            pos++;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        ParseException error(String reason) {
            log.debugf("Rejected box text at offset %d: %s", pos, reason);
            return new ParseException(pos, reason);
        }
    }

    private static boolean isTokenChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '_' || c == '.' || c == '\'';
    }
}

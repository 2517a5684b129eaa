package com.libragraph.boxes.types;

import java.math.BigInteger;

/**
 * Polarity of a single atom: a box atom ({@code +}) or its anti-box partner ({@code -}).
 */
public enum AtomSign {
    PLUS(1, '+'),
    MINUS(-1, '-');

    private final int id;
    private final char symbol;

    AtomSign(int id, char symbol) {
        this.id = id;
        this.symbol = symbol;
    }

    public int id() {
        return id;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * The signed unit count this polarity contributes: +1 or -1.
     */
    public BigInteger count() {
        return BigInteger.valueOf(id);
    }

    public AtomSign opposite() {
        return this == PLUS ? MINUS : PLUS;
    }

    public static AtomSign fromId(int id) {
        for (AtomSign s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown AtomSign id: " + id);
    }

    public static AtomSign fromSymbol(char symbol) {
        for (AtomSign s : values()) {
            if (s.symbol == symbol) return s;
        }
        throw new IllegalArgumentException("Unknown AtomSign symbol: '" + symbol + "'");
    }

    /**
     * Sign of a nonzero count.
     *
     * @throws IllegalArgumentException if {@code count} is zero
     */
    public static AtomSign of(BigInteger count) {
        int signum = count.signum();
        if (signum == 0) {
            throw new IllegalArgumentException("Zero count has no sign");
        }
        return signum > 0 ? PLUS : MINUS;
    }
}

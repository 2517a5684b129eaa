package com.libragraph.boxes.core;

/**
 * Thrown when supplied structure cannot form a box: a cyclic label graph, or
 * nesting deeper than the configured maximum.
 */
public class InvalidStructureException extends RuntimeException {

    public InvalidStructureException(String message) {
        super(message);
    }

    public static InvalidStructureException cycle() {
        return new InvalidStructureException("Box label graph contains a cycle");
    }

    public static InvalidStructureException tooDeep(int depth, int maxDepth) {
        return new InvalidStructureException(
                "Box nesting depth " + depth + " exceeds maximum " + maxDepth);
    }
}

package org.pragmatica.harel.model;

/**
 * Structural kind of a state, fixed by the number of regions it owns.
 */
public enum StateKind {
    /** No child region. */
    SIMPLE,
    /** Exactly one child region. */
    COMPOSITE,
    /** Two or more independently active child regions. */
    ORTHOGONAL;

    public static StateKind forRegionCount(int regionCount) {
        if (regionCount < 0) {
            throw new IllegalArgumentException("Negative region count: " + regionCount);
        }
        return switch (regionCount) {
            case 0 -> SIMPLE;
            case 1 -> COMPOSITE;
            default -> ORTHOGONAL;
        };
    }

    public boolean matches(int regionCount) {
        return regionCount >= 0 && this == forRegionCount(regionCount);
    }
}

package org.pragmatica.harel.model;

/**
 * Depth of a history pseudo-state.
 */
public enum History {
    /** Restores the most recently active direct child of the owning state. */
    SHALLOW,
    /** Restores the most recently active configuration below the owning state. */
    DEEP
}

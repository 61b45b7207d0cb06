package org.pragmatica.harel.traversal;

import org.pragmatica.harel.model.State;

/**
 * Direct child of a state together with the index of the region holding it.
 */
public record Child(State state, int regionIndex) {}

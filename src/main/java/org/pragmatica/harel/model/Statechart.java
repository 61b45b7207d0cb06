package org.pragmatica.harel.model;

import org.pragmatica.harel.tree.SourceSpan;

import java.util.List;

/**
 * Root of a parsed statechart. Owns exactly one top-level region.
 */
public record Statechart(String name, Region region, SourceSpan span) {

    public static Statechart of(String name, State... states) {
        return new Statechart(name, Region.of(states), SourceSpan.SYNTHETIC);
    }

    public List<State> states() {
        return region.states();
    }
}

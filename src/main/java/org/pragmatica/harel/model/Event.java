package org.pragmatica.harel.model;

import org.pragmatica.harel.tree.SourceSpan;

/**
 * Named trigger of a transition.
 */
public record Event(String name, SourceSpan span) {
    public static Event named(String name) {
        return new Event(name, SourceSpan.SYNTHETIC);
    }
}

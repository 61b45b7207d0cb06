package org.pragmatica.harel.model;

import org.pragmatica.harel.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Ordered container of sibling states.
 */
public record Region(List<State> states, SourceSpan span) {
    public Region {
        states = List.copyOf(states);
    }

    public static Region of(State... states) {
        return new Region(List.of(states), SourceSpan.SYNTHETIC);
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    /**
     * States carrying the explicit {@code initial} marker, in declaration order.
     */
    public List<State> explicitInitialStates() {
        return states.stream()
                     .filter(State::initial)
                     .toList();
    }

    /**
     * The explicitly marked state, otherwise the first declared one that is not a history pseudo-state.
     * With several markers the first marked state is returned; validation reports that case.
     */
    public Optional<State> initialState() {
        var marked = explicitInitialStates();
        if (!marked.isEmpty()) {
            return Optional.of(marked.get(0));
        }
        return states.stream()
                     .filter(state -> !state.isHistory())
                     .findFirst();
    }
}

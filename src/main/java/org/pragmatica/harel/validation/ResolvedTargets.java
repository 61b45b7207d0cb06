package org.pragmatica.harel.validation;

import org.pragmatica.harel.model.State;
import org.pragmatica.harel.model.Transition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Destination states of transitions, keyed by source state and transition identity.
 *
 * <p>Resolution depends on where the source state sits, so the same {@link Transition} instance owned by
 * two states may resolve differently for each of them.
 */
final class ResolvedTargets {
    private final Map<State, Map<Transition, List<State>>> bySource = new IdentityHashMap<>();

    void put(State source, Transition transition, List<State> targets) {
        bySource.computeIfAbsent(source, key -> new IdentityHashMap<>())
                .put(transition, List.copyOf(targets));
    }

    List<State> get(State source, Transition transition) {
        var transitions = bySource.get(source);
        if (transitions == null) {
            return List.of();
        }
        return transitions.getOrDefault(transition, List.of());
    }

    /**
     * Every resolved destination, one entry per target of each resolved transition.
     */
    Collection<State> destinations() {
        var destinations = new ArrayList<State>();
        bySource.values()
                .forEach(transitions -> transitions.values().forEach(destinations::addAll));
        return destinations;
    }
}

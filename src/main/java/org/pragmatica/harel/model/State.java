package org.pragmatica.harel.model;

import org.pragmatica.harel.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A named node of the statechart.
 *
 * <p>A single type covers all kinds: {@link StateKind#SIMPLE} owns no region, {@link StateKind#COMPOSITE}
 * owns one, {@link StateKind#ORTHOGONAL} owns two or more. The parser derives the kind from structure,
 * states built in code may declare any kind and are checked again by validation.
 *
 * <p>A history pseudo-state is a SIMPLE state carrying a {@link History} depth. Its only transition, if
 * any, is the default transition taken when no history has been recorded yet.
 *
 * @param name        name, unique among siblings
 * @param kind        structural kind
 * @param initial     explicit initial marker of the enclosing region
 * @param terminal    final state marker
 * @param history     history depth of a history pseudo-state, empty for ordinary states
 * @param entry       entry action
 * @param exit        exit action
 * @param transitions outgoing transitions in declaration order
 * @param regions     child regions in declaration order
 * @param span        location of the declaration
 */
public record State(
 String name,
 StateKind kind,
 boolean initial,
 boolean terminal,
 Optional<History> history,
 Optional<Action> entry,
 Optional<Action> exit,
 List<Transition> transitions,
 List<Region> regions,
 SourceSpan span) {

    public State {
        transitions = List.copyOf(transitions);
        regions = List.copyOf(regions);
    }

    public static State simple(String name, Transition... transitions) {
        var builder = builder(name);
        for (var transition : transitions) {
            builder.transition(transition);
        }
        return builder.build();
    }

    /**
     * History pseudo-state with an optional default transition.
     */
    public static State historyState(String name, History depth, Transition... defaultTransition) {
        var builder = builder(name).history(depth);
        for (var transition : defaultTransition) {
            builder.transition(transition);
        }
        return builder.build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean isSimple() {
        return kind == StateKind.SIMPLE;
    }

    public boolean isComposite() {
        return kind == StateKind.COMPOSITE;
    }

    public boolean isOrthogonal() {
        return kind == StateKind.ORTHOGONAL;
    }

    public boolean isHistory() {
        return history.isPresent();
    }

    /**
     * Direct children across all regions, in declaration order.
     */
    public List<State> children() {
        var children = new ArrayList<State>();
        for (var region : regions) {
            children.addAll(region.states());
        }
        return children;
    }

    /**
     * Accumulates the parts of a state and derives its kind from the regions added.
     */
    public static final class Builder {
        private final String name;
        private final List<Transition> transitions = new ArrayList<>();
        private final List<Region> regions = new ArrayList<>();
        private StateKind declaredKind;
        private boolean initial;
        private boolean terminal;
        private History history;
        private Action entry;
        private Action exit;
        private SourceSpan span = SourceSpan.SYNTHETIC;

        private Builder(String name) {
            this.name = name;
        }

        public Builder initial() {
            this.initial = true;
            return this;
        }

        public Builder terminal() {
            this.terminal = true;
            return this;
        }

        public Builder history(History depth) {
            this.history = depth;
            return this;
        }

        public Builder entry(Action entry) {
            this.entry = entry;
            return this;
        }

        public Builder exit(Action exit) {
            this.exit = exit;
            return this;
        }

        public Builder transition(Transition transition) {
            transitions.add(transition);
            return this;
        }

        public Builder region(Region region) {
            regions.add(region);
            return this;
        }

        public Builder children(State... states) {
            return region(Region.of(states));
        }

        /**
         * Override the kind derived from the region count.
         */
        public Builder kind(StateKind kind) {
            this.declaredKind = kind;
            return this;
        }

        public Builder span(SourceSpan span) {
            this.span = span;
            return this;
        }

        public boolean hasEntry() {
            return entry != null;
        }

        public boolean hasExit() {
            return exit != null;
        }

        public State build() {
            var kind = declaredKind != null
                       ? declaredKind
                       : StateKind.forRegionCount(regions.size());
            return new State(name,
                             kind,
                             initial,
                             terminal,
                             Optional.ofNullable(history),
                             Optional.ofNullable(entry),
                             Optional.ofNullable(exit),
                             transitions,
                             regions,
                             span);
        }
    }
}

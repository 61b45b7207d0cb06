package org.pragmatica.harel.validation;

import org.pragmatica.harel.error.SemanticError;
import org.pragmatica.harel.model.QualifiedName;
import org.pragmatica.harel.model.Region;
import org.pragmatica.harel.model.State;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.model.Transition;
import org.pragmatica.harel.traversal.Child;
import org.pragmatica.harel.traversal.StatechartNavigator;

import java.util.List;
import java.util.Optional;

/**
 * Statechart which passed validation without hard errors.
 *
 * <p>Only obtainable from a {@link ValidationReport}. Every target of every transition resolved to
 * exactly one state, available through {@link #targets(State, Transition)}. Instances are immutable.
 */
public final class ValidatedStatechart {
    private final Statechart statechart;
    private final StatechartNavigator navigator;
    private final ResolvedTargets resolvedTargets;
    private final List<SemanticError> warnings;

    ValidatedStatechart(ValidationReport report) {
        this.statechart = report.statechart();
        this.navigator = report.navigator();
        this.resolvedTargets = report.resolvedTargets();
        this.warnings = report.warnings();
    }

    public String name() {
        return statechart.name();
    }

    public Region region() {
        return statechart.region();
    }

    public Statechart statechart() {
        return statechart;
    }

    public StatechartNavigator navigator() {
        return navigator;
    }

    /**
     * Advisory findings, such as unreachable states.
     */
    public List<SemanticError> warnings() {
        return warnings;
    }

    public Optional<State> findState(String path) {
        return navigator.findState(path);
    }

    public Optional<State> findState(QualifiedName path) {
        return navigator.findState(path);
    }

    public List<Child> children(State state) {
        return navigator.children(state);
    }

    public List<Transition> outgoingTransitions(State state) {
        return navigator.outgoingTransitions(state);
    }

    public List<State> ancestorChain(State state) {
        return navigator.ancestorChain(state);
    }

    public QualifiedName qualifiedName(State state) {
        return navigator.qualifiedName(state);
    }

    /**
     * States the transition of {@code source} enters; empty only for internal transitions.
     */
    public List<State> targets(State source, Transition transition) {
        return resolvedTargets.get(source, transition);
    }

    /**
     * Destination of a single-target transition of {@code source}.
     */
    public Optional<State> target(State source, Transition transition) {
        var targets = targets(source, transition);
        return targets.size() == 1
               ? Optional.of(targets.get(0))
               : Optional.empty();
    }

    /**
     * Initial state of the top-level region.
     */
    public Optional<State> initialState() {
        return statechart.region().initialState();
    }
}

package org.pragmatica.harel.validation;

import org.pragmatica.harel.error.SemanticError;
import org.pragmatica.harel.model.History;
import org.pragmatica.harel.model.QualifiedName;
import org.pragmatica.harel.model.Region;
import org.pragmatica.harel.model.State;
import org.pragmatica.harel.model.StateKind;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.model.Transition;
import org.pragmatica.harel.traversal.StatechartNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Whole-tree semantic analysis of a parsed statechart.
 *
 * <p>Every check runs on the complete tree and all findings are collected:
 * <ul>
 *   <li>sibling names are unique within each region</li>
 *   <li>each region has at most one explicit initial marker</li>
 *   <li>every transition target resolves to exactly one state</li>
 *   <li>the targets of a multi-target transition lie in different regions of one orthogonal state</li>
 *   <li>orthogonal states own two or more non-empty regions</li>
 *   <li>declared kinds agree with region counts</li>
 *   <li>final states own neither transitions nor regions</li>
 *   <li>history pseudo-states sit inside a state and default to one of its descendants</li>
 *   <li>states that can never be entered are reported as warnings</li>
 * </ul>
 * The tree is never modified. Resolved transition targets are returned in the {@link ValidationReport}.
 */
public final class Validator {
    private static final Logger log = LoggerFactory.getLogger(Validator.class);

    private final Statechart statechart;
    private final StatechartNavigator navigator;
    private final List<SemanticError> problems = new ArrayList<>();
    private final ResolvedTargets resolvedTargets = new ResolvedTargets();

    private Validator(Statechart statechart) {
        this.statechart = statechart;
        this.navigator = StatechartNavigator.of(statechart);
    }

    public static ValidationReport validate(Statechart statechart) {
        return new Validator(statechart).run();
    }

    private ValidationReport run() {
        checkRegion(statechart.region(), QualifiedName.ROOT, statechart.name());
        checkReachability();

        var report = new ValidationReport(statechart, navigator, problems, resolvedTargets);
        log.debug("Validated statechart '{}': {} state(s), {} error(s), {} warning(s)",
                  statechart.name(),
                  navigator.states().size(),
                  report.errors().size(),
                  report.warnings().size());
        return report;
    }

    private void checkRegion(Region region, QualifiedName prefix, String regionPath) {
        checkDuplicateNames(region, prefix);
        checkInitialMarkers(region, regionPath);

        for (var state : region.states()) {
            var name = prefix.child(state.name());
            checkKind(state, name);
            checkOrthogonal(state, name);
            checkFinal(state, name);
            checkHistory(state, name);
            resolveTargets(state, name);

            var regions = state.regions();
            for (int i = 0; i < regions.size(); i++) {
                var childPath = regions.size() == 1
                                ? name.toString()
                                : name + "[" + (i + 1) + "]";
                checkRegion(regions.get(i), name, childPath);
            }
        }
    }

    private void checkDuplicateNames(Region region, QualifiedName prefix) {
        var firstByName = new LinkedHashMap<String, State>();
        var reported = new HashSet<String>();
        for (var state : region.states()) {
            var first = firstByName.putIfAbsent(state.name(), state);
            if (first != null && reported.add(state.name())) {
                problems.add(new SemanticError.DuplicateStateName(prefix.child(state.name()).toString(),
                                                                  state.span(),
                                                                  first.span()));
            }
        }
    }

    private void checkInitialMarkers(Region region, String regionPath) {
        var marked = region.explicitInitialStates();
        if (marked.size() > 1) {
            var names = marked.stream()
                              .map(State::name)
                              .collect(Collectors.toList());
            problems.add(new SemanticError.AmbiguousInitialState(regionPath, marked.get(1).span(), names));
        }
    }

    private void checkKind(State state, QualifiedName name) {
        int regionCount = state.regions().size();
        if (!state.kind().matches(regionCount)) {
            problems.add(new SemanticError.StateKindMismatch(name.toString(), state.kind(), regionCount, state.span()));
        }
    }

    private void checkOrthogonal(State state, QualifiedName name) {
        if (state.kind() != StateKind.ORTHOGONAL) {
            return;
        }
        var reasons = new ArrayList<String>();
        var regions = state.regions();
        if (regions.size() < 2) {
            reasons.add("declares " + regions.size() + " region(s), at least two are required");
        }
        for (int i = 0; i < regions.size(); i++) {
            if (regions.get(i).isEmpty()) {
                reasons.add("region " + (i + 1) + " is empty");
            }
        }
        if (!reasons.isEmpty()) {
            problems.add(new SemanticError.MalformedOrthogonalState(name.toString(),
                                                                    state.span(),
                                                                    String.join("; ", reasons)));
        }
    }

    private void checkFinal(State state, QualifiedName name) {
        if (!state.terminal()) {
            return;
        }
        if (!state.transitions().isEmpty()) {
            problems.add(new SemanticError.InvalidFinalState(name.toString(), state.span(), "has outgoing transitions"));
        }
        if (!state.regions().isEmpty()) {
            problems.add(new SemanticError.InvalidFinalState(name.toString(), state.span(), "owns child regions"));
        }
    }

    private void checkHistory(State state, QualifiedName name) {
        if (!state.isHistory()) {
            return;
        }
        var reasons = new ArrayList<String>();
        if (navigator.parent(state).isEmpty()) {
            reasons.add("is not nested in a state");
        }
        if (state.initial() || state.terminal()) {
            reasons.add("cannot be marked initial or final");
        }
        if (!state.regions().isEmpty()) {
            reasons.add("owns child regions");
        }
        if (state.entry().isPresent() || state.exit().isPresent()) {
            reasons.add("declares entry or exit actions");
        }
        if (state.transitions().size() > 1) {
            reasons.add("declares more than one default transition");
        }
        var eventDriven = state.transitions()
                               .stream()
                               .anyMatch(transition -> !transition.isCompletion() || transition.guard().isPresent());
        if (eventDriven) {
            reasons.add("default transition must have neither event nor guard");
        }
        if (state.transitions().stream().anyMatch(Transition::isInternal)) {
            reasons.add("default transition has no target");
        }
        reasons.forEach(reason -> problems.add(new SemanticError.InvalidHistoryState(name.toString(), state.span(), reason)));
    }

    private void resolveTargets(State state, QualifiedName name) {
        for (var transition : state.transitions()) {
            var resolved = new ArrayList<State>();
            for (var path : transition.targets()) {
                var matches = navigator.resolveAll(state, path);
                if (matches.isEmpty()) {
                    problems.add(new SemanticError.UnresolvedTarget(name.toString(), path.toString(), transition.span()));
                } else if (matches.size() > 1) {
                    problems.add(new SemanticError.AmbiguousTarget(name.toString(),
                                                                   path.toString(),
                                                                   transition.span(),
                                                                   describeAll(matches)));
                } else {
                    resolved.add(matches.get(0));
                }
            }
            if (resolved.size() < transition.targets().size()) {
                continue;
            }
            resolvedTargets.put(state, transition, resolved);
            if (transition.isMultiTarget()) {
                checkTargetsCompatible(name, transition, resolved);
            }
            if (state.isHistory()) {
                checkHistoryDefault(state, name, resolved);
            }
        }
    }

    /**
     * Qualified names, with the region number for states of orthogonal regions.
     */
    private List<String> describeAll(List<State> states) {
        return states.stream()
                     .map(this::describe)
                     .toList();
    }

    private String describe(State state) {
        var name = navigator.qualifiedName(state).toString();
        return navigator.parent(state)
                        .filter(State::isOrthogonal)
                        .map(parent -> name + " in region " + (navigator.regionIndexOf(state) + 1))
                        .orElse(name);
    }

    /**
     * Every pair of targets must meet at an orthogonal state, each inside a different one of its regions.
     */
    private void checkTargetsCompatible(QualifiedName name, Transition transition, List<State> targets) {
        for (int i = 0; i < targets.size(); i++) {
            for (int j = i + 1; j < targets.size(); j++) {
                var conflict = conflictBetween(targets.get(i), targets.get(j));
                if (conflict.isPresent()) {
                    var paths = transition.targets()
                                          .stream()
                                          .map(QualifiedName::toString)
                                          .toList();
                    problems.add(new SemanticError.ConflictingTargets(name.toString(),
                                                                      paths,
                                                                      transition.span(),
                                                                      conflict.get()));
                    return;
                }
            }
        }
    }

    private Optional<String> conflictBetween(State first, State second) {
        var firstName = "'" + navigator.qualifiedName(first) + "'";
        var secondName = "'" + navigator.qualifiedName(second) + "'";
        if (first == second) {
            return Optional.of(firstName + " is targeted twice");
        }
        if (navigator.isWithin(first, second) || navigator.isWithin(second, first)) {
            return Optional.of(firstName + " and " + secondName + " are nested in each other");
        }
        var firstChain = navigator.ancestorChain(first);
        var secondChain = navigator.ancestorChain(second);
        int common = 0;
        while (firstChain.get(common) == secondChain.get(common)) {
            common++;
        }
        if (common == 0) {
            return Optional.of(firstName + " and " + secondName + " share no orthogonal ancestor");
        }
        var owner = firstChain.get(common - 1);
        if (!owner.isOrthogonal()
            || navigator.regionIndexOf(firstChain.get(common)) == navigator.regionIndexOf(secondChain.get(common))) {
            return Optional.of(firstName + " and " + secondName + " lie in the same region of '"
                               + navigator.qualifiedName(owner) + "'");
        }
        return Optional.empty();
    }

    /**
     * A shallow history defaults to a direct child of its owner, a deep history to any state below it.
     */
    private void checkHistoryDefault(State history, QualifiedName name, List<State> targets) {
        var owner = navigator.parent(history);
        if (owner.isEmpty()) {
            return;
        }
        var deep = history.history().orElseThrow() == History.DEEP;
        for (var target : targets) {
            var valid = deep
                        ? target != owner.get() && navigator.isWithin(target, owner.get())
                        : navigator.parent(target).filter(parent -> parent == owner.get()).isPresent();
            if (!valid) {
                var expected = deep ? "a descendant" : "a child";
                problems.add(new SemanticError.InvalidHistoryState(name.toString(),
                                                                   history.span(),
                                                                   "defaults to '" + navigator.qualifiedName(target)
                                                                   + "', which is not " + expected + " of '"
                                                                   + navigator.qualifiedName(owner.get()) + "'"));
            }
        }
    }

    /**
     * A state is entered by any transition targeting it or one of its descendants, or by being the initial
     * state of its region.
     */
    private void checkReachability() {
        Set<State> entered = Collections.newSetFromMap(new IdentityHashMap<>());
        resolvedTargets.destinations()
                       .forEach(target -> entered.addAll(navigator.ancestorChain(target)));

        for (var state : navigator.states()) {
            if (entered.contains(state)) {
                continue;
            }
            var initial = navigator.regionOf(state).initialState();
            if (initial.isPresent() && initial.get() == state) {
                continue;
            }
            problems.add(new SemanticError.UnreachableState(navigator.qualifiedName(state).toString(), state.span()));
        }
    }
}

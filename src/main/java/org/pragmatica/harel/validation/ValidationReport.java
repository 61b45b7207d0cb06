package org.pragmatica.harel.validation;

import org.pragmatica.harel.error.Diagnostic;
import org.pragmatica.harel.error.Result;
import org.pragmatica.harel.error.SemanticError;
import org.pragmatica.harel.model.State;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.model.Transition;
import org.pragmatica.harel.traversal.StatechartNavigator;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating a statechart: every problem found, plus the transition targets that did resolve.
 *
 * <p>The statechart is accepted when no hard error was found; warnings never block acceptance. A rejected
 * statechart is still available for best-effort inspection through {@link #statechart()}.
 */
public final class ValidationReport {
    private final Statechart statechart;
    private final StatechartNavigator navigator;
    private final List<SemanticError> problems;
    private final ResolvedTargets resolvedTargets;

    ValidationReport(Statechart statechart,
                     StatechartNavigator navigator,
                     List<SemanticError> problems,
                     ResolvedTargets resolvedTargets) {
        this.statechart = statechart;
        this.navigator = navigator;
        this.problems = List.copyOf(problems);
        this.resolvedTargets = resolvedTargets;
    }

    public Statechart statechart() {
        return statechart;
    }

    public StatechartNavigator navigator() {
        return navigator;
    }

    /**
     * All findings, hard errors and warnings.
     */
    public List<SemanticError> problems() {
        return problems;
    }

    public List<SemanticError> errors() {
        return problems.stream()
                       .filter(SemanticError::isHardError)
                       .toList();
    }

    public List<SemanticError> warnings() {
        return problems.stream()
                       .filter(problem -> !problem.isHardError())
                       .toList();
    }

    public boolean isValid() {
        return problems.stream()
                       .noneMatch(SemanticError::isHardError);
    }

    public List<Diagnostic> diagnostics() {
        return problems.stream()
                       .map(SemanticError::toDiagnostic)
                       .toList();
    }

    /**
     * States the transition of {@code source} enters, in target order. Empty for internal transitions and
     * for transitions with a target that did not resolve to exactly one state.
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

    ResolvedTargets resolvedTargets() {
        return resolvedTargets;
    }

    /**
     * The accepted statechart, or empty when a hard error was found.
     */
    public Optional<ValidatedStatechart> validated() {
        return isValid()
               ? Optional.of(new ValidatedStatechart(this))
               : Optional.empty();
    }

    public Result<ValidatedStatechart> toResult() {
        return isValid()
               ? Result.success(new ValidatedStatechart(this))
               : Result.failure(new ValidationFailed(this));
    }
}

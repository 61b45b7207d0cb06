package org.pragmatica.harel.error;

import org.pragmatica.harel.model.StateKind;
import org.pragmatica.harel.tree.SourceSpan;

import java.util.List;

/**
 * Whole-tree problem found by validation. Validation collects all of them instead of stopping at the first.
 *
 * <p>Every kind is a hard error except {@link UnreachableState}, which is reported with
 * {@link Diagnostic.Severity#WARNING} and does not prevent acceptance of the statechart.
 */
public sealed interface SemanticError extends ChartError {

    @Override
    default Stage stage() {
        return Stage.VALIDATE;
    }

    default boolean isHardError() {
        return severity() == Diagnostic.Severity.ERROR;
    }

    record DuplicateStateName(String path, SourceSpan span, SourceSpan firstDeclaration) implements SemanticError {
        @Override
        public String kind() {
            return "DuplicateStateName";
        }

        @Override
        public String message() {
            return "Duplicate state name '" + path + "'";
        }

        @Override
        public Diagnostic toDiagnostic() {
            var diagnostic = Diagnostic.error(stage(), kind(), message(), span)
                                       .withLabel("declared again here");
            return firstDeclaration.isSynthetic()
                   ? diagnostic
                   : diagnostic.withSecondaryLabel(firstDeclaration, "first declared here");
        }
    }

    record AmbiguousInitialState(String regionPath, SourceSpan span, List<String> markedStates) implements SemanticError {
        public AmbiguousInitialState {
            markedStates = List.copyOf(markedStates);
        }

        @Override
        public String kind() {
            return "AmbiguousInitialState";
        }

        @Override
        public String message() {
            return "Region " + regionPath + " marks more than one initial state: " + String.join(", ", markedStates);
        }
    }

    record UnresolvedTarget(String fromState, String path, SourceSpan span) implements SemanticError {
        @Override
        public String kind() {
            return "UnresolvedTarget";
        }

        @Override
        public String message() {
            return "Transition from '" + fromState + "' targets unknown state '" + path + "'";
        }
    }

    /**
     * Target path matching more than one state in the innermost scope where it matches at all.
     */
    record AmbiguousTarget(String fromState, String path, SourceSpan span, List<String> candidates)
        implements SemanticError {
        public AmbiguousTarget {
            candidates = List.copyOf(candidates);
        }

        @Override
        public String kind() {
            return "AmbiguousTarget";
        }

        @Override
        public String message() {
            return "Transition from '" + fromState + "' targets ambiguous path '" + path + "', matching "
                   + String.join(", ", candidates);
        }
    }

    /**
     * Multi-target transition whose targets cannot be active together.
     */
    record ConflictingTargets(String fromState, List<String> paths, SourceSpan span, String reason)
        implements SemanticError {
        public ConflictingTargets {
            paths = List.copyOf(paths);
        }

        @Override
        public String kind() {
            return "ConflictingTargets";
        }

        @Override
        public String message() {
            return "Transition from '" + fromState + "' to " + String.join(", ", paths) + " is invalid: " + reason;
        }
    }

    record MalformedOrthogonalState(String path, SourceSpan span, String reason) implements SemanticError {
        @Override
        public String kind() {
            return "MalformedOrthogonalState";
        }

        @Override
        public String message() {
            return "Orthogonal state '" + path + "' is malformed: " + reason;
        }
    }

    record UnreachableState(String path, SourceSpan span) implements SemanticError {
        @Override
        public String kind() {
            return "UnreachableState";
        }

        @Override
        public Diagnostic.Severity severity() {
            return Diagnostic.Severity.WARNING;
        }

        @Override
        public String message() {
            return "State '" + path + "' has no incoming transition and is not an initial state";
        }
    }

    record StateKindMismatch(String path, StateKind declaredKind, int regionCount, SourceSpan span) implements SemanticError {
        @Override
        public String kind() {
            return "StateKindMismatch";
        }

        @Override
        public String message() {
            return "State '" + path + "' is declared " + declaredKind + " but owns " + regionCount + " region(s)";
        }
    }

    record InvalidFinalState(String path, SourceSpan span, String reason) implements SemanticError {
        @Override
        public String kind() {
            return "InvalidFinalState";
        }

        @Override
        public String message() {
            return "Final state '" + path + "' " + reason;
        }
    }

    record InvalidHistoryState(String path, SourceSpan span, String reason) implements SemanticError {
        @Override
        public String kind() {
            return "InvalidHistoryState";
        }

        @Override
        public String message() {
            return "History state '" + path + "' " + reason;
        }
    }
}

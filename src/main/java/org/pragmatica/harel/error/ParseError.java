package org.pragmatica.harel.error;

import org.pragmatica.harel.tree.SourceLocation;
import org.pragmatica.harel.tree.SourceSpan;

import java.util.List;

/**
 * Grammar violation. Parsing aborts at the first one and no tree is returned.
 */
public sealed interface ParseError extends ChartError {
    SourceLocation location();

    @Override
    default Stage stage() {
        return Stage.PARSE;
    }

    @Override
    default SourceSpan span() {
        return SourceSpan.at(location());
    }

    /**
     * Token which does not fit the grammar at this point.
     */
    record UnexpectedToken(
    SourceLocation location,
    List<String> expectedOneOf,
    String found) implements ParseError {
        public UnexpectedToken {
            expectedOneOf = List.copyOf(expectedOneOf);
        }

        @Override
        public String kind() {
            return "UnexpectedToken";
        }

        @Override
        public String message() {
            var expected = expectedOneOf.size() == 1
                           ? expectedOneOf.get(0)
                           : "one of " + String.join(", ", expectedOneOf);
            return "Unexpected " + found + " at " + location + ", expected " + expected;
        }
    }

    /**
     * State with a single explicit {@code region} block. Orthogonal states need at least two.
     */
    record MalformedOrthogonalState(
    SourceLocation location,
    String state,
    int regionCount) implements ParseError {
        @Override
        public String kind() {
            return "MalformedOrthogonalState";
        }

        @Override
        public String message() {
            return "State '" + state + "' at " + location + " declares " + regionCount
                   + " region block, orthogonal states need at least two";
        }
    }

    /**
     * Second {@code entry} or {@code exit} clause in one state.
     */
    record DuplicateClause(
    SourceLocation location,
    String state,
    String clause) implements ParseError {
        @Override
        public String kind() {
            return "DuplicateClause";
        }

        @Override
        public String message() {
            return "State '" + state + "' declares more than one " + clause + " action at " + location;
        }
    }

    /**
     * State nesting deeper than {@code ParserConfig.maxNestingDepth()}.
     */
    record NestingTooDeep(
    SourceLocation location,
    int limit) implements ParseError {
        @Override
        public String kind() {
            return "NestingTooDeep";
        }

        @Override
        public String message() {
            return "States nested deeper than " + limit + " levels at " + location;
        }
    }
}

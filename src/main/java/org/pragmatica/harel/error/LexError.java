package org.pragmatica.harel.error;

import org.pragmatica.harel.tree.SourceLocation;
import org.pragmatica.harel.tree.SourceSpan;

/**
 * Lexical error. Lexing stops at the first one, token boundaries after it are unreliable.
 */
public sealed interface LexError extends ChartError {
    SourceLocation location();

    @Override
    default Stage stage() {
        return Stage.LEX;
    }

    @Override
    default SourceSpan span() {
        return SourceSpan.at(location());
    }

    /**
     * Character which does not start any token.
     */
    record UnexpectedCharacter(SourceLocation location, char character) implements LexError {
        @Override
        public String kind() {
            return "UnexpectedCharacter";
        }

        @Override
        public String message() {
            return "Unexpected character '" + printable(character) + "' at " + location;
        }

        private static String printable(char c) {
            return Character.isISOControl(c)
                   ? String.format("\\u%04x", (int) c)
                   : String.valueOf(c);
        }
    }

    /**
     * Guard condition or quoted action which runs to end of input.
     */
    record UnterminatedLiteral(SourceLocation location, String what) implements LexError {
        @Override
        public String kind() {
            return "UnterminatedLiteral";
        }

        @Override
        public String message() {
            return "Unterminated " + what + " starting at " + location;
        }
    }
}

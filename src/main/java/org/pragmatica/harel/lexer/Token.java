package org.pragmatica.harel.lexer;

import org.pragmatica.harel.error.LexError;
import org.pragmatica.harel.tree.SourceSpan;

/**
 * Token types of the statechart language.
 */
public sealed interface Token {
    SourceSpan span();

    /**
     * Human readable form used in parse error messages.
     */
    String describe();

    record Identifier(SourceSpan span, String name) implements Token {
        @Override
        public String describe() {
            return "identifier '" + name + "'";
        }
    }

    record KeywordToken(SourceSpan span, Keyword keyword) implements Token {
        @Override
        public String describe() {
            return "'" + keyword.text() + "'";
        }
    }

    // Text between guard brackets, brackets excluded
    record Condition(SourceSpan span, String text) implements Token {
        @Override
        public String describe() {
            return "condition [" + text + "]";
        }
    }

    // Text after an action delimiter
    record ActionText(SourceSpan span, String text, boolean quoted) implements Token {
        @Override
        public String describe() {
            return "action text";
        }
    }

    record LBrace(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'{'";
        }
    }

    record RBrace(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'}'";
        }
    }

    record LBracket(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'['";
        }
    }

    record RBracket(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "']'";
        }
    }

    // ->
    record Arrow(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'->'";
        }
    }

    record Colon(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "':'";
        }
    }

    // Separates the targets of a multi-target transition
    record Comma(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "','";
        }
    }

    record Slash(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'/'";
        }
    }

    record Dot(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'.'";
        }
    }

    record Eof(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "end of input";
        }
    }

    record Error(SourceSpan span, LexError error) implements Token {
        @Override
        public String describe() {
            return "invalid input";
        }
    }
}

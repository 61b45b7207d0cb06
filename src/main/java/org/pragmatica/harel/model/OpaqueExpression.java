package org.pragmatica.harel.model;

import org.pragmatica.harel.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Uninterpreted guard or action payload: the raw text, where it came from, and a minimal token form
 * for downstream evaluators. The front end never evaluates it.
 *
 * @param text      raw text as written
 * @param span      location of the text in the source
 * @param fragments identifiers, numbers, quoted strings and operator runs, in order
 */
public record OpaqueExpression(String text, SourceSpan span, List<String> fragments) {
    public OpaqueExpression {
        fragments = List.copyOf(fragments);
    }

    public static OpaqueExpression of(String text, SourceSpan span) {
        return new OpaqueExpression(text, span, fragment(text));
    }

    public static OpaqueExpression of(String text) {
        return of(text, SourceSpan.SYNTHETIC);
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    static List<String> fragment(String text) {
        var fragments = new ArrayList<String>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int start = i;
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
            } else if (Character.isDigit(c)) {
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
            } else if (c == '"' || c == '\'') {
                i++;
                while (i < text.length() && text.charAt(i) != c) {
                    i += text.charAt(i) == '\\' ? 2 : 1;
                }
                i = Math.min(i + 1, text.length());
            } else if (isBracket(c)) {
                i++;
            } else {
                while (i < text.length() && isOperator(text.charAt(i))) {
                    i++;
                }
            }
            fragments.add(text.substring(start, i));
        }
        return fragments;
    }

    private static boolean isBracket(char c) {
        return c == '(' || c == ')' || c == '[' || c == ']' || c == '{' || c == '}' || c == ',';
    }

    private static boolean isOperator(char c) {
        return !Character.isWhitespace(c)
               && !Character.isLetterOrDigit(c)
               && c != '_' && c != '"' && c != '\''
               && !isBracket(c);
    }
}

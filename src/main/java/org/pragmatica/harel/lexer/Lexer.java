package org.pragmatica.harel.lexer;

import org.pragmatica.harel.error.LexError;
import org.pragmatica.harel.error.Result;
import org.pragmatica.harel.tree.SourceLocation;
import org.pragmatica.harel.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lexer for the statechart language.
 *
 * <p>Tokens are produced on demand. The lexer only checks character classes, never grammar. Guard conditions
 * ({@code [ ... ]}) and action text (after {@code /}) are captured verbatim because their content is opaque
 * to the front end. The last token is always {@link Token.Eof}, or {@link Token.Error} when lexing failed.
 */
public final class Lexer implements Iterator<Token> {
    public static final int DEFAULT_MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private final ArrayDeque<Token> pending = new ArrayDeque<>();
    private int pos;
    private int line;
    private int column;
    private boolean finished;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Lazy, restartable token sequence over the source.
     */
    public static Tokens tokens(String input) {
        return tokens(input, DEFAULT_MAX_INPUT_SIZE);
    }

    public static Tokens tokens(String input, int maxInputSize) {
        if (input.length() > maxInputSize) {
            throw new IllegalArgumentException(
            "Statechart input exceeds maximum size of " + maxInputSize + " characters");
        }
        return new Tokens(input);
    }

    /**
     * Lex the whole input eagerly.
     */
    public static Result<List<Token>> tokenize(String input) {
        var tokens = new ArrayList<Token>();
        for (var token : tokens(input)) {
            if (token instanceof Token.Error error) {
                return Result.failure(error.error());
            }
            tokens.add(token);
        }
        return Result.success(List.copyOf(tokens));
    }

    static Lexer over(String input) {
        return new Lexer(input);
    }

    @Override
    public boolean hasNext() {
        return !finished || !pending.isEmpty();
    }

    @Override
    public Token next() {
        if (!pending.isEmpty()) {
            return pending.poll();
        }
        if (finished) {
            throw new NoSuchElementException("Token sequence is exhausted");
        }
        var token = nextToken();
        if (token instanceof Token.Eof || token instanceof Token.Error) {
            finished = true;
        }
        return token;
    }

    private Token nextToken() {
        skipWhitespaceAndComments();
        if (isAtEnd()) {
            return new Token.Eof(currentSpan());
        }
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanWord(start);
        }
        return scanPunctuation(start);
    }

    private Token scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var word = sb.toString();
        var span = span(start);
        return Keyword.lookup(word)
                      .<Token>map(keyword -> new Token.KeywordToken(span, keyword))
                      .orElseGet(() -> new Token.Identifier(span, word));
    }

    private Token scanPunctuation(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case '{' -> new Token.LBrace(span(start));
            case '}' -> new Token.RBrace(span(start));
            case ']' -> new Token.RBracket(span(start));
            case ':' -> new Token.Colon(span(start));
            case ',' -> new Token.Comma(span(start));
            case '.' -> new Token.Dot(span(start));
            case '[' -> scanCondition(new Token.LBracket(span(start)));
            case '/' -> scanAction(new Token.Slash(span(start)));
            case '-' -> {
                if (!isAtEnd() && peek() == '>') {
                    advance();
                    yield new Token.Arrow(span(start));
                }
                yield error(new LexError.UnexpectedCharacter(start, c));
            }
            default -> error(new LexError.UnexpectedCharacter(start, c));
        };
    }

    /**
     * Capture raw text up to the matching ']'. Nested brackets are balanced.
     */
    private Token scanCondition(Token.LBracket open) {
        var start = currentLocation();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        int depth = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ']' && depth == 0) {
                break;
            }
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            return error(new LexError.UnterminatedLiteral(open.span().start(), "guard condition"));
        }
        pending.add(new Token.Condition(span(start), sb.toString().trim()));
        var closeStart = currentLocation();
        advance();
        pending.add(new Token.RBracket(span(closeStart)));
        return open;
    }

    /**
     * Capture action text after '/': a quoted string, or raw text up to end of line, ';', '#'
     * or an unbalanced '}'. A terminating ';' is consumed.
     */
    private Token scanAction(Token.Slash slash) {
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
            advance();
        }
        if (isAtEnd()) {
            return slash;
        }
        var start = currentLocation();
        if (peek() == '"') {
            return scanQuotedAction(slash, start);
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        int depth = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n' || c == '\r' || c == '#' || c == ';') {
                break;
            }
            if (c == '{' || c == '(' || c == '[') {
                depth++;
            } else if (c == '}' || c == ')' || c == ']') {
                if (c == '}' && depth == 0) {
                    break;
                }
                depth = Math.max(0, depth - 1);
            }
            sb.append(advance());
        }
        var text = sb.toString().stripTrailing();
        if (!text.isEmpty()) {
            var end = SourceLocation.at(start.line(), start.column() + text.length(), start.offset() + text.length());
            pending.add(new Token.ActionText(SourceSpan.of(start, end), text, false));
        }
        skipStatementTerminator();
        return slash;
    }

    private Token scanQuotedAction(Token.Slash slash, SourceLocation start) {
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return error(new LexError.UnterminatedLiteral(start, "quoted action"));
        }
        advance();
        pending.add(new Token.ActionText(span(start), sb.toString(), true));
        skipStatementTerminator();
        return slash;
    }

    private void skipStatementTerminator() {
        int mark = pos;
        int markLine = line;
        int markColumn = column;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
            advance();
        }
        if (!isAtEnd() && peek() == ';') {
            advance();
            return;
        }
        pos = mark;
        line = markLine;
        column = markColumn;
    }

    private char scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> c;
        };
    }

    private Token error(LexError error) {
        return new Token.Error(SourceSpan.at(error.location()), error);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}

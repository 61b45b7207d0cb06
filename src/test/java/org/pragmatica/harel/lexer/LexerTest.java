package org.pragmatica.harel.lexer;

import org.junit.jupiter.api.Test;
import org.pragmatica.harel.error.LexError;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    @Test
    void tokenize_keywordsAndIdentifiers_areDistinguished() {
        var tokens = Lexer.tokenize("statechart Light { state Red }").unwrap();

        assertEquals(7, tokens.size());
        assertEquals(Keyword.STATECHART, ((Token.KeywordToken) tokens.get(0)).keyword());
        assertEquals("Light", ((Token.Identifier) tokens.get(1)).name());
        assertInstanceOf(Token.LBrace.class, tokens.get(2));
        assertEquals(Keyword.STATE, ((Token.KeywordToken) tokens.get(3)).keyword());
        assertEquals("Red", ((Token.Identifier) tokens.get(4)).name());
        assertInstanceOf(Token.RBrace.class, tokens.get(5));
        assertInstanceOf(Token.Eof.class, tokens.get(6));
    }

    @Test
    void tokenize_reservedWords_becomeKeywords() {
        var tokens = Lexer.tokenize("region on entry exit initial final").unwrap();

        var keywords = tokens.stream()
                             .filter(Token.KeywordToken.class::isInstance)
                             .map(token -> ((Token.KeywordToken) token).keyword())
                             .toList();
        assertEquals(List.of(Keyword.REGION, Keyword.ON, Keyword.ENTRY, Keyword.EXIT, Keyword.INITIAL, Keyword.FINAL),
                     keywords);
    }

    @Test
    void tokenize_trackLineAndColumn() {
        var tokens = Lexer.tokenize("state\n  Idle").unwrap();

        var idle = tokens.get(1);
        assertEquals(2, idle.span().start().line());
        assertEquals(3, idle.span().start().column());
        assertEquals(8, idle.span().start().offset());
        assertEquals(12, idle.span().end().offset());
    }

    @Test
    void tokenize_arrowAndDots_producePunctuation() {
        var tokens = Lexer.tokenize("on go -> Outer.Inner").unwrap();

        assertInstanceOf(Token.Arrow.class, tokens.get(2));
        assertInstanceOf(Token.Identifier.class, tokens.get(3));
        assertInstanceOf(Token.Dot.class, tokens.get(4));
        assertEquals("Inner", ((Token.Identifier) tokens.get(5)).name());
    }

    @Test
    void tokenize_guard_capturesConditionVerbatim() {
        var tokens = Lexer.tokenize("on tick [ count > 3 && items[0] != null ] -> Done").unwrap();

        assertInstanceOf(Token.LBracket.class, tokens.get(2));
        var condition = assertInstanceOf(Token.Condition.class, tokens.get(3));
        assertEquals("count > 3 && items[0] != null", condition.text());
        assertInstanceOf(Token.RBracket.class, tokens.get(4));
        assertInstanceOf(Token.Arrow.class, tokens.get(5));
    }

    @Test
    void tokenize_rawAction_stopsAtUnbalancedBrace() {
        var tokens = Lexer.tokenize("entry / log(\"in\") }").unwrap();

        assertInstanceOf(Token.Slash.class, tokens.get(1));
        var action = assertInstanceOf(Token.ActionText.class, tokens.get(2));
        assertEquals("log(\"in\")", action.text());
        assertFalse(action.quoted());
        assertInstanceOf(Token.RBrace.class, tokens.get(3));
    }

    @Test
    void tokenize_rawAction_stopsAtEndOfLineAndSemicolon() {
        var tokens = Lexer.tokenize("entry / a = 1; exit / b = 2\nstate").unwrap();

        assertEquals("a = 1", ((Token.ActionText) tokens.get(2)).text());
        assertEquals(Keyword.EXIT, ((Token.KeywordToken) tokens.get(3)).keyword());
        assertEquals("b = 2", ((Token.ActionText) tokens.get(5)).text());
        assertEquals(Keyword.STATE, ((Token.KeywordToken) tokens.get(6)).keyword());
    }

    @Test
    void tokenize_quotedAction_unescapesContent() {
        var tokens = Lexer.tokenize("exit / \"say(\\\"bye\\\"); }\"").unwrap();

        var action = assertInstanceOf(Token.ActionText.class, tokens.get(2));
        assertEquals("say(\"bye\"); }", action.text());
        assertTrue(action.quoted());
        assertInstanceOf(Token.Eof.class, tokens.get(3));
    }

    @Test
    void tokenize_commentsAndWhitespace_areSkipped() {
        var tokens = Lexer.tokenize("""
            # leading comment
            state   # trailing comment
            \t Idle
            """).unwrap();

        assertEquals(3, tokens.size());
        assertEquals("Idle", ((Token.Identifier) tokens.get(1)).name());
    }

    @Test
    void tokenize_unexpectedCharacter_failsWithPosition() {
        var result = Lexer.tokenize("state A {\n  @ }");

        assertTrue(result.isFailure());
        var error = assertInstanceOf(LexError.UnexpectedCharacter.class, result.cause());
        assertEquals('@', error.character());
        assertEquals(2, error.location().line());
        assertEquals(3, error.location().column());
    }

    @Test
    void tokenize_loneDash_isUnexpected() {
        var result = Lexer.tokenize("on go - Target");

        var error = assertInstanceOf(LexError.UnexpectedCharacter.class, result.cause());
        assertEquals('-', error.character());
    }

    @Test
    void tokenize_unterminatedGuard_fails() {
        var result = Lexer.tokenize("on go [ ready ");

        var error = assertInstanceOf(LexError.UnterminatedLiteral.class, result.cause());
        assertEquals("guard condition", error.what());
        assertEquals(7, error.location().column());
    }

    @Test
    void tokens_stopAfterError() {
        var tokens = Lexer.tokens("state ? Idle").stream().toList();

        assertEquals(2, tokens.size());
        assertInstanceOf(Token.Error.class, tokens.get(1));
    }

    @Test
    void tokens_areRestartable() {
        var tokens = Lexer.tokens("statechart S { state A { on go -> A } }");

        var first = tokens.stream().toList();
        var second = tokens.stream().toList();

        assertEquals(first, second);
        assertInstanceOf(Token.Eof.class, first.get(first.size() - 1));
    }

    @Test
    void tokens_areProducedLazily() {
        var iterator = Lexer.tokens("state A } @").iterator();

        assertInstanceOf(Token.KeywordToken.class, iterator.next());
        assertInstanceOf(Token.Identifier.class, iterator.next());
        assertInstanceOf(Token.RBrace.class, iterator.next());
        assertInstanceOf(Token.Error.class, iterator.next());
        assertFalse(iterator.hasNext());
    }

    @Test
    void tokens_oversizedInput_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Lexer.tokens("state A", 3));
    }

    @Test
    void tokenize_emptyInput_yieldsOnlyEof() {
        var tokens = Lexer.tokenize("   ").unwrap();

        assertEquals(1, tokens.size());
        assertInstanceOf(Token.Eof.class, tokens.get(0));
    }

    @Test
    void tokenize_historyAndCommas_produceTokens() {
        var tokens = Lexer.tokenize("deep history H -> A, B").unwrap();

        assertEquals(Keyword.DEEP, ((Token.KeywordToken) tokens.get(0)).keyword());
        assertEquals(Keyword.HISTORY, ((Token.KeywordToken) tokens.get(1)).keyword());
        assertInstanceOf(Token.Arrow.class, tokens.get(3));
        assertInstanceOf(Token.Comma.class, tokens.get(5));
        assertEquals("B", ((Token.Identifier) tokens.get(6)).name());
        assertInstanceOf(Token.Eof.class, tokens.get(7));
    }
}

package org.pragmatica.harel.parser;

import org.pragmatica.harel.error.ParseError;
import org.pragmatica.harel.error.Result;
import org.pragmatica.harel.lexer.Keyword;
import org.pragmatica.harel.lexer.Lexer;
import org.pragmatica.harel.lexer.Token;
import org.pragmatica.harel.model.Action;
import org.pragmatica.harel.model.Event;
import org.pragmatica.harel.model.Guard;
import org.pragmatica.harel.model.History;
import org.pragmatica.harel.model.OpaqueExpression;
import org.pragmatica.harel.model.QualifiedName;
import org.pragmatica.harel.model.Region;
import org.pragmatica.harel.model.State;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.model.Transition;
import org.pragmatica.harel.tree.SourceLocation;
import org.pragmatica.harel.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for statechart source.
 *
 * <p>One method per grammar production over a single forward cursor with one token of lookahead:
 * <pre>
 * statechart  := 'statechart' IDENT '{' region_body '}'
 * region_body := (state | history)*
 * state       := ('initial' | 'final')* 'state' IDENT '{' state_body '}'
 * history     := 'deep'? 'history' IDENT ('->' targets action?)?
 * state_body  := (entry_action | exit_action | transition | region | state | history)*
 * region      := 'region' '{' region_body '}'
 * entry_action:= 'entry' '/' ACTION_TEXT
 * exit_action := 'exit' '/' ACTION_TEXT
 * transition  := 'on' IDENT? guard? ('->' targets action? | action)
 * targets     := QUALIFIED_PATH (',' QUALIFIED_PATH)*
 * guard       := '[' CONDITION_TEXT ']'
 * action      := '/' ACTION_TEXT
 * </pre>
 * Parsing stops at the first error and never returns a partial tree. Names are not resolved here.
 */
public final class StatechartParser {
    private static final List<String> STATE_START = List.of("'state'", "'initial'", "'final'");
    private static final List<String> MEMBER_START = List.of("'state'", "'initial'", "'final'", "'history'", "'deep'");

    private final Iterator<Token> tokens;
    private final ParserConfig config;
    private Token current;
    private SourceLocation lastEnd;

    private StatechartParser(Iterator<Token> tokens, ParserConfig config) {
        this.tokens = tokens;
        this.config = config;
        this.current = tokens.next();
        this.lastEnd = current.span().start();
    }

    /**
     * Parse statechart source text.
     */
    public static Result<Statechart> parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    /**
     * Parse statechart source text with custom configuration.
     *
     * @throws IllegalArgumentException if the source is larger than {@link ParserConfig#maxInputSize()}
     */
    public static Result<Statechart> parse(String source, ParserConfig config) {
        return parse(Lexer.tokens(source, config.maxInputSize()), config);
    }

    /**
     * Parse an already produced token sequence. The sequence must end with {@link Token.Eof} or
     * {@link Token.Error}, as sequences from {@link Lexer} do.
     */
    public static Result<Statechart> parse(Iterable<Token> tokens, ParserConfig config) {
        var iterator = tokens.iterator();
        if (!iterator.hasNext()) {
            throw new IllegalArgumentException("Token sequence is empty");
        }
        return new StatechartParser(iterator, config).parseStatechart();
    }

    private Result<Statechart> parseStatechart() {
        var start = current.span().start();

        if (!expectKeyword(Keyword.STATECHART)) {
            return unexpected("'statechart'");
        }
        if (!(current instanceof Token.Identifier name)) {
            return unexpected("statechart name");
        }
        advance();
        var header = SourceSpan.of(start, lastEnd);

        if (!(current instanceof Token.LBrace)) {
            return unexpected("'{'");
        }
        var region = parseRegionBody(current.span().start(), 0);
        if (region.isFailure()) {
            return Result.failure(region.cause());
        }

        if (!(current instanceof Token.Eof)) {
            return unexpected("end of input");
        }
        return Result.success(new Statechart(name.name(), region.unwrap(), header));
    }

    /**
     * Parses {@code '{' state* '}'}. The cursor is on the opening brace.
     */
    private Result<Region> parseRegionBody(SourceLocation start, int depth) {
        advance();
        var states = new ArrayList<State>();

        while (!(current instanceof Token.RBrace)) {
            if (!isMemberStart()) {
                return unexpected(expectedInRegion());
            }
            var state = parseMember(depth + 1);
            if (state.isFailure()) {
                return Result.failure(state.cause());
            }
            states.add(state.unwrap());
        }
        advance();

        return Result.success(new Region(states, SourceSpan.of(start, lastEnd)));
    }

    private Result<State> parseMember(int depth) {
        if (current instanceof Token.KeywordToken keyword
            && (keyword.keyword() == Keyword.HISTORY || keyword.keyword() == Keyword.DEEP)) {
            return parseHistory(depth);
        }
        return parseState(depth);
    }

    /**
     * Parses a history pseudo-state and its optional default transition.
     */
    private Result<State> parseHistory(int depth) {
        var start = current.span().start();
        var kind = expectKeyword(Keyword.DEEP)
                   ? History.DEEP
                   : History.SHALLOW;
        if (!expectKeyword(Keyword.HISTORY)) {
            return unexpected("'history'");
        }
        if (depth > config.maxNestingDepth()) {
            return Result.failure(new ParseError.NestingTooDeep(start, config.maxNestingDepth()));
        }
        if (!(current instanceof Token.Identifier name)) {
            return unexpected("history name");
        }
        advance();

        var builder = State.builder(name.name())
                           .history(kind)
                           .span(SourceSpan.of(start, lastEnd));
        if (current instanceof Token.Arrow) {
            var transitionStart = current.span().start();
            advance();
            var targets = parseTargets();
            if (targets.isFailure()) {
                return Result.failure(targets.cause());
            }
            Optional<Action> action = Optional.empty();
            if (current instanceof Token.Slash) {
                var parsed = parseAction(Action.Kind.TRANSITION);
                if (parsed.isFailure()) {
                    return Result.failure(parsed.cause());
                }
                action = Optional.of(parsed.unwrap());
            }
            builder.transition(new Transition(Optional.empty(),
                                              Optional.empty(),
                                              targets.unwrap(),
                                              action,
                                              SourceSpan.of(transitionStart, lastEnd)));
        }
        return Result.success(builder.build());
    }

    private Result<State> parseState(int depth) {
        var start = current.span().start();
        var modifiers = new ModifierSet();

        while (current instanceof Token.KeywordToken keyword && keyword.keyword() != Keyword.STATE) {
            if (keyword.keyword() == Keyword.INITIAL) {
                modifiers.initial = true;
            } else if (keyword.keyword() == Keyword.FINAL) {
                modifiers.terminal = true;
            } else {
                return unexpected(STATE_START);
            }
            advance();
        }
        if (!expectKeyword(Keyword.STATE)) {
            return unexpected(STATE_START);
        }
        if (depth > config.maxNestingDepth()) {
            return Result.failure(new ParseError.NestingTooDeep(start, config.maxNestingDepth()));
        }
        if (!(current instanceof Token.Identifier name)) {
            return unexpected("state name");
        }
        advance();

        var builder = State.builder(name.name())
                           .span(SourceSpan.of(start, lastEnd));
        if (modifiers.initial) {
            builder.initial();
        }
        if (modifiers.terminal) {
            builder.terminal();
        }

        if (!expect(Token.LBrace.class)) {
            return unexpected("'{'");
        }
        return parseStateBody(name.name(), start, depth, builder);
    }

    private Result<State> parseStateBody(String name, SourceLocation start, int depth, State.Builder builder) {
        var directStates = new ArrayList<State>();
        var regions = new ArrayList<Region>();
        SourceLocation directStart = null;

        while (!(current instanceof Token.RBrace)) {
            if (current instanceof Token.KeywordToken keyword) {
                switch (keyword.keyword()) {
                    case ENTRY -> {
                        if (builder.hasEntry()) {
                            return Result.failure(new ParseError.DuplicateClause(keyword.span().start(), name, "entry"));
                        }
                        advance();
                        var action = parseAction(Action.Kind.ENTRY);
                        if (action.isFailure()) {
                            return Result.failure(action.cause());
                        }
                        builder.entry(action.unwrap());
                    }
                    case EXIT -> {
                        if (builder.hasExit()) {
                            return Result.failure(new ParseError.DuplicateClause(keyword.span().start(), name, "exit"));
                        }
                        advance();
                        var action = parseAction(Action.Kind.EXIT);
                        if (action.isFailure()) {
                            return Result.failure(action.cause());
                        }
                        builder.exit(action.unwrap());
                    }
                    case ON -> {
                        var transition = parseTransition();
                        if (transition.isFailure()) {
                            return Result.failure(transition.cause());
                        }
                        builder.transition(transition.unwrap());
                    }
                    case REGION -> {
                        // Explicit regions and directly nested states cannot be mixed
                        if (!directStates.isEmpty()) {
                            return unexpected(expectedInStateBody(false, true));
                        }
                        var regionStart = current.span().start();
                        advance();
                        if (!(current instanceof Token.LBrace)) {
                            return unexpected("'{'");
                        }
                        var region = parseRegionBody(regionStart, depth);
                        if (region.isFailure()) {
                            return Result.failure(region.cause());
                        }
                        regions.add(region.unwrap());
                    }
                    case STATE, INITIAL, FINAL, HISTORY, DEEP -> {
                        if (!regions.isEmpty()) {
                            return unexpected(expectedInStateBody(true, false));
                        }
                        if (directStart == null) {
                            directStart = current.span().start();
                        }
                        var child = parseMember(depth + 1);
                        if (child.isFailure()) {
                            return Result.failure(child.cause());
                        }
                        directStates.add(child.unwrap());
                    }
                    default -> {
                        return unexpected(expectedInStateBody(true, true));
                    }
                }
            } else {
                return unexpected(expectedInStateBody(regions.isEmpty(), directStates.isEmpty()));
            }
        }
        advance();

        if (regions.size() == 1) {
            return Result.failure(new ParseError.MalformedOrthogonalState(start, name, 1));
        }
        if (!directStates.isEmpty()) {
            builder.region(new Region(directStates, SourceSpan.of(directStart, directStates.get(directStates.size() - 1)
                                                                                       .span()
                                                                                       .end())));
        }
        regions.forEach(builder::region);
        return Result.success(builder.build());
    }

    private Result<Transition> parseTransition() {
        var start = current.span().start();
        advance();

        Optional<Event> event = Optional.empty();
        if (current instanceof Token.Identifier id) {
            advance();
            event = Optional.of(new Event(id.name(), id.span()));
        }

        Optional<Guard> guard = Optional.empty();
        if (current instanceof Token.LBracket) {
            advance();
            if (!(current instanceof Token.Condition condition) || condition.text().isEmpty()) {
                return unexpected("guard condition");
            }
            advance();
            if (!expect(Token.RBracket.class)) {
                return unexpected("']'");
            }
            guard = Optional.of(new Guard(OpaqueExpression.of(condition.text(), condition.span())));
        }

        List<QualifiedName> targets = List.of();
        Optional<Action> action = Optional.empty();
        if (current instanceof Token.Arrow) {
            advance();
            var parsedTargets = parseTargets();
            if (parsedTargets.isFailure()) {
                return Result.failure(parsedTargets.cause());
            }
            targets = parsedTargets.unwrap();
            if (current instanceof Token.Slash) {
                var parsed = parseAction(Action.Kind.TRANSITION);
                if (parsed.isFailure()) {
                    return Result.failure(parsed.cause());
                }
                action = Optional.of(parsed.unwrap());
            }
        } else if (current instanceof Token.Slash) {
            var parsed = parseAction(Action.Kind.TRANSITION);
            if (parsed.isFailure()) {
                return Result.failure(parsed.cause());
            }
            action = Optional.of(parsed.unwrap());
        } else if (event.isEmpty() && guard.isEmpty()) {
            return unexpected("event name", "'['", "'->'", "'/'");
        } else {
            return unexpected("'->'", "'/'");
        }

        return Result.success(new Transition(event, guard, targets, action, SourceSpan.of(start, lastEnd)));
    }

    private Result<List<QualifiedName>> parseTargets() {
        var targets = new ArrayList<QualifiedName>();
        do {
            var path = parseQualifiedPath();
            if (path.isFailure()) {
                return Result.failure(path.cause());
            }
            targets.add(path.unwrap());
        } while (expect(Token.Comma.class));
        return Result.success(targets);
    }

    private Result<QualifiedName> parseQualifiedPath() {
        var segments = new ArrayList<String>();
        if (!(current instanceof Token.Identifier first)) {
            return unexpected("target state path");
        }
        advance();
        segments.add(first.name());

        while (current instanceof Token.Dot) {
            advance();
            if (!(current instanceof Token.Identifier next)) {
                return unexpected("state name");
            }
            advance();
            segments.add(next.name());
        }
        return Result.success(new QualifiedName(segments));
    }

    /**
     * Parses {@code '/' ACTION_TEXT}.
     */
    private Result<Action> parseAction(Action.Kind kind) {
        if (!expect(Token.Slash.class)) {
            return unexpected("'/'");
        }
        if (!(current instanceof Token.ActionText text)) {
            return unexpected("action text");
        }
        advance();
        return Result.success(new Action(kind, OpaqueExpression.of(text.text(), text.span())));
    }

    private boolean isMemberStart() {
        if (current instanceof Token.KeywordToken keyword) {
            return switch (keyword.keyword()) {
                case STATE, INITIAL, FINAL, HISTORY, DEEP -> true;
                default -> false;
            };
        }
        return false;
    }

    private static List<String> expectedInRegion() {
        var expected = new ArrayList<>(MEMBER_START);
        expected.add("'}'");
        return expected;
    }

    private static List<String> expectedInStateBody(boolean allowRegion, boolean allowState) {
        var expected = new ArrayList<String>();
        expected.add("'entry'");
        expected.add("'exit'");
        expected.add("'on'");
        if (allowRegion) {
            expected.add("'region'");
        }
        if (allowState) {
            expected.addAll(MEMBER_START);
        }
        expected.add("'}'");
        return expected;
    }

    private <T> Result<T> unexpected(String... expected) {
        return unexpected(List.of(expected));
    }

    private <T> Result<T> unexpected(List<String> expected) {
        if (current instanceof Token.Error error) {
            return Result.failure(error.error());
        }
        return Result.failure(new ParseError.UnexpectedToken(current.span().start(), expected, current.describe()));
    }

    private void advance() {
        if (current instanceof Token.Eof || current instanceof Token.Error) {
            return;
        }
        lastEnd = current.span().end();
        current = tokens.next();
    }

    private boolean expect(Class<? extends Token> tokenClass) {
        if (tokenClass.isInstance(current)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean expectKeyword(Keyword keyword) {
        if (current instanceof Token.KeywordToken token && token.keyword() == keyword) {
            advance();
            return true;
        }
        return false;
    }

    private static final class ModifierSet {
        private boolean initial;
        private boolean terminal;
    }
}

package org.pragmatica.harel;

import org.pragmatica.harel.error.ChartError;
import org.pragmatica.harel.error.Result;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.parser.ParserConfig;
import org.pragmatica.harel.parser.StatechartParser;
import org.pragmatica.harel.printer.CanonicalPrinter;
import org.pragmatica.harel.validation.ValidatedStatechart;
import org.pragmatica.harel.validation.ValidationReport;
import org.pragmatica.harel.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Entry point of the statechart front end.
 *
 * <p>Example usage:
 * <pre>{@code
 * var chart = Statecharts.load("""
 *     statechart TrafficLight {
 *         state Red    { on timer -> Green }
 *         state Green  { on timer -> Yellow }
 *         state Yellow { on timer -> Red }
 *     }
 *     """).unwrap();
 *
 * var green = chart.findState("Green").orElseThrow();
 * }</pre>
 */
public final class Statecharts {
    private static final Logger log = LoggerFactory.getLogger(Statecharts.class);

    private Statecharts() {}

    /**
     * Lex and parse source text. Fails with the first lexical or syntax error.
     */
    public static Result<Statechart> parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    public static Result<Statechart> parse(String source, ParserConfig config) {
        return StatechartParser.parse(source, config)
                               .onFailure(cause -> log.debug("Parsing failed: {}", cause.message()));
    }

    public static ValidationReport validate(Statechart statechart) {
        return Validator.validate(statechart);
    }

    /**
     * Parse and validate. Fails with the first lexical or syntax error, or with
     * {@link org.pragmatica.harel.validation.ValidationFailed} carrying every semantic finding.
     */
    public static Result<ValidatedStatechart> load(String source) {
        return load(source, ParserConfig.DEFAULT);
    }

    public static Result<ValidatedStatechart> load(String source, ParserConfig config) {
        return parse(source, config).flatMap(statechart -> validate(statechart).toResult());
    }

    /**
     * Run every stage and collect diagnostics instead of failing.
     */
    public static CompilationResult compile(String source) {
        return compile(source, ParserConfig.DEFAULT);
    }

    public static CompilationResult compile(String source, ParserConfig config) {
        var parsed = parse(source, config);
        if (parsed.isFailure()) {
            var cause = parsed.cause();
            if (!(cause instanceof ChartError error)) {
                throw new IllegalStateException("Unexpected failure cause: " + cause.message());
            }
            return new CompilationResult(Optional.empty(), Optional.empty(), List.of(error.toDiagnostic()), source);
        }
        var statechart = parsed.unwrap();
        var report = validate(statechart);
        if (!report.isValid()) {
            log.debug("Statechart '{}' rejected with {} error(s)", statechart.name(), report.errors().size());
        }
        return new CompilationResult(Optional.of(statechart), report.validated(), report.diagnostics(), source);
    }

    /**
     * Canonical source text of the statechart.
     */
    public static String print(Statechart statechart) {
        return CanonicalPrinter.print(statechart);
    }
}

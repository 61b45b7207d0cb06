package org.pragmatica.harel;

import org.pragmatica.harel.error.Diagnostic;
import org.pragmatica.harel.error.Stage;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.validation.ValidatedStatechart;

import java.util.List;
import java.util.Optional;

/**
 * Result of running the whole front end over one source, with every diagnostic collected.
 *
 * <p>When lexing or parsing fails, {@code statechart} is empty and {@code diagnostics} holds the single
 * failure. When validation rejects the tree, {@code statechart} is present, {@code validated} is empty and
 * {@code diagnostics} holds every finding. Warnings may accompany an accepted statechart.
 *
 * @param statechart  The parsed tree, or empty if lexing or parsing failed
 * @param validated   The accepted statechart, or empty if any stage reported a hard error
 * @param diagnostics Every diagnostic, in the order reported
 * @param source      The original source text (for formatting diagnostics)
 */
public record CompilationResult(
    Optional<Statechart> statechart,
    Optional<ValidatedStatechart> validated,
    List<Diagnostic> diagnostics,
    String source
) {
    public CompilationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return validated.isPresent();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * Stage which stopped processing, if any.
     */
    public Optional<Stage> failedStage() {
        return diagnostics.stream()
                          .filter(Diagnostic::isError)
                          .map(Diagnostic::stage)
                          .findFirst();
    }

    /**
     * Format all diagnostics in Rust style.
     *
     * @param filename Optional filename for display
     * @return Formatted diagnostics string
     */
    public String formatDiagnostics(String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }

    public int errorCount() {
        return (int) diagnostics.stream()
            .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
            .count();
    }

    public int warningCount() {
        return (int) diagnostics.stream()
            .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
            .count();
    }
}

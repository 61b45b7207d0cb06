package org.pragmatica.harel.error;

import org.pragmatica.harel.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rich diagnostic message for Rust-style error reporting.
 *
 * <p>Example output:
 * <pre>
 * error[UnresolvedTarget]: transition from 'Red' targets unknown state 'Missing'
 *   --> traffic.sc:3:15
 *    |
 *  3 |     on go -> Missing
 *    |     ^^^^^^^^^^^^^^^^
 *    |
 * </pre>
 *
 * @param stage    Front end stage which reported the problem
 * @param severity Error severity level
 * @param kind     Error kind name (e.g., "DuplicateStateName")
 * @param message  Primary error message
 * @param span     Source span where error occurred
 * @param labels   Additional labeled spans for context
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Stage stage,
    Severity severity,
    String kind,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public Diagnostic {
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    /**
     * Error severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span providing additional context.
     *
     * @param span    Source span for this label
     * @param message Label message
     * @param primary Whether this is the primary label (shown with ^^^)
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(Stage stage, String kind, String message, SourceSpan span) {
        return new Diagnostic(stage, Severity.ERROR, kind, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(Stage stage, String kind, String message, SourceSpan span) {
        return new Diagnostic(stage, Severity.WARNING, kind, message, span, List.of(), List.of());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Add a primary label.
     */
    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, message));
        return new Diagnostic(stage, severity, kind, this.message, span, newLabels, notes);
    }

    /**
     * Add a secondary label at a different span.
     */
    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, message));
        return new Diagnostic(stage, severity, kind, this.message, span, newLabels, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(stage, severity, kind, message, span, labels, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The statechart source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(severity.display())
          .append("[").append(kind).append("]")
          .append(": ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int minLine = span.start().line();
        int maxLine = span.end().line();
        for (var label : labels) {
            minLine = Math.min(minLine, label.span().start().line());
            maxLine = Math.max(maxLine, label.span().end().line());
        }

        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            String lineContent = lines[lineNum - 1];
            String lineNumStr = String.format("%" + gutterWidth + "d", lineNum);

            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");

            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth)).append(" | ");
                sb.append(formatUnderlines(lineNum, lineContent, lineLabels));
                sb.append("\n");
            }
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();

        // Implicit primary label when none was given explicitly
        if (span.start().line() <= lineNum && span.end().line() >= lineNum && labels.isEmpty()) {
            result.add(Label.primary(span, ""));
        }

        for (var label : labels) {
            if (label.span().start().line() <= lineNum && label.span().end().line() >= lineNum) {
                result.add(label);
            }
        }

        return result;
    }

    private String formatUnderlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;

        var sorted = lineLabels.stream()
            .sorted(Comparator.comparingInt(label -> label.span().start().column()))
            .toList();

        for (var label : sorted) {
            int startCol = label.span().start().line() == lineNum ? label.span().start().column() : 1;
            int endCol = label.span().end().line() == lineNum
                ? label.span().end().column()
                : lineContent.length() + 1;

            while (currentCol < startCol) {
                sb.append(" ");
                currentCol++;
            }

            char underlineChar = label.primary() ? '^' : '-';
            int underlineLen = Math.max(1, endCol - startCol);
            sb.append(String.valueOf(underlineChar).repeat(underlineLen));
            currentCol += underlineLen;

            if (!label.message().isEmpty()) {
                sb.append(" ").append(label.message());
            }
        }

        return sb.toString();
    }

    /**
     * Simple single-line format, e.g. {@code input:3:15: error[PARSE/UnexpectedToken]: ...}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s[%s/%s]: %s",
            filename, loc.line(), loc.column(), severity.display(), stage, kind, message);
    }
}

package org.pragmatica.harel.error;

import org.pragmatica.harel.tree.SourceSpan;

import java.util.List;

/**
 * Error found in statechart source at one of the front end stages.
 */
public interface ChartError extends Cause {
    Stage stage();

    /**
     * Short stable name of the error kind, e.g. {@code UnresolvedTarget}.
     */
    String kind();

    SourceSpan span();

    default Diagnostic.Severity severity() {
        return Diagnostic.Severity.ERROR;
    }

    default Diagnostic toDiagnostic() {
        return new Diagnostic(stage(), severity(), kind(), message(), span(), List.of(), List.of());
    }
}

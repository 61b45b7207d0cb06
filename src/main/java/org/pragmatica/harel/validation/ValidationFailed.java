package org.pragmatica.harel.validation;

import org.pragmatica.harel.error.Cause;

/**
 * Validation found at least one hard error. The full report stays available to the caller.
 */
public record ValidationFailed(ValidationReport report) implements Cause {
    @Override
    public String message() {
        var errors = report.errors();
        var sb = new StringBuilder();
        sb.append("Statechart '")
          .append(report.statechart().name())
          .append("' has ")
          .append(errors.size())
          .append(" error(s)");
        for (var error : errors) {
            sb.append("\n  ").append(error.message());
        }
        return sb.toString();
    }
}

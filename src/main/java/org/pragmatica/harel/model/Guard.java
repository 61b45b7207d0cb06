package org.pragmatica.harel.model;

/**
 * Boolean condition gating a transition. Kept opaque.
 */
public record Guard(OpaqueExpression condition) {
    public static Guard of(String condition) {
        return new Guard(OpaqueExpression.of(condition));
    }

    public String text() {
        return condition.text();
    }
}

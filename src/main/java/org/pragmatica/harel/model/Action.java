package org.pragmatica.harel.model;

/**
 * Side effect attached to a state's entry or exit, or to a transition. Carried as opaque text.
 */
public record Action(Kind kind, OpaqueExpression body) {
    public enum Kind {
        ENTRY,
        EXIT,
        TRANSITION
    }

    public static Action entry(String text) {
        return new Action(Kind.ENTRY, OpaqueExpression.of(text));
    }

    public static Action exit(String text) {
        return new Action(Kind.EXIT, OpaqueExpression.of(text));
    }

    public static Action transition(String text) {
        return new Action(Kind.TRANSITION, OpaqueExpression.of(text));
    }

    public String text() {
        return body.text();
    }
}

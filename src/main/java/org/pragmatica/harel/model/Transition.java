package org.pragmatica.harel.model;

import org.pragmatica.harel.tree.SourceSpan;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Transition owned by its source state.
 *
 * <p>Without an event it is a completion transition. Without targets it is an internal transition which
 * re-enters no state. Several targets enter states in different regions of one orthogonal state at once.
 * Targets are only paths here; resolving them to states is left to validation.
 */
public record Transition(
 Optional<Event> event,
 Optional<Guard> guard,
 List<QualifiedName> targets,
 Optional<Action> action,
 SourceSpan span) {

    public Transition {
        targets = List.copyOf(targets);
    }

    public static Transition on(String event, String... targets) {
        return new Transition(Optional.of(Event.named(event)),
                              Optional.empty(),
                              parseAll(targets),
                              Optional.empty(),
                              SourceSpan.SYNTHETIC);
    }

    /**
     * Transition without a triggering event, e.g. the default transition of a history pseudo-state.
     */
    public static Transition completion(String... targets) {
        return new Transition(Optional.empty(), Optional.empty(), parseAll(targets), Optional.empty(), SourceSpan.SYNTHETIC);
    }

    private static List<QualifiedName> parseAll(String... targets) {
        return Arrays.stream(targets)
                     .map(QualifiedName::parse)
                     .toList();
    }

    public Transition withGuard(String condition) {
        return new Transition(event, Optional.of(Guard.of(condition)), targets, action, span);
    }

    public Transition withAction(String text) {
        return new Transition(event, guard, targets, Optional.of(Action.transition(text)), span);
    }

    public boolean isCompletion() {
        return event.isEmpty();
    }

    public boolean isInternal() {
        return targets.isEmpty();
    }

    public boolean isMultiTarget() {
        return targets.size() > 1;
    }

    public String eventName() {
        return event.map(Event::name).orElse("");
    }
}

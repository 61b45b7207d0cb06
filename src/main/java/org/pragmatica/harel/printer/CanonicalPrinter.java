package org.pragmatica.harel.printer;

import org.pragmatica.harel.model.Action;
import org.pragmatica.harel.model.History;
import org.pragmatica.harel.model.Region;
import org.pragmatica.harel.model.State;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.model.Transition;

/**
 * Prints a statechart back to source text in canonical layout.
 *
 * <p>Layout: four spaces per nesting level, one clause per line, entry and exit first, then transitions,
 * then children. History pseudo-states take a single line. Actions are always quoted. Comments and
 * original formatting are not preserved, but printing, parsing and printing again yields the same text.
 */
public final class CanonicalPrinter {
    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();

    private CanonicalPrinter() {}

    public static String print(Statechart statechart) {
        var printer = new CanonicalPrinter();
        printer.printStatechart(statechart);
        return printer.out.toString();
    }

    private void printStatechart(Statechart statechart) {
        out.append("statechart ").append(statechart.name()).append(" {\n");
        printStates(statechart.region(), 1);
        out.append("}\n");
    }

    private void printStates(Region region, int level) {
        for (var state : region.states()) {
            printState(state, level);
        }
    }

    private void printState(State state, int level) {
        if (state.isHistory()) {
            printHistory(state, level);
            return;
        }
        indent(level);
        if (state.initial()) {
            out.append("initial ");
        }
        if (state.terminal()) {
            out.append("final ");
        }
        out.append("state ").append(state.name()).append(" {");

        if (isEmptyBody(state)) {
            out.append("}\n");
            return;
        }
        out.append("\n");

        state.entry().ifPresent(action -> printClause("entry", action, level + 1));
        state.exit().ifPresent(action -> printClause("exit", action, level + 1));
        for (var transition : state.transitions()) {
            printTransition(transition, level + 1);
        }

        if (state.regions().size() == 1) {
            printStates(state.regions().get(0), level + 1);
        } else {
            for (var region : state.regions()) {
                indent(level + 1);
                out.append("region {\n");
                printStates(region, level + 2);
                indent(level + 1);
                out.append("}\n");
            }
        }

        indent(level);
        out.append("}\n");
    }

    private void printHistory(State state, int level) {
        indent(level);
        if (state.history().orElseThrow() == History.DEEP) {
            out.append("deep ");
        }
        out.append("history ").append(state.name());
        state.transitions()
             .stream()
             .findFirst()
             .ifPresent(this::printTargetsAndAction);
        out.append("\n");
    }

    private static boolean isEmptyBody(State state) {
        return state.entry().isEmpty()
               && state.exit().isEmpty()
               && state.transitions().isEmpty()
               && state.regions().isEmpty();
    }

    private void printClause(String keyword, Action action, int level) {
        indent(level);
        out.append(keyword).append(" / ").append(quote(action.text())).append("\n");
    }

    private void printTransition(Transition transition, int level) {
        indent(level);
        out.append("on");
        transition.event().ifPresent(event -> out.append(' ').append(event.name()));
        transition.guard().ifPresent(guard -> out.append(" [").append(guard.text()).append(']'));
        printTargetsAndAction(transition);
        out.append("\n");
    }

    private void printTargetsAndAction(Transition transition) {
        if (!transition.isInternal()) {
            out.append(" -> ");
            var targets = transition.targets();
            for (int i = 0; i < targets.size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                out.append(targets.get(i));
            }
        }
        transition.action().ifPresent(action -> out.append(" / ").append(quote(action.text())));
    }

    private void indent(int level) {
        out.append(INDENT.repeat(level));
    }

    static String quote(String text) {
        var sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}

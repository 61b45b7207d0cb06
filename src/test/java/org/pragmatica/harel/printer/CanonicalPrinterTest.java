package org.pragmatica.harel.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.harel.model.Action;
import org.pragmatica.harel.model.State;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.model.Transition;
import org.pragmatica.harel.parser.StatechartParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CanonicalPrinterTest {

    private static String canonical(String source) {
        return CanonicalPrinter.print(StatechartParser.parse(source).unwrap());
    }

    @Test
    void print_normalizesLayoutAndQuotesActions() {
        var source = """
            statechart Door {
              initial state Closed {
                entry / lock()
                on open [ !locked ] -> Open / "beep(1)"
              }
              state Open {
                exit / log("bye")
                on close -> Closed
              }
              final state Gone {}
            }
            """;

        assertEquals("""
                         statechart Door {
                             initial state Closed {
                                 entry / "lock()"
                                 on open [!locked] -> Open / "beep(1)"
                             }
                             state Open {
                                 exit / "log(\\"bye\\")"
                                 on close -> Closed
                             }
                             final state Gone {}
                         }
                         """,
                     canonical(source));
    }

    @Test
    void print_orthogonalState_usesRegionBlocks() {
        var printed = canonical("statechart S { state P { region { state A {} } region { state B {} } } }");

        assertEquals("""
                         statechart S {
                             state P {
                                 region {
                                     state A {}
                                 }
                                 region {
                                     state B {}
                                 }
                             }
                         }
                         """,
                     printed);
    }

    @Test
    void print_completionAndInternalTransitions() {
        var printed = canonical("""
            statechart S {
                state A {
                    on tick / count++
                    on [count > 10] -> B
                    on -> B
                }
                state B {}
            }
            """);

        assertThat(printed).contains("        on tick / \"count++\"\n")
                           .contains("        on [count > 10] -> B\n")
                           .contains("        on -> B\n");
    }

    @Test
    void print_isStableAfterReparse() {
        var source = """
            statechart Machine {
                state Off { on power [ battery > 0 ] -> On.Idle / "log(\\"up\\")" }
                state On {
                    entry / "a\\nb"
                    exit / shutdown()   # raw action
                    region {
                        initial state Idle { on work -> Busy }
                        state Busy { on done -> Idle }
                    }
                    region {
                        state Fan { on -> Fan / spin }
                        state Empty {}
                    }
                    on off -> Off
                }
                final state Broken {}
            }
            """;

        var once = canonical(source);
        var twice = canonical(once);

        assertEquals(once, twice);
    }

    @Test
    void print_escapesSpecialCharacters() {
        assertEquals("\"say \\\"hi\\\"\\t\\\\\"", CanonicalPrinter.quote("say \"hi\"\t\\"));
    }

    @Test
    void print_builtStatechart_isParseable() {
        var red = State.builder("Red")
                       .initial()
                       .entry(Action.entry("lamp(red)"))
                       .transition(Transition.on("timer", "Green").withGuard("ready").withAction("click()"))
                       .build();
        var green = State.simple("Green", Transition.on("timer", "Red"));
        var printed = CanonicalPrinter.print(Statechart.of("Light", red, green));

        assertEquals(printed, canonical(printed));
        assertThat(printed).contains("on timer [ready] -> Green / \"click()\"");
    }

    @Test
    void print_historyAndMultiTargets() {
        var printed = canonical("""
            statechart Player {
                state Playing {
                    deep history H -> Track1 / resume()
                    history Plain
                    on skip -> Track1, Track2
                    state Track1 {}
                }
            }
            """);

        assertEquals("""
                         statechart Player {
                             state Playing {
                                 on skip -> Track1, Track2
                                 deep history H -> Track1 / "resume()"
                                 history Plain
                                 state Track1 {}
                             }
                         }
                         """,
                     printed);
        assertEquals(printed, canonical(printed));
    }
}

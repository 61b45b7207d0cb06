package org.pragmatica.harel.validation;

import org.junit.jupiter.api.Test;
import org.pragmatica.harel.error.Diagnostic;
import org.pragmatica.harel.error.SemanticError;
import org.pragmatica.harel.error.Stage;
import org.pragmatica.harel.model.History;
import org.pragmatica.harel.model.Region;
import org.pragmatica.harel.model.State;
import org.pragmatica.harel.model.StateKind;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.model.Transition;
import org.pragmatica.harel.parser.StatechartParser;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest {

    private static ValidationReport validate(String source) {
        return Validator.validate(StatechartParser.parse(source).unwrap());
    }

    private static <T extends SemanticError> List<T> problemsOf(ValidationReport report, Class<T> type) {
        return report.problems().stream()
                     .filter(type::isInstance)
                     .map(type::cast)
                     .toList();
    }

    @Test
    void validate_trafficLight_hasNoDiagnostics() {
        var report = validate("statechart TrafficLight { state Red { on timer -> Green } "
                              + "state Green { on timer -> Yellow } state Yellow { on timer -> Red } }");

        assertTrue(report.isValid());
        assertThat(report.problems()).isEmpty();
        var validated = report.validated().orElseThrow();
        assertEquals("Red", validated.initialState().orElseThrow().name());
    }

    @Test
    void validate_unknownTarget_reportsSingleUnresolvedTarget() {
        var report = validate("statechart S { state A { on go -> Missing } }");

        assertFalse(report.isValid());
        assertTrue(report.validated().isEmpty());
        var errors = report.errors();
        assertEquals(1, errors.size());
        var unresolved = assertInstanceOf(SemanticError.UnresolvedTarget.class, errors.get(0));
        assertEquals("A", unresolved.fromState());
        assertEquals("Missing", unresolved.path());
    }

    @Test
    void validate_duplicateSiblings_reportsOnePerName() {
        var report = validate("""
            statechart S {
                state A {}
                state A {}
                state A {}
            }
            """);

        var duplicates = problemsOf(report, SemanticError.DuplicateStateName.class);
        assertEquals(1, duplicates.size());
        assertEquals("A", duplicates.get(0).path());
        assertEquals(3, duplicates.get(0).span().start().line());
        assertEquals(2, duplicates.get(0).firstDeclaration().start().line());
    }

    @Test
    void validate_duplicateSiblingsDeepInside_reportsQualifiedPath() {
        var report = validate("""
            statechart S {
                state Outer {
                    state Middle {
                        state Leaf {}
                        state Leaf {}
                    }
                }
            }
            """);

        var duplicates = problemsOf(report, SemanticError.DuplicateStateName.class);
        assertEquals(1, duplicates.size());
        assertEquals("Outer.Middle.Leaf", duplicates.get(0).path());
    }

    @Test
    void validate_sameNameInDifferentRegions_isAllowed() {
        var report = validate("""
            statechart S {
                state Left { state Idle {} }
                state Right { state Idle {} }
            }
            """);

        assertThat(problemsOf(report, SemanticError.DuplicateStateName.class)).isEmpty();
    }

    @Test
    void validate_twoInitialMarkers_reportsAmbiguousInitialState() {
        var report = validate("""
            statechart S {
                state Machine {
                    initial state On {}
                    initial state Off {}
                }
            }
            """);

        var ambiguous = problemsOf(report, SemanticError.AmbiguousInitialState.class);
        assertEquals(1, ambiguous.size());
        assertEquals("Machine", ambiguous.get(0).regionPath());
        assertEquals(List.of("On", "Off"), ambiguous.get(0).markedStates());
        assertFalse(report.isValid());
    }

    @Test
    void validate_ambiguousInitialInOrthogonalRegion_namesRegionIndex() {
        var report = validate("""
            statechart S {
                state Both {
                    region { state A {} }
                    region { initial state B {} initial state C {} }
                }
            }
            """);

        var ambiguous = problemsOf(report, SemanticError.AmbiguousInitialState.class);
        assertEquals("Both[2]", ambiguous.get(0).regionPath());
    }

    @Test
    void validate_relativeTargets_resolveThroughEnclosingScopes() {
        var report = validate("""
            statechart S {
                state Outer {
                    state First { on next -> Second }
                    state Second { on leave -> Away }
                }
                state Away { on back -> Outer.Second }
            }
            """);

        assertTrue(report.isValid(), () -> report.problems().toString());
        var first = report.statechart().states().get(0).regions().get(0).states().get(0);
        var target = report.target(first, first.transitions().get(0)).orElseThrow();
        assertEquals("Second", target.name());
    }

    @Test
    void validate_innermostScopeWins() {
        var report = validate("""
            statechart S {
                state Outer {
                    state Inner { on go -> Target }
                    state Target {}
                }
                state Target {}
            }
            """);

        var outer = report.statechart().states().get(0);
        var inner = outer.regions().get(0).states().get(0);
        var resolved = report.target(inner, inner.transitions().get(0)).orElseThrow();
        assertSame(outer.regions().get(0).states().get(1), resolved);
    }

    @Test
    void validate_orthogonalWithEmptyRegion_isMalformed() {
        var report = validate("""
            statechart S {
                state Split {
                    region { state A {} }
                    region { }
                }
            }
            """);

        var malformed = problemsOf(report, SemanticError.MalformedOrthogonalState.class);
        assertEquals(1, malformed.size());
        assertEquals("Split", malformed.get(0).path());
        assertThat(malformed.get(0).reason()).contains("region 2 is empty");
    }

    @Test
    void validate_builtOrthogonalWithOneRegion_isMalformedAndMismatched() {
        var split = State.builder("Split")
                         .kind(StateKind.ORTHOGONAL)
                         .children(State.simple("A"))
                         .build();
        var report = Validator.validate(Statechart.of("S", split));

        assertEquals(1, problemsOf(report, SemanticError.MalformedOrthogonalState.class).size());
        var mismatch = problemsOf(report, SemanticError.StateKindMismatch.class);
        assertEquals(1, mismatch.size());
        assertEquals(StateKind.ORTHOGONAL, mismatch.get(0).declaredKind());
        assertEquals(1, mismatch.get(0).regionCount());
    }

    @Test
    void validate_simpleKindWithRegion_isKindMismatch() {
        var odd = State.builder("Odd")
                       .kind(StateKind.SIMPLE)
                       .region(Region.of(State.simple("Child")))
                       .build();
        var report = Validator.validate(Statechart.of("S", odd));

        var mismatch = problemsOf(report, SemanticError.StateKindMismatch.class);
        assertEquals(1, mismatch.size());
        assertEquals("Odd", mismatch.get(0).path());
    }

    @Test
    void validate_unreachableState_isWarningOnly() {
        var report = validate("""
            statechart S {
                state Start { on go -> End }
                state End {}
                state Spare {}
            }
            """);

        assertTrue(report.isValid());
        var warnings = report.warnings();
        assertEquals(1, warnings.size());
        var unreachable = assertInstanceOf(SemanticError.UnreachableState.class, warnings.get(0));
        assertEquals("Spare", unreachable.path());
        assertEquals(Diagnostic.Severity.WARNING, unreachable.severity());
        assertEquals(List.of(unreachable), report.validated().orElseThrow().warnings());
    }

    @Test
    void validate_selfLoop_countsAsIncomingTransition() {
        var report = validate("""
            statechart S {
                state Start {}
                state Loop { on again -> Loop }
            }
            """);

        assertThat(problemsOf(report, SemanticError.UnreachableState.class)).isEmpty();
    }

    @Test
    void validate_transitionFromParentIntoChild_entersParent() {
        var report = validate("""
            statechart S {
                state Start {}
                state Box {
                    on open -> Box.Inner
                    state Other {}
                    state Inner {}
                }
            }
            """);

        assertThat(problemsOf(report, SemanticError.UnreachableState.class)).isEmpty();
    }

    @Test
    void validate_transitionIntoNestedState_entersItsAncestors() {
        var report = validate("""
            statechart S {
                state Start { on deep -> Box.Inner }
                state Box {
                    state Other {}
                    state Inner {}
                }
            }
            """);

        var unreachable = problemsOf(report, SemanticError.UnreachableState.class).stream()
                                                                                   .map(SemanticError.UnreachableState::path)
                                                                                   .toList();
        assertEquals(List.of(), unreachable);
    }

    @Test
    void validate_nestedInitialStates_areReachable() {
        var report = validate("""
            statechart S {
                state Machine {
                    region { state A {} state B { on x -> A } }
                    region { state C {} }
                }
            }
            """);

        var unreachable = problemsOf(report, SemanticError.UnreachableState.class);
        assertEquals(List.of("Machine.B"), unreachable.stream().map(SemanticError.UnreachableState::path).toList());
    }

    @Test
    void validate_finalStateWithTransition_isInvalid() {
        var report = validate("""
            statechart S {
                state Run { on stop -> Done }
                final state Done { on restart -> Run }
            }
            """);

        var invalid = problemsOf(report, SemanticError.InvalidFinalState.class);
        assertEquals(1, invalid.size());
        assertEquals("Done", invalid.get(0).path());
        assertFalse(report.isValid());
    }

    @Test
    void validate_collectsAllErrorsInOnePass() {
        var report = validate("""
            statechart S {
                state A { on x -> Nowhere }
                state A {}
                state B {
                    initial state C { on y -> Elsewhere }
                    initial state D {}
                }
            }
            """);

        assertThat(report.errors())
            .extracting(SemanticError::kind)
            .containsExactlyInAnyOrder("DuplicateStateName", "UnresolvedTarget", "UnresolvedTarget",
                                       "AmbiguousInitialState");
    }

    @Test
    void validate_doesNotChangeTree() {
        var chart = StatechartParser.parse("statechart S { state A { on go -> Missing } state B {} }").unwrap();
        var copy = StatechartParser.parse("statechart S { state A { on go -> Missing } state B {} }").unwrap();

        Validator.validate(chart);

        assertEquals(copy, chart);
    }

    @Test
    void validate_internalTransition_hasNoTarget() {
        var report = validate("statechart S { state A { on tick / count++ } }");

        assertTrue(report.isValid());
        var state = report.statechart().states().get(0);
        assertTrue(report.targets(state, state.transitions().get(0)).isEmpty());
    }

    @Test
    void diagnostics_carryValidateStage() {
        var report = validate("statechart S { state A { on go -> Missing } }");

        var diagnostic = report.diagnostics().get(0);
        assertEquals(Stage.VALIDATE, diagnostic.stage());
        assertEquals("UnresolvedTarget", diagnostic.kind());
        assertEquals(1, diagnostic.span().start().line());
    }

    @Test
    void toResult_failure_carriesReport() {
        var report = validate("statechart S { state A { on go -> Missing } }");

        var result = report.toResult();

        assertTrue(result.isFailure());
        var failed = assertInstanceOf(ValidationFailed.class, result.cause());
        assertSame(report, failed.report());
        assertThat(failed.message()).contains("1 error(s)").contains("Missing");
    }

    @Test
    void validatedStatechart_exposesResolvedTargets() {
        var a = State.simple("A", Transition.on("go", "B"));
        var b = State.simple("B", Transition.on("back", "A"));
        var validated = Validator.validate(Statechart.of("S", a, b)).toResult().unwrap();

        assertEquals("S", validated.name());
        assertSame(b, validated.target(a, a.transitions().get(0)).orElseThrow());
        assertSame(a, validated.target(b, b.transitions().get(0)).orElseThrow());
        assertEquals(List.of(a), validated.ancestorChain(a));
    }

    @Test
    void validate_pathMatchingStatesInTwoRegions_isAmbiguous() {
        var report = validate("""
            statechart S {
                state Start { on go -> P.X }
                state P {
                    region { state X {} }
                    region { state X {} }
                }
            }
            """);

        assertFalse(report.isValid());
        assertTrue(report.validated().isEmpty());
        var ambiguous = problemsOf(report, SemanticError.AmbiguousTarget.class);
        assertEquals(1, ambiguous.size());
        assertEquals("Start", ambiguous.get(0).fromState());
        assertEquals("P.X", ambiguous.get(0).path());
        assertEquals(List.of("P.X in region 1", "P.X in region 2"), ambiguous.get(0).candidates());
        var start = report.statechart().states().get(0);
        assertTrue(report.targets(start, start.transitions().get(0)).isEmpty());
    }

    @Test
    void validate_pathToDuplicatedSiblings_isAmbiguous() {
        var report = validate("""
            statechart S {
                state B { on go -> A }
                state A {}
                state A {}
            }
            """);

        assertThat(report.errors())
            .extracting(SemanticError::kind)
            .containsExactlyInAnyOrder("DuplicateStateName", "AmbiguousTarget");
    }

    @Test
    void validate_innermostRegionDisambiguatesSameNames() {
        var report = validate("""
            statechart S {
                state P {
                    region { state X { on again -> X } }
                    region { state X {} }
                }
            }
            """);

        assertTrue(report.isValid(), () -> report.problems().toString());
        var first = report.statechart().states().get(0).regions().get(0).states().get(0);
        assertSame(first, report.target(first, first.transitions().get(0)).orElseThrow());
    }

    private static final String OVEN = """
        statechart Oven {
            state Idle { on start -> %s }
            state Running {
                region { state Waiting {} state Heating {} }
                region { state Off {} state Fan {} }
            }
        }
        """;

    @Test
    void validate_multiTargetIntoDifferentRegions_isAccepted() {
        var report = validate(OVEN.formatted("Running.Heating, Running.Fan"));

        assertThat(report.problems()).isEmpty();
        var idle = report.statechart().states().get(0);
        var targets = report.targets(idle, idle.transitions().get(0));
        assertEquals(List.of("Heating", "Fan"), targets.stream().map(State::name).toList());
        assertTrue(report.target(idle, idle.transitions().get(0)).isEmpty());
    }

    @Test
    void validate_multiTargetIntoSameRegion_conflicts() {
        var report = validate(OVEN.formatted("Running.Waiting, Running.Heating"));

        var conflicts = problemsOf(report, SemanticError.ConflictingTargets.class);
        assertEquals(1, conflicts.size());
        assertEquals(List.of("Running.Waiting", "Running.Heating"), conflicts.get(0).paths());
        assertThat(conflicts.get(0).reason()).contains("same region of 'Running'");
    }

    @Test
    void validate_multiTargetWithNestedStates_conflicts() {
        var report = validate(OVEN.formatted("Running, Running.Fan"));

        var conflicts = problemsOf(report, SemanticError.ConflictingTargets.class);
        assertThat(conflicts.get(0).reason()).contains("nested in each other");
    }

    @Test
    void validate_multiTargetAtTopLevel_conflicts() {
        var report = validate(OVEN.formatted("Idle, Running"));

        var conflicts = problemsOf(report, SemanticError.ConflictingTargets.class);
        assertThat(conflicts.get(0).reason()).contains("share no orthogonal ancestor");
    }

    @Test
    void validate_multiTargetWithUnknownPath_reportsOnlyUnresolved() {
        var report = validate(OVEN.formatted("Running.Fan, Running.Nope"));

        assertThat(report.errors())
            .extracting(SemanticError::kind)
            .containsExactly("UnresolvedTarget");
    }

    @Test
    void validate_historyWithChildDefault_isAccepted() {
        var report = validate("""
            statechart Player {
                state Stopped { on play -> Playing.H }
                state Playing {
                    history H -> Track1
                    state Track1 { on next -> Track2 }
                    state Track2 { on next -> Track1 }
                    on stop -> Stopped
                }
            }
            """);

        assertThat(report.problems()).isEmpty();
        var validated = report.validated().orElseThrow();
        var history = validated.findState("Playing.H").orElseThrow();
        assertEquals("Track1", validated.target(history, history.transitions().get(0)).orElseThrow().name());
        assertEquals("Track1", validated.findState("Playing").orElseThrow().regions().get(0).initialState()
                                        .orElseThrow()
                                        .name());
    }

    @Test
    void validate_shallowHistoryDefaultingToGrandchild_isInvalid() {
        var report = validate("""
            statechart S {
                state Start { on go -> Box.H }
                state Box {
                    history H -> Inner.Leaf
                    state Inner { state Leaf {} }
                }
            }
            """);

        var invalid = problemsOf(report, SemanticError.InvalidHistoryState.class);
        assertEquals(1, invalid.size());
        assertEquals("Box.H", invalid.get(0).path());
        assertEquals("defaults to 'Box.Inner.Leaf', which is not a child of 'Box'", invalid.get(0).reason());
    }

    @Test
    void validate_deepHistoryDefaultingToGrandchild_isAccepted() {
        var report = validate("""
            statechart S {
                state Start { on go -> Box.H }
                state Box {
                    deep history H -> Inner.Leaf
                    state Inner { state Leaf {} }
                }
            }
            """);

        assertThat(report.problems()).isEmpty();
    }

    @Test
    void validate_historyDefaultOutsideOwner_isInvalid() {
        var report = validate("""
            statechart S {
                state Box {
                    deep history H -> Elsewhere
                    state Inside {}
                }
                state Elsewhere {}
            }
            """);

        var invalid = problemsOf(report, SemanticError.InvalidHistoryState.class);
        assertThat(invalid).extracting(SemanticError.InvalidHistoryState::reason)
                           .containsExactly("defaults to 'Elsewhere', which is not a descendant of 'Box'");
    }

    @Test
    void validate_topLevelHistory_isInvalid() {
        var report = validate("statechart S { state A {} history H }");

        var invalid = problemsOf(report, SemanticError.InvalidHistoryState.class);
        assertEquals(1, invalid.size());
        assertEquals("is not nested in a state", invalid.get(0).reason());
    }

    @Test
    void validate_builtHistoryWithTriggeredDefault_isInvalid() {
        var history = State.builder("H")
                           .history(History.SHALLOW)
                           .transition(Transition.on("resume", "A"))
                           .build();
        var box = State.builder("Box").children(State.simple("A"), history).build();
        var report = Validator.validate(Statechart.of("S", box));

        assertThat(problemsOf(report, SemanticError.InvalidHistoryState.class))
            .extracting(SemanticError.InvalidHistoryState::reason)
            .containsExactly("default transition must have neither event nor guard");
    }

    @Test
    void validate_sharedTransitionInstance_resolvesPerSource() {
        var shared = Transition.on("go", "Target");
        var inner = State.simple("Inner", shared);
        var innerTarget = State.simple("Target");
        var box = State.builder("Box").children(inner, innerTarget).build();
        var start = State.simple("Start", shared);
        var topTarget = State.simple("Target");

        var report = Validator.validate(Statechart.of("S", start, box, topTarget));

        assertThat(report.problems()).isEmpty();
        assertSame(innerTarget, report.target(inner, shared).orElseThrow());
        assertSame(topTarget, report.target(start, shared).orElseThrow());
    }
}

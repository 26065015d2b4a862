package com.williamcallahan.specweave.service.linking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.specweave.domain.diagnostics.Diagnostic;
import com.williamcallahan.specweave.domain.diagnostics.DiagnosticKind;
import com.williamcallahan.specweave.service.TestSessions;
import com.williamcallahan.specweave.service.biblio.Bibliography;
import java.util.List;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

/**
 * Verifies final step paths of replacement algorithms.
 */
class ReplacementStepResolverTest {

    private final ReplacementStepResolver resolver = new ReplacementStepResolver();

    @Test
    void replacementStepsContinueFromTargetPath() {
        TestSessions.Walked walked = TestSessions.walk("""
            <emu-clause id="sec-a"><h1>A</h1>
            <emu-alg>
              1. First.
              1. Second.
                1. [id="step-target"] Nested.
            </emu-alg>
            </emu-clause>
            <emu-clause id="sec-b"><h1>B</h1>
            <emu-alg replaces-step="step-target">
              1. Replacement.
                1. [id="step-new-1"] One.
                1. [id="step-new-2"] Two.
            </emu-alg>
            </emu-clause>
            """);
        Bibliography bibliography = walked.session().bibliography();

        assertEquals(List.of(2, 1), bibliography.stepEntry("step-target").orElseThrow().stepNumbers());
        assertEquals(List.of(1, 1), bibliography.stepEntry("step-new-1").orElseThrow().stepNumbers());

        assertEquals(1, resolver.resolve(walked.session()));

        assertEquals(List.of(2, 1, 1), bibliography.stepEntry("step-new-1").orElseThrow().stepNumbers());
        assertEquals(List.of(2, 1, 2), bibliography.stepEntry("step-new-2").orElseThrow().stepNumbers());
        Element list = walked.document().selectFirst("emu-alg[replaces-step] > ol");
        assertEquals("1", list.attr("start"));
        assertTrue(list.hasClass("nested-once"));
        assertTrue(walked.sink().diagnostics().isEmpty());
    }

    @Test
    void chainedReplacementsResolveInDependencyOrder() {
        TestSessions.Walked walked = TestSessions.walk("""
            <emu-alg replaces-step="step-inner">
              1. Deepest.
                1. [id="step-deepest"] Leaf.
            </emu-alg>
            <emu-alg>
              1. Root.
              1. Root two.
              1. [id="step-outer"] Root three.
            </emu-alg>
            <emu-alg replaces-step="step-outer">
              1. Middle.
                1. Filler.
                1. [id="step-inner"] Inner.
            </emu-alg>
            """);

        assertEquals(2, resolver.resolve(walked.session()));

        Bibliography bibliography = walked.session().bibliography();
        assertEquals(List.of(3, 2), bibliography.stepEntry("step-inner").orElseThrow().stepNumbers());
        assertEquals(List.of(3, 2, 1), bibliography.stepEntry("step-deepest").orElseThrow().stepNumbers());
        Element deepestList = walked.document().selectFirst("emu-alg[replaces-step=step-inner] > ol");
        assertEquals("2", deepestList.attr("start"));
        assertTrue(deepestList.hasClass("nested-once"));
    }

    @Test
    void cycleIsReportedOnce() {
        TestSessions.Walked walked = TestSessions.walk("""
            <emu-alg replaces-step="s2">
              1. [id="s1"] A.
            </emu-alg>
            <emu-alg replaces-step="s1">
              1. [id="s2"] B.
            </emu-alg>
            """);

        assertEquals(0, resolver.resolve(walked.session()));

        List<Diagnostic> diagnostics = walked.sink().diagnostics();
        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticKind.GLOBAL, diagnostics.get(0).kind());
        assertEquals("invalid-replacement", diagnostics.get(0).ruleId());
        assertTrue(diagnostics.get(0).message().contains("cycle"));

        Bibliography bibliography = walked.session().bibliography();
        assertEquals(List.of(1), bibliography.stepEntry("s1").orElseThrow().stepNumbers());
        assertEquals(List.of(1), bibliography.stepEntry("s2").orElseThrow().stepNumbers());
        List<Element> lists = walked.document().select("emu-alg > ol");
        assertEquals(2, lists.size());
        for (Element list : lists) {
            assertFalse(list.hasAttr("start"));
            for (String className : list.classNames()) {
                assertFalse(className.startsWith("nested-"), className);
            }
        }
    }

    @Test
    void reportsMissingAndNonStepTargetsOnAttribute() {
        TestSessions.Walked walked = TestSessions.walk("""
            <emu-clause id="sec-a"><h1>A</h1></emu-clause>
            <emu-alg replaces-step="nope">
              1. X.
            </emu-alg>
            <emu-alg replaces-step="sec-a">
              1. Y.
            </emu-alg>
            """);

        resolver.resolve(walked.session());

        List<Diagnostic> diagnostics = walked.sink().diagnostics();
        assertEquals(2, diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            assertEquals(DiagnosticKind.ATTRIBUTE, diagnostic.kind());
            assertTrue(diagnostic.message().endsWith("(attribute replaces-step)"));
        }
        assertTrue(diagnostics.get(1).message().contains("not a clause"));
    }

    @Test
    void appliesNestingClassByDepth() {
        Element algorithm = new Element("emu-alg").appendChild(new Element("ol"));

        ReplacementStepResolver.applyStart(algorithm, List.of(1, 2, 3, 4, 5, 6, 7));

        Element list = algorithm.child(0);
        assertEquals("7", list.attr("start"));
        assertTrue(list.hasClass("nested-lots"));
    }
}

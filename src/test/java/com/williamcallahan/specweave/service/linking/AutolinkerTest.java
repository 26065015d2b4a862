package com.williamcallahan.specweave.service.linking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.specweave.domain.biblio.EntryKind;
import com.williamcallahan.specweave.service.TestSessions;
import java.util.Set;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

/**
 * Verifies which text runs are autolinked and how.
 */
class AutolinkerTest {

    private static final String TERMS = """
        <emu-clause id="sec-terms"><h1>Terms</h1>
          <p>An <dfn>execution context</dfn> and a <dfn variants="agents">agent</dfn>.</p>
        </emu-clause>
        """;

    @Test
    void linksMultiWordTermsAcrossLineBreaksAndVariants() {
        TestSessions.Walked walked = TestSessions.walk(TERMS + """
            <emu-clause id="sec-use"><h1>Use</h1><p>The running execution
              context of all agents.</p></emu-clause>
            """);

        int linked = new Autolinker(AutolinkPolicy.defaults()).link(walked.session());

        assertEquals(2, linked);
        Document document = walked.document();
        assertEquals("#sec-terms", document.selectFirst("#sec-use emu-xref").attr("href"));
        assertEquals("agents", document.select("#sec-use emu-xref a").get(1).text());
    }

    @Test
    void secondRunFindsNothingLeftToLink() {
        TestSessions.Walked walked = TestSessions.walk(TERMS + "<p>Each agent is busy.</p>");
        Autolinker autolinker = new Autolinker(AutolinkPolicy.defaults());

        assertEquals(1, autolinker.link(walked.session()));
        String once = walked.document().body().html();

        assertEquals(0, autolinker.link(walked.session()));
        assertEquals(once, walked.document().body().html());
    }

    @Test
    void leavesSuppressedRegionsAlone() {
        TestSessions.Walked walked = TestSessions.walk(TERMS + """
            <p><code>agent</code> <var>agent</var> <emu-not-ref>agent</emu-not-ref>
            <emu-xref href="#sec-terms">agent</emu-xref> <a href="#x">agent</a></p>
            <pre>agent</pre>
            """);

        assertEquals(0, new Autolinker(AutolinkPolicy.defaults()).link(walked.session()));
    }

    @Test
    void skipsPartialWordMatches() {
        TestSessions.Walked walked = TestSessions.walk(TERMS + "<p>Agentive reagent agent_x.</p>");

        assertEquals(0, new Autolinker(AutolinkPolicy.defaults()).link(walked.session()));
    }

    @Test
    void honorsPolicyInsideAlgorithms() {
        String html = """
            <emu-clause id="sec-get" aoid="Get"><h1>Get ( O, P )</h1></emu-clause>
            <emu-clause id="sec-use"><h1>Use</h1>
              <p>Call Get here.</p>
              <emu-alg>
                1. Return Get(O, P).
              </emu-alg>
            </emu-clause>
            """;
        TestSessions.Walked walked = TestSessions.walk(html);
        AutolinkPolicy outsideOnly = new AutolinkPolicy(Set.of(EntryKind.OPERATION), Set.of());

        assertEquals(1, new Autolinker(outsideOnly).link(walked.session()));
        assertNull(walked.document().selectFirst("emu-alg emu-xref"));
        assertEquals("Get", walked.document().selectFirst("p emu-xref").attr("aoid"));
    }

    @Test
    void ambiguousTermIsReportedAndNotLinked() {
        TestSessions.Walked walked = TestSessions.walk("""
            <emu-clause id="sec-one"><h1>One</h1><p><dfn>widget</dfn></p></emu-clause>
            <emu-clause id="sec-two"><h1>Two</h1><p><dfn>widget</dfn></p></emu-clause>
            <p>A widget and another widget.</p>
            """);

        assertEquals(0, new Autolinker(AutolinkPolicy.defaults()).link(walked.session()));

        assertEquals(1, walked.sink().diagnostics().size());
        assertEquals("ambiguous-autolink", walked.sink().diagnostics().get(0).ruleId());
        assertTrue(walked.sink().diagnostics().get(0).message().contains("widget"));
    }

    @Test
    void nestedNamespaceSeesOuterTermsButNotSiblings() {
        TestSessions.Walked walked = TestSessions.walk("""
            <emu-clause id="sec-outer"><h1>Outer</h1><p>A <dfn>realm</dfn>.</p></emu-clause>
            <emu-clause id="sec-intl" namespace="intl"><h1>Intl</h1>
              <p>A <dfn>locale</dfn> in a realm.</p>
            </emu-clause>
            <p>No locale here.</p>
            """);

        assertEquals(1, new Autolinker(AutolinkPolicy.defaults()).link(walked.session()));
        assertEquals("#sec-outer", walked.document().selectFirst("#sec-intl emu-xref").attr("href"));
    }
}

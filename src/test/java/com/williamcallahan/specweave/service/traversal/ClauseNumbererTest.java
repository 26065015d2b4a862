package com.williamcallahan.specweave.service.traversal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

class ClauseNumbererTest {

    private final ClauseNumberer numberer = new ClauseNumberer();

    private static ClauseFrame frame(String number) {
        return new ClauseFrame(new Element("emu-clause"), "ns", number);
    }

    @Test
    void numbersNestedClausesFromParent() {
        String first = numberer.assign(null, "emu-clause");
        ClauseFrame parent = frame(first);

        assertEquals("1", first);
        assertEquals("1.1", numberer.assign(parent, "emu-clause"));
        assertEquals("1.2", numberer.assign(parent, "emu-clause"));
        assertEquals("2", numberer.assign(null, "emu-clause"));
    }

    @Test
    void leavesIntroductionsAndTheirChildrenUnnumbered() {
        String intro = numberer.assign(null, "emu-intro");

        assertEquals("", intro);
        assertEquals("", numberer.assign(frame(intro), "emu-clause"));
        assertEquals("1", numberer.assign(null, "emu-clause"));
    }

    @Test
    void annexesUseLettersAndBlockLaterClauses() {
        assertEquals("A", numberer.assign(null, "emu-annex"));
        assertEquals("A.1", numberer.assign(frame("A"), "emu-clause"));
        assertEquals("B", numberer.assign(null, "emu-annex"));
        assertNull(numberer.assign(null, "emu-clause"));
    }

    @Test
    void annexLettersContinuePastZ() {
        assertEquals("Z", ClauseNumberer.annexLetters(26));
        assertEquals("AA", ClauseNumberer.annexLetters(27));
    }
}

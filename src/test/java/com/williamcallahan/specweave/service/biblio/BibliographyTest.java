package com.williamcallahan.specweave.service.biblio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.specweave.domain.biblio.ClauseEntry;
import com.williamcallahan.specweave.domain.biblio.EntryKind;
import com.williamcallahan.specweave.domain.biblio.EntryRef;
import com.williamcallahan.specweave.domain.biblio.OperationEntry;
import com.williamcallahan.specweave.domain.biblio.ProductionEntry;
import com.williamcallahan.specweave.domain.biblio.StepEntry;
import com.williamcallahan.specweave.domain.biblio.TermEntry;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies namespace-aware lookup and back-reference bookkeeping.
 */
class BibliographyTest {

    private static final String DOC = "https://example.com/doc";

    private Bibliography bibliography;

    @BeforeEach
    void setUp() {
        bibliography = new Bibliography(DOC);
    }

    @Test
    void nearerNamespaceShadowsOuterDefinition() throws DuplicateIdException {
        bibliography.createNamespace("intl", DOC);
        bibliography.define(new TermEntry("outer-realm", null, DOC, "realm", List.of()));
        bibliography.define(new TermEntry("inner-realm", null, "intl", "realm", List.of()));

        LookupResult inner = bibliography.lookup("intl", "realm");
        LookupResult outer = bibliography.lookup(DOC, "realm");

        assertEquals("inner-realm", assertInstanceOf(LookupResult.Found.class, inner).ref().entry().id());
        assertEquals("outer-realm", assertInstanceOf(LookupResult.Found.class, outer).ref().entry().id());
    }

    @Test
    void lookupFallsBackToGlobalThenExternalTables() throws DuplicateIdException {
        bibliography.define(new OperationEntry(null, "sec-tonumber", Bibliography.GLOBAL_NAMESPACE, "ToNumber"));
        bibliography.importExternal("https://other.example/", List.of(
            new OperationEntry(null, "sec-get", "https://other.example/", "Get")));

        LookupResult global = bibliography.lookup(DOC, "ToNumber");
        LookupResult external = bibliography.lookup(DOC, "Get");

        assertFalse(assertInstanceOf(LookupResult.Found.class, global).ref().isExternal());
        EntryRef externalRef = assertInstanceOf(LookupResult.Found.class, external).ref();
        assertTrue(externalRef.isExternal());
        assertEquals("https://other.example/#sec-get", externalRef.href());
    }

    @Test
    void keyMatchingTwoEntriesAtOneLevelIsAmbiguous() throws DuplicateIdException {
        bibliography.define(new TermEntry("a", null, DOC, "value", List.of()));
        bibliography.define(new TermEntry("b", null, DOC, "value", List.of()));

        LookupResult result = bibliography.lookup(DOC, "value");

        assertEquals(2, assertInstanceOf(LookupResult.Ambiguous.class, result).candidates().size());
    }

    @Test
    void explicitIdOfUnexpectedKindIsReportedAsWrongKind() throws DuplicateIdException {
        bibliography.define(new ClauseEntry("sec-intro", DOC, null, "Introduction", "1"));

        LookupResult result = bibliography.lookup(DOC, "sec-intro", null, Set.of(EntryKind.PRODUCTION));

        assertEquals(EntryKind.CLAUSE, assertInstanceOf(LookupResult.WrongKind.class, result).ref().entry().kind());
        assertInstanceOf(LookupResult.Missing.class, bibliography.lookup(DOC, "nope", null, Set.of(EntryKind.CLAUSE)));
    }

    @Test
    void keyedLookupReportsNearestEntryOfOtherKind() throws DuplicateIdException {
        bibliography.define(new TermEntry("dfn-list", null, DOC, "List", List.of()));

        LookupResult result = bibliography.lookup(DOC, null, "List", Set.of(EntryKind.PRODUCTION));

        assertInstanceOf(LookupResult.WrongKind.class, result);
    }

    @Test
    void whitespaceInKeysIsCanonicalized() throws DuplicateIdException {
        bibliography.define(new TermEntry("dfn-ec", null, DOC, "execution context", List.of("execution contexts")));

        assertInstanceOf(LookupResult.Found.class, bibliography.lookup(DOC, "execution\n   context"));
        assertInstanceOf(LookupResult.Found.class, bibliography.lookup(DOC, "execution contexts"));
        assertInstanceOf(LookupResult.Missing.class, bibliography.lookup(DOC, "Execution context"));
    }

    @Test
    void rejectsSecondEntryWithSameIdAcrossNamespaces() throws DuplicateIdException {
        bibliography.createNamespace("intl", DOC);
        bibliography.define(new ClauseEntry("sec-a", DOC, null, "A", "1"));

        DuplicateIdException failure = assertThrows(DuplicateIdException.class,
            () -> bibliography.define(new ProductionEntry("sec-a", "intl", "A")));

        assertEquals("sec-a", failure.duplicateId());
        assertEquals(1, bibliography.entries().size());
    }

    @Test
    void recordsEachReferenceOnceAndIgnoresExternalEntries() throws DuplicateIdException {
        bibliography.define(new ClauseEntry("sec-a", DOC, null, "A", "1"));
        bibliography.importExternal("https://other.example/", List.of(
            new ClauseEntry("sec-ext", "https://other.example/", null, "Ext", "1")));

        assertTrue(bibliography.recordReference("sec-a", "_ref_0"));
        assertTrue(bibliography.recordReference("sec-a", "_ref_0"));
        assertTrue(bibliography.recordReference("sec-a", "_ref_1"));
        assertFalse(bibliography.recordReference("sec-ext", "_ref_2"));

        assertEquals(List.of("_ref_0", "_ref_1"), bibliography.referencingIds("sec-a"));
        assertTrue(bibliography.referencingIds("sec-ext").isEmpty());
    }

    @Test
    void localIdWinsOverExternalIdInByIdLookup() throws DuplicateIdException {
        bibliography.importExternal("https://other.example/", List.of(
            new ClauseEntry("sec-a", "https://other.example/", null, "Other", "9")));
        bibliography.define(new ClauseEntry("sec-a", DOC, null, "Mine", "1"));

        EntryRef ref = bibliography.byId("sec-a").orElseThrow();

        assertFalse(ref.isExternal());
        assertEquals("#sec-a", ref.href());
    }

    @Test
    void visibleEntriesKeepOnlyNearestLevelPerKey() throws DuplicateIdException {
        bibliography.createNamespace("intl", DOC);
        bibliography.define(new TermEntry("outer", null, DOC, "realm", List.of()));
        bibliography.define(new TermEntry("inner", null, "intl", "realm", List.of()));
        bibliography.define(new TermEntry("agent", null, DOC, "agent", List.of()));
        bibliography.define(new ProductionEntry("prod-Script", DOC, "Script"));

        Map<String, List<EntryRef>> visible = bibliography.visibleEntries("intl", Set.of(EntryKind.TERM));

        assertEquals(Set.of("realm", "agent"), visible.keySet());
        assertEquals("inner", visible.get("realm").get(0).entry().id());
        assertEquals(1, visible.get("realm").size());
    }

    @Test
    void replacesStepNumbersInPlace() throws DuplicateIdException {
        bibliography.define(new StepEntry("step-x", DOC, List.of(1, 2)));

        bibliography.replaceStepNumbers("step-x", List.of(3, 1, 2));

        assertEquals(List.of(3, 1, 2), bibliography.stepEntry("step-x").orElseThrow().stepNumbers());
        assertEquals(List.of(3, 1, 2), ((StepEntry) bibliography.entries().get(0)).stepNumbers());
    }

    @Test
    void namespaceChainEndsInGlobal() {
        bibliography.createNamespace("intl", DOC);
        bibliography.createNamespace("intl-temporal", "intl");

        assertEquals(List.of("intl-temporal", "intl", DOC, Bibliography.GLOBAL_NAMESPACE),
            bibliography.namespaceChain("intl-temporal"));
    }
}

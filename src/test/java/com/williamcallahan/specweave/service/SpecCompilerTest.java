package com.williamcallahan.specweave.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.specweave.domain.CompilationResult;
import com.williamcallahan.specweave.domain.OutlineEntry;
import com.williamcallahan.specweave.domain.diagnostics.Diagnostic;
import com.williamcallahan.specweave.domain.diagnostics.DiagnosticKind;
import com.williamcallahan.specweave.service.biblio.BiblioJsonCodec;
import com.williamcallahan.specweave.service.grammar.SimpleGrammarEngine;
import com.williamcallahan.specweave.service.imports.FileImportLoader;
import com.williamcallahan.specweave.service.linking.AutolinkPolicy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Compiles small documents end to end and checks the rendered tree, diagnostics and exports.
 */
class SpecCompilerTest {

    private static final String LOCATION = "https://example.com/spec/";

    private static SpecCompiler compiler(CompilerOptions options) {
        return new SpecCompiler(options, new SimpleGrammarEngine(), new FileImportLoader(), new BiblioJsonCodec());
    }

    private static SpecCompiler compilerWithLocation() {
        return compiler(new CompilerOptions(LOCATION, List.of(), AutolinkPolicy.defaults(), false, false));
    }

    private static List<String> ruleIds(CompilationResult result) {
        List<String> ids = new ArrayList<>();
        for (Diagnostic diagnostic : result.diagnostics()) {
            ids.add(diagnostic.ruleId());
        }
        return ids;
    }

    @Test
    void numbersClausesInDocumentOrder() {
        String source = """
            <emu-intro id="intro"><h1>Introduction</h1></emu-intro>
            <emu-clause id="a"><h1>A</h1>
              <emu-clause id="c"><h1>C</h1></emu-clause>
            </emu-clause>
            <emu-clause id="b"><h1>B</h1></emu-clause>
            <emu-annex id="x"><h1>X</h1></emu-annex>
            <emu-annex id="y"><h1>Y</h1></emu-annex>
            """;

        CompilationResult result = compiler(CompilerOptions.defaults()).compile(source, null);
        Document html = Jsoup.parse(result.html());

        assertNull(html.getElementById("intro").selectFirst("span.secnum"));
        assertEquals("1", html.getElementById("a").selectFirst("h1 > span.secnum").text());
        assertEquals("1.1", html.getElementById("c").selectFirst("h1 > span.secnum").text());
        assertEquals("2", html.getElementById("b").selectFirst("h1 > span.secnum").text());
        assertEquals("A", html.getElementById("x").selectFirst("h1 > span.secnum").text());
        assertEquals("B", html.getElementById("y").selectFirst("h1 > span.secnum").text());

        List<OutlineEntry> outline = result.outline();
        assertEquals(5, outline.size());
        assertEquals("1.1", outline.get(1).children().get(0).number());
        assertEquals("C", outline.get(1).children().get(0).title());
        assertFalse(result.hasDiagnostics());
    }

    @Test
    void reportsClauseFollowingAnnex() {
        String source = """
            <emu-annex id="x"><h1>X</h1></emu-annex>
            <emu-clause id="late"><h1>Late</h1></emu-clause>
            """;

        CompilationResult result = compiler(CompilerOptions.defaults()).compile(source, null);

        assertEquals(List.of("clause-after-annex"), ruleIds(result));
        assertNull(Jsoup.parse(result.html()).getElementById("late").selectFirst("span.secnum"));
    }

    @Test
    void resolvesForwardCrossReferenceAndRecordsBackReference() throws IOException {
        String source = """
            <emu-clause id="a"><h1>A</h1><p>See <emu-xref href="#b"></emu-xref>.</p></emu-clause>
            <emu-clause id="b"><h1>B</h1></emu-clause>
            """;

        CompilationResult result = compilerWithLocation().compile(source, null);
        Element xref = Jsoup.parse(result.html()).selectFirst("emu-xref");

        assertEquals("#b", xref.selectFirst("a").attr("href"));
        assertEquals("2", xref.text());
        assertEquals("_ref_0", xref.id());

        JsonNode exported = new ObjectMapper().readTree(result.biblioJson()).get(LOCATION);
        JsonNode clauseB = null;
        for (JsonNode entry : exported) {
            if ("b".equals(entry.path("id").asText())) {
                clauseB = entry;
            }
        }
        assertNotNull(clauseB);
        assertEquals("_ref_0", clauseB.get("referencingIds").get(0).asText());
    }

    @Test
    void keepsAuthoredXrefContentAndUsesTitleWhenAsked() {
        String source = """
            <emu-clause id="a"><h1>Alpha</h1></emu-clause>
            <p><emu-xref href="#a">this clause</emu-xref> and <emu-xref href="#a" title></emu-xref></p>
            """;

        CompilationResult result = compiler(CompilerOptions.defaults()).compile(source, null);
        List<Element> xrefs = Jsoup.parse(result.html()).select("emu-xref");

        assertEquals("this clause", xrefs.get(0).selectFirst("a").text());
        assertEquals("Alpha", xrefs.get(1).selectFirst("a").text());
    }

    @Test
    void reportsUnresolvableCrossReferences() {
        String source = """
            <p><emu-xref href="#nowhere"></emu-xref> <emu-xref aoid="Missing"></emu-xref>
            <emu-xref href="https://elsewhere/"></emu-xref> <emu-xref></emu-xref></p>
            """;

        CompilationResult result = compiler(CompilerOptions.defaults()).compile(source, null);

        assertEquals(4, ruleIds(result).stream().filter("invalid-xref"::equals).count());
        Diagnostic attributeDiagnostic = result.diagnostics().stream()
            .filter(diagnostic -> diagnostic.kind() == DiagnosticKind.ATTRIBUTE)
            .findFirst()
            .orElseThrow();
        assertTrue(attributeDiagnostic.message().endsWith("(attribute href)"));
        assertEquals(2, attributeDiagnostic.location().line());
    }

    @Test
    void autolinksOperationsAndTermsButNotTheirOwnDefinitions() {
        String source = """
            <emu-clause id="sec-tonumber" aoid="ToNumber"><h1>ToNumber ( _x_ )</h1>
              <p>ToNumber converts values.</p>
            </emu-clause>
            <emu-clause id="sec-realms"><h1>Realms</h1><p>A <dfn>realm</dfn> is a thing.</p></emu-clause>
            <emu-clause id="use"><h1>Use</h1><p>Realm records call ToNumber, unlike realms.</p></emu-clause>
            """;

        CompilationResult result = compiler(CompilerOptions.defaults()).compile(source, null);
        Document html = Jsoup.parse(result.html());

        assertTrue(html.getElementById("sec-tonumber").select("p emu-xref").isEmpty());
        List<Element> links = html.getElementById("use").select("p emu-xref");
        assertEquals(2, links.size());
        assertEquals("#sec-realms", links.get(0).attr("href"));
        assertEquals("Realm", links.get(0).text());
        assertEquals("ToNumber", links.get(1).attr("aoid"));
        assertEquals("#sec-tonumber", links.get(1).selectFirst("a").attr("href"));
        assertTrue(html.getElementById("use").selectFirst("p").text().endsWith("unlike realms."));
    }

    @Test
    void firstOfDuplicateIdsWins() {
        String source = """
            <emu-clause id="dup"><h1>First</h1></emu-clause>
            <emu-clause id="dup"><h1>Second</h1></emu-clause>
            <p><emu-xref href="#dup"></emu-xref></p>
            """;

        CompilationResult result = compiler(CompilerOptions.defaults()).compile(source, null);

        assertEquals(List.of("duplicate-id"), ruleIds(result));
        assertEquals("1", Jsoup.parse(result.html()).selectFirst("emu-xref").text());
    }

    @Test
    void expandsInlineShorthandInProse() {
        String source = "<p>Let _x_ be *true* or ~empty~.</p><pre>Keep _this_ as is.</pre>";

        CompilationResult result = compiler(CompilerOptions.defaults()).compile(source, null);
        Document html = Jsoup.parse(result.html());

        assertEquals("x", html.selectFirst("p > var").text());
        assertEquals("true", html.selectFirst("p > emu-val").text());
        assertEquals("empty", html.selectFirst("p > emu-const").text());
        assertEquals("Keep _this_ as is.", html.selectFirst("pre").text());
    }

    @Test
    void insertsAnchorsForOldIds() {
        String source = "<emu-clause id=\"new\" oldids=\"old-one, old-two\"><h1>Renamed</h1></emu-clause>";

        CompilationResult result = compiler(CompilerOptions.defaults()).compile(source, null);
        Document html = Jsoup.parse(result.html());

        assertEquals("span", html.getElementById("old-one").normalName());
        assertEquals("new", html.getElementById("old-two").parent().id());
    }

    @Test
    void oldIdsOnVoidElementIsFatal() {
        String source = "<p>Line<br oldids=\"gone\">break</p>";

        assertThrows(SpecStructureException.class,
            () -> compiler(CompilerOptions.defaults()).compile(source, null));
    }

    @Test
    void cancelledCompilationProducesNoResult() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        CompilationCancelledException failure = assertThrows(CompilationCancelledException.class,
            () -> compiler(CompilerOptions.defaults()).compile("<p>x</p>", null, signal, null));

        assertTrue(failure.getMessage().contains("biblio loading"));
    }

    @Test
    void recompilingRenderedOutputKeepsOneSectionNumber() {
        String source = """
            <emu-clause id="a"><h1>Alpha</h1>
              <emu-clause id="a-one"><h1>Alpha One</h1></emu-clause>
            </emu-clause>
            """;
        SpecCompiler compiler = compiler(CompilerOptions.defaults());

        CompilationResult first = compiler.compile(source, null);
        CompilationResult second = compiler.compile(first.html(), null);
        Document html = Jsoup.parse(second.html());

        assertEquals(1, html.select("#a > h1 > span.secnum").size());
        assertEquals("1 Alpha", html.selectFirst("#a > h1").text());
        assertEquals("1.1 Alpha One", html.selectFirst("#a-one > h1").text());
        assertEquals("Alpha", second.outline().get(0).title());
        assertEquals("Alpha One", second.outline().get(0).children().get(0).title());
    }

    @Test
    void marksFirstHeadingWhenNoTextPrecedesIt() {
        SpecCompiler compiler = compiler(CompilerOptions.defaults());

        Document leading = Jsoup.parse(compiler.compile("""
            <emu-clause id="a"><h1>Alpha</h1></emu-clause>
            <emu-clause id="b"><h1>Beta</h1></emu-clause>
            """, null).html());
        Document preceded = Jsoup.parse(compiler.compile("""
            <p>Front matter.</p>
            <emu-clause id="a"><h1>Alpha</h1></emu-clause>
            """, null).html());

        assertTrue(leading.selectFirst("#a > h1").hasClass("first"));
        assertFalse(leading.selectFirst("#b > h1").hasClass("first"));
        assertFalse(preceded.selectFirst("#a > h1").hasClass("first"));
    }

    @Test
    void sameProductionInTwoNamespacesGetsDistinctAnchors() {
        String source = """
            <emu-clause id="a" namespace="one"><h1>One</h1>
              <emu-grammar type="definition">Foo : `a`</emu-grammar>
              <p>Uses |Foo|.</p>
            </emu-clause>
            <emu-clause id="b" namespace="two"><h1>Two</h1>
              <emu-grammar type="definition">Foo : `b`</emu-grammar>
              <p>Uses |Foo|.</p>
            </emu-clause>
            """;

        CompilationResult result = compilerWithLocation().compile(source, null);
        Document html = Jsoup.parse(result.html());

        assertEquals(1, html.select("[id=prod-Foo]").size());
        assertEquals("a", html.getElementById("prod-Foo").closest("emu-clause").id());
        assertEquals("b", html.getElementById("prod-Foo-2").closest("emu-clause").id());
        assertEquals("#prod-Foo", html.selectFirst("#a p emu-nt > a").attr("href"));
        assertEquals("#prod-Foo-2", html.selectFirst("#b p emu-nt > a").attr("href"));
        assertFalse(result.hasDiagnostics(), () -> ruleIds(result).toString());
    }

    @Test
    void productionAnchorAvoidsIdAuthoredLaterInDocument() {
        String source = """
            <emu-grammar type="definition">Foo : `a`</emu-grammar>
            <p id="prod-Foo">Authored anchor.</p>
            """;

        CompilationResult result = compilerWithLocation().compile(source, null);
        Document html = Jsoup.parse(result.html());

        assertEquals(1, html.select("[id=prod-Foo]").size());
        assertEquals("p", html.getElementById("prod-Foo").normalName());
        assertEquals("emu-production", html.getElementById("prod-Foo-2").normalName());
        assertFalse(ruleIds(result).contains("duplicate-id"));
    }

    @Test
    void rendersGrammarAndLinksNonTerminals() {
        String source = """
            <emu-grammar type="definition">
              Script :
                ScriptBody?
              ScriptBody :
                StatementList
            </emu-grammar>
            <emu-grammar type="definition">StatementList : `;`</emu-grammar>
            <p>The |Script| goal symbol.</p>
            <emu-prodref name="ScriptBody"></emu-prodref>
            """;

        CompilationResult result = compilerWithLocation().compile(source, null);
        Document html = Jsoup.parse(result.html());

        assertNotNull(html.getElementById("prod-Script"));
        assertNotNull(html.getElementById("prod-StatementList"));
        assertEquals("#prod-ScriptBody",
            html.getElementById("prod-Script").selectFirst("emu-rhs emu-nt > a").attr("href"));
        assertEquals("#prod-Script", html.selectFirst("p emu-nt > a").attr("href"));
        Element copied = html.selectFirst("emu-prodref > emu-production");
        assertEquals("ScriptBody", copied.attr("name"));
        assertTrue(copied.select("[id]").isEmpty());
        assertFalse(copied.hasAttr("id"));
        assertFalse(result.hasDiagnostics());
    }

    @Test
    void reportsUndefinedNonTerminal() {
        CompilationResult result = compiler(CompilerOptions.defaults()).compile("<p>Uses |Nowhere|.</p>", null);

        assertEquals(List.of("undefined-nonterminal"), ruleIds(result));
    }

    @Test
    void resolvesExternalOperationsFromBiblioFile(@TempDir Path tempDir) throws IOException {
        Path biblio = tempDir.resolve("biblio.json");
        Files.writeString(biblio, """
            {"https://tc39.es/ecma262/": [
              {"type": "op", "aoid": "Get", "refId": "sec-get-o-p", "namespace": "https://tc39.es/ecma262/"}
            ]}
            """, StandardCharsets.UTF_8);
        CompilerOptions options = new CompilerOptions(null, List.of(biblio), AutolinkPolicy.defaults(), false, false);

        CompilationResult result = compiler(options)
            .compile("<p><emu-xref aoid=\"Get\"></emu-xref> and Get again.</p>", null);
        List<Element> links = Jsoup.parse(result.html()).select("emu-xref a");

        assertEquals(2, links.size());
        assertEquals("https://tc39.es/ecma262/#sec-get-o-p", links.get(0).attr("href"));
        assertEquals("Get", links.get(0).text());
        assertFalse(Jsoup.parse(result.html()).selectFirst("emu-xref").hasAttr("id"));
    }

    @Test
    void loadsBiblioReferencedFromDocument(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("other.json"), """
            {"https://other.example/": [
              {"type": "clause", "id": "sec-other", "namespace": "https://other.example/", "title": "Other", "number": "7"}
            ]}
            """, StandardCharsets.UTF_8);
        Path root = tempDir.resolve("spec.html");
        String source = "<emu-biblio href=\"other.json\"></emu-biblio><p><emu-xref href=\"#sec-other\"></emu-xref></p>";

        CompilationResult result = compiler(CompilerOptions.defaults()).compile(source, root);
        Document html = Jsoup.parse(result.html());

        assertNull(html.selectFirst("emu-biblio"));
        assertEquals("https://other.example/#sec-other", html.selectFirst("emu-xref a").attr("href"));
        assertEquals("7", html.selectFirst("emu-xref").text());
    }

    @Test
    void inlinesImportsAndLocatesTheirDiagnostics(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("part.html"), """
            <emu-clause id="imported"><h1>Imported</h1>
            <p><emu-xref href="#missing"></emu-xref></p>
            </emu-clause>
            """, StandardCharsets.UTF_8);
        Path root = tempDir.resolve("spec.html");

        CompilationResult result = compiler(CompilerOptions.defaults())
            .compile("<emu-import href=\"part.html\"></emu-import>", root);

        assertEquals("1", Jsoup.parse(result.html()).getElementById("imported").selectFirst("span.secnum").text());
        Diagnostic diagnostic = result.diagnostics().get(0);
        assertEquals("invalid-xref", diagnostic.ruleId());
        assertTrue(diagnostic.location().file().endsWith("part.html"));
        assertEquals(2, diagnostic.location().line());
    }

    @Test
    void exportsEmptyBiblioWithDiagnosticWhenRequestedWithoutLocation() {
        CompilerOptions options = new CompilerOptions(null, List.of(), AutolinkPolicy.defaults(), false, true);

        CompilationResult result = compiler(options).compile("<p>x</p>", null);

        assertEquals("{}", result.biblioJson());
        assertEquals(List.of("no-location"), ruleIds(result));
    }

    @Test
    void rendersDoctypeAndCharset() {
        CompilationResult result = compiler(CompilerOptions.defaults()).compile("<p>x</p>", null);

        assertTrue(result.html().toLowerCase().startsWith("<!doctype html>"));
        assertNotNull(Jsoup.parse(result.html()).selectFirst("head > meta[charset=utf-8]"));
    }

    @Test
    void forwardsDiagnosticsToListener() {
        List<Diagnostic> seen = new ArrayList<>();

        compiler(CompilerOptions.defaults())
            .compile("<p><emu-xref href=\"#none\"></emu-xref></p>", null, CancellationSignal.none(), seen::add);

        assertEquals(1, seen.size());
    }
}

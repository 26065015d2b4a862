package com.williamcallahan.specweave.service;

import com.williamcallahan.specweave.domain.CompilationResult;
import com.williamcallahan.specweave.domain.biblio.BiblioEntry;
import com.williamcallahan.specweave.service.biblio.Bibliography;
import com.williamcallahan.specweave.service.biblio.BiblioJsonCodec;
import com.williamcallahan.specweave.service.builders.AlgorithmBuilder;
import com.williamcallahan.specweave.service.builders.ClauseBuilder;
import com.williamcallahan.specweave.service.builders.DfnBuilder;
import com.williamcallahan.specweave.service.builders.EqnBuilder;
import com.williamcallahan.specweave.service.builders.ExampleBuilder;
import com.williamcallahan.specweave.service.builders.FigureBuilder;
import com.williamcallahan.specweave.service.builders.GrammarBuilder;
import com.williamcallahan.specweave.service.builders.HeadingBuilder;
import com.williamcallahan.specweave.service.builders.NonTerminalBuilder;
import com.williamcallahan.specweave.service.builders.NoteBuilder;
import com.williamcallahan.specweave.service.builders.ProdRefBuilder;
import com.williamcallahan.specweave.service.builders.ProductionBuilder;
import com.williamcallahan.specweave.service.builders.XrefBuilder;
import com.williamcallahan.specweave.service.diagnostics.CollectingDiagnosticSink;
import com.williamcallahan.specweave.service.diagnostics.DiagnosticSink;
import com.williamcallahan.specweave.service.diagnostics.SourceLocator;
import com.williamcallahan.specweave.service.grammar.GrammarEngine;
import com.williamcallahan.specweave.service.imports.ImportInliner;
import com.williamcallahan.specweave.service.imports.ImportLoader;
import com.williamcallahan.specweave.service.linking.Autolinker;
import com.williamcallahan.specweave.service.linking.ReferenceResolver;
import com.williamcallahan.specweave.service.linking.ReplacementStepResolver;
import com.williamcallahan.specweave.service.markdown.InlineEmphasisExpander;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.BuilderRegistry;
import com.williamcallahan.specweave.service.traversal.TraversalEngine;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles a specification document into linked, numbered html.
 *
 * <p>Phases run strictly in order over one tree and one bibliography: external biblios,
 * imports, the walk, replacement numbering, reference resolution, autolinking, output.
 * Cancellation is checked before each of the first phases; a cancelled or failed
 * compilation produces no output.</p>
 */
public class SpecCompiler {

    private static final Logger log = LoggerFactory.getLogger(SpecCompiler.class);
    private static final String DOCTYPE = "<!doctype html>\n";

    private final CompilerOptions options;
    private final BiblioJsonCodec biblioCodec;
    private final ImportInliner importInliner;
    private final TraversalEngine traversalEngine;
    private final ReplacementStepResolver replacementStepResolver = new ReplacementStepResolver();
    private final ReferenceResolver referenceResolver = new ReferenceResolver();
    private final Autolinker autolinker;

    /**
     * Creates a compiler with the standard builders.
     *
     * @param options compiler settings
     * @param grammarEngine converts grammar notation
     * @param importLoader loads imported fragments
     * @param biblioCodec reads and writes biblio tables
     */
    public SpecCompiler(CompilerOptions options, GrammarEngine grammarEngine, ImportLoader importLoader,
                        BiblioJsonCodec biblioCodec) {
        this.options = Objects.requireNonNull(options, "options");
        this.biblioCodec = Objects.requireNonNull(biblioCodec, "biblioCodec");
        this.importInliner = new ImportInliner(importLoader);
        InlineEmphasisExpander emphasisExpander = new InlineEmphasisExpander();
        this.traversalEngine = new TraversalEngine(
            new BuilderRegistry(standardBuilders(grammarEngine, emphasisExpander)), emphasisExpander);
        this.autolinker = new Autolinker(options.autolinkPolicy());
    }

    /**
     * Builders for every element kind the compiler understands.
     *
     * @param grammarEngine converts grammar notation
     * @param emphasisExpander inline shorthand expansion for algorithm steps
     * @return one builder per kind group
     */
    public static List<Builder> standardBuilders(GrammarEngine grammarEngine, InlineEmphasisExpander emphasisExpander) {
        return List.of(
            new ClauseBuilder(),
            new HeadingBuilder(),
            new AlgorithmBuilder(emphasisExpander),
            new XrefBuilder(),
            new DfnBuilder(),
            new EqnBuilder(),
            new GrammarBuilder(grammarEngine),
            new ProductionBuilder(),
            new NonTerminalBuilder(),
            new ProdRefBuilder(),
            new FigureBuilder(),
            new ExampleBuilder(),
            new NoteBuilder());
    }

    public CompilationResult compile(String source, Path rootFile) {
        return compile(source, rootFile, CancellationSignal.none(), null);
    }

    /**
     * Compiles one document.
     *
     * @param source document source text
     * @param rootFile file the source came from, or null; imports and biblios resolve against its directory
     * @param cancellation cooperative cancellation signal
     * @param listener receives each diagnostic as it is found, or null
     * @return rendered document, diagnostics, outline and biblio export
     * @throws SpecCompilationException on fatal errors, including cancellation
     */
    public CompilationResult compile(String source, Path rootFile, CancellationSignal cancellation, DiagnosticSink listener) {
        CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink(listener);
        String text = source == null ? "" : source;
        String baseUri = rootFile == null ? "" : rootFile.toAbsolutePath().toUri().toString();
        Document document = Parser.htmlParser().setTrackPosition(true).parseInput(text, baseUri);

        Bibliography bibliography = new Bibliography(options.documentNamespace());
        SourceLocator locator = new SourceLocator(rootFile, text);
        CompilationSession session = new CompilationSession(document, bibliography, sink, locator, signal);

        signal.throwIfCancellationRequested("biblio loading");
        log.info("Loading biblios...");
        loadBiblios(document, rootFile, bibliography);

        signal.throwIfCancellationRequested("import loading");
        log.info("Loading imports...");
        importInliner.inline(document.body(), rootFile, locator, signal);

        signal.throwIfCancellationRequested("document walk");
        log.info("Walking document, building various elements...");
        traversalEngine.walk(document.body(), session);

        signal.throwIfCancellationRequested("replacement step resolution");
        log.info("Finding offsets for replacement algorithm steps...");
        replacementStepResolver.resolve(session);

        log.info("Linking xrefs...");
        referenceResolver.resolve(session);

        log.info("Autolinking terms and abstract ops...");
        autolinker.link(session);

        markFirstHeading(document);
        ensureCharset(document);
        document.outputSettings().prettyPrint(options.prettyPrint());
        String html = render(document);

        String biblioJson = "{}";
        if (options.hasLocation() || options.exportBiblio()) {
            biblioJson = biblioCodec.export(bibliography, options.location(), sink, options.prettyPrint());
        }
        log.info("Compiled document with {} diagnostics", sink.diagnostics().size());
        return new CompilationResult(html, sink.diagnostics(), session.outline(), biblioJson);
    }

    private void loadBiblios(Document document, Path rootFile, Bibliography bibliography) {
        for (Path external : options.externalBiblios()) {
            importTables(biblioCodec.read(external), bibliography);
        }
        Path baseDirectory = rootFile == null || rootFile.getParent() == null ? Path.of("") : rootFile.getParent();
        for (Element biblio : new ArrayList<>(document.select("emu-biblio"))) {
            String href = biblio.attr("href").trim();
            if (!href.isEmpty()) {
                importTables(biblioCodec.read(baseDirectory.resolve(href).normalize()), bibliography);
            }
            biblio.remove();
        }
    }

    private static void importTables(Map<String, List<BiblioEntry>> tables, Bibliography bibliography) {
        tables.forEach(bibliography::importExternal);
    }

    /**
     * Adds class {@code first} to the document's first h1 when no text precedes it.
     */
    private static void markFirstHeading(Document document) {
        NodeTraversor.filter(new NodeFilter() {
            @Override
            public FilterResult head(Node node, int depth) {
                if (node instanceof TextNode text && !text.isBlank()) {
                    return FilterResult.STOP;
                }
                if (node instanceof Element element && "h1".equals(element.normalName())) {
                    element.addClass("first");
                    return FilterResult.STOP;
                }
                return FilterResult.CONTINUE;
            }
        }, document.body());
    }

    private static void ensureCharset(Document document) {
        Element head = document.head();
        if (head.selectFirst("meta[charset]") == null) {
            head.prependChild(new Element("meta").attr("charset", "utf-8"));
        }
    }

    private static String render(Document document) {
        String html = document.outerHtml();
        for (Node child : document.childNodes()) {
            if (child instanceof DocumentType) {
                return html;
            }
        }
        return DOCTYPE + html;
    }
}

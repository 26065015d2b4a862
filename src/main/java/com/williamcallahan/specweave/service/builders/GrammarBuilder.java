package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.service.GrammarConversionException;
import com.williamcallahan.specweave.service.SpecCompilationException;
import com.williamcallahan.specweave.service.diagnostics.SourceLocator;
import com.williamcallahan.specweave.service.grammar.GrammarEngine;
import com.williamcallahan.specweave.service.grammar.GrammarOptions;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces grammar notation with rendered productions.
 *
 * <p>The notation is read from the source text between the element's tags, since the parsed
 * tree may have mangled it. When the parser found no end tag, or the content contains a tag
 * from a small set of block and document elements, the content is cut at that tag. Content
 * without source positions falls back to the element's serialized markup.</p>
 */
public class GrammarBuilder implements Builder {

    private static final Logger log = LoggerFactory.getLogger(GrammarBuilder.class);

    // recovery only considers emu-* elements and a few block-level elements
    private static final Pattern END_TAG = Pattern.compile(
        "</?(emu-\\w+|h?\\d|p|ul|table|pre|code)\\b[^>]*>", Pattern.CASE_INSENSITIVE);

    private final GrammarEngine grammarEngine;

    public GrammarBuilder(GrammarEngine grammarEngine) {
        this.grammarEngine = grammarEngine;
    }

    @Override
    public Set<String> elementKinds() {
        return Set.of("emu-grammar");
    }

    @Override
    public void enter(TraversalContext context) {
        Element grammar = context.node();
        String content = extractContent(grammar, context.session().locator());
        String rendered;
        try {
            rendered = grammarEngine.convert(content, GrammarOptions.forDocument(), context.session().cancellation()).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof SpecCompilationException compilationFailure) {
                throw compilationFailure;
            }
            throw new GrammarConversionException("Failed to convert grammar: " + cause.getMessage(), cause);
        }
        grammar.html(rendered);
        log.debug("Converted grammar of {} characters", content.length());
    }

    /**
     * Reads the grammar notation of an element.
     *
     * @param grammar the grammar element
     * @param locator source positions of the tree
     * @return notation text
     */
    static String extractContent(Element grammar, SourceLocator locator) {
        Optional<SourceLocator.Located> located = locator.locate(grammar);
        if (located.isEmpty()) {
            return grammar.html().replace("&gt;", ">");
        }

        SourceLocator.Located location = located.get();
        String source = location.source();
        int start = Math.min(location.startTag().end().pos(), source.length());
        if (location.endTag() != null && location.endTag().isTracked() && !location.endTag().isImplicit()) {
            int end = Math.max(start, Math.min(location.endTag().start().pos(), source.length()));
            return truncateAtEndTag(source.substring(start, end));
        }

        Matcher endTag = END_TAG.matcher(source);
        int end = endTag.find(start) ? endTag.start() : source.length();
        return source.substring(start, end);
    }

    private static String truncateAtEndTag(String content) {
        Matcher endTag = END_TAG.matcher(content);
        return endTag.find() ? content.substring(0, endTag.start()) : content;
    }
}

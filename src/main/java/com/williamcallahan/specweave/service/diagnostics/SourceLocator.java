package com.williamcallahan.specweave.service.diagnostics;

import com.williamcallahan.specweave.domain.diagnostics.SourceLocation;
import com.williamcallahan.specweave.service.imports.ImportedSource;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.Range;

import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps tree nodes back to the text they were parsed from.
 *
 * <p>Nodes inlined by an {@code emu-import} carry positions relative to the imported file;
 * the nearest import ancestor decides which source a node belongs to.</p>
 */
public class SourceLocator {

    private static final String IMPORT_KIND = "emu-import";

    private final Path rootFile;
    private final String rootSource;
    private final Map<Element, ImportedSource> importSources = new IdentityHashMap<>();

    /**
     * Creates a locator for a root document.
     *
     * @param rootFile root file path, or null
     * @param rootSource root source text
     */
    public SourceLocator(Path rootFile, String rootSource) {
        this.rootFile = rootFile;
        this.rootSource = rootSource == null ? "" : rootSource;
    }

    /**
     * Source text and positions of one node.
     *
     * @param file file the node came from, or null
     * @param source the whole source text of that file
     * @param startTag range of the node (the start tag for elements)
     * @param endTag range of the end tag; untracked when implicit, null for text nodes
     */
    public record Located(Path file, String source, Range startTag, Range endTag) {}

    /**
     * Registers the source of an import element's inlined content.
     *
     * @param importElement the {@code emu-import} element
     * @param importedSource its source
     */
    public void registerImport(Element importElement, ImportedSource importedSource) {
        importSources.put(importElement, importedSource);
    }

    /**
     * Finds the source text and positions of a node.
     *
     * @param node any node of the tree
     * @return positions, or empty when the node was created during compilation
     */
    public Optional<Located> locate(Node node) {
        if (node == null) {
            return Optional.empty();
        }
        Range range = node.sourceRange();
        if (!range.isTracked()) {
            return Optional.empty();
        }
        Range endRange = node instanceof Element element ? element.endSourceRange() : null;
        ImportedSource imported = enclosingImport(node);
        if (imported != null) {
            return Optional.of(new Located(imported.file(), imported.source(), range, endRange));
        }
        return Optional.of(new Located(rootFile, rootSource, range, endRange));
    }

    /**
     * Computes the diagnostic position of a node.
     *
     * @param node any node
     * @return location, or empty when untracked
     */
    public Optional<SourceLocation> locationOf(Node node) {
        return locate(node).map(located -> new SourceLocation(
            located.file() == null ? null : located.file().toString(),
            Math.max(1, located.startTag().start().lineNumber()),
            Math.max(1, located.startTag().start().columnNumber()),
            located.startTag().start().pos()));
    }

    private ImportedSource enclosingImport(Node node) {
        Node pointer = node.parentNode();
        while (pointer != null) {
            if (pointer instanceof Element element && IMPORT_KIND.equals(element.normalName())) {
                return importSources.get(element);
            }
            pointer = pointer.parentNode();
        }
        return null;
    }
}

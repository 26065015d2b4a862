package com.williamcallahan.specweave.service.imports;

import com.williamcallahan.specweave.service.CancellationSignal;
import com.williamcallahan.specweave.service.ImportLoadException;
import com.williamcallahan.specweave.service.SpecCompilationException;
import com.williamcallahan.specweave.service.diagnostics.SourceLocator;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Inlines every {@code emu-import} of a tree, following nested imports.
 */
public class ImportInliner {

    private static final Logger log = LoggerFactory.getLogger(ImportInliner.class);
    private static final String IMPORT_KIND = "emu-import";

    private final ImportLoader importLoader;

    public ImportInliner(ImportLoader importLoader) {
        this.importLoader = Objects.requireNonNull(importLoader, "importLoader");
    }

    /**
     * Loads the imports below an element and appends their content as children of each import.
     *
     * @param root element to search
     * @param rootFile file the root was parsed from, or null
     * @param locator receives the source of each import
     * @param cancellation cooperative cancellation signal
     * @return number of imports inlined
     * @throws ImportLoadException if an import cannot be read or imports itself
     */
    public int inline(Element root, Path rootFile, SourceLocator locator, CancellationSignal cancellation) {
        Set<Path> chain = new HashSet<>();
        Path baseDirectory = Path.of("");
        if (rootFile != null) {
            chain.add(rootFile.toAbsolutePath().normalize());
            if (rootFile.getParent() != null) {
                baseDirectory = rootFile.getParent();
            }
        }
        int inlined = inlineBelow(root, baseDirectory, chain, locator, cancellation);
        if (inlined > 0) {
            log.info("Inlined {} imports", inlined);
        }
        return inlined;
    }

    private int inlineBelow(Element root, Path baseDirectory, Set<Path> chain, SourceLocator locator,
                            CancellationSignal cancellation) {
        List<Element> imports = new ArrayList<>();
        for (Element candidate : root.select(IMPORT_KIND)) {
            if (candidate != root) {
                imports.add(candidate);
            }
        }
        int inlined = 0;
        for (Element importElement : imports) {
            LoadedImport loaded = await(importElement, baseDirectory, cancellation);
            Path file = loaded.source().file().toAbsolutePath().normalize();
            if (chain.contains(file)) {
                throw new ImportLoadException("Import cycle detected at " + file);
            }
            for (Node node : loaded.nodes()) {
                importElement.appendChild(node);
            }
            locator.registerImport(importElement, loaded.source());
            inlined++;

            Set<Path> nestedChain = new HashSet<>(chain);
            nestedChain.add(file);
            inlined += inlineBelow(importElement, loaded.baseDirectory(), nestedChain, locator, cancellation);
        }
        return inlined;
    }

    private LoadedImport await(Element importElement, Path baseDirectory, CancellationSignal cancellation) {
        try {
            return importLoader.load(importElement, baseDirectory, cancellation).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof SpecCompilationException compilationFailure) {
                throw compilationFailure;
            }
            throw new ImportLoadException("Failed to load import " + importElement.attr("href"), cause);
        }
    }
}

package com.williamcallahan.specweave.service.imports;

import com.williamcallahan.specweave.service.CancellationSignal;
import org.jsoup.nodes.Element;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches the content of an {@code emu-import} element.
 */
public interface ImportLoader {

    /**
     * Loads the fragment an import element points at.
     *
     * @param importElement element carrying the {@code href}
     * @param baseDirectory directory the href resolves against
     * @param cancellation cooperative cancellation signal
     * @return future completing with the parsed fragment, or exceptionally when it cannot be read
     */
    CompletableFuture<LoadedImport> load(Element importElement, Path baseDirectory, CancellationSignal cancellation);
}

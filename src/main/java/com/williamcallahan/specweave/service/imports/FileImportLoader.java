package com.williamcallahan.specweave.service.imports;

import com.williamcallahan.specweave.service.CancellationSignal;
import com.williamcallahan.specweave.service.CompilationCancelledException;
import com.williamcallahan.specweave.service.ImportLoadException;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Loads imports from the local file system, parsing them with source positions.
 */
public class FileImportLoader implements ImportLoader {

    private static final Logger log = LoggerFactory.getLogger(FileImportLoader.class);

    @Override
    public CompletableFuture<LoadedImport> load(Element importElement, Path baseDirectory, CancellationSignal cancellation) {
        if (cancellation != null && cancellation.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CompilationCancelledException("import loading"));
        }
        String href = importElement.attr("href").trim();
        if (href.isEmpty()) {
            return CompletableFuture.failedFuture(new ImportLoadException("emu-import has no href"));
        }
        Path base = baseDirectory == null ? Path.of("") : baseDirectory;
        Path file = base.resolve(href).normalize();
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            Document fragment = Parser.htmlParser().setTrackPosition(true).parseInput(source, file.toUri().toString());
            List<Node> nodes = new ArrayList<>(fragment.body().childNodes());
            for (Node node : nodes) {
                node.remove();
            }
            log.debug("Loaded import {} ({} characters)", file, source.length());
            Path parent = file.getParent() == null ? base : file.getParent();
            return CompletableFuture.completedFuture(new LoadedImport(new ImportedSource(file, source), nodes, parent));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new ImportLoadException("Failed to read import " + file, e));
        }
    }
}

package com.williamcallahan.specweave.service.imports;

import org.jsoup.nodes.Node;

import java.nio.file.Path;
import java.util.List;

/**
 * Content of one import, ready to be inserted into the tree.
 *
 * @param source the imported file and its text
 * @param nodes top-level nodes of the imported fragment, detached
 * @param baseDirectory directory nested imports resolve against
 */
public record LoadedImport(ImportedSource source, List<Node> nodes, Path baseDirectory) {

    public LoadedImport {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}

package com.williamcallahan.specweave.service.traversal;

import org.jsoup.nodes.TextNode;

/**
 * A text node recorded during the walk for later autolinking.
 *
 * @param node the text node
 * @param namespace namespace of the innermost clause
 * @param inAlgorithm whether the text sits inside an algorithm
 * @param enclosingId id of the nearest ancestor that has one, or null
 */
public record TextSpanEntry(TextNode node, String namespace, boolean inAlgorithm, String enclosingId) {}

package com.williamcallahan.specweave.service.traversal;

import com.williamcallahan.specweave.service.CompilationSession;
import com.williamcallahan.specweave.service.SpecStructureException;
import com.williamcallahan.specweave.service.markdown.InlineEmphasisExpander;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Depth-first walk of the document that dispatches elements to their builders.
 *
 * <p>The next node to visit is derived from the tree after each visit, so nodes inserted
 * ahead of the cursor by a builder or by inline expansion are visited in the same walk.
 * Text nodes are expanded once and recorded for autolinking; nothing is linked here because
 * the bibliography is incomplete until the walk ends.</p>
 */
public class TraversalEngine {

    private static final Logger log = LoggerFactory.getLogger(TraversalEngine.class);

    static final Set<String> NO_AUTOLINK_KINDS = Set.of(
        "pre", "code", "emu-const", "emu-production", "emu-grammar", "emu-xref",
        "h1", "h2", "h3", "h4", "h5", "h6", "emu-var", "emu-val", "var", "a", "dfn", "sub",
        "emu-not-ref", "emu-nt", "emu-prodref");

    static final Set<String> NO_EMPHASIS_KINDS = Set.of(
        "pre", "code", "emu-production", "emu-alg", "emu-grammar", "emu-eqn");

    private static final String OLD_IDS_ATTRIBUTE = "oldids";

    private final BuilderRegistry registry;
    private final InlineEmphasisExpander emphasisExpander;

    /**
     * Creates an engine.
     *
     * @param registry builders by element kind
     * @param emphasisExpander inline shorthand expansion for prose text
     */
    public TraversalEngine(BuilderRegistry registry, InlineEmphasisExpander emphasisExpander) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.emphasisExpander = Objects.requireNonNull(emphasisExpander, "emphasisExpander");
    }

    /**
     * Walks a subtree once.
     *
     * @param root element to start at
     * @param session compilation state the builders write to
     * @return the walk state after the last node
     * @throws SpecStructureException on structural authoring errors
     */
    public TraversalContext walk(Element root, CompilationSession session) {
        TraversalContext context = new TraversalContext(session);
        Walk walk = new Walk(context);
        walk.visit(root);
        log.debug("Walk finished: {} text spans recorded", session.textSpansByNamespace().values().stream()
            .mapToInt(List::size).sum());
        return context;
    }

    /**
     * State local to one walk: the pending inline-expansion boundary.
     */
    private final class Walk {
        private final TraversalContext context;
        private Node emphasisResumeBoundary;

        private Walk(TraversalContext context) {
            this.context = context;
        }

        /**
         * Visits one node.
         *
         * @return the node the caller must continue with instead of the visited node's next
         *     sibling, or null to continue normally
         */
        private Node visit(Node node) {
            if (emphasisResumeBoundary != null && node == emphasisResumeBoundary) {
                emphasisResumeBoundary = null;
                context.noEmphasis(false);
            }
            if (node instanceof TextNode text) {
                return visitText(text);
            }
            if (node instanceof Element element) {
                visitElement(element);
            }
            return null;
        }

        private Node visitText(TextNode text) {
            if (text.isBlank()) {
                return null;
            }
            if (!context.noEmphasis()) {
                context.noEmphasis(true);
                emphasisResumeBoundary = followingNode(text);
                List<Node> expanded = emphasisExpander.expand(text.getWholeText());
                if (!expanded.isEmpty()) {
                    for (Node replacement : expanded) {
                        text.before(replacement);
                    }
                    text.remove();
                    return expanded.get(0);
                }
            }
            if (!context.noAutolink()) {
                context.session().addTextSpan(new TextSpanEntry(
                    text, context.namespace(), context.inAlgorithm(), context.currentId()));
            }
            return null;
        }

        private void visitElement(Element element) {
            String kind = element.normalName();
            insertOldIdAnchors(element);

            String parentId = context.currentId();
            if (element.hasAttr("id")) {
                context.session().registerNodeId(element);
                context.currentId(element.id());
            }

            boolean changedNoAutolink = false;
            boolean changedNoEmphasis = false;
            if (NO_AUTOLINK_KINDS.contains(kind) && !context.noAutolink()) {
                context.noAutolink(true);
                changedNoAutolink = true;
            }
            if (NO_EMPHASIS_KINDS.contains(kind) && !context.noEmphasis()) {
                context.noEmphasis(true);
                changedNoEmphasis = true;
            }

            context.pushElement(element);
            Optional<Builder> builder = registry.builderFor(kind);
            builder.ifPresent(b -> b.enter(context));

            Node child = element.childNodeSize() == 0 ? null : element.childNode(0);
            while (child != null) {
                Node replacement = visit(child);
                child = replacement != null ? replacement : child.nextSibling();
            }

            builder.ifPresent(b -> b.exit(context));
            if (changedNoAutolink) {
                context.noAutolink(false);
            }
            if (changedNoEmphasis) {
                context.noEmphasis(false);
            }
            context.currentId(parentId);
            context.popElement();
        }

        private void insertOldIdAnchors(Element element) {
            String oldIds = element.attr(OLD_IDS_ATTRIBUTE);
            if (oldIds.isEmpty()) {
                return;
            }
            if (element.tag().isEmpty()) {
                throw new SpecStructureException("oldids found on unsupported element: " + element.normalName());
            }
            String[] ids = oldIds.split(",");
            for (String oldId : ids) {
                String trimmed = oldId.trim();
                if (!trimmed.isEmpty()) {
                    element.prependChild(new Element("span").attr("id", trimmed));
                }
            }
        }

        private Node followingNode(Node node) {
            Node pointer = node;
            while (pointer != null && pointer.nextSibling() == null) {
                pointer = pointer.parentNode();
            }
            return pointer == null ? null : pointer.nextSibling();
        }
    }
}

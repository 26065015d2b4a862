package com.williamcallahan.specweave.service.builders;

import com.williamcallahan.specweave.domain.biblio.StepEntry;
import com.williamcallahan.specweave.service.CompilationSession;
import com.williamcallahan.specweave.service.linking.ReplacementDeclaration;
import com.williamcallahan.specweave.service.markdown.InlineEmphasisExpander;
import com.williamcallahan.specweave.service.traversal.Builder;
import com.williamcallahan.specweave.service.traversal.TraversalContext;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Renders algorithm steps as ordered lists and defines their labeled steps.
 *
 * <p>An algorithm with a {@code replaces-step} attribute is recorded as a replacement; its
 * labeled steps keep local paths until the replacement is resolved after the walk.</p>
 */
public class AlgorithmBuilder implements Builder {

    private static final Logger log = LoggerFactory.getLogger(AlgorithmBuilder.class);
    private static final String REPLACES_STEP = "replaces-step";

    private final InlineEmphasisExpander emphasisExpander;

    public AlgorithmBuilder(InlineEmphasisExpander emphasisExpander) {
        this.emphasisExpander = emphasisExpander;
    }

    @Override
    public Set<String> elementKinds() {
        return Set.of("emu-alg");
    }

    @Override
    public void enter(TraversalContext context) {
        Element algorithm = context.node();
        context.enterAlgorithm();
        if (rootList(algorithm) != null) {
            return;
        }
        AlgorithmListParser.Conversion conversion = AlgorithmListParser.tryConvert(new ArrayList<>(algorithm.childNodes()));
        if (conversion == null) {
            return;
        }
        for (AlgorithmListParser.LabelProblem problem : conversion.problems()) {
            context.session().reportTextOffset(problem.source(), problem.offset(), "invalid-step-label", problem.message());
        }
        algorithm.empty();
        algorithm.appendChild(conversion.list());
        for (Element step : conversion.list().select("li")) {
            expandInline(step);
        }
    }

    @Override
    public void exit(TraversalContext context) {
        Element algorithm = context.node();
        CompilationSession session = context.session();
        List<String> labeledSteps = new ArrayList<>();
        Element list = rootList(algorithm);
        if (list != null) {
            defineSteps(list, List.of(), labeledSteps, context);
        }
        context.exitAlgorithm();

        String target = algorithm.attr(REPLACES_STEP).trim();
        if (!target.isEmpty()) {
            session.addReplacementDeclaration(new ReplacementDeclaration(algorithm, target, labeledSteps));
            log.debug("Algorithm replacing step {} holds {} labeled steps", target, labeledSteps.size());
        }
    }

    private void defineSteps(Element list, List<Integer> prefix, List<String> labeledSteps, TraversalContext context) {
        int number = startOf(list);
        for (Element step : list.children()) {
            if (!"li".equals(step.normalName())) {
                continue;
            }
            List<Integer> path = new ArrayList<>(prefix);
            path.add(number++);
            if (!step.id().isEmpty()
                && context.session().define(step, new StepEntry(step.id(), context.namespace(), path))) {
                labeledSteps.add(step.id());
            }
            for (Element nested : step.children()) {
                if ("ol".equals(nested.normalName())) {
                    defineSteps(nested, path, labeledSteps, context);
                }
            }
        }
    }

    private void expandInline(Element step) {
        for (Node child : new ArrayList<>(step.childNodes())) {
            if (child instanceof TextNode text && !text.isBlank()) {
                List<Node> expanded = emphasisExpander.expand(text.getWholeText());
                for (Node replacement : expanded) {
                    text.before(replacement);
                }
                if (!expanded.isEmpty()) {
                    text.remove();
                }
            }
        }
    }

    private static int startOf(Element list) {
        String start = list.attr("start").trim();
        if (start.isEmpty()) {
            return 1;
        }
        try {
            return Integer.parseInt(start);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static Element rootList(Element algorithm) {
        for (Element child : algorithm.children()) {
            if ("ol".equals(child.normalName())) {
                return child;
            }
        }
        return null;
    }
}

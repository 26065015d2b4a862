package com.williamcallahan.specweave.service.builders;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the plain-text step notation of an algorithm into nested ordered lists.
 *
 * <p>Each step starts a line with {@code 1.}; deeper indentation nests a step under the
 * previous one. A step may open with a label {@code [id="name"]}. Lines without a marker
 * continue the previous step. Elements embedded in a step (cross-references, markup) move
 * into the step's list item unchanged.</p>
 */
final class AlgorithmListParser {

    private static final Pattern STEP_MARKER = Pattern.compile("^([ \\t]*)\\d+\\.[ \\t]+");
    private static final Pattern STEP_LABEL = Pattern.compile("^\\[\\s*id\\s*=\\s*\"([^\"]+)\"\\s*]\\s*");

    private AlgorithmListParser() {}

    /**
     * Converts the children of an algorithm element.
     *
     * @param children snapshot of the algorithm's child nodes
     * @return the root list and any label problems; null when the content holds no step
     */
    static Conversion tryConvert(List<Node> children) {
        List<Line> lines = splitLines(children);
        Deque<Level> levels = new ArrayDeque<>();
        List<LabelProblem> problems = new ArrayList<>();
        Element root = null;
        Element previousStep = null;

        for (Line line : lines) {
            if (line.isBlank()) {
                continue;
            }
            Matcher marker = line.firstText() == null ? null : STEP_MARKER.matcher(line.firstText());
            if (marker == null || !marker.find()) {
                if (previousStep == null) {
                    return null;
                }
                previousStep.appendChild(new TextNode(" "));
                appendContent(previousStep, line.nodes, stripLeading(line.firstText()));
                continue;
            }

            int indent = marker.group(1).length();
            String rest = line.firstText().substring(marker.end());
            Element step = new Element("li");
            Matcher label = STEP_LABEL.matcher(rest);
            if (label.find()) {
                step.attr("id", label.group(1));
                rest = rest.substring(label.end());
            } else if (rest.startsWith("[")) {
                problems.add(new LabelProblem(line.source, line.sourceOffset + marker.end(),
                    "malformed step label; expected [id=\"name\"]"));
            }
            appendContent(step, line.nodes, rest);

            if (root == null) {
                root = new Element("ol");
                levels.push(new Level(indent, root));
            } else if (indent > levels.peek().indent()) {
                Element nested = new Element("ol");
                previousStep.appendChild(nested);
                levels.push(new Level(indent, nested));
            } else {
                while (levels.size() > 1 && indent < levels.peek().indent()) {
                    levels.pop();
                }
            }
            levels.peek().list().appendChild(step);
            previousStep = step;
        }
        return root == null ? null : new Conversion(root, problems);
    }

    private static void appendContent(Element step, List<Node> nodes, String firstText) {
        if (firstText != null && !firstText.isEmpty()) {
            step.appendChild(new TextNode(firstText));
        }
        for (int i = firstText == null ? 0 : 1; i < nodes.size(); i++) {
            step.appendChild(nodes.get(i));
        }
    }

    private static String stripLeading(String text) {
        return text == null ? null : text.stripLeading();
    }

    private static List<Line> splitLines(List<Node> children) {
        List<Line> lines = new ArrayList<>();
        Line current = new Line();
        for (Node child : children) {
            if (child instanceof TextNode text) {
                String whole = text.getWholeText();
                int start = 0;
                while (true) {
                    int newline = whole.indexOf('\n', start);
                    String part = newline < 0 ? whole.substring(start) : whole.substring(start, newline);
                    if (!part.isEmpty()) {
                        current.add(new TextNode(part), text, start);
                    }
                    if (newline < 0) {
                        break;
                    }
                    lines.add(current);
                    current = new Line();
                    start = newline + 1;
                }
            } else {
                current.add(child, null, -1);
            }
        }
        lines.add(current);
        return lines;
    }

    /**
     * Result of converting an algorithm's text.
     *
     * @param list root ordered list
     * @param problems malformed labels found along the way
     */
    record Conversion(Element list, List<LabelProblem> problems) {}

    /**
     * A step label that could not be read.
     *
     * @param source text node the label came from
     * @param offset character offset of the label in that node
     * @param message description
     */
    record LabelProblem(TextNode source, int offset, String message) {}

    private record Level(int indent, Element list) {}

    /**
     * One source line: the nodes it holds and where its first text came from.
     */
    private static final class Line {
        private final List<Node> nodes = new ArrayList<>();
        private TextNode source;
        private int sourceOffset;

        void add(Node node, TextNode origin, int offset) {
            if (nodes.isEmpty()) {
                source = origin;
                sourceOffset = offset;
            }
            nodes.add(node);
        }

        String firstText() {
            return !nodes.isEmpty() && nodes.get(0) instanceof TextNode text ? text.getWholeText() : null;
        }

        boolean isBlank() {
            for (Node node : nodes) {
                if (!(node instanceof TextNode text) || !text.isBlank()) {
                    return false;
                }
            }
            return true;
        }
    }
}

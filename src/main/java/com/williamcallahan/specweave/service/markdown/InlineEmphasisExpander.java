package com.williamcallahan.specweave.service.markdown;

import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.Emphasis;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands the inline shorthand of prose text into document elements.
 *
 * <p>Text is parsed as inline markdown: {@code _x_} becomes a {@code var}, {@code *x*} an
 * {@code emu-val}, {@code **x**} a {@code b} and {@code `x`} a {@code code}. Inside plain runs,
 * {@code |Name|} becomes an {@code emu-nt} and {@code ~name~} an {@code emu-const}. Text that
 * markdown would read as a block (a list, a heading) is left alone.</p>
 */
public class InlineEmphasisExpander {

    private static final Logger log = LoggerFactory.getLogger(InlineEmphasisExpander.class);

    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^\\s+");
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("\\s+$");
    // |Name|, |Name[Yield]|, |Name_opt|, and ~constant~
    private static final Pattern SHORTHAND = Pattern.compile(
        "\\|([A-Za-z][A-Za-z0-9]*)(\\[[^\\]|]*])?(_opt)?\\||~([A-Za-z0-9@.\\-]+)~");

    private final Parser parser;

    public InlineEmphasisExpander() {
        MutableDataSet options = new MutableDataSet()
            .set(Parser.BLANK_LINES_IN_AST, false)
            .set(Parser.HTML_BLOCK_PARSER, false)
            .set(Parser.INDENTED_CODE_BLOCK_PARSER, false);
        this.parser = Parser.builder(options).build();
    }

    /**
     * Expands one run of text.
     *
     * @param text raw text content
     * @return replacement nodes in order, or an empty list when the text has no shorthand
     */
    public List<Node> expand(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String leading = match(LEADING_WHITESPACE, text);
        String trailing = match(TRAILING_WHITESPACE, text);
        String core = text.substring(leading.length(), text.length() - trailing.length());

        Document markdown = parser.parse(core);
        com.vladsch.flexmark.util.ast.Node first = markdown.getFirstChild();
        if (!(first instanceof Paragraph) || first.getNext() != null) {
            return List.of();
        }

        Conversion conversion = new Conversion();
        List<Node> converted = new ArrayList<>();
        if (!leading.isEmpty()) {
            converted.add(new TextNode(leading));
        }
        conversion.convertChildren(first, converted);
        if (!trailing.isEmpty()) {
            converted.add(new TextNode(trailing));
        }
        if (!conversion.changed) {
            return List.of();
        }
        log.debug("Expanded inline shorthand into {} nodes", converted.size());
        return mergeAdjacentText(converted);
    }

    private static String match(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group() : "";
    }

    private static List<Node> mergeAdjacentText(List<Node> nodes) {
        List<Node> merged = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (node instanceof TextNode text && !merged.isEmpty()
                && merged.get(merged.size() - 1) instanceof TextNode previous) {
                previous.text(previous.getWholeText() + text.getWholeText());
            } else {
                merged.add(node);
            }
        }
        return merged;
    }

    /**
     * Maps one parsed paragraph onto document nodes.
     */
    private static final class Conversion {
        private boolean changed;

        void convertChildren(com.vladsch.flexmark.util.ast.Node parent, List<Node> out) {
            for (com.vladsch.flexmark.util.ast.Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
                convert(child, out);
            }
        }

        private void convert(com.vladsch.flexmark.util.ast.Node node, List<Node> out) {
            if (node instanceof Text text) {
                String unescaped = text.getChars().unescape();
                if (!unescaped.contentEquals(text.getChars())) {
                    changed = true;
                }
                convertShorthand(unescaped, out);
            } else if (node instanceof Emphasis emphasis) {
                String tag = emphasis.getOpeningMarker().startsWith("_") ? "var" : "emu-val";
                out.add(wrap(tag, emphasis));
            } else if (node instanceof StrongEmphasis strong) {
                out.add(wrap("b", strong));
            } else if (node instanceof Code code) {
                changed = true;
                Element element = new Element("code");
                element.appendChild(new TextNode(code.getText().toString()));
                out.add(element);
            } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
                out.add(new TextNode("\n"));
            } else {
                out.add(new TextNode(node.getChars().toString()));
            }
        }

        private Element wrap(String tag, com.vladsch.flexmark.util.ast.Node node) {
            changed = true;
            Element element = new Element(tag);
            List<Node> children = new ArrayList<>();
            convertChildren(node, children);
            for (Node child : mergeAdjacentText(children)) {
                element.appendChild(child);
            }
            return element;
        }

        private void convertShorthand(String text, List<Node> out) {
            Matcher matcher = SHORTHAND.matcher(text);
            int last = 0;
            while (matcher.find()) {
                changed = true;
                if (matcher.start() > last) {
                    out.add(new TextNode(text.substring(last, matcher.start())));
                }
                if (matcher.group(1) != null) {
                    Element nonTerminal = new Element("emu-nt");
                    if (matcher.group(2) != null) {
                        String params = matcher.group(2);
                        nonTerminal.attr("params", params.substring(1, params.length() - 1));
                    }
                    if (matcher.group(3) != null) {
                        nonTerminal.attr("optional", "");
                    }
                    nonTerminal.appendChild(new TextNode(matcher.group(1)));
                    out.add(nonTerminal);
                } else {
                    Element constant = new Element("emu-const");
                    constant.appendChild(new TextNode(matcher.group(4)));
                    out.add(constant);
                }
                last = matcher.end();
            }
            if (last < text.length()) {
                out.add(new TextNode(text.substring(last)));
            }
        }
    }
}

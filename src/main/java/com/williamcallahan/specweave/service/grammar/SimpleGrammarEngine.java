package com.williamcallahan.specweave.service.grammar;

import com.williamcallahan.specweave.service.CancellationSignal;
import com.williamcallahan.specweave.service.CompilationCancelledException;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based grammar engine for the notation used in documents.
 *
 * <p>A production starts at the outermost indentation with {@code Name[params] :} (one,
 * two or three colons for syntactic, lexical and regular-expression grammars). Its
 * right-hand sides follow on the same line or on more deeply indented lines. Within a
 * right-hand side, {@code `x`} is a terminal, {@code Name[params]?} a non-terminal,
 * {@code [...]} an annotation, {@code <X>} prose, and {@code but not ...} a constraint.</p>
 */
public class SimpleGrammarEngine implements GrammarEngine {

    private static final Logger log = LoggerFactory.getLogger(SimpleGrammarEngine.class);

    private static final Pattern PRODUCTION_HEADER = Pattern.compile(
        "^([A-Za-z][A-Za-z0-9_]*)(?:\\[([^\\]]*)])?\\s*(:{1,3})\\s*(.*)$");
    private static final Pattern RHS_TOKEN = Pattern.compile(
        "`([^`]+)`(\\?)?"
            + "|\\[([^\\]]*)]"
            + "|<([^>]+)>"
            + "|([A-Za-z][A-Za-z0-9_]*)(?:\\[([^\\]]*)])?(\\?)?");
    private static final Pattern BUT_NOT = Pattern.compile("\\s+but\\s+not\\s+");
    private static final String ONE_OF = "one of";

    @Override
    public CompletableFuture<String> convert(String content, GrammarOptions options, CancellationSignal cancellation) {
        if (cancellation != null && cancellation.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CompilationCancelledException("grammar conversion"));
        }
        try {
            return CompletableFuture.completedFuture(render(content == null ? "" : content));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String render(String content) {
        List<String> lines = new ArrayList<>();
        int baseIndent = Integer.MAX_VALUE;
        for (String line : content.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            lines.add(line);
            baseIndent = Math.min(baseIndent, indentOf(line));
        }

        List<Element> productions = new ArrayList<>();
        Element current = null;
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            String trimmed = line.trim();
            if (indentOf(line) == baseIndent) {
                Matcher header = PRODUCTION_HEADER.matcher(trimmed);
                if (!header.matches()) {
                    throw new IllegalArgumentException("grammar line " + lineNumber + " does not start a production: " + trimmed);
                }
                current = production(header.group(1), header.group(2), header.group(3));
                productions.add(current);
                String inlineRhs = header.group(4).trim();
                if (!inlineRhs.isEmpty()) {
                    current.attr("collapsed", "");
                    current.appendChild(new TextNode(" "));
                    current.appendChild(rightHandSide(inlineRhs));
                }
            } else {
                if (current == null) {
                    throw new IllegalArgumentException("grammar line " + lineNumber + " is not part of a production");
                }
                current.appendChild(new TextNode("\n    "));
                current.appendChild(rightHandSide(trimmed));
            }
        }
        log.debug("Rendered {} grammar productions", productions.size());

        StringBuilder html = new StringBuilder();
        for (Element production : productions) {
            if (html.length() > 0) {
                html.append('\n');
            }
            html.append(production.outerHtml());
        }
        return html.toString();
    }

    private static Element production(String name, String params, String colons) {
        Element production = new Element("emu-production").attr("name", name);
        if (params != null && !params.isBlank()) {
            production.attr("params", params.trim());
        }
        if (colons.length() == 2) {
            production.attr("type", "lexical");
        } else if (colons.length() == 3) {
            production.attr("type", "regexp");
        }
        production.appendChild(nonTerminal(name, params, false));
        production.appendChild(new TextNode(" "));
        production.appendChild(new Element("emu-geq").text(colons));
        return production;
    }

    private static Element rightHandSide(String text) {
        Element rhs = new Element("emu-rhs");
        if (text.startsWith(ONE_OF)) {
            rhs.appendChild(new Element("emu-oneof").text(ONE_OF));
            for (String literal : text.substring(ONE_OF.length()).trim().split("\\s+")) {
                if (!literal.isEmpty()) {
                    rhs.appendChild(new TextNode(" "));
                    rhs.appendChild(new Element("emu-t").text(literal.replace("`", "")));
                }
            }
            return rhs;
        }

        String symbols = text;
        String constraint = null;
        Matcher butNot = BUT_NOT.matcher(text);
        if (butNot.find()) {
            symbols = text.substring(0, butNot.start());
            constraint = text.substring(butNot.start()).trim();
        }
        appendSymbols(rhs, symbols);
        if (constraint != null) {
            rhs.appendChild(new TextNode(" "));
            rhs.appendChild(new Element("emu-gmod").text(constraint));
        }
        return rhs;
    }

    private static void appendSymbols(Element rhs, String symbols) {
        Matcher token = RHS_TOKEN.matcher(symbols);
        boolean first = true;
        while (token.find()) {
            if (!first) {
                rhs.appendChild(new TextNode(" "));
            }
            first = false;
            if (token.group(1) != null) {
                Element terminal = new Element("emu-t").text(token.group(1));
                if (token.group(2) != null) {
                    terminal.attr("optional", "");
                    terminal.appendChild(optionalMarker());
                }
                rhs.appendChild(terminal);
            } else if (token.group(3) != null) {
                rhs.appendChild(new Element("emu-gann").text("[" + token.group(3).trim() + "]"));
            } else if (token.group(4) != null) {
                rhs.appendChild(new Element("emu-gprose").text(token.group(4).trim()));
            } else {
                rhs.appendChild(nonTerminal(token.group(5), token.group(6), token.group(7) != null));
            }
        }
    }

    private static Element nonTerminal(String name, String params, boolean optional) {
        Element nonTerminal = new Element("emu-nt").appendChild(new TextNode(name));
        boolean hasParams = params != null && !params.isBlank();
        if (hasParams) {
            nonTerminal.attr("params", params.trim());
        }
        if (optional) {
            nonTerminal.attr("optional", "");
        }
        if (hasParams || optional) {
            Element mods = new Element("emu-mods");
            if (hasParams) {
                mods.appendChild(new Element("emu-params").text("[" + params.trim() + "]"));
            }
            if (optional) {
                mods.appendChild(new Element("emu-opt").text("opt"));
            }
            nonTerminal.appendChild(mods);
        }
        return nonTerminal;
    }

    private static Element optionalMarker() {
        return new Element("emu-mods").appendChild(new Element("emu-opt").text("opt"));
    }

    private static int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && (line.charAt(indent) == ' ' || line.charAt(indent) == '\t')) {
            indent++;
        }
        return indent;
    }
}

package com.williamcallahan.specweave.service.linking;

import com.williamcallahan.specweave.domain.biblio.EntryKind;
import com.williamcallahan.specweave.domain.biblio.EntryRef;
import com.williamcallahan.specweave.domain.biblio.OperationEntry;
import com.williamcallahan.specweave.service.CompilationSession;
import com.williamcallahan.specweave.service.traversal.TextSpanEntry;
import com.williamcallahan.specweave.support.TextKeyNormalizer;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Links plain text that names a term or operation to its definition.
 *
 * <p>One matcher is compiled per namespace and algorithm flag from every key visible there.
 * Longer keys win over shorter ones at the same position, matches respect word boundaries,
 * and a key starting with a lowercase letter also matches with an uppercase initial. Text
 * spliced in by this pass is never scanned again.</p>
 */
public class Autolinker {

    private static final Logger log = LoggerFactory.getLogger(Autolinker.class);

    private static final String WORD_START = "(?<![\\p{L}\\p{N}_])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}_])";

    private final AutolinkPolicy policy;

    public Autolinker(AutolinkPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Links every recorded text span of a session.
     *
     * @param session compilation state with a complete bibliography
     * @return number of links inserted
     */
    public int link(CompilationSession session) {
        int linked = 0;
        Set<String> reportedAmbiguities = new HashSet<>();
        for (Map.Entry<String, List<TextSpanEntry>> namespaceSpans : session.textSpansByNamespace().entrySet()) {
            String namespace = namespaceSpans.getKey();
            Map<Boolean, KeyMatcher> matchers = new HashMap<>();
            for (TextSpanEntry span : namespaceSpans.getValue()) {
                KeyMatcher matcher = matchers.computeIfAbsent(span.inAlgorithm(),
                    inAlgorithm -> buildMatcher(session, namespace, policy.kindsFor(inAlgorithm), reportedAmbiguities));
                linked += linkSpan(span, matcher);
            }
        }
        log.info("Autolinked {} occurrences", linked);
        return linked;
    }

    private KeyMatcher buildMatcher(CompilationSession session, String namespace, Set<EntryKind> kinds,
                                    Set<String> reportedAmbiguities) {
        if (kinds.isEmpty()) {
            return KeyMatcher.EMPTY;
        }
        Map<String, EntryRef> targets = new HashMap<>();
        session.bibliography().visibleEntries(namespace, kinds).forEach((key, candidates) -> {
            if (candidates.size() == 1) {
                targets.put(key, candidates.get(0));
            } else if (reportedAmbiguities.add(namespace + '\u0000' + key)) {
                session.reportGlobal("ambiguous-autolink",
                    "\"" + key + "\" has " + candidates.size() + " definitions visible in namespace " + namespace
                        + "; it is not autolinked");
            }
        });
        if (targets.isEmpty()) {
            return KeyMatcher.EMPTY;
        }
        List<String> keys = new ArrayList<>(targets.keySet());
        keys.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        StringBuilder alternatives = new StringBuilder();
        for (String key : keys) {
            if (alternatives.length() > 0) {
                alternatives.append('|');
            }
            alternatives.append(keyPattern(key));
        }
        Pattern pattern = Pattern.compile(WORD_START + "(?:" + alternatives + ")" + WORD_END);
        log.debug("Compiled autolink matcher with {} keys for namespace {}", keys.size(), namespace);
        return new KeyMatcher(pattern, targets);
    }

    private static String keyPattern(String key) {
        StringBuilder pattern = new StringBuilder();
        int start = 0;
        char first = key.charAt(0);
        if (Character.isLowerCase(first) && first < 128) {
            pattern.append('[').append(Character.toUpperCase(first)).append(first).append(']');
            start = 1;
        }
        String[] words = key.substring(start).split(" ", -1);
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                pattern.append("\\s+");
            }
            if (!words[i].isEmpty()) {
                pattern.append(Pattern.quote(words[i]));
            }
        }
        return pattern.toString();
    }

    private static int linkSpan(TextSpanEntry span, KeyMatcher keyMatcher) {
        TextNode node = span.node();
        if (keyMatcher.pattern() == null || node.parentNode() == null) {
            return 0;
        }
        String text = node.getWholeText();
        Matcher matcher = keyMatcher.pattern().matcher(text);
        List<Node> replacement = new ArrayList<>();
        int last = 0;
        int links = 0;
        while (matcher.find()) {
            EntryRef target = keyMatcher.targetFor(matcher.group());
            if (target == null || isSelfReference(target, span)) {
                continue;
            }
            if (matcher.start() > last) {
                replacement.add(new TextNode(text.substring(last, matcher.start())));
            }
            replacement.add(citation(target, matcher.group()));
            last = matcher.end();
            links++;
        }
        if (links == 0) {
            return 0;
        }
        if (last < text.length()) {
            replacement.add(new TextNode(text.substring(last)));
        }
        for (Node replacementNode : replacement) {
            node.before(replacementNode);
        }
        node.remove();
        return links;
    }

    private static boolean isSelfReference(EntryRef target, TextSpanEntry span) {
        return !target.isExternal() && span.enclosingId() != null
            && span.enclosingId().equals(target.entry().anchorId());
    }

    private static Element citation(EntryRef target, String text) {
        Element xref = new Element("emu-xref");
        if (target.entry() instanceof OperationEntry operation) {
            xref.attr("aoid", operation.aoid());
        } else {
            xref.attr("href", target.href());
        }
        xref.appendChild(new Element("a").attr("href", target.href()).text(text));
        return xref;
    }

    /**
     * Compiled pattern plus the entry each key links to.
     */
    private record KeyMatcher(Pattern pattern, Map<String, EntryRef> targets) {

        static final KeyMatcher EMPTY = new KeyMatcher(null, Map.of());

        EntryRef targetFor(String matched) {
            String normalized = TextKeyNormalizer.normalize(matched);
            EntryRef exact = targets.get(normalized);
            return exact != null ? exact : targets.get(TextKeyNormalizer.lowerInitial(normalized));
        }
    }
}

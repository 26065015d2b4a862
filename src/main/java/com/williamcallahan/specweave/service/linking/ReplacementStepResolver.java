package com.williamcallahan.specweave.service.linking;

import com.williamcallahan.specweave.domain.biblio.EntryRef;
import com.williamcallahan.specweave.domain.biblio.StepEntry;
import com.williamcallahan.specweave.service.CompilationSession;
import com.williamcallahan.specweave.service.biblio.Bibliography;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Numbers algorithms that replace a single step of another algorithm.
 *
 * <p>A replacing algorithm starts at the replaced step's number and is styled for the step's
 * depth; its labeled steps take the replaced step's path as prefix. A declaration whose
 * target is itself inside an unresolved replacement waits until that replacement resolves.
 * Declarations still waiting after every resolvable one has been processed form a cycle or
 * depend on a broken replacement; they keep their default numbering and are reported once.</p>
 */
public class ReplacementStepResolver {

    private static final Logger log = LoggerFactory.getLogger(ReplacementStepResolver.class);
    private static final String RULE_ID = "invalid-replacement";
    private static final String REPLACES_STEP = "replaces-step";
    private static final String[] NESTING_CLASSES = {
        "nested-once", "nested-twice", "nested-thrice", "nested-four-times", "nested-lots"
    };

    /**
     * Resolves every replacement declaration of a session.
     *
     * @param session compilation state after the walk
     * @return number of algorithms that were renumbered
     */
    public int resolve(CompilationSession session) {
        Map<String, List<ReplacementDeclaration>> pending = new LinkedHashMap<>();
        int resolved = 0;
        for (ReplacementDeclaration declaration : session.replacementDeclarations()) {
            String target = declaration.targetStepId();
            if (session.isAwaitingReplacement(target)) {
                pending.computeIfAbsent(target, id -> new ArrayList<>()).add(declaration);
                continue;
            }
            Optional<EntryRef> targetEntry = session.bibliography().byId(target);
            if (targetEntry.isEmpty()) {
                session.reportAttribute(declaration.algorithm(), REPLACES_STEP, RULE_ID,
                    "could not find step \"" + target + "\"");
            } else if (!(targetEntry.get().entry() instanceof StepEntry step)) {
                session.reportAttribute(declaration.algorithm(), REPLACES_STEP, RULE_ID,
                    "expected algorithm to replace a step, not a " + targetEntry.get().entry().kind().label());
            } else {
                resolved += propagate(declaration, step.stepNumbers(), pending, session);
            }
        }
        if (!pending.isEmpty()) {
            session.reportGlobal(RULE_ID, "could not unambiguously determine replacement algorithm offsets"
                + " - do you have a cycle in your replacement algorithms?");
            log.warn("{} replacement target(s) never resolved: {}", pending.size(), pending.keySet());
        }
        log.info("Renumbered {} replacement algorithms", resolved);
        return resolved;
    }

    private int propagate(ReplacementDeclaration first, List<Integer> firstPath,
                          Map<String, List<ReplacementDeclaration>> pending, CompilationSession session) {
        Bibliography bibliography = session.bibliography();
        Deque<Activation> work = new ArrayDeque<>();
        work.add(new Activation(first, firstPath));
        int resolved = 0;
        while (!work.isEmpty()) {
            Activation activation = work.poll();
            applyStart(activation.declaration().algorithm(), activation.targetPath());
            resolved++;
            for (String stepId : activation.declaration().containedStepIds()) {
                Optional<StepEntry> step = bibliography.stepEntry(stepId);
                if (step.isEmpty()) {
                    continue;
                }
                List<Integer> localPath = step.get().stepNumbers();
                List<Integer> finalPath = new ArrayList<>(activation.targetPath());
                finalPath.addAll(localPath.subList(1, localPath.size()));
                bibliography.replaceStepNumbers(stepId, finalPath);
                session.markReplacementResolved(stepId);

                List<ReplacementDeclaration> waiting = pending.remove(stepId);
                if (waiting != null) {
                    for (ReplacementDeclaration declaration : waiting) {
                        work.add(new Activation(declaration, finalPath));
                    }
                }
            }
        }
        return resolved;
    }

    static void applyStart(Element algorithm, List<Integer> targetPath) {
        Element list = null;
        for (Element child : algorithm.children()) {
            if ("ol".equals(child.normalName())) {
                list = child;
                break;
            }
        }
        if (list == null) {
            return;
        }
        list.attr("start", String.valueOf(targetPath.get(targetPath.size() - 1)));
        if (targetPath.size() > 1) {
            int index = Math.min(targetPath.size() - 2, NESTING_CLASSES.length - 1);
            list.addClass(NESTING_CLASSES[index]);
        }
    }

    private record Activation(ReplacementDeclaration declaration, List<Integer> targetPath) {}
}

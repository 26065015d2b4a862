package com.williamcallahan.specweave.service.traversal;

/**
 * Assigns section numbers in document order.
 *
 * <p>Top-level clauses count 1, 2, 3; top-level annexes count A, B, C; nested clauses append
 * their position among siblings to the parent's number. Introductions and everything nested
 * in them stay unnumbered.</p>
 */
public class ClauseNumberer {

    static final String INTRO_KIND = "emu-intro";
    static final String ANNEX_KIND = "emu-annex";

    private int topLevelCount;
    private int annexCount;

    /**
     * Computes the number of a clause that is being opened.
     *
     * @param parent innermost open clause, or null at the top level
     * @param kind element kind of the new clause
     * @return dotted number, empty when unnumbered, or null for a top-level clause following an annex
     */
    public String assign(ClauseFrame parent, String kind) {
        if (INTRO_KIND.equals(kind)) {
            return "";
        }
        if (parent == null) {
            if (ANNEX_KIND.equals(kind)) {
                return annexLetters(++annexCount);
            }
            if (annexCount > 0) {
                return null;
            }
            return String.valueOf(++topLevelCount);
        }
        if (parent.number().isEmpty()) {
            return "";
        }
        return parent.number() + "." + parent.nextChildClauseNumber();
    }

    static String annexLetters(int index) {
        StringBuilder letters = new StringBuilder();
        int remaining = index;
        while (remaining > 0) {
            remaining--;
            letters.insert(0, (char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return letters.toString();
    }
}

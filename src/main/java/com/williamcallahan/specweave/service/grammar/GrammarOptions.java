package com.williamcallahan.specweave.service.grammar;

/**
 * Options passed to a grammar engine.
 *
 * @param emitFormat markup dialect to emit
 * @param noChecks skip semantic checks of the grammar
 */
public record GrammarOptions(String emitFormat, boolean noChecks) {

    public static final String EMU_FORMAT = "emu";

    /**
     * Options used while compiling documents: emu markup, no checks.
     *
     * @return default options
     */
    public static GrammarOptions forDocument() {
        return new GrammarOptions(EMU_FORMAT, true);
    }
}

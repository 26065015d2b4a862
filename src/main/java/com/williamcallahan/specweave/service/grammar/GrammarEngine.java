package com.williamcallahan.specweave.service.grammar;

import com.williamcallahan.specweave.service.CancellationSignal;

import java.util.concurrent.CompletableFuture;

/**
 * Converts grammar notation into production markup.
 */
public interface GrammarEngine {

    /**
     * Converts grammar source text.
     *
     * @param content grammar notation
     * @param options conversion options
     * @param cancellation cooperative cancellation signal
     * @return future completing with the rendered markup, or exceptionally when the text cannot be converted
     */
    CompletableFuture<String> convert(String content, GrammarOptions options, CancellationSignal cancellation);
}

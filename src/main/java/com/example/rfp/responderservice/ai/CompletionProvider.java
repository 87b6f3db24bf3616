package com.example.rfp.responderservice.ai;

/**
 * Produces a text completion for a prompt. Implementations report every failure as
 * {@link com.example.rfp.responderservice.exception.CompletionUnavailableException}.
 */
@FunctionalInterface
public interface CompletionProvider {

    String complete(String prompt);
}

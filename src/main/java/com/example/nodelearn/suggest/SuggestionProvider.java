package com.example.nodelearn.suggest;

import java.util.List;

/**
 * Source of related-topic candidates for a node being expanded.
 */
public interface SuggestionProvider {

    /**
     * @return candidates in rank order, best first
     * @throws com.example.nodelearn.error.SuggestionProviderException if the provider is unreachable
     *                                                                  or its output is malformed
     */
    List<SuggestionCandidate> suggest(SuggestionRequest request);

    /**
     * @return a markdown explanation of the requested topic
     * @throws com.example.nodelearn.error.SuggestionProviderException if the provider is unreachable
     *                                                                  or returns no text
     */
    String explain(ExplanationRequest request);
}

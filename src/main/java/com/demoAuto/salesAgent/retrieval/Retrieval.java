package com.demoAuto.salesAgent.retrieval;

import java.util.List;

/**
 * Semantic top-K lookup over a fixed index. Deterministic for a fixed index and query.
 *
 * @param <T> indexed item type
 */
public interface Retrieval<T> {

    /**
     * @return at most {@code k} items ordered by descending score
     * @throws RetrievalUnavailableException if the index or the query embedding is unavailable
     */
    List<ScoredItem<T>> topK(String query, int k);
}

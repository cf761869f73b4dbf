package com.demoAuto.salesAgent.retrieval;

import com.demoAuto.salesAgent.llm.service.EmbeddingClient;
import com.demoAuto.salesAgent.llm.service.EmbeddingUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * In-memory embedding index ranked by cosine similarity.
 * Vectors are computed once in {@link #build}; the index is read-only afterwards.
 *
 * @param <T> indexed item type
 */
@Slf4j
public class EmbeddingRetrieval<T> implements Retrieval<T> {

    private final List<T> items;
    private final List<float[]> vectors;
    private final EmbeddingClient embeddingClient;

    private EmbeddingRetrieval(List<T> items, List<float[]> vectors, EmbeddingClient embeddingClient) {
        this.items = List.copyOf(items);
        this.vectors = List.copyOf(vectors);
        this.embeddingClient = embeddingClient;
    }

    /**
     * Embeds every item's text and returns the finished index.
     *
     * @throws EmbeddingUnavailableException if any item cannot be embedded
     */
    public static <T> EmbeddingRetrieval<T> build(List<T> items, Function<T, String> textOf, EmbeddingClient embeddingClient) {
        List<float[]> vectors = new ArrayList<>(items.size());
        for (T item : items) {
            vectors.add(embeddingClient.embed(textOf.apply(item)));
        }
        log.info("Embedding index built - items: {}", items.size());
        return new EmbeddingRetrieval<>(items, vectors, embeddingClient);
    }

    @Override
    public List<ScoredItem<T>> topK(String query, int k) {
        if (k <= 0 || items.isEmpty()) {
            return List.of();
        }
        float[] queryVector;
        try {
            queryVector = embeddingClient.embed(query);
        } catch (EmbeddingUnavailableException e) {
            throw new RetrievalUnavailableException("Query embedding failed: " + e.getMessage(), e);
        }

        List<Ranked<T>> ranked = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            ranked.add(new Ranked<>(i, items.get(i), cosine(queryVector, vectors.get(i))));
        }
        // index order breaks ties so equal scores come back in load order
        ranked.sort(Comparator.<Ranked<T>>comparingDouble(Ranked::score).reversed()
                .thenComparingInt(Ranked::index));

        return ranked.stream()
                .limit(k)
                .map(r -> new ScoredItem<>(r.item(), r.score()))
                .toList();
    }

    public int size() {
        return items.size();
    }

    static double cosine(float[] a, float[] b) {
        if (a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private record Ranked<T>(int index, T item, double score) {
    }
}

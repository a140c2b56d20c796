package ch.so.arp.rag.memory;

import java.util.List;

/**
 * Outcome of {@link Embedder#embedMany(List)}. Only inputs whose whole chunk was
 * embedded successfully appear in {@link #embeddings()}, in input order.
 *
 * @param embeddings     successfully embedded inputs
 * @param requested      number of non-blank inputs that were sent for embedding
 * @param skippedIndexes positions of blank inputs that were never sent
 * @param failedIndexes  positions of inputs whose chunk could not be embedded
 */
public record EmbeddingBatch(
        List<Embedded> embeddings,
        int requested,
        List<Integer> skippedIndexes,
        List<Integer> failedIndexes) {

    public EmbeddingBatch {
        embeddings = List.copyOf(embeddings);
        skippedIndexes = List.copyOf(skippedIndexes);
        failedIndexes = List.copyOf(failedIndexes);
    }

    /**
     * @return how many inputs actually received a vector
     */
    public int embeddedCount() {
        return embeddings.size();
    }

    public boolean isComplete() {
        return failedIndexes.isEmpty();
    }

    /**
     * A single embedded input.
     *
     * @param index  position of the text in the original input list
     * @param text   the embedded text
     * @param vector the embedding
     */
    public record Embedded(int index, String text, float[] vector) {
    }
}

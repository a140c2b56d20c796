package ch.so.arp.rag.memory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ConcurrentLruCache;

/**
 * Turns text into vectors through an {@link EmbeddingProvider}. Adds a bounded
 * LRU cache for single texts, a linear backoff retry loop for transient
 * failures and chunking for large batches.
 */
public class Embedder {

    private static final Logger LOGGER = LoggerFactory.getLogger(Embedder.class);

    private final EmbeddingProvider provider;
    private final int dimensions;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final int batchSize;
    private final ConcurrentLruCache<String, float[]> cache;
    private final Sleeper sleeper;

    public Embedder(EmbeddingProvider provider, DocumentStoreProperties properties) {
        this(provider, properties, Thread::sleep);
    }

    Embedder(EmbeddingProvider provider, DocumentStoreProperties properties, Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.provider = Objects.requireNonNull(provider, "provider");
        DocumentStoreProperties.Embedding settings = properties.getEmbedding();
        if (properties.getDimensions() <= 0 || settings.getMaxAttempts() <= 0 || properties.getBatchSize() <= 0) {
            throw new IllegalArgumentException("dimensions, max-attempts and batch-size must be positive");
        }
        this.dimensions = properties.getDimensions();
        this.maxAttempts = settings.getMaxAttempts();
        this.retryDelay = Objects.requireNonNull(settings.getRetryDelay(), "retryDelay");
        this.batchSize = properties.getBatchSize();
        this.cache = new ConcurrentLruCache<>(settings.getCacheCapacity(), this::embedUncached);
    }

    /**
     * Embed a single text. Repeated calls with the same text are answered from
     * the cache while the entry has not been evicted.
     *
     * @throws ValidationException           if the text is blank
     * @throws EmbeddingUnavailableException if no vector could be obtained
     */
    public float[] embedOne(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Cannot embed empty text");
        }
        return cache.get(text).clone();
    }

    /**
     * Embed many texts in chunks. Blank texts are skipped. A chunk that cannot
     * be embedded is reported in {@link EmbeddingBatch#failedIndexes()} without
     * affecting the other chunks.
     */
    public EmbeddingBatch embedMany(List<String> texts) {
        List<Integer> skipped = new ArrayList<>();
        List<Integer> pendingIndexes = new ArrayList<>();
        List<String> pendingTexts = new ArrayList<>();
        if (texts != null) {
            for (int i = 0; i < texts.size(); i++) {
                String text = texts.get(i);
                if (text == null || text.isBlank()) {
                    skipped.add(i);
                } else {
                    pendingIndexes.add(i);
                    pendingTexts.add(text);
                }
            }
        }

        List<EmbeddingBatch.Embedded> embedded = new ArrayList<>(pendingTexts.size());
        List<Integer> failed = new ArrayList<>();
        for (int start = 0; start < pendingTexts.size(); start += batchSize) {
            int end = Math.min(start + batchSize, pendingTexts.size());
            List<String> chunk = pendingTexts.subList(start, end);
            try {
                List<float[]> vectors = embedWithRetry(chunk);
                for (int i = 0; i < chunk.size(); i++) {
                    embedded.add(new EmbeddingBatch.Embedded(pendingIndexes.get(start + i), chunk.get(i),
                            vectors.get(i)));
                }
            } catch (EmbeddingUnavailableException ex) {
                LOGGER.warn("Skipping chunk of {} texts starting at input {}: {}", chunk.size(),
                        pendingIndexes.get(start), ex.getMessage());
                failed.addAll(pendingIndexes.subList(start, end));
            }
        }
        if (!skipped.isEmpty()) {
            LOGGER.debug("Skipped {} blank texts in batch of {}", skipped.size(), texts.size());
        }
        return new EmbeddingBatch(embedded, pendingTexts.size(), skipped, failed);
    }

    public int dimensions() {
        return dimensions;
    }

    public String modelName() {
        return provider.modelName();
    }

    boolean isCached(String text) {
        return cache.contains(text);
    }

    int cacheSize() {
        return cache.size();
    }

    private float[] embedUncached(String text) {
        return embedWithRetry(List.of(text)).get(0);
    }

    private List<float[]> embedWithRetry(List<String> texts) {
        RuntimeException lastFailure = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                List<float[]> vectors = provider.embed(texts);
                verify(vectors, texts.size());
                return vectors;
            } catch (EmbeddingProviderException ex) {
                lastFailure = ex;
                if (!ex.isTransientFailure()) {
                    LOGGER.error("Embedding failed permanently: {}", ex.getMessage());
                    break;
                }
            } catch (RuntimeException ex) {
                lastFailure = ex;
            }
            if (attempt < maxAttempts) {
                LOGGER.warn("Error generating embeddings (attempt {}/{}): {}", attempt, maxAttempts,
                        lastFailure.getMessage());
                pause(attempt);
            }
        }
        throw new EmbeddingUnavailableException(
                "Failed to generate embeddings after " + attempt + " attempt(s): " + lastFailure.getMessage(),
                lastFailure);
    }

    private void verify(List<float[]> vectors, int expected) {
        if (vectors == null || vectors.size() != expected) {
            throw new EmbeddingProviderException("Expected " + expected + " vectors but received "
                    + (vectors == null ? 0 : vectors.size()), false);
        }
        for (float[] vector : vectors) {
            if (vector == null || vector.length != dimensions) {
                throw new EmbeddingProviderException("Expected vectors with " + dimensions + " dimensions but received "
                        + (vector == null ? 0 : vector.length), false);
            }
        }
    }

    private void pause(int attempt) {
        long millis = retryDelay.multipliedBy(attempt).toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Interrupted while waiting to retry embedding", ex);
        }
    }

    /**
     * Waits between retry attempts.
     */
    @FunctionalInterface
    interface Sleeper {

        void sleep(long millis) throws InterruptedException;
    }
}

package ch.so.arp.rag.memory;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the document store, bound from {@code memory.store.*}.
 */
@ConfigurationProperties(prefix = "memory.store")
public class DocumentStoreProperties {

    /**
     * Dimensionality of the stored vectors. Must match the embedding model.
     */
    private int dimensions = 1536;

    /**
     * Number of documents embedded and written together in batch operations.
     */
    private int batchSize = 20;

    /**
     * Result count used when a search does not ask for a specific one.
     */
    private int defaultTopK = 8;

    /**
     * Maximum number of documents scanned client side by the lexical fallback.
     */
    private int fallbackScanLimit = 100;

    /**
     * Load the bundled sample documents on startup.
     */
    private boolean seedSamples;

    private final Embedding embedding = new Embedding();

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getFallbackScanLimit() {
        return fallbackScanLimit;
    }

    public void setFallbackScanLimit(int fallbackScanLimit) {
        this.fallbackScanLimit = fallbackScanLimit;
    }

    public boolean isSeedSamples() {
        return seedSamples;
    }

    public void setSeedSamples(boolean seedSamples) {
        this.seedSamples = seedSamples;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    /**
     * Retry and cache settings of the {@link Embedder}.
     */
    public static class Embedding {

        /**
         * Attempts per embedding request, including the first one.
         */
        private int maxAttempts = 3;

        /**
         * Base delay between attempts. Retry n waits n times this value.
         */
        private Duration retryDelay = Duration.ofSeconds(2);

        /**
         * Number of single-text embeddings kept in memory.
         */
        private int cacheCapacity = 100;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public int getCacheCapacity() {
            return cacheCapacity;
        }

        public void setCacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
        }
    }
}

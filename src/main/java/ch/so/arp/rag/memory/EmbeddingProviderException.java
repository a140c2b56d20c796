package ch.so.arp.rag.memory;

/**
 * Failure reported by an {@link EmbeddingProvider}. The transient flag tells the
 * {@link Embedder} whether another attempt may succeed.
 */
public class EmbeddingProviderException extends RuntimeException {

    private final boolean transientFailure;

    public EmbeddingProviderException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public EmbeddingProviderException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}

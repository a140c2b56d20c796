package ch.so.arp.rag.memory;

/**
 * Raised once the embedding service could not produce a vector, either because
 * all attempts were used up or because the service reported a fatal error.
 */
public class EmbeddingUnavailableException extends DocumentStoreException {

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

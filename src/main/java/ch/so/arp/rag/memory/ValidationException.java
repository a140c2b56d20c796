package ch.so.arp.rag.memory;

/**
 * Raised for invalid caller input such as blank content, blank queries or a
 * missing document id. Never retried.
 */
public class ValidationException extends DocumentStoreException {

    public ValidationException(String message) {
        super(message);
    }
}

package ch.so.arp.rag.memory;

/**
 * Base class of all failures reported by the document store. The concrete
 * subclasses tag the failure so callers can decide whether to retry, fall back
 * or give up.
 */
public abstract class DocumentStoreException extends RuntimeException {

    protected DocumentStoreException(String message) {
        super(message);
    }

    protected DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package ch.so.arp.rag.memory;

/**
 * Raised when the persistence backend rejects a read or a write. For batch
 * writes {@link #committedCount()} tells how many documents were stored before
 * the failure.
 */
public class PersistenceException extends DocumentStoreException {

    private final int committedCount;

    public PersistenceException(String message) {
        this(message, null, 0);
    }

    public PersistenceException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public PersistenceException(String message, Throwable cause, int committedCount) {
        super(message, cause);
        this.committedCount = committedCount;
    }

    public int committedCount() {
        return committedCount;
    }
}

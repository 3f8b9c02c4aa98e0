package ch.so.arp.rag.router.vector;

/**
 * Failure reading from or writing to the vector store.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

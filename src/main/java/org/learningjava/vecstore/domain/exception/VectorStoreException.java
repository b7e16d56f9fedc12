package org.learningjava.vecstore.domain.exception;

/**
 * Root of every failure surfaced by a vector store operation.
 * Unchecked, like the rest of the adapter layer; the original cause is always kept.
 */
public class VectorStoreException extends RuntimeException {

    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

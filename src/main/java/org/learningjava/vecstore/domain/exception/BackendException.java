package org.learningjava.vecstore.domain.exception;

/**
 * The downstream vector database call failed. The message is stable per operation
 * ("failed to add vector entries", ...) and the transport failure is kept as the cause.
 */
public class BackendException extends VectorStoreException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.learningjava.vecstore.domain.exception;

// backend client could not be constructed
public class InitializationException extends VectorStoreException {

    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}

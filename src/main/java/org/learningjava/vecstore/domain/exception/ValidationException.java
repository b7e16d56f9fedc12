package org.learningjava.vecstore.domain.exception;

/**
 * A caller-supplied request broke a precondition. Raised before the backend is contacted.
 */
public class ValidationException extends VectorStoreException {

    public ValidationException(String message) {
        super(message);
    }
}

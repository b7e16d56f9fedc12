package org.learningjava.vecstore.domain.exception;

/**
 * An id, embedding or metadata value could not be coerced to the type the backend expects.
 */
public class ConversionException extends VectorStoreException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}

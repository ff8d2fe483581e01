package io.github.devsha256.odataclient.exception;

/**
 * Simple custom exception to indicate an entity set wasn't found.
 */
public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(String message) {
        super(message);
    }
}

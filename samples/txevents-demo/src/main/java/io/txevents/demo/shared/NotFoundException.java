package io.txevents.demo.shared;

/**
 * Thrown when an aggregate looked up by id does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}

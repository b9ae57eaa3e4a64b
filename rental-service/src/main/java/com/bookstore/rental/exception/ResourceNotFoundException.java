package com.bookstore.rental.exception;

/**
 * A referenced book or rental does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}

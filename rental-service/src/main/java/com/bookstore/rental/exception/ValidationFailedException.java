package com.bookstore.rental.exception;

/**
 * Input that breaks a domain rule the core checks itself, e.g. a due date that is not after the
 * rental date.
 */
public class ValidationFailedException extends RuntimeException {

    public ValidationFailedException(String message) {
        super(message);
    }
}

package com.bookstore.rental.exception;

/**
 * Internal bookkeeping is inconsistent, e.g. a returned copy finds every copy of its book already
 * on the shelf. Reported as a server error, never as a client mistake.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}

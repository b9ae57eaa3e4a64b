package com.bookstore.rental.exception;

/**
 * An operation that is well-formed but not allowed in the current state, such as renting a book
 * with no available copies.
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}

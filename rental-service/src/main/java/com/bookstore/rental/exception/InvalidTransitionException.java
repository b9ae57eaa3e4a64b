package com.bookstore.rental.exception;

import com.bookstore.rental.model.RentalStatus;

/**
 * Attempt to move a rental out of its terminal returned state.
 */
public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(RentalStatus from, RentalStatus to) {
        super("Cannot change status of " + from.value() + " rental to " + to.value());
    }
}

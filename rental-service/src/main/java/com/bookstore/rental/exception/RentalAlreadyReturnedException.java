package com.bookstore.rental.exception;

import java.util.UUID;

public class RentalAlreadyReturnedException extends BusinessException {

    public RentalAlreadyReturnedException(UUID rentalId) {
        super("Book is already returned for rental: " + rentalId);
    }
}

package com.bookstore.rental.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

public record ReturnRequest(
    @NotNull(message = "Rental ID is required")
    UUID rentalId,

    Instant returnDate,

    @Size(max = 500, message = "Notes cannot exceed 500 characters")
    String notes
) {}

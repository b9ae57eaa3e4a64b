package com.bookstore.rental.dto;

import com.bookstore.rental.model.RentalStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RentalStatusUpdateRequest(
    @NotNull(message = "Status is required")
    RentalStatus status,

    @Size(max = 500, message = "Notes cannot exceed 500 characters")
    String notes
) {}

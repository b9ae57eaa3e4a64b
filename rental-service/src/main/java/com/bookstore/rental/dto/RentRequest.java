package com.bookstore.rental.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

public record RentRequest(
    @NotNull(message = "Book ID is required")
    UUID bookId,

    @NotBlank(message = "Renter name is required")
    @Size(min = 2, max = 100, message = "Renter name must be between 2 and 100 characters")
    String renterName,

    @NotBlank(message = "Renter email is required")
    @Email(message = "Please provide a valid email address")
    @Size(max = 254, message = "Renter email cannot exceed 254 characters")
    String renterEmail,

    @Pattern(regexp = "^[\\d\\s\\-+()]*$", message = "Phone number contains invalid characters")
    @Size(max = 32, message = "Phone number cannot exceed 32 characters")
    String renterPhone,

    @NotNull(message = "Due date is required")
    Instant dueDate,

    @Size(max = 500, message = "Notes cannot exceed 500 characters")
    String notes
) {}

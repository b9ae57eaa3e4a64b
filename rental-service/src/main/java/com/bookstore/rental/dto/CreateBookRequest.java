package com.bookstore.rental.dto;

import com.bookstore.rental.model.Genre;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateBookRequest(
    @NotBlank(message = "Title is required")
    @Size(min = 2, max = 200, message = "Title must be between 2 and 200 characters")
    String title,

    @NotBlank(message = "Author is required")
    @Size(min = 2, max = 100, message = "Author name must be between 2 and 100 characters")
    String author,

    @NotNull(message = "Genre is required")
    Genre genre,

    @Size(max = 32, message = "ISBN cannot exceed 32 characters")
    @Pattern(regexp = "^[\\d-]+$", message = "ISBN must contain only numbers and hyphens")
    String isbn,

    @Min(value = 1000, message = "Published year must be valid")
    Integer publishedYear,

    @NotNull(message = "Total copies is required")
    @Min(value = 1, message = "Total copies must be at least 1")
    @Max(value = 1000, message = "Total copies cannot exceed 1000")
    Integer totalCopies,

    @NotNull(message = "Available copies is required")
    @Min(value = 0, message = "Available copies cannot be negative")
    Integer availableCopies,

    @Size(max = 1000, message = "Description cannot exceed 1000 characters")
    String description,

    @Pattern(regexp = "^(https?://.+\\.(?i)(jpg|jpeg|png|gif|webp))?$",
             message = "Cover image must be a valid URL ending with an image extension")
    @Size(max = 500, message = "Cover image URL cannot exceed 500 characters")
    String coverImage
) {}

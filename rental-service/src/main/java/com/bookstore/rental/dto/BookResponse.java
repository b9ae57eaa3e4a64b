package com.bookstore.rental.dto;

import com.bookstore.rental.model.Book;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.UUID;

public record BookResponse(
    UUID id,
    String title,
    String author,
    String genre,
    String isbn,
    Integer publishedYear,
    int totalCopies,
    int availableCopies,
    @JsonProperty("isAvailable") boolean isAvailable,
    String description,
    String coverImage,
    @JsonProperty("isActive") boolean isActive,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
    public static BookResponse from(Book book) {
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getAuthor(),
            book.getGenre(),
            book.getIsbn(),
            book.getPublishedYear(),
            book.getTotalCopies(),
            book.getAvailableCopies(),
            book.isAvailable(),
            book.getDescription(),
            book.getCoverImage(),
            book.isActive(),
            book.getCreatedAt(),
            book.getUpdatedAt());
    }
}

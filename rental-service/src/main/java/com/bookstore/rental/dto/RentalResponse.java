package com.bookstore.rental.dto;

import com.bookstore.rental.model.Book;
import com.bookstore.rental.model.Rental;
import com.bookstore.rental.model.RentalStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A rental as seen at {@code now}: the stored {@code status} next to the time-derived
 * {@code effectiveStatus}, {@code daysOverdue}, {@code isOverdue} and {@code rentalDuration}.
 */
public record RentalResponse(
    UUID id,
    BookSummary book,
    String renterName,
    String renterEmail,
    String renterPhone,
    Instant rentalDate,
    Instant dueDate,
    Instant returnDate,
    RentalStatus status,
    RentalStatus effectiveStatus,
    long daysOverdue,
    @JsonProperty("isOverdue") boolean isOverdue,
    long rentalDuration,
    BigDecimal lateFee,
    String notes
) {
    public record BookSummary(UUID id, String title, String author, String genre) {
        static BookSummary from(Book book) {
            return new BookSummary(book.getId(), book.getTitle(), book.getAuthor(), book.getGenre());
        }
    }

    public static RentalResponse from(Rental rental, Instant now) {
        return new RentalResponse(
            rental.getId(),
            BookSummary.from(rental.getBook()),
            rental.getRenterName(),
            rental.getRenterEmail(),
            rental.getRenterPhone(),
            rental.getRentalDate(),
            rental.getDueDate(),
            rental.getReturnDate(),
            rental.getStatus(),
            rental.effectiveStatus(now),
            rental.daysOverdue(now),
            rental.isOverdue(now),
            rental.rentalDuration(now),
            rental.getLateFee(),
            rental.getNotes());
    }
}

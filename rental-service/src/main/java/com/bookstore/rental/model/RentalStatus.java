package com.bookstore.rental.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Stored lifecycle state of a {@link Rental}. {@link #RETURNED} is terminal.
 *
 * <p>{@link #OVERDUE} is only written at a reconciliation point (return or explicit status
 * update); between those, an {@link #ACTIVE} rental past its due date is reported as overdue
 * by {@link Rental#effectiveStatus(java.time.Instant)} without being rewritten.
 */
public enum RentalStatus {
    ACTIVE,
    RETURNED,
    OVERDUE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Both {@code ACTIVE} and {@code OVERDUE} rentals still hold a copy of the book.
     */
    public boolean isOpen() {
        return this != RETURNED;
    }

    public static Optional<RentalStatus> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(s -> s.name().equalsIgnoreCase(value.trim()))
            .findFirst();
    }

    @JsonCreator
    static RentalStatus fromJson(String value) {
        return fromValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Invalid rental status: " + value));
    }
}

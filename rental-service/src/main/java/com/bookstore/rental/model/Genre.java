package com.bookstore.rental.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of genres a book can be filed under. Serialized and stored by label.
 */
public enum Genre {
    FICTION("Fiction"),
    NON_FICTION("Non-Fiction"),
    MYSTERY("Mystery"),
    ROMANCE("Romance"),
    THRILLER("Thriller"),
    SCIENCE_FICTION("Science Fiction"),
    FANTASY("Fantasy"),
    BIOGRAPHY("Biography"),
    HISTORY("History"),
    SELF_HELP("Self-Help"),
    BUSINESS("Business"),
    TECHNOLOGY("Technology"),
    HEALTH("Health"),
    TRAVEL("Travel"),
    COOKING("Cooking"),
    ART("Art"),
    MUSIC("Music"),
    SPORTS("Sports"),
    EDUCATION("Education"),
    OTHER("Other");

    private final String label;

    Genre(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<Genre> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
            .filter(g -> g.label.equalsIgnoreCase(trimmed) || g.name().equalsIgnoreCase(trimmed))
            .findFirst();
    }

    @JsonCreator
    static Genre fromJson(String value) {
        return fromLabel(value)
            .orElseThrow(() -> new IllegalArgumentException("Invalid genre: " + value));
    }
}

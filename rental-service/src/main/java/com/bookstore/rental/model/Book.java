package com.bookstore.rental.model;

import com.bookstore.rental.exception.BusinessException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.UuidGenerator;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A catalogue entry and its copy ledger.
 *
 * <p>{@code 0 <= availableCopies <= totalCopies} holds after every save: an available count above
 * the total is clamped down before the row is written, whichever path changed it.
 * Books are never removed; {@link #softDelete()} only hides them from listings.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
public class Book {

    @Id
    @UuidGenerator
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "author", nullable = false)
    private String author;

    /** Stored as the {@link Genre} label so search can match on it. */
    @Column(name = "genre", nullable = false)
    private String genre;

    @Column(name = "isbn", unique = true)
    private String isbn;

    @Column(name = "published_year")
    private Integer publishedYear;

    @Column(name = "total_copies", nullable = false)
    private int totalCopies;

    @Column(name = "available_copies", nullable = false)
    private int availableCopies;

    @Column(name = "description")
    private String description;

    @Column(name = "cover_image")
    private String coverImage;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = OffsetDateTime.now();
        this.updatedAt = this.createdAt;
        clampAvailableCopies();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = OffsetDateTime.now();
        clampAvailableCopies();
    }

    public boolean isAvailable() {
        return availableCopies > 0;
    }

    public boolean canBeRented() {
        return active && availableCopies > 0;
    }

    public void decrementAvailability() {
        if (!canBeRented()) {
            throw new BusinessException("Book is not available for rental: " + id);
        }
        availableCopies -= 1;
    }

    public void incrementAvailability() {
        if (availableCopies >= totalCopies) {
            throw new BusinessException("All copies are already available for book: " + id);
        }
        availableCopies += 1;
    }

    /**
     * Hides the book from default listings. Copy counts and open rentals are left as they are,
     * so copies already out can still be returned.
     */
    public void softDelete() {
        this.active = false;
    }

    void clampAvailableCopies() {
        if (availableCopies > totalCopies) {
            availableCopies = totalCopies;
        }
    }
}

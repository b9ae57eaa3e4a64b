package com.bookstore.rental.model;

import com.bookstore.rental.exception.InvalidTransitionException;
import com.bookstore.rental.exception.RentalAlreadyReturnedException;
import com.bookstore.rental.exception.ValidationFailedException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UuidGenerator;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * One rental of one copy of a {@link Book}.
 *
 * <p>Lifecycle: created {@link RentalStatus#ACTIVE} by {@link #open}, observed as overdue once the
 * due date passes, closed by {@link #markReturned}. Once returned, the return date and status are
 * frozen. Overdue state is derived at read time by {@link #effectiveStatus(Instant)}; the stored
 * status only catches up when {@link #markReturned} or {@link #updateStatus} runs.
 */
@Entity
@Table(name = "rentals")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Rental {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    @Id
    @UuidGenerator
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false, updatable = false)
    private Book book;

    @Column(name = "renter_name", nullable = false)
    private String renterName;

    @Column(name = "renter_email", nullable = false)
    private String renterEmail;

    @Column(name = "renter_phone")
    private String renterPhone;

    @Column(name = "rental_date", nullable = false, updatable = false)
    private Instant rentalDate;

    @Column(name = "due_date", nullable = false)
    private Instant dueDate;

    @Column(name = "return_date")
    private Instant returnDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RentalStatus status = RentalStatus.ACTIVE;

    @Column(name = "late_fee", nullable = false)
    private BigDecimal lateFee = BigDecimal.ZERO;

    @Column(name = "notes")
    private String notes;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = OffsetDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = OffsetDateTime.now();
    }

    /**
     * Creates an active rental. The email is trimmed and lower-cased before it is stored.
     *
     * @throws ValidationFailedException if the due date is not strictly after the rental date or
     *                                   the email is malformed
     */
    public static Rental open(Book book, String renterName, String renterEmail, String renterPhone,
                              Instant rentalDate, Instant dueDate, String notes) {
        if (book == null) {
            throw new ValidationFailedException("Book reference is required");
        }
        if (renterName == null || renterName.isBlank()) {
            throw new ValidationFailedException("Renter name is required");
        }
        String email = normalizeEmail(renterEmail);
        if (email == null || !EMAIL.matcher(email).matches()) {
            throw new ValidationFailedException("Please provide a valid email address");
        }
        if (rentalDate == null || dueDate == null || !dueDate.isAfter(rentalDate)) {
            throw new ValidationFailedException("Due date must be after rental date");
        }

        Rental rental = new Rental();
        rental.book = book;
        rental.renterName = renterName.trim();
        rental.renterEmail = email;
        rental.renterPhone = blankToNull(renterPhone);
        rental.rentalDate = rentalDate;
        rental.dueDate = dueDate;
        rental.notes = blankToNull(notes);
        return rental;
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Whole days past the due date, rounding any started day up. Zero once returned.
     */
    public long daysOverdue(Instant now) {
        if (status == RentalStatus.RETURNED) {
            return 0;
        }
        long lateMillis = Duration.between(dueDate, now).toMillis();
        return lateMillis > 0 ? ceilDays(lateMillis) : 0;
    }

    public boolean isOverdue(Instant now) {
        return status == RentalStatus.ACTIVE && daysOverdue(now) > 0;
    }

    /**
     * Days from rental to return, or to {@code now} while the copy is still out.
     */
    public long rentalDuration(Instant now) {
        Instant end = returnDate != null ? returnDate : now;
        return ceilDays(Duration.between(rentalDate, end).toMillis());
    }

    /**
     * The status as observed at {@code now}: an active rental past its due date reads as overdue.
     */
    public RentalStatus effectiveStatus(Instant now) {
        if (status == RentalStatus.ACTIVE && daysOverdue(now) > 0) {
            return RentalStatus.OVERDUE;
        }
        return status;
    }

    /**
     * Closes the rental at {@code returnedAt}. A return after the due date is charged
     * {@code feePerDay} for every started day late.
     */
    public void markReturned(Instant returnedAt, BigDecimal feePerDay) {
        if (status == RentalStatus.RETURNED) {
            throw new RentalAlreadyReturnedException(id);
        }
        if (returnedAt.isBefore(rentalDate)) {
            throw new ValidationFailedException("Return date cannot be before rental date");
        }
        long lateDays = daysOverdue(returnedAt);

        this.returnDate = returnedAt;
        this.status = RentalStatus.RETURNED;
        if (lateDays > 0) {
            this.lateFee = feePerDay.multiply(BigDecimal.valueOf(lateDays));
        }
    }

    /**
     * Administrative status change between the open states. An active status on a rental that is
     * already past due is stored as overdue so the stored and observed values agree.
     *
     * @throws InvalidTransitionException if the rental is returned and {@code newStatus} is not
     */
    public void updateStatus(RentalStatus newStatus, String newNotes, Instant now) {
        if (status == RentalStatus.RETURNED && newStatus != RentalStatus.RETURNED) {
            throw new InvalidTransitionException(status, newStatus);
        }
        if (status != RentalStatus.RETURNED && newStatus == RentalStatus.RETURNED) {
            throw new IllegalStateException("Open rentals are closed through markReturned: " + id);
        }
        this.status = newStatus;
        if (status == RentalStatus.ACTIVE && daysOverdue(now) > 0) {
            this.status = RentalStatus.OVERDUE;
        }
        replaceNotes(newNotes);
    }

    public void replaceNotes(String newNotes) {
        if (newNotes != null && !newNotes.isBlank()) {
            this.notes = newNotes;
        }
    }

    public BigDecimal totalFee(BigDecimal baseRate) {
        return baseRate.add(lateFee);
    }

    private static long ceilDays(long millis) {
        return Math.floorDiv(millis + DAY_MILLIS - 1, DAY_MILLIS);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

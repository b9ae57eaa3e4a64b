package com.bookstore.rental.service;

import com.bookstore.rental.config.RentalProperties;
import com.bookstore.rental.dto.PageResponse;
import com.bookstore.rental.dto.RentRequest;
import com.bookstore.rental.dto.RentalResponse;
import com.bookstore.rental.dto.RentalStatsResponse;
import com.bookstore.rental.exception.BusinessException;
import com.bookstore.rental.exception.ConflictException;
import com.bookstore.rental.exception.InvariantViolationException;
import com.bookstore.rental.exception.ResourceNotFoundException;
import com.bookstore.rental.model.Book;
import com.bookstore.rental.model.Rental;
import com.bookstore.rental.model.RentalStatus;
import com.bookstore.rental.repository.BookRepository;
import com.bookstore.rental.repository.RentalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.UUID;

/**
 * Coordinates the book ledger and the rental tracker. This is the only place where a single
 * request changes both a {@link Book} and a {@link Rental}.
 *
 * <p>Each operation runs in one local transaction, but availability is not version-checked:
 * two concurrent rents of the last copy can both pass {@link Book#canBeRented()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RentalService {

    private static final int MONTHLY_HISTOGRAM_SIZE = 12;

    private final RentalRepository rentalRepository;
    private final BookRepository bookRepository;
    private final RentalProperties rentalProperties;
    private final Clock clock;

    @Transactional
    public RentalResponse rent(RentRequest request) {
        Instant now = clock.instant();

        Book book = bookRepository.findById(request.bookId())
            .orElseThrow(() -> new ResourceNotFoundException("Book not found: " + request.bookId()));

        if (!book.canBeRented()) {
            throw new BusinessException("Book is not available for rental: " + book.getId());
        }

        String email = Rental.normalizeEmail(request.renterEmail());
        if (rentalRepository.existsByBook_IdAndRenterEmailAndStatusIn(
                book.getId(), email, EnumSet.of(RentalStatus.ACTIVE, RentalStatus.OVERDUE))) {
            throw new ConflictException("Renter already has an active rental for this book");
        }

        // The copy is only taken once the rental itself has passed validation.
        Rental rental = Rental.open(book, request.renterName(), email, request.renterPhone(),
            now, request.dueDate(), request.notes());
        Rental saved = rentalRepository.save(rental);

        book.decrementAvailability();
        bookRepository.save(book);

        log.info("Book rented: rentalId={} bookId={} renter={} dueDate={} availableCopies={}",
            saved.getId(), book.getId(), email, saved.getDueDate(), book.getAvailableCopies());
        return RentalResponse.from(saved, now);
    }

    /**
     * Closes a rental and puts its copy back. If the copy cannot be put back because the book's
     * ledger already shows every copy available, the rental still commits as returned and an
     * {@link InvariantViolationException} is raised.
     */
    @Transactional(noRollbackFor = InvariantViolationException.class)
    public RentalResponse returnBook(UUID rentalId, Instant returnDate, String notes) {
        Instant now = clock.instant();

        Rental rental = loadRental(rentalId);
        if (rental.getStatus() == RentalStatus.RETURNED) {
            throw new BusinessException("Book is already returned for rental: " + rentalId);
        }

        closeAndRestock(rental, returnDate != null ? returnDate : now, notes);
        return RentalResponse.from(rental, now);
    }

    /**
     * Administrative status change. Moving an open rental to returned runs the full return so the
     * book gets its copy back.
     */
    @Transactional(noRollbackFor = InvariantViolationException.class)
    public RentalResponse updateStatus(UUID rentalId, RentalStatus status, String notes) {
        Instant now = clock.instant();
        Rental rental = loadRental(rentalId);

        if (status == RentalStatus.RETURNED && rental.getStatus().isOpen()) {
            closeAndRestock(rental, now, notes);
        } else {
            RentalStatus previous = rental.getStatus();
            rental.updateStatus(status, notes, now);
            rentalRepository.save(rental);
            log.info("Rental status updated: rentalId={} from={} to={}", rentalId, previous, rental.getStatus());
        }
        return RentalResponse.from(rental, now);
    }

    @Transactional(readOnly = true)
    public RentalResponse findById(UUID rentalId) {
        return RentalResponse.from(loadRental(rentalId), clock.instant());
    }

    @Transactional(readOnly = true)
    public PageResponse<RentalResponse> findAll(RentalStatus status, String renterEmail, UUID bookId, Pageable pageable) {
        Instant now = clock.instant();
        return PageResponse.from(
            rentalRepository.search(status, Rental.normalizeEmail(renterEmail), bookId, pageable),
            rental -> RentalResponse.from(rental, now));
    }

    @Transactional(readOnly = true)
    public PageResponse<RentalResponse> findByRenter(String renterEmail, RentalStatus status, Pageable pageable) {
        Pageable newestFirst = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
            Sort.by(Sort.Direction.DESC, "rentalDate"));
        return findAll(status, renterEmail, null, newestFirst);
    }

    @Transactional(readOnly = true)
    public PageResponse<RentalResponse> findOverdue(Pageable pageable) {
        Instant now = clock.instant();
        Pageable oldestDueFirst = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
            Sort.by(Sort.Direction.ASC, "dueDate"));
        return PageResponse.from(
            rentalRepository.findOverdue(now, oldestDueFirst),
            rental -> RentalResponse.from(rental, now));
    }

    @Transactional(readOnly = true)
    public RentalStatsResponse stats() {
        Instant now = clock.instant();
        RentalStatsResponse.Totals overall = new RentalStatsResponse.Totals(
            rentalRepository.count(),
            rentalRepository.countByStatus(RentalStatus.ACTIVE),
            rentalRepository.countByStatus(RentalStatus.RETURNED),
            rentalRepository.countOverdue(now),
            rentalRepository.sumLateFees());

        var monthly = rentalRepository.countByMonth(PageRequest.of(0, MONTHLY_HISTOGRAM_SIZE)).stream()
            .map(m -> new RentalStatsResponse.MonthlyCount(m.getRentalYear(), m.getRentalMonth(), m.getRentalCount()))
            .toList();

        return new RentalStatsResponse(overall, monthly);
    }

    private Rental loadRental(UUID rentalId) {
        return rentalRepository.findWithBookById(rentalId)
            .orElseThrow(() -> new ResourceNotFoundException("Rental not found: " + rentalId));
    }

    private void closeAndRestock(Rental rental, Instant returnedAt, String notes) {
        rental.markReturned(returnedAt, rentalProperties.getLateFeePerDay());
        rental.replaceNotes(notes);
        rentalRepository.save(rental);

        Book book = rental.getBook();
        try {
            book.incrementAvailability();
        } catch (BusinessException e) {
            log.error("Copy bookkeeping inconsistent on return: rentalId={} bookId={} availableCopies={} totalCopies={}",
                rental.getId(), book.getId(), book.getAvailableCopies(), book.getTotalCopies());
            throw new InvariantViolationException(
                "Rental " + rental.getId() + " was returned but book " + book.getId()
                    + " already has all copies available", e);
        }
        bookRepository.save(book);

        log.info("Book returned: rentalId={} bookId={} lateFee={} availableCopies={}",
            rental.getId(), book.getId(), rental.getLateFee(), book.getAvailableCopies());
    }
}

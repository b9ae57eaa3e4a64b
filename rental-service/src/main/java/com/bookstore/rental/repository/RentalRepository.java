package com.bookstore.rental.repository;

import com.bookstore.rental.model.Rental;
import com.bookstore.rental.model.RentalStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RentalRepository extends JpaRepository<Rental, UUID> {

    @EntityGraph(attributePaths = "book")
    Optional<Rental> findWithBookById(UUID id);

    boolean existsByBook_IdAndRenterEmailAndStatusIn(UUID bookId, String renterEmail,
                                                     Collection<RentalStatus> statuses);

    @EntityGraph(attributePaths = "book")
    @Query("""
        SELECT r FROM Rental r
        WHERE (:status IS NULL OR r.status = :status)
          AND (:email IS NULL OR r.renterEmail = :email)
          AND (:bookId IS NULL OR r.book.id = :bookId)
        """)
    Page<Rental> search(@Param("status") RentalStatus status,
                        @Param("email") String renterEmail,
                        @Param("bookId") UUID bookId,
                        Pageable pageable);

    /**
     * Rentals whose stored status is overdue, plus active ones already past their due date.
     */
    @EntityGraph(attributePaths = "book")
    @Query("""
        SELECT r FROM Rental r
        WHERE r.status = com.bookstore.rental.model.RentalStatus.OVERDUE
           OR (r.status = com.bookstore.rental.model.RentalStatus.ACTIVE AND r.dueDate < :now)
        """)
    Page<Rental> findOverdue(@Param("now") Instant now, Pageable pageable);

    @Query("""
        SELECT COUNT(r) FROM Rental r
        WHERE r.status = com.bookstore.rental.model.RentalStatus.OVERDUE
           OR (r.status = com.bookstore.rental.model.RentalStatus.ACTIVE AND r.dueDate < :now)
        """)
    long countOverdue(@Param("now") Instant now);

    long countByStatus(RentalStatus status);

    @Query("SELECT COALESCE(SUM(r.lateFee), 0) FROM Rental r")
    BigDecimal sumLateFees();

    @Query("""
        SELECT YEAR(r.rentalDate) AS rentalYear,
               MONTH(r.rentalDate) AS rentalMonth,
               COUNT(r) AS rentalCount
        FROM Rental r
        GROUP BY YEAR(r.rentalDate), MONTH(r.rentalDate)
        ORDER BY YEAR(r.rentalDate) DESC, MONTH(r.rentalDate) DESC
        """)
    List<MonthlyCount> countByMonth(Pageable pageable);

    interface MonthlyCount {
        Integer getRentalYear();
        Integer getRentalMonth();
        Long getRentalCount();
    }
}

package com.bookstore.rental.repository;

import com.bookstore.rental.model.Book;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface BookRepository extends JpaRepository<Book, UUID> {

    @Query("""
        SELECT b FROM Book b
        WHERE b.active = true
          AND (:genre IS NULL OR b.genre = :genre)
          AND (:q IS NULL
               OR LOWER(b.title) LIKE LOWER(CONCAT('%', :q, '%'))
               OR LOWER(b.author) LIKE LOWER(CONCAT('%', :q, '%'))
               OR LOWER(b.genre) LIKE LOWER(CONCAT('%', :q, '%')))
        """)
    Page<Book> search(@Param("genre") String genre, @Param("q") String query, Pageable pageable);

    @Query("""
        SELECT b FROM Book b
        WHERE b.active = true
          AND b.availableCopies > 0
          AND (:genre IS NULL OR b.genre = :genre)
          AND (:q IS NULL
               OR LOWER(b.title) LIKE LOWER(CONCAT('%', :q, '%'))
               OR LOWER(b.author) LIKE LOWER(CONCAT('%', :q, '%')))
        """)
    Page<Book> searchAvailable(@Param("genre") String genre, @Param("q") String query, Pageable pageable);

    Page<Book> findByActiveTrueAndGenre(String genre, Pageable pageable);

    boolean existsByIsbn(String isbn);

    boolean existsByIsbnAndIdNot(String isbn, UUID id);

    @Query("""
        SELECT COUNT(b) AS bookCount,
               COALESCE(SUM(b.totalCopies), 0) AS totalCopies,
               COALESCE(SUM(b.availableCopies), 0) AS availableCopies
        FROM Book b
        WHERE b.active = true
        """)
    CopyTotals totals();

    @Query("""
        SELECT b.genre AS genre,
               COUNT(b) AS bookCount,
               SUM(b.totalCopies) AS totalCopies,
               SUM(b.availableCopies) AS availableCopies
        FROM Book b
        WHERE b.active = true
        GROUP BY b.genre
        ORDER BY COUNT(b) DESC
        """)
    List<GenreTotals> totalsByGenre();

    interface CopyTotals {
        Long getBookCount();
        Long getTotalCopies();
        Long getAvailableCopies();
    }

    interface GenreTotals extends CopyTotals {
        String getGenre();
    }
}

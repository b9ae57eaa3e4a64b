package com.bookstore.rental.service;

import com.bookstore.rental.dto.BookStatsResponse;
import com.bookstore.rental.dto.CreateBookRequest;
import com.bookstore.rental.dto.UpdateBookRequest;
import com.bookstore.rental.exception.ConflictException;
import com.bookstore.rental.exception.ResourceNotFoundException;
import com.bookstore.rental.exception.ValidationFailedException;
import com.bookstore.rental.model.Book;
import com.bookstore.rental.model.Genre;
import com.bookstore.rental.repository.BookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Year;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class BookService {

    private final BookRepository bookRepository;
    private final Clock clock;

    public Page<Book> findAll(Genre genre, String search, Pageable pageable) {
        return bookRepository.search(labelOf(genre), blankToNull(search), pageable);
    }

    public Page<Book> findAvailable(Genre genre, String search, Pageable pageable) {
        return bookRepository.searchAvailable(labelOf(genre), blankToNull(search), pageable);
    }

    public Page<Book> findByGenre(Genre genre, Pageable pageable) {
        return bookRepository.findByActiveTrueAndGenre(genre.getLabel(), pageable);
    }

    public Book findById(UUID id) {
        return bookRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book not found: " + id));
    }

    @Transactional
    public Book create(CreateBookRequest request) {
        if (request.availableCopies() > request.totalCopies()) {
            throw new ValidationFailedException("Available copies cannot exceed total copies");
        }
        checkPublishedYear(request.publishedYear());
        String isbn = blankToNull(request.isbn());
        if (isbn != null && bookRepository.existsByIsbn(isbn)) {
            throw new ConflictException("Book with this ISBN already exists: " + isbn);
        }

        Book book = new Book();
        book.setTitle(request.title().trim());
        book.setAuthor(request.author().trim());
        book.setGenre(request.genre().getLabel());
        book.setIsbn(isbn);
        book.setPublishedYear(request.publishedYear());
        book.setTotalCopies(request.totalCopies());
        book.setAvailableCopies(request.availableCopies());
        book.setDescription(request.description());
        book.setCoverImage(blankToNull(request.coverImage()));

        Book saved = bookRepository.save(book);
        log.info("Book created: bookId={} title='{}' copies={}", saved.getId(), saved.getTitle(), saved.getTotalCopies());
        return saved;
    }

    /**
     * Applies the non-null fields of {@code request}. The available count is checked against the
     * total the book will have after the update; a total lowered below the current available
     * count is absorbed by the clamp on save.
     */
    @Transactional
    public Book update(UUID id, UpdateBookRequest request) {
        Book book = findById(id);

        if (request.isbn() != null) {
            String isbn = blankToNull(request.isbn());
            if (isbn != null && bookRepository.existsByIsbnAndIdNot(isbn, id)) {
                throw new ConflictException("Book with this ISBN already exists: " + isbn);
            }
            book.setIsbn(isbn);
        }

        int effectiveTotal = request.totalCopies() != null ? request.totalCopies() : book.getTotalCopies();
        if (request.availableCopies() != null && request.availableCopies() > effectiveTotal) {
            throw new ValidationFailedException("Available copies cannot exceed total copies");
        }
        checkPublishedYear(request.publishedYear());

        if (request.title() != null) book.setTitle(request.title().trim());
        if (request.author() != null) book.setAuthor(request.author().trim());
        if (request.genre() != null) book.setGenre(request.genre().getLabel());
        if (request.publishedYear() != null) book.setPublishedYear(request.publishedYear());
        if (request.totalCopies() != null) book.setTotalCopies(request.totalCopies());
        if (request.availableCopies() != null) book.setAvailableCopies(request.availableCopies());
        if (request.description() != null) book.setDescription(request.description());
        if (request.coverImage() != null) book.setCoverImage(blankToNull(request.coverImage()));
        if (request.isActive() != null) book.setActive(request.isActive());

        Book saved = bookRepository.save(book);
        log.info("Book updated: bookId={}", saved.getId());
        return saved;
    }

    @Transactional
    public void softDelete(UUID id) {
        Book book = findById(id);
        book.softDelete();
        bookRepository.save(book);
        log.info("Book deactivated: bookId={}", id);
    }

    public BookStatsResponse stats() {
        BookRepository.CopyTotals totals = bookRepository.totals();
        BookStatsResponse.Totals overall = BookStatsResponse.Totals.of(
            valueOf(totals.getBookCount()),
            valueOf(totals.getTotalCopies()),
            valueOf(totals.getAvailableCopies()));

        var byGenre = bookRepository.totalsByGenre().stream()
            .map(g -> new BookStatsResponse.GenreTotals(
                g.getGenre(),
                valueOf(g.getBookCount()),
                valueOf(g.getTotalCopies()),
                valueOf(g.getAvailableCopies())))
            .toList();

        return new BookStatsResponse(overall, byGenre);
    }

    private void checkPublishedYear(Integer publishedYear) {
        if (publishedYear != null && publishedYear > Year.now(clock).getValue()) {
            throw new ValidationFailedException("Published year cannot be in the future");
        }
    }

    private static String labelOf(Genre genre) {
        return genre == null ? null : genre.getLabel();
    }

    private static long valueOf(Long value) {
        return value == null ? 0L : value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

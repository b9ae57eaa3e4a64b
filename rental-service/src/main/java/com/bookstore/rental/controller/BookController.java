package com.bookstore.rental.controller;

import com.bookstore.rental.dto.BookResponse;
import com.bookstore.rental.dto.BookStatsResponse;
import com.bookstore.rental.dto.CreateBookRequest;
import com.bookstore.rental.dto.PageResponse;
import com.bookstore.rental.dto.UpdateBookRequest;
import com.bookstore.rental.exception.ValidationFailedException;
import com.bookstore.rental.model.Genre;
import com.bookstore.rental.service.BookService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/books")
@RequiredArgsConstructor
public class BookController {

    private final BookService bookService;

    @GetMapping
    public ResponseEntity<PageResponse<BookResponse>> listBooks(
            @RequestParam(required = false) String genre,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "false") boolean available,
            @PageableDefault(size = 10, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable) {
        Genre parsed = parseGenre(genre);
        var books = available
            ? bookService.findAvailable(parsed, search, pageable)
            : bookService.findAll(parsed, search, pageable);
        return ResponseEntity.ok(PageResponse.from(books, BookResponse::from));
    }

    @GetMapping("/available")
    public ResponseEntity<PageResponse<BookResponse>> listAvailableBooks(
            @RequestParam(required = false) String genre,
            @RequestParam(required = false) String search,
            @PageableDefault(size = 10, sort = "title") Pageable pageable) {
        return ResponseEntity.ok(PageResponse.from(
            bookService.findAvailable(parseGenre(genre), search, pageable), BookResponse::from));
    }

    @GetMapping("/stats")
    public ResponseEntity<BookStatsResponse> getBookStats() {
        return ResponseEntity.ok(bookService.stats());
    }

    @GetMapping("/genre/{genre}")
    public ResponseEntity<PageResponse<BookResponse>> listBooksByGenre(
            @PathVariable String genre,
            @PageableDefault(size = 10, sort = "title") Pageable pageable) {
        return ResponseEntity.ok(PageResponse.from(
            bookService.findByGenre(parseGenre(genre), pageable), BookResponse::from));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BookResponse> getBook(@PathVariable UUID id) {
        return ResponseEntity.ok(BookResponse.from(bookService.findById(id)));
    }

    @PostMapping
    public ResponseEntity<BookResponse> createBook(@Valid @RequestBody CreateBookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(BookResponse.from(bookService.create(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BookResponse> updateBook(
            @PathVariable UUID id,
            @Valid @RequestBody UpdateBookRequest request) {
        return ResponseEntity.ok(BookResponse.from(bookService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBook(@PathVariable UUID id) {
        bookService.softDelete(id);
        return ResponseEntity.noContent().build();
    }

    private static Genre parseGenre(String genre) {
        if (genre == null || genre.isBlank()) {
            return null;
        }
        return Genre.fromLabel(genre)
            .orElseThrow(() -> new ValidationFailedException("Invalid genre: " + genre));
    }
}

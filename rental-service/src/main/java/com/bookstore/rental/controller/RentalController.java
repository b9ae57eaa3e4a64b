package com.bookstore.rental.controller;

import com.bookstore.rental.dto.PageResponse;
import com.bookstore.rental.dto.RentRequest;
import com.bookstore.rental.dto.RentalResponse;
import com.bookstore.rental.dto.RentalStatsResponse;
import com.bookstore.rental.dto.RentalStatusUpdateRequest;
import com.bookstore.rental.dto.ReturnRequest;
import com.bookstore.rental.exception.ValidationFailedException;
import com.bookstore.rental.model.RentalStatus;
import com.bookstore.rental.service.RentalService;
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
@RequestMapping("/api/rentals")
@RequiredArgsConstructor
public class RentalController {

    private final RentalService rentalService;

    @PostMapping("/rent")
    public ResponseEntity<RentalResponse> rentBook(@Valid @RequestBody RentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(rentalService.rent(request));
    }

    @PostMapping("/return")
    public ResponseEntity<RentalResponse> returnBook(@Valid @RequestBody ReturnRequest request) {
        return ResponseEntity.ok(rentalService.returnBook(request.rentalId(), request.returnDate(), request.notes()));
    }

    @GetMapping
    public ResponseEntity<PageResponse<RentalResponse>> listRentals(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String renterEmail,
            @RequestParam(required = false) UUID bookId,
            @PageableDefault(size = 10, sort = "rentalDate", direction = Sort.Direction.DESC) Pageable pageable) {
        return ResponseEntity.ok(rentalService.findAll(parseStatus(status), renterEmail, bookId, pageable));
    }

    @GetMapping("/stats")
    public ResponseEntity<RentalStatsResponse> getRentalStats() {
        return ResponseEntity.ok(rentalService.stats());
    }

    @GetMapping("/overdue")
    public ResponseEntity<PageResponse<RentalResponse>> listOverdueRentals(
            @PageableDefault(size = 10) Pageable pageable) {
        return ResponseEntity.ok(rentalService.findOverdue(pageable));
    }

    @GetMapping("/renter/{email}")
    public ResponseEntity<PageResponse<RentalResponse>> listRentalsByRenter(
            @PathVariable String email,
            @RequestParam(required = false) String status,
            @PageableDefault(size = 10) Pageable pageable) {
        return ResponseEntity.ok(rentalService.findByRenter(email, parseStatus(status), pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RentalResponse> getRental(@PathVariable UUID id) {
        return ResponseEntity.ok(rentalService.findById(id));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<RentalResponse> updateRentalStatus(
            @PathVariable UUID id,
            @Valid @RequestBody RentalStatusUpdateRequest request) {
        return ResponseEntity.ok(rentalService.updateStatus(id, request.status(), request.notes()));
    }

    private static RentalStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        return RentalStatus.fromValue(status)
            .orElseThrow(() -> new ValidationFailedException("Invalid status filter: " + status));
    }
}

package com.bookstore.rental.controller;

import com.bookstore.rental.dto.PageResponse;
import com.bookstore.rental.dto.RentRequest;
import com.bookstore.rental.dto.RentalResponse;
import com.bookstore.rental.exception.BusinessException;
import com.bookstore.rental.exception.ConflictException;
import com.bookstore.rental.exception.GlobalExceptionHandler;
import com.bookstore.rental.exception.InvalidTransitionException;
import com.bookstore.rental.exception.InvariantViolationException;
import com.bookstore.rental.exception.ResourceNotFoundException;
import com.bookstore.rental.exception.ValidationFailedException;
import com.bookstore.rental.model.RentalStatus;
import com.bookstore.rental.service.RentalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.web.PageableHandlerMethodArgumentResolver;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class RentalControllerTest {

    private static final UUID BOOK_ID = UUID.fromString("3f2c8a4e-7d1b-4c9a-9e55-0b6a1f2d3c4e");
    private static final UUID RENTAL_ID = UUID.fromString("8a1d0c6b-2e4f-4b7a-8c3d-9f0e1a2b3c4d");

    @Mock
    private RentalService rentalService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        PageableHandlerMethodArgumentResolver pageableResolver = new PageableHandlerMethodArgumentResolver();
        pageableResolver.setOneIndexedParameters(true);
        mockMvc = MockMvcBuilders.standaloneSetup(new RentalController(rentalService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .setCustomArgumentResolvers(pageableResolver)
            .build();
    }

    private static RentalResponse response(RentalStatus status, RentalStatus effective, long daysOverdue) {
        return new RentalResponse(
            RENTAL_ID,
            new RentalResponse.BookSummary(BOOK_ID, "Kindred", "Octavia E. Butler", "Science Fiction"),
            "Dana Franklin",
            "dana@example.com",
            null,
            Instant.parse("2026-05-01T10:00:00Z"),
            Instant.parse("2026-05-08T10:00:00Z"),
            null,
            status,
            effective,
            daysOverdue,
            effective == RentalStatus.OVERDUE && status == RentalStatus.ACTIVE,
            3,
            BigDecimal.ZERO,
            null);
    }

    private static final String RENT_BODY = """
        {
          "bookId": "3f2c8a4e-7d1b-4c9a-9e55-0b6a1f2d3c4e",
          "renterName": "Dana Franklin",
          "renterEmail": "dana@example.com",
          "dueDate": "2026-05-08T10:00:00Z"
        }
        """;

    @Test
    void rent_returnsCreatedRental() throws Exception {
        when(rentalService.rent(any(RentRequest.class))).thenReturn(response(RentalStatus.ACTIVE, RentalStatus.ACTIVE, 0));

        mockMvc.perform(post("/api/rentals/rent").contentType(MediaType.APPLICATION_JSON).content(RENT_BODY))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(RENTAL_ID.toString()))
            .andExpect(jsonPath("$.status").value("active"))
            .andExpect(jsonPath("$.book.title").value("Kindred"))
            .andExpect(jsonPath("$.isOverdue").value(false));
    }

    @Test
    void rent_missingRenterName_isBadRequestWithoutCallingService() throws Exception {
        String body = """
            {"bookId": "3f2c8a4e-7d1b-4c9a-9e55-0b6a1f2d3c4e", "renterEmail": "dana@example.com",
             "dueDate": "2026-05-08T10:00:00Z"}
            """;

        mockMvc.perform(post("/api/rentals/rent").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(rentalService);
    }

    @Test
    void rent_phoneLongerThanColumn_isBadRequestWithoutCallingService() throws Exception {
        String body = """
            {"bookId": "3f2c8a4e-7d1b-4c9a-9e55-0b6a1f2d3c4e", "renterName": "Dana Franklin",
             "renterEmail": "dana@example.com", "renterPhone": "+1 (555) 010-2030 555 010 2030 555 010 2030",
             "dueDate": "2026-05-08T10:00:00Z"}
            """;

        mockMvc.perform(post("/api/rentals/rent").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(rentalService);
    }

    @Test
    void rent_unknownBook_isNotFound() throws Exception {
        when(rentalService.rent(any(RentRequest.class)))
            .thenThrow(new ResourceNotFoundException("Book not found: " + BOOK_ID));

        mockMvc.perform(post("/api/rentals/rent").contentType(MediaType.APPLICATION_JSON).content(RENT_BODY))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.detail").value("Book not found: " + BOOK_ID));
    }

    @Test
    void rent_noCopies_isBadRequest() throws Exception {
        when(rentalService.rent(any(RentRequest.class)))
            .thenThrow(new BusinessException("Book is not available for rental: " + BOOK_ID));

        mockMvc.perform(post("/api/rentals/rent").contentType(MediaType.APPLICATION_JSON).content(RENT_BODY))
            .andExpect(status().isBadRequest());
    }

    @Test
    void rent_duplicate_isConflict() throws Exception {
        when(rentalService.rent(any(RentRequest.class)))
            .thenThrow(new ConflictException("Renter already has an active rental for this book"));

        mockMvc.perform(post("/api/rentals/rent").contentType(MediaType.APPLICATION_JSON).content(RENT_BODY))
            .andExpect(status().isConflict());
    }

    @Test
    void rent_dueDateNotAfterNow_isBadRequest() throws Exception {
        when(rentalService.rent(any(RentRequest.class)))
            .thenThrow(new ValidationFailedException("Due date must be after rental date"));

        mockMvc.perform(post("/api/rentals/rent").contentType(MediaType.APPLICATION_JSON).content(RENT_BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("Due date must be after rental date"));
    }

    @Test
    void returnBook_passesOptionalReturnDate() throws Exception {
        RentalResponse returned = response(RentalStatus.RETURNED, RentalStatus.RETURNED, 0);
        when(rentalService.returnBook(RENTAL_ID, null, "left in drop box")).thenReturn(returned);

        mockMvc.perform(post("/api/rentals/return").contentType(MediaType.APPLICATION_JSON)
                .content("{\"rentalId\": \"" + RENTAL_ID + "\", \"notes\": \"left in drop box\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("returned"));
    }

    @Test
    void returnBook_inconsistentLedger_isServerError() throws Exception {
        when(rentalService.returnBook(eq(RENTAL_ID), isNull(), isNull()))
            .thenThrow(new InvariantViolationException("Rental was returned but book already has all copies available",
                new BusinessException("All copies are already available")));

        mockMvc.perform(post("/api/rentals/return").contentType(MediaType.APPLICATION_JSON)
                .content("{\"rentalId\": \"" + RENTAL_ID + "\"}"))
            .andExpect(status().isInternalServerError());
    }

    @Test
    void getRental_reportsDerivedOverdueNextToStoredStatus() throws Exception {
        when(rentalService.findById(RENTAL_ID)).thenReturn(response(RentalStatus.ACTIVE, RentalStatus.OVERDUE, 2));

        mockMvc.perform(get("/api/rentals/{id}", RENTAL_ID))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("active"))
            .andExpect(jsonPath("$.effectiveStatus").value("overdue"))
            .andExpect(jsonPath("$.daysOverdue").value(2))
            .andExpect(jsonPath("$.isOverdue").value(true));
    }

    @Test
    void getRental_malformedId_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/rentals/{id}", "not-a-uuid"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(rentalService);
    }

    @Test
    void listRentals_parsesStatusFilter() throws Exception {
        PageResponse<RentalResponse> page = new PageResponse<>(List.of(),
            new PageResponse.Pagination(1, 0, 0, 10, false, false));
        when(rentalService.findAll(eq(RentalStatus.OVERDUE), eq("dana@example.com"), isNull(), any())).thenReturn(page);

        mockMvc.perform(get("/api/rentals").param("status", "overdue").param("renterEmail", "dana@example.com"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pagination.currentPage").value(1));
    }

    @Test
    void listRentals_unknownStatus_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/rentals").param("status", "lost"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(rentalService);
    }

    @Test
    void updateStatus_fromReturned_isBadRequest() throws Exception {
        when(rentalService.updateStatus(RENTAL_ID, RentalStatus.ACTIVE, null))
            .thenThrow(new InvalidTransitionException(RentalStatus.RETURNED, RentalStatus.ACTIVE));

        mockMvc.perform(put("/api/rentals/{id}/status", RENTAL_ID).contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"active\"}"))
            .andExpect(status().isBadRequest());
        verify(rentalService).updateStatus(RENTAL_ID, RentalStatus.ACTIVE, null);
    }

    @Test
    void updateStatus_unknownValue_isBadRequest() throws Exception {
        mockMvc.perform(put("/api/rentals/{id}/status", RENTAL_ID).contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"lost\"}"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(rentalService);
    }
}

package com.bookstore.rental.dto;

import java.math.BigDecimal;
import java.util.List;

public record RentalStatsResponse(Totals overall, List<MonthlyCount> monthly) {

    public record Totals(
        long totalRentals,
        long activeRentals,
        long returnedRentals,
        long overdueRentals,
        BigDecimal totalLateFees
    ) {}

    public record MonthlyCount(int year, int month, long count) {}
}

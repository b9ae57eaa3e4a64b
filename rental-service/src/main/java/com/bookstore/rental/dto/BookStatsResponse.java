package com.bookstore.rental.dto;

import java.util.List;

public record BookStatsResponse(Totals overall, List<GenreTotals> byGenre) {

    public record Totals(long totalBooks, long totalCopies, long availableCopies, long rentedCopies) {
        public static Totals of(long totalBooks, long totalCopies, long availableCopies) {
            return new Totals(totalBooks, totalCopies, availableCopies, totalCopies - availableCopies);
        }
    }

    public record GenreTotals(String genre, long count, long totalCopies, long availableCopies) {}
}

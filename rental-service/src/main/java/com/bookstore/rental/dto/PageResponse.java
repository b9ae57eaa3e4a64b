package com.bookstore.rental.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Paged listing body. {@code currentPage} is 1-based.
 */
public record PageResponse<T>(List<T> items, Pagination pagination) {

    public record Pagination(
        int currentPage,
        int totalPages,
        long totalItems,
        int itemsPerPage,
        boolean hasNextPage,
        boolean hasPrevPage
    ) {}

    public static <E, T> PageResponse<T> from(Page<E> page, Function<? super E, T> mapper) {
        List<T> items = page.getContent().stream().<T>map(mapper).toList();
        Pagination pagination = new Pagination(
            page.getNumber() + 1,
            page.getTotalPages(),
            page.getTotalElements(),
            page.getSize(),
            page.hasNext(),
            page.hasPrevious());
        return new PageResponse<>(items, pagination);
    }
}

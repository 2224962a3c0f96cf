package com.campaign.canon.api;

import java.util.List;

/**
 * A page of results from a paginated read.
 *
 * @param content       the content of this page
 * @param totalElements total number of elements across all pages
 * @param pageNumber    the current page number (0-based)
 * @param pageSize      the requested page size
 * @param <T>           the element type
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    /**
     * Cuts the page described by {@code request} out of an already ordered list.
     */
    public static <T> Page<T> slice(List<T> ordered, PageRequest request) {
        int total = ordered.size();
        int from = Math.min(request.offset(), total);
        int to = Math.min(request.offset() + request.limit(), total);
        return new Page<>(ordered.subList(from, to), total, request.pageNumber(), request.limit());
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int numberOfElements() {
        return content.size();
    }
}

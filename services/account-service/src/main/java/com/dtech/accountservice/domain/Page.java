package com.dtech.accountservice.domain;

import java.util.List;

/**
 * One slice of a sorted result together with the size of the whole result.
 */
public record Page<T>(List<T> items, long total) {

    public Page {
        items = List.copyOf(items);
    }

    /**
     * Cuts {@code [offset, offset + limit)} out of {@code all}. Negative arguments fall back to
     * offset 0 and limit 10.
     */
    public static <T> Page<T> slice(List<T> all, int offset, int limit) {
        int from = offset < 0 ? 0 : Math.min(offset, all.size());
        int size = limit < 0 ? 10 : limit;
        int to = (int) Math.min((long) from + size, all.size());
        return new Page<>(all.subList(from, to), all.size());
    }
}

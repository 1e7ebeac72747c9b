package com.bbthechange.rehearsalsync.util;

import java.util.ArrayList;
import java.util.List;

public final class Batches {

    private Batches() {
    }

    /**
     * Split a list into consecutive chunks of at most {@code size} elements.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + size);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            batches.add(List.copyOf(items.subList(i, Math.min(i + size, items.size()))));
        }
        return batches;
    }
}

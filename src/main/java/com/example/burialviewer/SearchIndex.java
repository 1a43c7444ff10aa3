package com.example.burialviewer;

import java.util.Locale;
import java.util.OptionalInt;

public final class SearchIndex {
    private SearchIndex() {
    }

    /**
     * Linear scan for the first row whose distance text contains {@code query}, ignoring case and
     * surrounding whitespace. A blank query never matches.
     *
     * @return the row index in display order, or empty when nothing matches
     */
    public static OptionalInt find(DenseSeries series, String query) {
        if (query == null) return OptionalInt.empty();
        String needle = query.strip().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) return OptionalInt.empty();

        for (int i = 0; i < series.size(); i++) {
            String label = series.get(i).getXLabel().toLowerCase(Locale.ROOT);
            if (label.contains(needle)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}

package com.task.tablescan.reconstruct;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

final class Medians {

    private Medians() {
    }

    /**
     * Median of an ascending list; the mean of the two middle values for an even count.
     * Values are widened to {@code long} before they are summed.
     */
    static OptionalDouble ofSorted(List<? extends Number> sorted) {
        int n = sorted.size();
        if (n == 0) {
            return OptionalDouble.empty();
        }
        if (n % 2 == 1) {
            return OptionalDouble.of(sorted.get(n / 2).longValue());
        }
        return OptionalDouble.of((sorted.get(n / 2 - 1).longValue() + sorted.get(n / 2).longValue()) / 2.0);
    }

    static List<Long> consecutiveGaps(List<Integer> sorted) {
        List<Long> gaps = new ArrayList<>(Math.max(0, sorted.size() - 1));
        for (int i = 0; i + 1 < sorted.size(); i++) {
            gaps.add((long) sorted.get(i + 1) - sorted.get(i));
        }
        gaps.sort(null);
        return gaps;
    }
}

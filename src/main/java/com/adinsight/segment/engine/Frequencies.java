package com.adinsight.segment.engine;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Most-frequent-value lookups shared by the analyzers.
 */
public final class Frequencies {

    private Frequencies() {}

    /**
     * Returns the most frequent key, or null for an empty collection.
     * On equal counts the key seen first wins.
     */
    public static <T, K> K mostFrequent(Collection<T> items, Function<T, K> keyFn) {
        Map<K, Integer> counts = new LinkedHashMap<>();
        for (T item : items) {
            counts.merge(keyFn.apply(item), 1, Integer::sum);
        }

        K best = null;
        int bestCount = 0;
        for (Map.Entry<K, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    public static double mean(double sum, int count) {
        return count > 0 ? sum / count : 0.0;
    }
}

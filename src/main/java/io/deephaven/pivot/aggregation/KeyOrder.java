package io.deephaven.pivot.aggregation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * The order in which row keys or column keys appear in a pivot result. Rows and columns are ordered independently.
 */
public enum KeyOrder {
    /**
     * The order in which the keys first appeared in the input.
     */
    INDEX,
    /**
     * Lexicographic order of the key text.
     */
    ASCENDING,
    /**
     * Reverse lexicographic order of the key text.
     */
    DESCENDING;

    /**
     * Arranges keys in this order.
     *
     * @param keys The keys, in first-seen order.
     * @return A new list holding the keys in this order.
     */
    public List<String> arrange(final Collection<String> keys) {
        final List<String> result = new ArrayList<>(keys);
        switch (this) {
            case ASCENDING:
                result.sort(Comparator.naturalOrder());
                break;
            case DESCENDING:
                result.sort(Comparator.reverseOrder());
                break;
            default:
                break;
        }
        return result;
    }
}

package io.deephaven.pivot.util;

import java.util.Collection;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Helpers for building human-readable error messages. */
public class Renderer {
    /**
     * Renders the items as a comma-separated list.
     *
     * @param items The items.
     * @return The rendered list.
     */
    public static <T> String renderList(Collection<T> items) {
        return renderList(items, ", ", Object::toString);
    }

    /**
     * Renders the items, each transformed by {@code renderer}, separated by {@code separator}.
     *
     * @param items The items.
     * @param separator The separator.
     * @param renderer The function converting each item into text.
     * @return The rendered list.
     */
    public static <T> String renderList(Collection<T> items, String separator, Function<T, String> renderer) {
        return items.stream().map(renderer).collect(Collectors.joining(separator));
    }
}

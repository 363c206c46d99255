package com.libragraph.framekit.util.collection;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Order-preserving insertion into lists that are already sorted.
 *
 * <p>None of these methods check that the list is actually sorted under the
 * comparison rule in use; on an unsorted list the resulting position is unspecified.
 */
public final class SortedLists {

    private SortedLists() {
    }

    /**
     * Inserts {@code item} into a list sorted by natural ordering.
     *
     * @return the index at which the item was inserted
     */
    public static <T extends Comparable<? super T>> int insert(List<T> list, T item) {
        return insert(list, item, null);
    }

    /**
     * Inserts {@code item} into a list sorted by {@code comparator}.
     * If an equal element is hit by the search, the item goes in front of it;
     * which element of a run of equal ones is hit is not specified.
     *
     * @param comparator ordering of the list, or {@code null} for natural ordering
     * @return the index at which the item was inserted
     */
    public static <T> int insert(List<T> list, T item, Comparator<? super T> comparator) {
        int index = search(list, item, comparator).index();
        list.add(index, item);
        return index;
    }

    /**
     * Binary-searches {@code list} for {@code item}.
     *
     * @param comparator ordering of the list, or {@code null} for natural ordering
     */
    public static <T> SearchOutcome search(List<? extends T> list, T item, Comparator<? super T> comparator) {
        Objects.requireNonNull(list, "list cannot be null");

        int result = Collections.binarySearch(list, item, comparator);
        if (result >= 0) {
            return SearchOutcome.found(result);
        }
        return SearchOutcome.absent(-(result + 1));
    }
}

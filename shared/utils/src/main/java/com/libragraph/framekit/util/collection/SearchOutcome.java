package com.libragraph.framekit.util.collection;

/**
 * Result of a binary search over a sorted list.
 *
 * <p>Either an equal element was found, or the search ended at the position
 * where the item would have to be inserted to keep the list sorted.
 */
public sealed interface SearchOutcome {

    record Found(int index) implements SearchOutcome {}

    record Absent(int insertionPoint) implements SearchOutcome {
        @Override
        public int index() {
            return insertionPoint;
        }
    }

    static SearchOutcome found(int index) {
        return new Found(index);
    }

    static SearchOutcome absent(int insertionPoint) {
        return new Absent(insertionPoint);
    }

    /**
     * Index at which the searched item can be inserted without breaking order.
     */
    int index();

    default boolean isFound() {
        return this instanceof Found;
    }
}

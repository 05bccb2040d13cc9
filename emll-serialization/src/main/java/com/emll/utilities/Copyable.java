package com.emll.utilities;

/**
 * Capability of a mutable value to produce an independent deep copy of itself.
 * {@link Variant#copy()} uses it for held values that are neither immutable nor arrays.
 *
 * @param <T> Type of the copy
 */
public interface Copyable<T> {
    /**
     * Create a deep copy of this value.
     *
     * @return A copy that shares no mutable state with this value
     */
    T copy();
}

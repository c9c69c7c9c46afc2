/*
 * Copyright 2026 The Arrayslice Project
 *
 * The Arrayslice Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.arrayslice.collection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Creates new {@link ImmutableSlice}s by copying arrays, collections and other iterables, or by combining
 * existing ones.
 * <p>
 * Every factory copies its input, except when the input already is an {@link ImmutableSlice}: slices never change,
 * so their storage is shared instead. The copy is done with the cheapest access the input supports, see
 * {@link #copyOf(Iterable)}.
 *
 * <h3>Creating a slice from individual elements</h3>
 * <pre>
 * import static io.arrayslice.collection.{@link Slices}.*;
 *
 * {@link ImmutableSlice}&lt;String&gt; a = of("a", "b", "c");
 * {@link ImmutableSlice}&lt;String&gt; b = copyOf(list);
 * {@link ImmutableSlice}&lt;String&gt; c = concat(a, b);
 * </pre>
 */
public final class Slices {

    /**
     * Returns the empty slice.
     */
    public static <T> ImmutableSlice<T> empty() {
        return ImmutableSlice.empty();
    }

    /**
     * Creates a new slice holding the given elements.
     */
    @SafeVarargs
    public static <T> ImmutableSlice<T> of(T... elements) {
        return copyOf(elements);
    }

    /**
     * Creates a new slice whose content is a copy of {@code array}.
     */
    public static <T> ImmutableSlice<T> copyOf(T[] array) {
        checkNotNull(array, "array");
        return copyOf(array, 0, array.length);
    }

    /**
     * Creates a new slice whose content is a copy of {@code array[offset : offset + length]}.
     *
     * @throws IndexOutOfBoundsException if {@code offset} is not in {@code [0, array.length]}, or the requested
     *         window extends past the end of the array
     */
    public static <T> ImmutableSlice<T> copyOf(T[] array, int offset, int length) {
        return SliceSource.of(array, offset, length).toSlice();
    }

    /**
     * Creates a new slice whose content is a copy of the part of {@code array} selected by {@code range}.
     */
    public static <T> ImmutableSlice<T> copyOf(T[] array, Range range) {
        checkNotNull(array, "array");
        return SliceSource.of(array, 0, array.length).toSlice(range);
    }

    /**
     * Creates a new slice holding the elements of {@code source}.
     * <ul>
     * <li>An {@link ImmutableSlice} is returned as is.</li>
     * <li>A {@link java.util.RandomAccess} {@link List} is copied by index into an array of its exact size.</li>
     * <li>Any other {@link java.util.Collection} is copied into an array of its exact size.</li>
     * <li>Any other {@link Iterable} is read once into a growing array.</li>
     * </ul>
     */
    public static <T> ImmutableSlice<T> copyOf(Iterable<? extends T> source) {
        return SliceSource.<T>of(source).toSlice();
    }

    /**
     * Creates a new slice holding {@code length} elements of {@code source}, starting at {@code offset}. A plain
     * {@link Iterable} is read only as far as the requested window.
     *
     * @throws IndexOutOfBoundsException if {@code offset} is past the end of {@code source}, or the requested
     *         window extends past its end
     * @throws InconsistentSequenceException if {@code source} yields a different number of elements each time it is
     *         enumerated
     */
    public static <T> ImmutableSlice<T> copyOf(Iterable<? extends T> source, int offset, int length) {
        return SliceSource.<T>of(source).toSlice(offset, length);
    }

    /**
     * Creates a new slice holding the part of {@code source} selected by {@code range}. A range measured from the
     * end of a plain {@link Iterable} requires enumerating it once to learn its length.
     */
    public static <T> ImmutableSlice<T> copyOf(Iterable<? extends T> source, Range range) {
        return SliceSource.<T>of(source).toSlice(range);
    }

    /**
     * Creates a new slice holding the elements of all {@code sources}, in order.
     */
    @SafeVarargs
    public static <T> ImmutableSlice<T> concat(Iterable<? extends T>... sources) {
        checkNotNull(sources, "sources");
        return concat(Arrays.asList(sources));
    }

    /**
     * Creates a new slice holding the elements of all {@code sources}, in order. Each source is copied directly into
     * a single array of the combined length.
     *
     * @throws IllegalArgumentException if the combined length does not fit in an array
     */
    public static <T> ImmutableSlice<T> concat(List<? extends Iterable<? extends T>> sources) {
        checkNotNull(sources, "sources");
        int count = sources.size();
        switch (count) {
        case 0:
            return empty();
        case 1:
            return copyOf(sources.get(0));
        default:
            break;
        }

        List<SliceSource<T>> resolved = new ArrayList<SliceSource<T>>(count);
        int length = 0;
        for (int i = 0; i < count; i ++) {
            SliceSource<T> source = SliceSource.of(sources.get(i));
            length = SliceUtil.checkTotalLength(length, source.length());
            resolved.add(source);
        }
        if (length == 0) {
            return empty();
        }

        Object[] array = new Object[length];
        int destOffset = 0;
        for (SliceSource<T> source: resolved) {
            source.copyTo(array, destOffset);
            destOffset += source.length();
        }
        return ImmutableSlice.adopt(array);
    }

    /**
     * Creates a new slice holding the elements of all {@code sources} with {@code delimiter} between each adjacent
     * pair.
     */
    public static <T> ImmutableSlice<T> join(T delimiter, List<? extends Iterable<? extends T>> sources) {
        return joinWith(of(delimiter), sources);
    }

    /**
     * Creates a new slice holding the elements of all {@code sources} with the elements of {@code delimiter}
     * between each adjacent pair. An empty {@code delimiter} behaves like {@link #concat(List)}.
     */
    public static <T> ImmutableSlice<T> joinWith(Iterable<? extends T> delimiter,
                                                 List<? extends Iterable<? extends T>> sources) {
        checkNotNull(sources, "sources");
        ImmutableSlice<? extends T> separator = copyOf(delimiter);
        int count = sources.size();
        if (count == 0) {
            return empty();
        }
        if (count == 1) {
            return copyOf(sources.get(0));
        }
        if (separator.isEmpty()) {
            return concat(sources);
        }

        List<Iterable<? extends T>> parts = new ArrayList<Iterable<? extends T>>(count * 2 - 1);
        for (int i = 0; i < count; i ++) {
            if (i > 0) {
                parts.add(separator);
            }
            parts.add(sources.get(i));
        }
        return concat(parts);
    }

    /**
     * Returns {@code slice} typed as a slice of a supertype of its elements. No copy is made: a slice cannot be
     * written to, so the widened view is safe.
     */
    @SuppressWarnings("unchecked")
    public static <T> ImmutableSlice<T> upcast(ImmutableSlice<? extends T> slice) {
        return (ImmutableSlice<T>) checkNotNull(slice, "slice");
    }

    private Slices() {
        // Unused
    }
}

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

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.RandomAccess;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A source of elements for a new {@link ImmutableSlice}, classified once by what it can do cheaply.
 * <p>
 * Every operation that produces a new, larger slice (construction, append, insert, concatenation) resolves its
 * inputs to a {@link SliceSource} and then lets the source copy itself into a destination array it did not
 * allocate. The fastest copy each kind of source supports is used:
 * <ul>
 * <li>{@link ArraySource} and {@link SliceBackedSource}: {@link System#arraycopy}</li>
 * <li>{@link RandomAccessSource}: indexed copy through {@link List#get(int)}</li>
 * <li>{@link CollectionSource}: one iterator pass of a known length</li>
 * <li>{@link SequenceSource}: one pass to count and one pass to copy; the two passes must agree</li>
 * </ul>
 */
abstract class SliceSource<T> {

    /**
     * Classifies the given source.
     */
    @SuppressWarnings("unchecked")
    static <T> SliceSource<T> of(Iterable<? extends T> source) {
        checkNotNull(source, "source");
        if (source instanceof ImmutableSlice) {
            return new SliceBackedSource<T>((ImmutableSlice<? extends T>) source);
        }
        if (source instanceof List && source instanceof RandomAccess) {
            return new RandomAccessSource<T>((List<? extends T>) source);
        }
        if (source instanceof Collection) {
            return new CollectionSource<T>((Collection<? extends T>) source);
        }
        return new SequenceSource<T>(source);
    }

    /**
     * Returns a source over the {@code [offset, offset + length)} window of the given array.
     */
    static <T> SliceSource<T> of(T[] array, int offset, int length) {
        checkNotNull(array, "array");
        SliceUtil.checkSourceRange(offset, length, array.length);
        return new ArraySource<T>(array, offset, length);
    }

    /**
     * The number of elements this source will copy.
     */
    abstract int length();

    /**
     * Copies all {@link #length()} elements into {@code dest}, starting at {@code destOffset}.
     */
    abstract void copyTo(Object[] dest, int destOffset);

    /**
     * Copies {@code [offset, offset + length)} of this source into a new slice. The range has been validated.
     */
    abstract ImmutableSlice<T> copyRange(int offset, int length);

    /**
     * Returns a slice holding every element of this source.
     */
    ImmutableSlice<T> toSlice() {
        int length = length();
        if (length == 0) {
            return ImmutableSlice.empty();
        }
        Object[] copy = new Object[length];
        copyTo(copy, 0);
        return ImmutableSlice.adopt(copy);
    }

    ImmutableSlice<T> toSlice(int offset, int length) {
        SliceUtil.checkSourceRange(offset, length, length());
        return copyRange(offset, length);
    }

    ImmutableSlice<T> toSlice(Range range) {
        checkNotNull(range, "range");
        if (range.isAll()) {
            return toSlice();
        }
        int sourceLength = length();
        return copyRange(range.offset(sourceLength), range.length(sourceLength));
    }

    /**
     * Allocates an array of {@code length() + extraLength} elements and copies this source into it at
     * {@code destOffset}. The caller fills the remaining {@code extraLength} slots.
     */
    final Object[] allocateAndCopy(int destOffset, int extraLength) {
        Object[] dest = new Object[SliceUtil.checkTotalLength(length(), extraLength)];
        copyTo(dest, destOffset);
        return dest;
    }

    /**
     * A window over an array the caller still owns.
     */
    static final class ArraySource<T> extends SliceSource<T> {
        private final T[] array;
        private final int offset;
        private final int length;

        ArraySource(T[] array, int offset, int length) {
            this.array = array;
            this.offset = offset;
            this.length = length;
        }

        @Override
        int length() {
            return length;
        }

        @Override
        void copyTo(Object[] dest, int destOffset) {
            System.arraycopy(array, offset, dest, destOffset, length);
        }

        @Override
        ImmutableSlice<T> copyRange(int offset, int length) {
            if (length == 0) {
                return ImmutableSlice.empty();
            }
            int start = this.offset + offset;
            return ImmutableSlice.adopt(Arrays.copyOfRange(array, start, start + length, Object[].class));
        }
    }

    /**
     * An existing slice. Its array is immutable, so building a slice from it never copies.
     */
    static final class SliceBackedSource<T> extends SliceSource<T> {
        private final ImmutableSlice<T> slice;

        SliceBackedSource(ImmutableSlice<? extends T> slice) {
            this.slice = Slices.upcast(slice);
        }

        @Override
        int length() {
            return slice.length();
        }

        @Override
        void copyTo(Object[] dest, int destOffset) {
            slice.copyInto(dest, destOffset);
        }

        @Override
        ImmutableSlice<T> toSlice() {
            return slice;
        }

        @Override
        ImmutableSlice<T> copyRange(int offset, int length) {
            return slice.slice(offset, length);
        }
    }

    /**
     * A collection whose size is known up front.
     */
    static class CollectionSource<T> extends SliceSource<T> {
        final Collection<? extends T> collection;

        CollectionSource(Collection<? extends T> collection) {
            this.collection = collection;
        }

        @Override
        final int length() {
            return collection.size();
        }

        @Override
        ImmutableSlice<T> toSlice() {
            Object[] copy = collection.toArray();
            if (copy.length == 0) {
                return ImmutableSlice.empty();
            }
            if (copy.getClass() != Object[].class) {
                copy = Arrays.copyOf(copy, copy.length, Object[].class);
            }
            return ImmutableSlice.adopt(copy);
        }

        @Override
        void copyTo(Object[] dest, int destOffset) {
            int length = length();
            Iterator<? extends T> i = collection.iterator();
            for (int n = 0; n < length; n ++) {
                if (!i.hasNext()) {
                    throw SliceUtil.inconsistentSequence(collection, length, n);
                }
                dest[destOffset + n] = i.next();
            }
            if (i.hasNext()) {
                throw SliceUtil.inconsistentSequence(collection, length, length + 1);
            }
        }

        @Override
        ImmutableSlice<T> copyRange(int offset, int length) {
            if (offset == 0 && length == length()) {
                return toSlice();
            }
            if (length == 0) {
                return ImmutableSlice.empty();
            }
            Iterator<? extends T> i = collection.iterator();
            for (int n = 0; n < offset; n ++) {
                if (!i.hasNext()) {
                    throw SliceUtil.inconsistentSequence(collection, length(), n);
                }
                i.next();
            }
            Object[] copy = new Object[length];
            for (int n = 0; n < length; n ++) {
                if (!i.hasNext()) {
                    throw SliceUtil.inconsistentSequence(collection, length(), offset + n);
                }
                copy[n] = i.next();
            }
            return ImmutableSlice.adopt(copy);
        }
    }

    /**
     * A list with constant-time positional access. Copies never touch its iterator.
     */
    static final class RandomAccessSource<T> extends CollectionSource<T> {

        RandomAccessSource(List<? extends T> list) {
            super(list);
        }

        private List<? extends T> list() {
            return (List<? extends T>) collection;
        }

        @Override
        void copyTo(Object[] dest, int destOffset) {
            List<? extends T> list = list();
            for (int i = 0, length = list.size(); i < length; i ++) {
                dest[destOffset + i] = list.get(i);
            }
        }

        @Override
        ImmutableSlice<T> copyRange(int offset, int length) {
            if (offset == 0 && length == length()) {
                return toSlice();
            }
            if (length == 0) {
                return ImmutableSlice.empty();
            }
            List<? extends T> list = list();
            Object[] copy = new Object[length];
            for (int i = 0; i < length; i ++) {
                copy[i] = list.get(offset + i);
            }
            return ImmutableSlice.adopt(copy);
        }
    }

    /**
     * Any other {@link Iterable}. Its length is unknown until it has been enumerated once, and nothing guarantees
     * that a second enumeration yields the same elements, so every copy verifies the length it observed.
     */
    static final class SequenceSource<T> extends SliceSource<T> {
        private static final int INITIAL_CAPACITY = 16;

        private final Iterable<? extends T> sequence;
        private int length = -1;

        SequenceSource(Iterable<? extends T> sequence) {
            this.sequence = sequence;
        }

        @Override
        int length() {
            if (length < 0) {
                int count = 0;
                for (Iterator<? extends T> i = sequence.iterator(); i.hasNext(); i.next()) {
                    count ++;
                }
                length = count;
            }
            return length;
        }

        @Override
        void copyTo(Object[] dest, int destOffset) {
            int length = length();
            Iterator<? extends T> i = sequence.iterator();
            for (int n = 0; n < length; n ++) {
                if (!i.hasNext()) {
                    throw SliceUtil.inconsistentSequence(sequence, length, n);
                }
                dest[destOffset + n] = i.next();
            }
            if (i.hasNext()) {
                throw SliceUtil.inconsistentSequence(sequence, length, length + 1);
            }
        }

        /**
         * Materializes the sequence in a single pass, growing the destination as needed.
         */
        @Override
        ImmutableSlice<T> toSlice() {
            Iterator<? extends T> i = sequence.iterator();
            if (!i.hasNext()) {
                return ImmutableSlice.empty();
            }
            Object[] copy = new Object[INITIAL_CAPACITY];
            int count = 0;
            while (i.hasNext()) {
                if (count == copy.length) {
                    copy = Arrays.copyOf(copy, SliceUtil.checkTotalLength(count, Math.max(1, count >>> 1)));
                }
                copy[count ++] = i.next();
            }
            length = count;
            return ImmutableSlice.adopt(count == copy.length ? copy : Arrays.copyOf(copy, count));
        }

        /**
         * Copies an absolute range in a single pass that stops as soon as the range has been read.
         */
        @Override
        ImmutableSlice<T> toSlice(int offset, int length) {
            if (offset < 0) {
                throw new IndexOutOfBoundsException("offset: " + offset + " (expected: >= 0)");
            }
            if (length < 0) {
                throw new IndexOutOfBoundsException("length: " + length + " (expected: >= 0)");
            }
            return copyRange(offset, length);
        }

        @Override
        ImmutableSlice<T> toSlice(Range range) {
            checkNotNull(range, "range");
            if (range.isAll()) {
                return toSlice();
            }
            if (range.isBoundedFromStart()) {
                if (range.end() < range.start()) {
                    throw new IndexOutOfBoundsException("range: " + range + " (expected: start <= end)");
                }
                return copyRange(range.start(), range.end() - range.start());
            }
            return super.toSlice(range);
        }

        /**
         * Copies {@code [offset, offset + length)}. When the sequence has not been counted yet, running out early
         * means the request was out of range; once it has been counted, it means the sequence changed.
         */
        @Override
        ImmutableSlice<T> copyRange(int offset, int length) {
            Iterator<? extends T> i = sequence.iterator();
            for (int n = 0; n < offset; n ++) {
                if (!i.hasNext()) {
                    throw exhausted(offset, length, n);
                }
                i.next();
            }
            if (length == 0) {
                return ImmutableSlice.empty();
            }
            // The source may be shorter than length.
            Object[] copy = new Object[Math.min(length, INITIAL_CAPACITY)];
            for (int n = 0; n < length; n ++) {
                if (!i.hasNext()) {
                    throw exhausted(offset, length, offset + n);
                }
                if (n == copy.length) {
                    copy = Arrays.copyOf(copy, (int) Math.min(length, (long) n + Math.max(1, n >>> 1)));
                }
                copy[n] = i.next();
            }
            return ImmutableSlice.adopt(copy);
        }

        private RuntimeException exhausted(int offset, int length, int actualLength) {
            if (this.length >= 0) {
                return SliceUtil.inconsistentSequence(sequence, this.length, actualLength);
            }
            if (actualLength < offset) {
                return SliceUtil.offsetBeyondSource(offset, actualLength);
            }
            return SliceUtil.spanPastEnd(offset, length, actualLength);
        }
    }
}

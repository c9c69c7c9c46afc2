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

import io.netty.util.HashingStrategy;
import io.netty.util.internal.EmptyArrays;
import io.netty.util.internal.StringUtil;
import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.RandomAccess;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static io.netty.util.internal.MathUtil.isOutOfBounds;
import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * An immutable view over a contiguous run of elements of an array.
 * <p>
 * A slice is an {@code (array, offset, length)} triple. The array is never written to once a slice has been
 * handed out, so any number of slices can share it: {@link #slice(int, int)} and friends only adjust the offset
 * and length, in constant time. Every operation that changes the content ({@link #append(Object)},
 * {@link #insertAll(int, Iterable)}, {@link #removeAll(Predicate)}, {@link Slices#concat(List)}, ...) allocates one
 * new array of exactly the final size and returns a slice over it.
 * <p>
 * Slices are created through {@link Slices}; construction from anything but another slice copies the input, so
 * later changes to the input are not visible through the slice. Only the elements themselves are shared: if they
 * are mutable objects, mutating them is visible through every slice that holds them.
 *
 * <h3>Indexes</h3>
 * All indexes are relative to the slice, not to the backing array. By default every element access is
 * bounds-checked against the slice; setting {@code -Dio.arrayslice.collection.checkBounds=false} removes the
 * check from {@link #get(int)} and {@link #getFromEnd(int)}, in which case an out-of-slice index reads a
 * neighbouring element of the backing array or fails with {@link ArrayIndexOutOfBoundsException}.
 *
 * <h3>Search</h3>
 * The {@code indexOf} family accepts the equality to use in two forms: a {@link HashingStrategy} (the comparer
 * form, defaulting to {@link HashingStrategy#JAVA_HASHER}) or an {@link ElementEquality} (a single-method
 * relation that is cheaper to supply as a lambda). The relation is always invoked as
 * {@code equals(sought, element)}. Methods return the index within the slice, or {@code -1}.
 */
public final class ImmutableSlice<T> implements Iterable<T>, RandomAccess {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ImmutableSlice.class);
    private static final String PROP_CHECK_BOUNDS = "io.arrayslice.collection.checkBounds";
    static final boolean checkBounds;

    static {
        checkBounds = SystemPropertyUtil.getBoolean(PROP_CHECK_BOUNDS, true);
        if (logger.isDebugEnabled()) {
            logger.debug("-D{}: {}", PROP_CHECK_BOUNDS, checkBounds);
        }
    }

    private static final ImmutableSlice<Object> EMPTY = new ImmutableSlice<Object>(EmptyArrays.EMPTY_OBJECTS, 0, 0);

    final Object[] array;
    final int offset;
    final int length;

    private ImmutableSlice(Object[] array, int offset, int length) {
        this.array = array;
        this.offset = offset;
        this.length = length;
    }

    /**
     * Returns the empty slice. It has no backing storage of its own and is shared by every empty result.
     */
    @SuppressWarnings("unchecked")
    public static <T> ImmutableSlice<T> empty() {
        return (ImmutableSlice<T>) EMPTY;
    }

    /**
     * Wraps {@code array} without copying it. The caller must have just allocated and filled the array and must
     * not keep any other reference to it.
     */
    static <T> ImmutableSlice<T> adopt(Object[] array) {
        return array.length == 0 ? ImmutableSlice.<T>empty() : new ImmutableSlice<T>(array, 0, array.length);
    }

    /**
     * Like {@link #adopt(Object[])}, limited to a window of the array.
     */
    static <T> ImmutableSlice<T> adopt(Object[] array, int offset, int length) {
        assert !isOutOfBounds(offset, length, array.length);
        return length == 0 ? ImmutableSlice.<T>empty() : new ImmutableSlice<T>(array, offset, length);
    }

    /**
     * Returns the number of elements in this slice.
     */
    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * Returns the element at {@code index}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, length())}
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        if (checkBounds) {
            checkIndex(index);
        }
        return (T) array[offset + index];
    }

    /**
     * Returns the element {@code fromEnd} positions from the end: {@code getFromEnd(1)} is the last element.
     *
     * @throws IndexOutOfBoundsException if {@code fromEnd} is not in {@code [1, length()]}
     */
    @SuppressWarnings("unchecked")
    public T getFromEnd(int fromEnd) {
        if (checkBounds && (fromEnd <= 0 || fromEnd > length)) {
            throw new IndexOutOfBoundsException(String.format(
                    "fromEnd: %d (expected: range(1, %d))", fromEnd, length + 1));
        }
        return (T) array[offset + length - fromEnd];
    }

    /**
     * Returns a read-only {@link List} view of this slice. The view shares this slice's storage; nothing is
     * copied.
     */
    public List<T> asList() {
        return new ListView();
    }

    /**
     * Returns the slice of {@code length} elements starting at {@code index}. The result shares this slice's
     * storage.
     *
     * @throws IndexOutOfBoundsException if the requested slice does not lie within this slice
     */
    public ImmutableSlice<T> slice(int index, int length) {
        if (isOutOfBounds(index, length, this.length)) {
            throw new IndexOutOfBoundsException(String.format(
                    "index: %d, length: %d (expected: range(0, %d))", index, length, this.length));
        }
        if (index == 0 && length == this.length) {
            return this;
        }
        return adopt(array, offset + index, length);
    }

    /**
     * Returns the slice from {@code index} to the end of this slice.
     */
    public ImmutableSlice<T> slice(int index) {
        return slice(index, length - index);
    }

    /**
     * Returns the part of this slice selected by {@code range}.
     */
    public ImmutableSlice<T> slice(Range range) {
        checkNotNull(range, "range");
        return slice(range.offset(length), range.length(length));
    }

    /**
     * Copies this slice into {@code dest} starting at {@code destIndex}.
     */
    public void copyTo(T[] dest, int destIndex) {
        copyTo(dest, destIndex, length);
    }

    /**
     * Copies the first {@code length} elements of this slice into {@code dest} starting at {@code destIndex}.
     *
     * @throws IndexOutOfBoundsException if {@code length} exceeds this slice, or the destination range does not fit
     *         in {@code dest}
     */
    public void copyTo(T[] dest, int destIndex, int length) {
        checkNotNull(dest, "dest");
        if (length < 0 || length > this.length) {
            throw new IndexOutOfBoundsException(String.format(
                    "length: %d (expected: range(0, %d))", length, this.length + 1));
        }
        if (isOutOfBounds(destIndex, length, dest.length)) {
            throw new IndexOutOfBoundsException(String.format(
                    "destIndex: %d, length: %d (expected: range(0, %d))", destIndex, length, dest.length));
        }
        System.arraycopy(array, offset, dest, destIndex, length);
    }

    void copyInto(Object[] dest, int destIndex) {
        System.arraycopy(array, offset, dest, destIndex, length);
    }

    /**
     * Returns a new array holding the elements of this slice.
     */
    public Object[] toArray() {
        return Arrays.copyOfRange(array, offset, offset + length);
    }

    /**
     * Returns the elements of this slice in {@code a} if it is large enough, or else in a new array of the same
     * runtime type. Follows the contract of {@link Collection#toArray(Object[])}.
     */
    @SuppressWarnings("unchecked")
    public <E> E[] toArray(E[] a) {
        checkNotNull(a, "a");
        if (a.length < length) {
            return (E[]) Arrays.copyOfRange(array, offset, offset + length, a.getClass());
        }
        System.arraycopy(array, offset, a, 0, length);
        if (a.length > length) {
            a[length] = null;
        }
        return a;
    }

    /**
     * Returns a slice with {@code value} added at the end.
     */
    public ImmutableSlice<T> append(T value) {
        Object[] newArray = new Object[SliceUtil.checkTotalLength(length, 1)];
        System.arraycopy(array, offset, newArray, 0, length);
        newArray[length] = value;
        return adopt(newArray);
    }

    /**
     * Returns a slice with {@code value} added at the start.
     */
    public ImmutableSlice<T> prepend(T value) {
        Object[] newArray = new Object[SliceUtil.checkTotalLength(length, 1)];
        newArray[0] = value;
        System.arraycopy(array, offset, newArray, 1, length);
        return adopt(newArray);
    }

    /**
     * Returns a slice with the elements of {@code items} added at the end.
     */
    public ImmutableSlice<T> appendAll(Iterable<? extends T> items) {
        return appendAll(SliceSource.<T>of(items));
    }

    /**
     * Returns a slice with the elements of {@code items} added at the end.
     */
    public ImmutableSlice<T> appendAll(T[] items) {
        checkNotNull(items, "items");
        return appendAll(SliceSource.of(items, 0, items.length));
    }

    private ImmutableSlice<T> appendAll(SliceSource<T> source) {
        if (length == 0) {
            return source.toSlice();
        }
        if (source.length() == 0) {
            return this;
        }
        Object[] newArray = source.allocateAndCopy(length, length);
        System.arraycopy(array, offset, newArray, 0, length);
        return adopt(newArray);
    }

    /**
     * Returns a slice with {@code value} inserted at {@code index}. An {@code index} of {@code 0} prepends and an
     * {@code index} of {@link #length()} appends.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, length()]}
     */
    public ImmutableSlice<T> insert(int index, T value) {
        checkInsertIndex(index);
        if (index == length) {
            return append(value);
        }
        if (index == 0) {
            return prepend(value);
        }
        Object[] newArray = new Object[SliceUtil.checkTotalLength(length, 1)];
        System.arraycopy(array, offset, newArray, 0, index);
        newArray[index] = value;
        System.arraycopy(array, offset + index, newArray, index + 1, length - index);
        return adopt(newArray);
    }

    /**
     * Returns a slice with the elements of {@code items} inserted at {@code index}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, length()]}
     */
    public ImmutableSlice<T> insertAll(int index, Iterable<? extends T> items) {
        checkInsertIndex(index);
        return insertAll(index, SliceSource.<T>of(items));
    }

    /**
     * Returns a slice with the elements of {@code items} inserted at {@code index}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, length()]}
     */
    public ImmutableSlice<T> insertAll(int index, T[] items) {
        checkInsertIndex(index);
        checkNotNull(items, "items");
        return insertAll(index, SliceSource.of(items, 0, items.length));
    }

    private ImmutableSlice<T> insertAll(int index, SliceSource<T> source) {
        if (index == length) {
            return appendAll(source);
        }
        int sourceLength = source.length();
        if (sourceLength == 0) {
            return this;
        }
        Object[] newArray = source.allocateAndCopy(index, length);
        System.arraycopy(array, offset, newArray, 0, index);
        System.arraycopy(array, offset + index, newArray, index + sourceLength, length - index);
        return adopt(newArray);
    }

    /**
     * Returns a slice without the elements matching {@code match}. The predicate is evaluated once per element, in
     * order. Returns this slice if nothing matched, and the empty slice if everything did.
     */
    @SuppressWarnings("unchecked")
    public ImmutableSlice<T> removeAll(Predicate<? super T> match) {
        checkNotNull(match, "match");
        Object[] retained = null;
        int retainedCount = 0;
        for (int i = 0; i < length; i ++) {
            Object element = array[offset + i];
            if (match.test((T) element)) {
                if (retained == null) {
                    retained = new Object[length - 1];
                    System.arraycopy(array, offset, retained, 0, i);
                    retainedCount = i;
                }
            } else if (retained != null) {
                retained[retainedCount ++] = element;
            }
        }
        if (retained == null) {
            return this;
        }
        if (retainedCount == retained.length) {
            return adopt(retained);
        }
        return retainedCount == 0 ? ImmutableSlice.<T>empty() : adopt(Arrays.copyOf(retained, retainedCount));
    }

    /**
     * Returns the index of the first occurrence of {@code item}, using {@link Object#equals(Object)}.
     */
    public int indexOf(T item) {
        return indexOf(item, 0, length, ImmutableSlice.<T>javaHasher());
    }

    /**
     * Returns the index of the first occurrence of {@code item} at or after {@code start}.
     */
    public int indexOf(T item, int start) {
        return indexOf(item, start, length - start, ImmutableSlice.<T>javaHasher());
    }

    /**
     * Returns the index of the first occurrence of {@code item} in {@code [start, start + count)}.
     */
    public int indexOf(T item, int start, int count) {
        return indexOf(item, start, count, ImmutableSlice.<T>javaHasher());
    }

    public int indexOf(T item, HashingStrategy<? super T> strategy) {
        return indexOf(item, 0, length, strategy);
    }

    public int indexOf(T item, int start, HashingStrategy<? super T> strategy) {
        return indexOf(item, start, length - start, strategy);
    }

    /**
     * Returns the index of the first element in {@code [start, start + count)} for which
     * {@code strategy.equals(item, element)} holds, or {@code -1}.
     *
     * @throws IndexOutOfBoundsException if {@code [start, start + count)} does not lie within this slice
     */
    @SuppressWarnings("unchecked")
    public int indexOf(T item, int start, int count, HashingStrategy<? super T> strategy) {
        checkSearchRange(start, count);
        checkNotNull(strategy, "strategy");
        for (int i = offset + start, end = i + count; i < end; i ++) {
            if (strategy.equals(item, (T) array[i])) {
                return i - offset;
            }
        }
        return -1;
    }

    public int indexOf(T item, ElementEquality<? super T> equality) {
        return indexOf(item, 0, length, equality);
    }

    public int indexOf(T item, int start, ElementEquality<? super T> equality) {
        return indexOf(item, start, length - start, equality);
    }

    /**
     * Returns the index of the first element in {@code [start, start + count)} for which
     * {@code equality.equal(item, element)} holds, or {@code -1}.
     *
     * @throws IndexOutOfBoundsException if {@code [start, start + count)} does not lie within this slice
     */
    @SuppressWarnings("unchecked")
    public int indexOf(T item, int start, int count, ElementEquality<? super T> equality) {
        checkSearchRange(start, count);
        checkNotNull(equality, "equality");
        for (int i = offset + start, end = i + count; i < end; i ++) {
            if (equality.equal(item, (T) array[i])) {
                return i - offset;
            }
        }
        return -1;
    }

    public int lastIndexOf(T item) {
        return lastIndexOf(item, ImmutableSlice.<T>javaHasher());
    }

    /**
     * Returns the index of the last element for which {@code strategy.equals(item, element)} holds, or {@code -1}.
     */
    @SuppressWarnings("unchecked")
    public int lastIndexOf(T item, HashingStrategy<? super T> strategy) {
        checkNotNull(strategy, "strategy");
        for (int i = offset + length - 1; i >= offset; i --) {
            if (strategy.equals(item, (T) array[i])) {
                return i - offset;
            }
        }
        return -1;
    }

    /**
     * Returns the index of the last element for which {@code equality.equal(item, element)} holds, or {@code -1}.
     */
    @SuppressWarnings("unchecked")
    public int lastIndexOf(T item, ElementEquality<? super T> equality) {
        checkNotNull(equality, "equality");
        for (int i = offset + length - 1; i >= offset; i --) {
            if (equality.equal(item, (T) array[i])) {
                return i - offset;
            }
        }
        return -1;
    }

    public boolean contains(T item) {
        return indexOf(item) >= 0;
    }

    public int indexOfAny(Iterable<? extends T> candidates) {
        return indexOfAny(candidates, 0, length, ImmutableSlice.<T>javaHasher());
    }

    public int indexOfAny(Iterable<? extends T> candidates, int start, int count) {
        return indexOfAny(candidates, start, count, ImmutableSlice.<T>javaHasher());
    }

    public int indexOfAny(Iterable<? extends T> candidates, int start, int count, HashingStrategy<? super T> strategy) {
        checkNotNull(strategy, "strategy");
        return indexOfAny(candidates, start, count, new StrategyEquality<T>(strategy));
    }

    /**
     * Returns the index of the first element in {@code [start, start + count)} that matches any of
     * {@code candidates}, or {@code -1}.
     *
     * @throws IndexOutOfBoundsException if {@code [start, start + count)} does not lie within this slice
     */
    @SuppressWarnings("unchecked")
    public int indexOfAny(Iterable<? extends T> candidates, int start, int count, ElementEquality<? super T> equality) {
        ImmutableSlice<? extends T> sought = Slices.copyOf(candidates);
        checkSearchRange(start, count);
        checkNotNull(equality, "equality");
        for (int i = offset + start, end = i + count; i < end; i ++) {
            T element = (T) array[i];
            for (int j = sought.offset, soughtEnd = j + sought.length; j < soughtEnd; j ++) {
                if (equality.equal((T) sought.array[j], element)) {
                    return i - offset;
                }
            }
        }
        return -1;
    }

    public int indexOfSequence(Iterable<? extends T> needle) {
        return indexOfSequence(needle, 0, length, ImmutableSlice.<T>javaHasher());
    }

    public int indexOfSequence(Iterable<? extends T> needle, int start, int count) {
        return indexOfSequence(needle, start, count, ImmutableSlice.<T>javaHasher());
    }

    public int indexOfSequence(Iterable<? extends T> needle, int start, int count,
                               HashingStrategy<? super T> strategy) {
        checkNotNull(strategy, "strategy");
        return indexOfSequence(needle, start, count, new StrategyEquality<T>(strategy));
    }

    /**
     * Returns the index at which the first complete occurrence of {@code needle} inside
     * {@code [start, start + count)} begins, or {@code -1}. An occurrence that starts inside the range but would end
     * past {@code start + count} is not a match. An empty {@code needle} matches at {@code start}.
     *
     * @throws IndexOutOfBoundsException if {@code [start, start + count)} does not lie within this slice
     */
    public int indexOfSequence(Iterable<? extends T> needle, int start, int count,
                               ElementEquality<? super T> equality) {
        ImmutableSlice<? extends T> sought = Slices.copyOf(needle);
        checkSearchRange(start, count);
        checkNotNull(equality, "equality");
        for (int i = start, last = start + count - sought.length; i <= last; i ++) {
            if (regionMatches(i, sought, equality)) {
                return i;
            }
        }
        return -1;
    }

    public int indexOfAnySequence(List<? extends Iterable<? extends T>> needles) {
        return indexOfAnySequence(needles, 0, length, ImmutableSlice.<T>javaHasher());
    }

    public int indexOfAnySequence(List<? extends Iterable<? extends T>> needles, int start, int count) {
        return indexOfAnySequence(needles, start, count, ImmutableSlice.<T>javaHasher());
    }

    public int indexOfAnySequence(List<? extends Iterable<? extends T>> needles, int start, int count,
                                  HashingStrategy<? super T> strategy) {
        checkNotNull(strategy, "strategy");
        return indexOfAnySequence(needles, start, count, new StrategyEquality<T>(strategy));
    }

    /**
     * Returns the earliest index inside {@code [start, start + count)} at which a complete occurrence of any of
     * {@code needles} begins, or {@code -1}. When several needles occur at that index, the first one in
     * {@code needles} wins; it makes no difference to the returned index.
     *
     * @throws IndexOutOfBoundsException if {@code [start, start + count)} does not lie within this slice
     */
    public int indexOfAnySequence(List<? extends Iterable<? extends T>> needles, int start, int count,
                                  ElementEquality<? super T> equality) {
        checkNotNull(needles, "needles");
        checkSearchRange(start, count);
        checkNotNull(equality, "equality");
        int needleCount = needles.size();
        if (needleCount == 0) {
            return -1;
        }
        @SuppressWarnings("unchecked")
        ImmutableSlice<? extends T>[] sought = new ImmutableSlice[needleCount];
        int shortest = Integer.MAX_VALUE;
        for (int i = 0; i < needleCount; i ++) {
            sought[i] = Slices.copyOf(needles.get(i));
            shortest = Math.min(shortest, sought[i].length);
        }
        int end = start + count;
        for (int i = start, last = end - shortest; i <= last; i ++) {
            for (ImmutableSlice<? extends T> needle : sought) {
                if (needle.length <= end - i && regionMatches(i, needle, equality)) {
                    return i;
                }
            }
        }
        return -1;
    }

    @SuppressWarnings("unchecked")
    private boolean regionMatches(int index, ImmutableSlice<? extends T> needle, ElementEquality<? super T> equality) {
        for (int i = offset + index, j = needle.offset, needleEnd = j + needle.length; j < needleEnd; i ++, j ++) {
            if (!equality.equal((T) needle.array[j], (T) array[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Iterates over the whole slice with the specified {@code processor}.
     *
     * @return {@code -1} if the processor iterated to the end. The index of the last visited element if
     *         {@link ElementProcessor#process(Object)} returned {@code false}.
     */
    public int forEachElement(ElementProcessor<? super T> processor) {
        return forEachElement(0, length, processor);
    }

    /**
     * Iterates over {@code [index, index + length)} with the specified {@code processor}.
     *
     * @return {@code -1} if the processor iterated to the end of the range. The index of the last visited element
     *         if {@link ElementProcessor#process(Object)} returned {@code false}.
     */
    @SuppressWarnings("unchecked")
    public int forEachElement(int index, int length, ElementProcessor<? super T> processor) {
        checkSearchRange(index, length);
        checkNotNull(processor, "processor");
        for (int i = offset + index, end = i + length; i < end; i ++) {
            if (!processor.process((T) array[i])) {
                return i - offset;
            }
        }
        return -1;
    }

    /**
     * Returns {@code true} if {@code other} yields exactly the elements of this slice, in order.
     */
    public boolean contentEquals(Iterable<? extends T> other) {
        return contentEquals(other, ImmutableSlice.<T>javaHasher());
    }

    /**
     * Returns {@code true} if {@code other} yields, in order, elements that match the elements of this slice
     * according to {@code strategy}, and no more.
     */
    @SuppressWarnings("unchecked")
    public boolean contentEquals(Iterable<? extends T> other, HashingStrategy<? super T> strategy) {
        checkNotNull(other, "other");
        checkNotNull(strategy, "strategy");
        if (other instanceof ImmutableSlice) {
            ImmutableSlice<? extends T> that = (ImmutableSlice<? extends T>) other;
            if (that.length != length) {
                return false;
            }
            for (int i = 0; i < length; i ++) {
                if (!strategy.equals((T) array[offset + i], (T) that.array[that.offset + i])) {
                    return false;
                }
            }
            return true;
        }
        if (other instanceof Collection && ((Collection<?>) other).size() != length) {
            return false;
        }
        int i = offset;
        int end = offset + length;
        for (T element : other) {
            if (i == end || !strategy.equals((T) array[i ++], element)) {
                return false;
            }
        }
        return i == end;
    }

    @Override
    public Iterator<T> iterator() {
        return new SliceIterator();
    }

    /**
     * Returns a new {@link SliceCursor} positioned before the first element of this slice.
     */
    public SliceCursor<T> cursor() {
        return new Cursor<T>(array, offset, length);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Spliterator<T> spliterator() {
        return (Spliterator<T>) Spliterators.spliterator(array, offset, offset + length,
                Spliterator.ORDERED | Spliterator.IMMUTABLE);
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof ImmutableSlice)) {
            return false;
        }
        ImmutableSlice<?> that = (ImmutableSlice<?>) o;
        if (that.length != length) {
            return false;
        }
        for (int i = 0; i < length; i ++) {
            Object a = array[offset + i];
            Object b = that.array[that.offset + i];
            if (a != b && (a == null || !a.equals(b))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the same hash code a {@link List} of the same elements would.
     */
    @Override
    public int hashCode() {
        int hashCode = 1;
        for (int i = offset, end = offset + length; i < end; i ++) {
            Object element = array[i];
            hashCode = 31 * hashCode + (element == null ? 0 : element.hashCode());
        }
        return hashCode;
    }

    @Override
    public String toString() {
        if (length == 0) {
            return StringUtil.simpleClassName(this) + "(length: 0)";
        }
        return StringUtil.simpleClassName(this) + "(offset: " + offset + ", length: " + length
                + ", capacity: " + array.length + ')';
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException(String.format(
                    "index: %d (expected: range(0, %d))", index, length));
        }
    }

    private void checkInsertIndex(int index) {
        if (index < 0 || index > length) {
            throw new IndexOutOfBoundsException(String.format(
                    "index: %d (expected: range(0, %d))", index, length + 1));
        }
    }

    private void checkSearchRange(int start, int count) {
        if (isOutOfBounds(start, count, length)) {
            throw new IndexOutOfBoundsException(String.format(
                    "start: %d, count: %d (expected: range(0, %d))", start, count, length));
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> HashingStrategy<T> javaHasher() {
        return HashingStrategy.JAVA_HASHER;
    }

    private static final class StrategyEquality<T> implements ElementEquality<T> {
        private final HashingStrategy<? super T> strategy;

        StrategyEquality(HashingStrategy<? super T> strategy) {
            this.strategy = strategy;
        }

        @Override
        public boolean equal(T sought, T element) {
            return strategy.equals(sought, element);
        }
    }

    private final class SliceIterator implements Iterator<T> {
        private int index;

        @Override
        public boolean hasNext() {
            return index < length;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return (T) array[offset + index ++];
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException("Read-Only");
        }
    }

    private final class ListView extends AbstractList<T> implements RandomAccess {
        @Override
        @SuppressWarnings("unchecked")
        public T get(int index) {
            checkIndex(index);
            return (T) array[offset + index];
        }

        @Override
        public int size() {
            return length;
        }

        @Override
        public Object[] toArray() {
            return ImmutableSlice.this.toArray();
        }
    }

    private static final class Cursor<T> implements SliceCursor<T> {
        private final Object[] array;
        private final int start;
        private final int end;
        private int position;

        Cursor(Object[] array, int offset, int length) {
            this.array = array;
            start = offset;
            end = offset + length;
            position = start - 1;
        }

        @Override
        public boolean advance() {
            if (position < end) {
                position ++;
            }
            return position < end;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T current() {
            if (position < start || position >= end) {
                throw new IllegalStateException("cursor is not positioned on an element (position: "
                        + position() + ", length: " + (end - start) + ')');
            }
            return (T) array[position];
        }

        @Override
        public void reset() {
            position = start - 1;
        }

        @Override
        public int position() {
            return position - start;
        }

        @Override
        public int remaining() {
            return end - Math.min(end, position + 1);
        }
    }
}

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

import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * A half-open range {@code [start, end)} whose bounds are either absolute or measured from the end of the
 * sequence it is applied to. A bound measured from the end counts back from the length, so
 * {@code Range.fromEnd(2, 0)} selects the last two elements of any sequence.
 * <p>
 * A {@link Range} carries no length of its own; it is resolved against a concrete length by {@link #offset(int)}
 * and {@link #length(int)}.
 */
public final class Range {

    private static final Range ALL = new Range(0, false, 0, true);

    private final int start;
    private final boolean startFromEnd;
    private final int end;
    private final boolean endFromEnd;

    private Range(int start, boolean startFromEnd, int end, boolean endFromEnd) {
        this.start = start;
        this.startFromEnd = startFromEnd;
        this.end = end;
        this.endFromEnd = endFromEnd;
    }

    /**
     * Returns the range {@code [start, end)} with both bounds absolute.
     */
    public static Range of(int start, int end) {
        return new Range(checkPositiveOrZero(start, "start"), false, checkPositiveOrZero(end, "end"), false);
    }

    /**
     * Returns the range starting at the absolute index {@code start} and running to the end.
     */
    public static Range from(int start) {
        return new Range(checkPositiveOrZero(start, "start"), false, 0, true);
    }

    /**
     * Returns the range covering the last {@code count} elements.
     */
    public static Range last(int count) {
        return new Range(checkPositiveOrZero(count, "count"), true, 0, true);
    }

    /**
     * Returns the range {@code [length - startFromEnd, length - endFromEnd)}.
     */
    public static Range fromEnd(int startFromEnd, int endFromEnd) {
        return new Range(checkPositiveOrZero(startFromEnd, "startFromEnd"), true,
                checkPositiveOrZero(endFromEnd, "endFromEnd"), true);
    }

    /**
     * Returns the range covering everything.
     */
    public static Range all() {
        return ALL;
    }

    /**
     * Resolves the start of this range against a sequence of the given length.
     *
     * @throws IndexOutOfBoundsException if the start falls outside {@code [0, length]}
     */
    public int offset(int length) {
        int offset = startFromEnd ? length - start : start;
        if (offset < 0 || offset > length) {
            throw SliceUtil.offsetBeyondSource(offset, length);
        }
        return offset;
    }

    /**
     * Resolves the number of elements this range covers in a sequence of the given length.
     *
     * @throws IndexOutOfBoundsException if the start falls outside {@code [0, length]}, or the end falls before the
     *         start or past {@code length}
     */
    public int length(int length) {
        int offset = offset(length);
        int endOffset = endFromEnd ? length - end : end;
        if (endOffset < offset || endOffset > length) {
            throw SliceUtil.spanPastEnd(offset, endOffset - offset, length);
        }
        return endOffset - offset;
    }

    /**
     * Returns {@code true} if both bounds are absolute, meaning the range can be applied to a sequence without
     * knowing its length.
     */
    boolean isBoundedFromStart() {
        return !startFromEnd && !endFromEnd;
    }

    boolean isAll() {
        return start == 0 && !startFromEnd && end == 0 && endFromEnd;
    }

    int start() {
        return start;
    }

    int end() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Range)) {
            return false;
        }
        Range that = (Range) o;
        return start == that.start && startFromEnd == that.startFromEnd
                && end == that.end && endFromEnd == that.endFromEnd;
    }

    @Override
    public int hashCode() {
        int hash = start;
        hash = 31 * hash + (startFromEnd ? 1 : 0);
        hash = 31 * hash + end;
        return 31 * hash + (endFromEnd ? 1 : 0);
    }

    @Override
    public String toString() {
        return '[' + (startFromEnd ? "^" : "") + start + ", " + (endFromEnd ? "^" : "") + end + ')';
    }
}

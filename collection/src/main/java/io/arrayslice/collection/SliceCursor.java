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

/**
 * The SliceCursor scans forward through the elements of an {@link ImmutableSlice}.
 * Unlike an {@link java.util.Iterator}, the element read by the last {@link #advance()} stays available through
 * {@link #current()} until the cursor moves again, and the cursor can be rewound with {@link #reset()}.
 * <p>
 * Cursors are not thread-safe.
 */
public interface SliceCursor<T> {
    /**
     * Move the cursor to the next element, if there is one.
     *
     * @return {@code true} if the cursor is now positioned on an element, {@code false} if it moved past the end.
     */
    boolean advance();

    /**
     * Return the element the cursor is positioned on.
     *
     * @throws IllegalStateException if {@link #advance()} has not been called since creation or the last
     *         {@link #reset()}, or if the last call to {@link #advance()} returned {@code false}.
     */
    T current();

    /**
     * Rewind the cursor to the state it had right after creation: before the first element of the slice.
     */
    void reset();

    /**
     * The index of the current element within the slice, {@code -1} before the first {@link #advance()}, or the
     * slice length once the cursor moved past the end.
     */
    int position();

    /**
     * The number of elements left to read with {@link #advance()}.
     */
    int remaining();
}

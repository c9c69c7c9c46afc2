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

import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

/**
 * Bounds checks and error construction shared by {@link Range}, {@link Slices} and the copy dispatcher.
 */
final class SliceUtil {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(SliceUtil.class);

    private SliceUtil() { }

    /**
     * Validates a {@code [offset, offset + length)} request against a source of {@code sourceLength} elements.
     */
    static void checkSourceRange(int offset, int length, int sourceLength) {
        if (offset < 0 || offset > sourceLength) {
            throw offsetBeyondSource(offset, sourceLength);
        }
        if (length < 0 || length > sourceLength - offset) {
            throw spanPastEnd(offset, length, sourceLength);
        }
    }

    static IndexOutOfBoundsException offsetBeyondSource(int offset, int sourceLength) {
        return new IndexOutOfBoundsException(String.format(
                "offset: %d (expected: range(0, %d))", offset, sourceLength));
    }

    static IndexOutOfBoundsException spanPastEnd(int offset, int length, int sourceLength) {
        return new IndexOutOfBoundsException(String.format(
                "offset: %d, length: %d exceeds source length: %d", offset, length, sourceLength));
    }

    static int checkTotalLength(int length, int extraLength) {
        if (Integer.MAX_VALUE - length < extraLength) {
            throw new IllegalArgumentException("The total length of the specified sources is too big.");
        }
        return length + extraLength;
    }

    static InconsistentSequenceException inconsistentSequence(Iterable<?> source, int expected, int actual) {
        InconsistentSequenceException e = new InconsistentSequenceException(expected, actual);
        if (logger.isDebugEnabled()) {
            logger.debug("{} changed its length between two enumerations", source.getClass().getName(), e);
        }
        return e;
    }
}

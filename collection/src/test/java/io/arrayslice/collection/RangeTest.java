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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RangeTest {

    @Test
    public void testResolve() {
        assertEquals(2, Range.of(2, 5).offset(10));
        assertEquals(3, Range.of(2, 5).length(10));
        assertEquals(7, Range.from(7).offset(10));
        assertEquals(3, Range.from(7).length(10));
        assertEquals(6, Range.last(4).offset(10));
        assertEquals(4, Range.last(4).length(10));
        assertEquals(7, Range.fromEnd(3, 1).offset(10));
        assertEquals(2, Range.fromEnd(3, 1).length(10));
        assertEquals(0, Range.all().offset(10));
        assertEquals(10, Range.all().length(10));
        assertEquals(0, Range.all().length(0));
    }

    @Test
    public void testOutOfRange() {
        assertThrows(IndexOutOfBoundsException.class, new Executable() {
            @Override
            public void execute() {
                Range.of(11, 12).offset(10);
            }
        });
        assertThrows(IndexOutOfBoundsException.class, new Executable() {
            @Override
            public void execute() {
                Range.of(5, 3).length(10);
            }
        });
        assertThrows(IndexOutOfBoundsException.class, new Executable() {
            @Override
            public void execute() {
                Range.of(5, 11).length(10);
            }
        });
        assertThrows(IndexOutOfBoundsException.class, new Executable() {
            @Override
            public void execute() {
                Range.last(11).offset(10);
            }
        });
    }

    @Test
    public void testNegativeBounds() {
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                Range.of(-1, 2);
            }
        });
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                Range.fromEnd(1, -2);
            }
        });
    }

    @Test
    public void testValueSemantics() {
        assertEquals(Range.of(1, 3), Range.of(1, 3));
        assertEquals(Range.of(1, 3).hashCode(), Range.of(1, 3).hashCode());
        assertNotEquals(Range.of(1, 3), Range.fromEnd(1, 3));
        assertEquals(Range.from(0), Range.all());
        assertSame(Range.all(), Range.all());
        assertThat(Range.fromEnd(2, 0).toString()).isEqualTo("[^2, ^0)");
        assertThat(Range.of(2, 4).toString()).isEqualTo("[2, 4)");
    }
}

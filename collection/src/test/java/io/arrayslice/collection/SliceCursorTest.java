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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SliceCursorTest {

    @Test
    public void testCurrentBeforeFirstAdvance() {
        final SliceCursor<String> cursor = Slices.of("a").cursor();
        assertEquals(-1, cursor.position());
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                cursor.current();
            }
        });
    }

    @Test
    public void testCurrentAfterEnd() {
        final SliceCursor<String> cursor = Slices.of("a", "b").cursor();
        assertTrue(cursor.advance());
        assertTrue(cursor.advance());
        assertEquals("b", cursor.current());
        assertFalse(cursor.advance());
        assertFalse(cursor.advance());
        assertEquals(2, cursor.position());
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                cursor.current();
            }
        });
    }

    @Test
    public void testWalkAndRemaining() {
        SliceCursor<String> cursor = Slices.of("a", "b", "c").cursor();
        StringBuilder seen = new StringBuilder();
        assertEquals(3, cursor.remaining());
        while (cursor.advance()) {
            seen.append(cursor.position()).append(cursor.current());
        }
        assertEquals("0a1b2c", seen.toString());
        assertEquals(0, cursor.remaining());
    }

    @Test
    public void testResetHonoursWindow() {
        SliceCursor<String> cursor = Slices.of("_", "a", "b", "c", "_").slice(1, 3).cursor();
        assertTrue(cursor.advance());
        assertTrue(cursor.advance());
        assertEquals("b", cursor.current());
        assertEquals(1, cursor.remaining());

        cursor.reset();
        assertEquals(-1, cursor.position());
        assertEquals(3, cursor.remaining());
        assertTrue(cursor.advance());
        assertEquals("a", cursor.current());

        while (cursor.advance()) {
            assertFalse("_".equals(cursor.current()));
        }
        cursor.reset();
        assertTrue(cursor.advance());
        assertEquals("a", cursor.current());
    }

    @Test
    public void testEmptyCursor() {
        final SliceCursor<Object> cursor = Slices.empty().cursor();
        assertEquals(0, cursor.remaining());
        assertFalse(cursor.advance());
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                cursor.current();
            }
        });
    }
}

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

import io.arrayslice.collection.TestIterables.CountingIterable;
import io.arrayslice.collection.TestIterables.GrowingIterable;
import io.arrayslice.collection.TestIterables.ShrinkingIterable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.AbstractCollection;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

public class SliceSourceTest {

    @Test
    public void testClassification() {
        assertThat(SliceSource.of(Slices.of("a"))).isInstanceOf(SliceSource.SliceBackedSource.class);
        assertThat(SliceSource.of(Arrays.asList("a"))).isInstanceOf(SliceSource.RandomAccessSource.class);
        assertThat(SliceSource.of(new LinkedList<String>())).isInstanceOf(SliceSource.CollectionSource.class);
        assertThat(SliceSource.of(new CountingIterable<String>("a"))).isInstanceOf(SliceSource.SequenceSource.class);
        assertThat(SliceSource.of(new String[] { "a" }, 0, 1)).isInstanceOf(SliceSource.ArraySource.class);
    }

    @Test
    public void testAllocateAndCopy() {
        List<SliceSource<String>> sources = Arrays.asList(
                SliceSource.of(new String[] { "x", "a", "b", "c" }, 1, 3),
                SliceSource.<String>of(Slices.of("x", "a", "b", "c").slice(1)),
                SliceSource.<String>of(new ArrayList<String>(Arrays.asList("a", "b", "c"))),
                SliceSource.<String>of(new LinkedList<String>(Arrays.asList("a", "b", "c"))),
                SliceSource.<String>of(new CountingIterable<String>("a", "b", "c")));
        for (SliceSource<String> source : sources) {
            assertEquals(3, source.length());
            Object[] dest = source.allocateAndCopy(1, 2);
            assertArrayEquals(new Object[] { null, "a", "b", "c", null }, dest, source.getClass().getName());
        }
    }

    @Test
    public void testAllocateAndCopyTooLarge() {
        final SliceSource<String> source = SliceSource.of(new String[] { "a", "b" }, 0, 2);
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                source.allocateAndCopy(0, Integer.MAX_VALUE - 1);
            }
        });
    }

    @Test
    public void testRandomAccessListIsNotIterated() {
        List<String> list = spy(new ArrayList<String>(Arrays.asList("a", "b", "c", "d")));
        SliceSource<String> source = SliceSource.of(list);
        assertArrayEquals(new Object[] { "a", "b", "c", "d" }, source.allocateAndCopy(0, 0));
        assertEquals(Slices.of("b", "c"), source.toSlice(1, 2));
        assertEquals(Slices.of("a", "b", "c", "d"), source.toSlice());
        verify(list, never()).iterator();
    }

    @Test
    public void testCollectionToSliceUsesToArray() {
        Collection<String> collection = spy(new LinkedList<String>(Arrays.asList("a", "b")));
        assertEquals(Slices.of("a", "b"), SliceSource.of(collection).toSlice());
        verify(collection).toArray();
        verify(collection, never()).iterator();
    }

    @Test
    public void testCollectionWithCovariantToArray() {
        Collection<String> collection = new AbstractCollection<String>() {
            private final List<String> elements = Arrays.asList("a", "b");

            @Override
            public Iterator<String> iterator() {
                return elements.iterator();
            }

            @Override
            public int size() {
                return elements.size();
            }

            @Override
            public Object[] toArray() {
                return new String[] { "a", "b" };
            }
        };
        ImmutableSlice<String> slice = SliceSource.of(collection).toSlice();
        assertSame(Object[].class, slice.array.getClass());
        assertEquals(Slices.of("a", "b"), slice.append("c").slice(0, 2));
    }

    @Test
    public void testCollectionWithWrongSize() {
        final Collection<String> collection = new AbstractCollection<String>() {
            @Override
            public Iterator<String> iterator() {
                return Arrays.asList("a", "b").iterator();
            }

            @Override
            public int size() {
                return 3;
            }
        };
        assertThrows(InconsistentSequenceException.class, new Executable() {
            @Override
            public void execute() {
                SliceSource.of(collection).allocateAndCopy(0, 0);
            }
        });
        assertThrows(InconsistentSequenceException.class, new Executable() {
            @Override
            public void execute() {
                SliceSource.of(collection).toSlice(1, 2);
            }
        });
    }

    @Test
    public void testSequenceGrowingBetweenPasses() {
        final GrowingIterable sequence = new GrowingIterable(3);
        InconsistentSequenceException e = assertThrows(InconsistentSequenceException.class, new Executable() {
            @Override
            public void execute() {
                SliceSource.of(sequence).allocateAndCopy(0, 0);
            }
        });
        assertEquals("expected length: 3, actual length: > 3", e.getMessage());
    }

    @Test
    public void testSequenceShrinkingBetweenPasses() {
        final ShrinkingIterable sequence = new ShrinkingIterable(3);
        InconsistentSequenceException e = assertThrows(InconsistentSequenceException.class, new Executable() {
            @Override
            public void execute() {
                SliceSource.of(sequence).allocateAndCopy(0, 0);
            }
        });
        assertEquals("expected length: 3, actual length: 2", e.getMessage());
    }

    @Test
    public void testSequenceShrinkingForEndRelativeRange() {
        final ShrinkingIterable sequence = new ShrinkingIterable(5);
        assertThrows(InconsistentSequenceException.class, new Executable() {
            @Override
            public void execute() {
                SliceSource.of(sequence).toSlice(Range.last(1));
            }
        });
    }

    @Test
    public void testSequenceMaterializedInOnePass() {
        Integer[] elements = new Integer[40];
        for (int i = 0; i < elements.length; i ++) {
            elements[i] = i;
        }
        CountingIterable<Integer> sequence = new CountingIterable<Integer>(elements);
        ImmutableSlice<Integer> slice = SliceSource.of(sequence).toSlice();
        assertEquals(1, sequence.iterators);
        assertEquals(40, slice.length());
        assertEquals(40, slice.array.length);
        assertEquals(Slices.copyOf(elements), slice);
    }

    @Test
    public void testEmptySequence() {
        assertSame(Slices.empty(), SliceSource.of(new CountingIterable<String>()).toSlice());
        assertSame(Slices.empty(), SliceSource.of(new CountingIterable<String>("a")).toSlice(1, 0));
    }
}

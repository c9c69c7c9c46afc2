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
 * Provides a mechanism to iterate over the elements of an {@link ImmutableSlice}.
 *
 * @see ImmutableSlice#forEachElement(ElementProcessor)
 */
public interface ElementProcessor<T> {

    /**
     * @return {@code true} if the processor wants to continue the loop and handle the next element in the slice.
     *         {@code false} if the processor wants to stop handling elements and abort the loop.
     */
    boolean process(T value);
}

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
 * A lightweight equality relation used by the search operations of {@link ImmutableSlice}.
 * <p>
 * This is the single-method alternative to {@link io.netty.util.HashingStrategy}: it never needs a hash code, so
 * it can be written as a lambda and is invoked without any adaptation. Both forms produce identical results for the
 * same relation.
 */
public interface ElementEquality<T> {
    /**
     * Returns {@code true} if {@code sought} (the value being searched for) matches {@code element} (the value
     * stored in the slice).
     */
    boolean equal(T sought, T element);
}

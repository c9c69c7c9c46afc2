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
 * An {@link IllegalStateException} which is raised when a source has to be enumerated twice (once to learn its
 * length and once to copy it) and the second enumeration yields a different number of elements than the first.
 */
public class InconsistentSequenceException extends IllegalStateException {

    private static final long serialVersionUID = 4179508830632861795L;

    public InconsistentSequenceException() { }

    public InconsistentSequenceException(int expectedLength, int actualLength) {
        this("expected length: " + expectedLength + ", actual length: "
                + (actualLength > expectedLength ? "> " + expectedLength : actualLength));
    }

    public InconsistentSequenceException(String message) {
        super(message);
    }

    public InconsistentSequenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public InconsistentSequenceException(Throwable cause) {
        super(cause);
    }
}

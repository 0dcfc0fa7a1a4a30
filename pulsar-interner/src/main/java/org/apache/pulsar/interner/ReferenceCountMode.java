/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.pulsar.interner;

/**
 * How the reference count of the handles returned by an interner is maintained.
 */
public enum ReferenceCountMode {

    /**
     * Plain counter. Handles must stay within a single thread, or be externally synchronized.
     */
    LOCAL {
        @Override
        <T> AbstractInternedRef<T> newRef(T value) {
            return new LocalInternedRef<>(value);
        }
    },

    /**
     * Atomic counter. Handles can be retained and released concurrently from any thread.
     */
    SHARED {
        @Override
        <T> AbstractInternedRef<T> newRef(T value) {
            return new SharedInternedRef<>(value);
        }
    };

    /**
     * Create a handle that owns a single reference, the one held by the interner table.
     */
    abstract <T> AbstractInternedRef<T> newRef(T value);
}

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

import io.netty.util.ReferenceCounted;

/**
 * Reference counted, read-only handle to a canonical value held by an {@link Interner}.
 *
 * <p/>Every holder of a handle owns one reference. {@link #retain()} registers a new holder and returns the very
 * same handle, so all the holders of an interned value share one instance. {@link #release()} drops a holder; when
 * the last reference is gone the value is deallocated. The interner that produced the handle keeps one reference of
 * its own for as long as the entry stays in its table.
 *
 * <p/>Two handles are equal only when they are the same instance. Compare the values returned by {@link #get()} to
 * check for value equality.
 *
 * @param <T> type of the interned value
 */
public interface InternedRef<T> extends ReferenceCounted {

    /**
     * Get the interned value. The value is shared by all the holders and must not be modified.
     *
     * @throws io.netty.util.IllegalReferenceCountException if the handle has already been deallocated
     */
    T get();

    /**
     * Check whether both handles point to the same canonical allocation.
     */
    boolean isSameInstance(InternedRef<?> other);

    @Override
    InternedRef<T> retain();

    @Override
    InternedRef<T> retain(int increment);

    @Override
    InternedRef<T> touch();

    @Override
    InternedRef<T> touch(Object hint);
}

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

import static io.netty.util.internal.ObjectUtil.checkPositive;
import io.netty.util.IllegalReferenceCountException;
import io.netty.util.ReferenceCountUtil;
import java.util.Objects;

/**
 * Base class of the {@link InternedRef} implementations. It holds the value and the retain/release contract, while
 * subclasses only decide how the counter itself is updated.
 *
 * <p/>A handle is created with a reference count of 1, which is the reference owned by the interner table.
 */
abstract class AbstractInternedRef<T> implements InternedRef<T> {

    private final T value;

    AbstractInternedRef(T value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public final T get() {
        int refCnt = refCnt();
        if (refCnt == 0) {
            throw new IllegalReferenceCountException(refCnt);
        }
        return value;
    }

    /**
     * Access the value without checking the reference count. Used by the interner to compare the canonical instance.
     */
    final T value() {
        return value;
    }

    @Override
    public final boolean isSameInstance(InternedRef<?> other) {
        return this == other;
    }

    @Override
    public final InternedRef<T> retain() {
        retain0(1);
        return this;
    }

    @Override
    public final InternedRef<T> retain(int increment) {
        retain0(checkPositive(increment, "increment"));
        return this;
    }

    @Override
    public final boolean release() {
        return release0(1);
    }

    @Override
    public final boolean release(int decrement) {
        return release0(checkPositive(decrement, "decrement"));
    }

    @Override
    public final InternedRef<T> touch() {
        return touch(null);
    }

    @Override
    public InternedRef<T> touch(Object hint) {
        return this;
    }

    /**
     * Increment the counter.
     *
     * @throws IllegalReferenceCountException if the handle was already deallocated or the counter would overflow
     */
    protected abstract void retain0(int increment);

    /**
     * Decrement the counter and call {@link #deallocate()} once it reaches 0.
     *
     * @return true if this call deallocated the handle
     * @throws IllegalReferenceCountException if the counter is lower than the decrement
     */
    protected abstract boolean release0(int decrement);

    /**
     * Called once {@link #refCnt()} is equals 0.
     */
    protected void deallocate() {
        // values that own resources of their own (e.g. a ByteBuf) are released with the last handle, the elements
        // of a collection are not
        ReferenceCountUtil.release(value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{value=" + value + ", refCnt=" + refCnt() + "}";
    }
}

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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndexes;
import com.google.common.base.Equivalence;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Interner for sequences of elements, handed out as immutable {@link List lists}.
 *
 * <p/>Sequences are compared element by element, so a borrowed view (an array, a range of an array or any list) is
 * looked up without being copied. The view is copied only the first time an equal sequence is interned. Sequences
 * that the caller already owns can be adopted as they are with {@link #internOwned(List)}.
 *
 * <p/>Null elements are not supported. The interner does not manage the lifecycle of the elements: when a sequence
 * is discarded because an equal one is already interned, or when an interned sequence is deallocated, elements that
 * are {@link io.netty.util.ReferenceCounted} are not released, and remain owned by whoever created them.
 *
 * @param <E> type of the elements
 */
public class SliceInterner<E> implements AutoCloseable {
    private static final Equivalence<Object> EQUIVALENCE = Equivalence.equals();

    private final Interner<List<E>> interner;

    public SliceInterner() {
        this(new InternerConfig());
    }

    public SliceInterner(InternerConfig config) {
        this.interner = new Interner<>(config, EQUIVALENCE);
    }

    public static <E> SliceInterner<E> newLocalInterner() {
        return new SliceInterner<>(Interner.configFor(ReferenceCountMode.LOCAL));
    }

    public static <E> SliceInterner<E> newSharedInterner() {
        return new SliceInterner<>(Interner.configFor(ReferenceCountMode.SHARED));
    }

    public Optional<InternedRef<List<E>>> tryIntern(List<? extends E> elements) {
        return interner.tryInternKey(checkElements(elements));
    }

    public Optional<InternedRef<List<E>>> tryIntern(E[] elements) {
        return tryIntern(Arrays.asList(elements));
    }

    /**
     * Intern the sequence seen through a borrowed list, which is copied only if no equal sequence is interned.
     */
    public InternedRef<List<E>> intern(List<? extends E> elements) {
        return interner.internKey(checkElements(elements), () -> ImmutableList.copyOf(elements));
    }

    public InternedRef<List<E>> intern(E[] elements) {
        return intern(Arrays.asList(elements));
    }

    /**
     * Intern the range {@code [offset, offset + length)} of an array.
     */
    public InternedRef<List<E>> intern(E[] elements, int offset, int length) {
        checkPositionIndexes(offset, offset + length, elements.length);
        return intern(Arrays.asList(elements).subList(offset, offset + length));
    }

    /**
     * Intern a list owned by the caller without copying it. The caller must not modify the list afterwards.
     */
    public InternedRef<List<E>> internOwned(List<E> elements) {
        checkNoNullElement(elements);
        List<E> canonical = elements instanceof ImmutableList ? elements : Collections.unmodifiableList(elements);
        return interner.intern(canonical);
    }

    /**
     * Intern an array owned by the caller without copying it. The caller must not modify the array afterwards.
     */
    public InternedRef<List<E>> internOwned(E[] elements) {
        return internOwned(Arrays.asList(elements));
    }

    public boolean contains(List<? extends E> elements) {
        return interner.containsKey(checkElements(elements));
    }

    private static List<?> checkElements(List<?> elements) {
        return checkNotNull(elements, "elements");
    }

    private static void checkNoNullElement(List<?> elements) {
        for (int i = 0; i < elements.size(); i++) {
            checkNotNull(elements.get(i), "null element at index %s", i);
        }
    }

    /**
     * @see Interner#compact()
     */
    public int compact() {
        return interner.compact();
    }

    public int clear() {
        return interner.clear();
    }

    @Override
    public void close() {
        interner.close();
    }

    public int size() {
        return interner.size();
    }

    public boolean isEmpty() {
        return interner.isEmpty();
    }

    public ReferenceCountMode getReferenceCountMode() {
        return interner.getReferenceCountMode();
    }

    public InternerStats getStats() {
        return interner.getStats();
    }

    @Override
    public String toString() {
        return "SliceInterner{referenceCountMode=" + getReferenceCountMode() + ", size=" + size() + "}";
    }
}

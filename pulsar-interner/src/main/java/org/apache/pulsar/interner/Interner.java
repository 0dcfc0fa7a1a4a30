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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import com.google.common.base.Equivalence;
import io.netty.util.IllegalReferenceCountException;
import io.netty.util.ReferenceCountUtil;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Table that deduplicates immutable values behind reference counted {@link InternedRef handles}.
 *
 * <p/>Interning a value returns the handle of the first equal value that was interned, so that equal values collapse
 * into a single canonical instance and can be compared by identity. The table keeps one reference to every handle it
 * has handed out. Entries are never removed implicitly: {@link #compact()} drops the entries for which the table
 * holds the last reference, and it is up to the user to decide when to call it.
 *
 * <p/>Equality and hashing of the values are delegated to the values themselves. The hash of a value is computed once,
 * when it is interned, and its equality is checked on every lookup: a canonical value must not be mutated while it is
 * interned. For a {@link io.netty.buffer.ByteBuf} this includes its reader and writer indexes, so holders should read
 * it through {@code duplicate()} or absolute getters.
 *
 * <p/>The table is not thread-safe. {@link #intern(Object)}, {@link #compact()} and {@link #clear()} require
 * exclusive access. {@link #tryIntern(Object)} only reads the table and retains the handle it finds, so concurrent
 * callers of {@link #tryIntern(Object)} need {@link ReferenceCountMode#SHARED} handles; with
 * {@link ReferenceCountMode#LOCAL} handles every call needs exclusive access. With {@link ReferenceCountMode#SHARED}
 * the handles taken out of the table can be used from any thread.
 *
 * @param <T> type of the interned values
 */
@Slf4j
public class Interner<T> implements AutoCloseable {

    private final ReferenceCountMode referenceCountMode;
    private final boolean shrinkOnCompact;
    private final Equivalence<Object> equivalence;

    private Map<EntryKey, AbstractInternedRef<T>> entries;

    private final LongAdder hitCount = new LongAdder();
    private final LongAdder missCount = new LongAdder();
    private final LongAdder insertCount = new LongAdder();
    private final LongAdder evictionCount = new LongAdder();
    private final LongAdder compactionCount = new LongAdder();

    /**
     * Construct an interner with the default {@link InternerConfig}.
     */
    public Interner() {
        this(new InternerConfig());
    }

    public Interner(InternerConfig config) {
        this(config, Equivalence.equals());
    }

    Interner(InternerConfig config, Equivalence<? super T> equivalence) {
        checkArgument(config.getInitialCapacity() >= 0, "initialCapacity must be >= 0, got %s",
                config.getInitialCapacity());
        this.referenceCountMode = Objects.requireNonNull(config.getReferenceCountMode(), "referenceCountMode");
        this.shrinkOnCompact = config.isShrinkOnCompact();
        this.equivalence = castEquivalence(equivalence);
        this.entries = new HashMap<>(config.getInitialCapacity());
        if (log.isDebugEnabled()) {
            log.debug("Created interner with {}", config);
        }
    }

    /**
     * Interner whose handles use a plain reference counter and must stay within a single thread.
     */
    public static <T> Interner<T> newLocalInterner() {
        return new Interner<>(configFor(ReferenceCountMode.LOCAL));
    }

    /**
     * Interner whose handles use an atomic reference counter and can be shared among threads.
     */
    public static <T> Interner<T> newSharedInterner() {
        return new Interner<>(configFor(ReferenceCountMode.SHARED));
    }

    @SuppressWarnings("unchecked")
    private static Equivalence<Object> castEquivalence(Equivalence<?> equivalence) {
        // lookup views are only ever compared with values of the type the equivalence was built for
        return (Equivalence<Object>) Objects.requireNonNull(equivalence, "equivalence");
    }

    static InternerConfig configFor(ReferenceCountMode referenceCountMode) {
        InternerConfig config = new InternerConfig();
        config.setReferenceCountMode(referenceCountMode);
        return config;
    }

    /**
     * Get the handle of a value equal to the given one, if it was already interned. The table is not modified.
     *
     * @return the handle, retained on behalf of the caller, or empty if no equal value is interned
     */
    public Optional<InternedRef<T>> tryIntern(T value) {
        return tryInternKey(Objects.requireNonNull(value, "value"));
    }

    /**
     * Intern a value, taking ownership of it.
     *
     * <p/>If an equal value is already interned, the given value is discarded (and released, if it is itself
     * {@link io.netty.util.ReferenceCounted}) and the existing handle is returned. Otherwise the value becomes the
     * canonical instance.
     *
     * @return the canonical handle, retained on behalf of the caller
     */
    public InternedRef<T> intern(T value) {
        Objects.requireNonNull(value, "value");
        AbstractInternedRef<T> existing = lookup(value);
        if (existing != null) {
            if (existing.value() != value) {
                ReferenceCountUtil.release(value);
            }
            return existing;
        }
        return insert(value);
    }

    /**
     * Intern a value that remains owned by the caller. A copy is made only when no equal value is interned yet.
     *
     * @param copier creates the canonical copy, which must be equal to the given value
     * @return the canonical handle, retained on behalf of the caller
     */
    public InternedRef<T> internCopy(T value, Function<? super T, ? extends T> copier) {
        Objects.requireNonNull(copier, "copier");
        return internKey(Objects.requireNonNull(value, "value"), () -> copier.apply(value));
    }

    /**
     * Lookup by a view, which may be a borrowed object rather than a value of the interned type. The view must be
     * supported by the equivalence of this interner.
     */
    Optional<InternedRef<T>> tryInternKey(Object view) {
        return Optional.ofNullable(lookup(view));
    }

    /**
     * Get or insert the entry matching a view. The materializer creates the canonical value on a miss.
     */
    InternedRef<T> internKey(Object view, Supplier<? extends T> materializer) {
        AbstractInternedRef<T> existing = lookup(view);
        if (existing != null) {
            return existing;
        }
        T value = Objects.requireNonNull(materializer.get(), "value");
        checkState(equivalence.equivalent(view, value), "Materialized value %s does not match the interned key",
                value);
        return insert(value);
    }

    /**
     * @apiNote the returned handle must be released if it's not null
     */
    private AbstractInternedRef<T> lookup(Object view) {
        AbstractInternedRef<T> ref = entries.get(new EntryKey(equivalence, view, null));
        if (ref != null) {
            try {
                ref.retain();
                hitCount.increment();
                return ref;
            } catch (IllegalReferenceCountException e) {
                // The handle was over-released by its holders, the entry is stale
                if (log.isDebugEnabled()) {
                    log.debug("Ignoring deallocated entry for {}", ref.value());
                }
            }
        }
        missCount.increment();
        return null;
    }

    private InternedRef<T> insert(T value) {
        AbstractInternedRef<T> ref = referenceCountMode.newRef(value);
        // deallocated entries never match a key, they stay in the table until the next compaction
        entries.put(new EntryKey(equivalence, value, ref), ref);
        insertCount.increment();
        return ref.retain();
    }

    /**
     * Check whether a value equal to the given one is interned, without retaining its handle.
     */
    public boolean contains(T value) {
        return containsKey(Objects.requireNonNull(value, "value"));
    }

    boolean containsKey(Object view) {
        AbstractInternedRef<T> ref = entries.get(new EntryKey(equivalence, view, null));
        return ref != null && ref.refCnt() > 0;
    }

    /**
     * Remove the entries that are not referenced outside of the table, then shrink the table storage.
     *
     * <p/>An entry is kept only if its handle has more than one reference: the one owned by the table and at least one
     * owned by a holder. The values of the removed entries are deallocated.
     *
     * @return the number of removed entries
     */
    public int compact() {
        int removed = 0;
        Iterator<AbstractInternedRef<T>> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            AbstractInternedRef<T> ref = iterator.next();
            // a handle with a single reference is only reachable through the table, so its count can't grow here
            int refCnt = ref.refCnt();
            if (refCnt > 1) {
                continue;
            }
            iterator.remove();
            removed++;
            if (refCnt == 1) {
                ref.release();
            } else {
                log.warn("Unexpected refCnt {} for {}, removed entry without releasing the value", refCnt,
                        ref.value());
            }
        }
        if (removed > 0 && shrinkOnCompact) {
            entries = new HashMap<>(entries);
        }
        evictionCount.add(removed);
        compactionCount.increment();
        if (log.isDebugEnabled()) {
            log.debug("Compacted interner, removed {} entries, {} remaining", removed, entries.size());
        }
        return removed;
    }

    /**
     * Remove all the entries and release the references held by the table. Handles owned by other holders remain
     * valid.
     *
     * @return the number of removed entries
     */
    public int clear() {
        int removed = entries.size();
        for (AbstractInternedRef<T> ref : entries.values()) {
            try {
                ref.release();
            } catch (IllegalReferenceCountException e) {
                log.warn("Unexpected refCnt {} for {}, removed entry without releasing the value", ref.refCnt(),
                        ref.value());
            }
        }
        entries = new HashMap<>();
        if (log.isDebugEnabled()) {
            log.debug("Cleared interner, removed {} entries", removed);
        }
        return removed;
    }

    /**
     * Same as {@link #clear()}. The interner can still be used afterwards.
     */
    @Override
    public void close() {
        clear();
    }

    /**
     * Number of entries in the table, including the ones that the next {@link #compact()} would remove.
     */
    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public ReferenceCountMode getReferenceCountMode() {
        return referenceCountMode;
    }

    public InternerStats getStats() {
        return new InternerStats(entries.size(), hitCount.sum(), missCount.sum(), insertCount.sum(),
                evictionCount.sum(), compactionCount.sum());
    }

    @Override
    public String toString() {
        return "Interner{referenceCountMode=" + referenceCountMode + ", size=" + entries.size() + "}";
    }

    /**
     * Key of the table. The hash is computed once, so that entries can be moved and removed without touching their
     * value. The key of an entry whose handle has been deallocated is only equal to itself: its value may already have
     * been released and can't be compared anymore.
     */
    private static final class EntryKey {
        private final Equivalence<Object> equivalence;
        private final Object reference;
        private final int hash;
        // null for the keys used in lookups
        private final AbstractInternedRef<?> ref;

        EntryKey(Equivalence<Object> equivalence, Object reference, AbstractInternedRef<?> ref) {
            this.equivalence = equivalence;
            this.reference = reference;
            this.hash = equivalence.hash(reference);
            this.ref = ref;
        }

        private boolean isDeallocated() {
            return ref != null && ref.refCnt() == 0;
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof EntryKey)) {
                return false;
            }
            EntryKey that = (EntryKey) obj;
            if (hash != that.hash || isDeallocated() || that.isDeallocated()) {
                return false;
            }
            return equivalence.equivalent(reference, that.reference);
        }
    }
}

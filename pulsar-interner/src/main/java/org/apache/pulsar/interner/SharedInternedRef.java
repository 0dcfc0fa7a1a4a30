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

import io.netty.util.IllegalReferenceCountException;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

/**
 * {@link InternedRef} with an atomic counter. Holders in different threads can retain and release the same handle
 * without any external synchronization.
 *
 * <p/>A successful {@link #retain()} always leaves the handle valid: the counter is never moved away from 0 once the
 * value has been deallocated.
 */
final class SharedInternedRef<T> extends AbstractInternedRef<T> {
    @SuppressWarnings("rawtypes")
    private static final AtomicIntegerFieldUpdater<SharedInternedRef> REF_CNT_UPDATER =
            AtomicIntegerFieldUpdater.newUpdater(SharedInternedRef.class, "refCnt");

    private volatile int refCnt = 1;

    SharedInternedRef(T value) {
        super(value);
    }

    @Override
    public int refCnt() {
        return refCnt;
    }

    @Override
    protected void retain0(int increment) {
        for (;;) {
            int refCnt = this.refCnt;
            final int nextCnt = refCnt + increment;

            // Ensure we not resurrect (which means the refCnt was 0) and also that we encountered an overflow.
            if (nextCnt <= increment) {
                throw new IllegalReferenceCountException(refCnt, increment);
            }
            if (REF_CNT_UPDATER.compareAndSet(this, refCnt, nextCnt)) {
                return;
            }
        }
    }

    @Override
    protected boolean release0(int decrement) {
        for (;;) {
            int refCnt = this.refCnt;
            if (refCnt < decrement) {
                throw new IllegalReferenceCountException(refCnt, -decrement);
            }

            if (REF_CNT_UPDATER.compareAndSet(this, refCnt, refCnt - decrement)) {
                if (refCnt == decrement) {
                    deallocate();
                    return true;
                }
                return false;
            }
        }
    }
}

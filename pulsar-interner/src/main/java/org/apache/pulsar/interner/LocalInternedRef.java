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

/**
 * {@link InternedRef} whose counter is a plain field. It must only be retained and released from a single thread, or
 * under external synchronization.
 */
final class LocalInternedRef<T> extends AbstractInternedRef<T> {

    private int refCnt = 1;

    LocalInternedRef(T value) {
        super(value);
    }

    @Override
    public int refCnt() {
        return refCnt;
    }

    @Override
    protected void retain0(int increment) {
        int nextCnt = refCnt + increment;
        // Ensure we not resurrect (which means the refCnt was 0) and also that we encountered an overflow.
        if (nextCnt <= increment) {
            throw new IllegalReferenceCountException(refCnt, increment);
        }
        refCnt = nextCnt;
    }

    @Override
    protected boolean release0(int decrement) {
        if (refCnt < decrement) {
            throw new IllegalReferenceCountException(refCnt, -decrement);
        }
        refCnt -= decrement;
        if (refCnt == 0) {
            deallocate();
            return true;
        }
        return false;
    }
}

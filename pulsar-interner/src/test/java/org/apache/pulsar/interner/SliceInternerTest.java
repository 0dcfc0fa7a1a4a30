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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotSame;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;
import com.google.common.collect.Lists;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.Cleanup;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class SliceInternerTest {

    @DataProvider
    public static Object[][] referenceCountModes() {
        return new Object[][]{ { ReferenceCountMode.LOCAL }, { ReferenceCountMode.SHARED } };
    }

    @Test(dataProvider = "referenceCountModes")
    public void borrowedAndOwned(ReferenceCountMode mode) {
        @Cleanup
        SliceInterner<Integer> interner = new SliceInterner<>(Interner.configFor(mode));
        assertEquals(interner.getReferenceCountMode(), mode);

        InternedRef<List<Integer>> borrowed = interner.intern(new Integer[]{ 1, 2, 3 });
        InternedRef<List<Integer>> owned = interner.internOwned(Lists.newArrayList(1, 2, 3));
        InternedRef<List<Integer>> view = interner.intern(Arrays.asList(1, 2, 3));

        assertSame(owned, borrowed);
        assertSame(view, borrowed);
        assertEquals(borrowed.get(), List.of(1, 2, 3));
        assertEquals(borrowed.refCnt(), 4);
        assertEquals(interner.size(), 1);
    }

    @Test
    public void borrowedArrayIsCopiedOnMiss() {
        SliceInterner<String> interner = SliceInterner.newLocalInterner();
        String[] elements = { "a", "b", "c" };

        InternedRef<List<String>> ref = interner.intern(elements);
        elements[0] = "z";

        assertEquals(ref.get(), List.of("a", "b", "c"));
        assertFalse(interner.contains(Arrays.asList(elements)));
        assertTrue(interner.contains(List.of("a", "b", "c")));
        expectThrows(UnsupportedOperationException.class, () -> ref.get().add("d"));
    }

    @Test
    public void borrowedHitDoesNotCopy() {
        SliceInterner<String> interner = SliceInterner.newSharedInterner();

        InternedRef<List<String>> ref1 = interner.intern(List.of("a", "b"));
        List<String> canonical = ref1.get();
        InternedRef<List<String>> ref2 = interner.intern(new String[]{ "a", "b" });

        assertSame(ref2, ref1);
        assertSame(ref2.get(), canonical);
    }

    @Test
    public void ownedListIsAdopted() {
        SliceInterner<String> interner = SliceInterner.newLocalInterner();
        List<String> owned = new ArrayList<>(List.of("a", "b"));

        InternedRef<List<String>> ref = interner.internOwned(owned);
        assertEquals(ref.get(), owned);
        expectThrows(UnsupportedOperationException.class, () -> ref.get().add("c"));

        // a second owned list with the same elements is discarded
        InternedRef<List<String>> ref2 = interner.internOwned(new ArrayList<>(List.of("a", "b")));
        assertSame(ref2, ref);
    }

    @Test
    public void ownedArrayIsAdopted() {
        SliceInterner<Integer> interner = SliceInterner.newLocalInterner();

        InternedRef<List<Integer>> ref = interner.internOwned(new Integer[]{ 4, 5 });
        assertEquals(ref.get(), List.of(4, 5));
        assertSame(interner.intern(List.of(4, 5)), ref);
    }

    @Test
    public void arrayRange() {
        SliceInterner<Integer> interner = SliceInterner.newLocalInterner();
        Integer[] elements = { 1, 2, 3, 4 };

        InternedRef<List<Integer>> range = interner.intern(elements, 1, 2);
        assertEquals(range.get(), List.of(2, 3));
        assertSame(interner.intern(new Integer[]{ 2, 3 }), range);

        InternedRef<List<Integer>> empty = interner.intern(elements, 4, 0);
        assertTrue(empty.get().isEmpty());
        assertSame(interner.internOwned(new ArrayList<>()), empty);

        expectThrows(IndexOutOfBoundsException.class, () -> interner.intern(elements, 3, 2));
        expectThrows(IndexOutOfBoundsException.class, () -> interner.intern(elements, -1, 2));
        assertEquals(interner.size(), 2);
    }

    @Test(dataProvider = "referenceCountModes")
    public void compact(ReferenceCountMode mode) {
        SliceInterner<Integer> interner = new SliceInterner<>(Interner.configFor(mode));

        InternedRef<List<Integer>> x = interner.intern(new Integer[]{ 4, 2 });
        InternedRef<List<Integer>> y = interner.intern(new Integer[]{ 1, 3, 3, 7 });
        InternedRef<List<Integer>> z = y.retain();
        x.release();
        y.release();

        assertEquals(interner.compact(), 1);
        assertFalse(interner.tryIntern(new Integer[]{ 4, 2 }).isPresent());
        Optional<InternedRef<List<Integer>>> found = interner.tryIntern(List.of(1, 3, 3, 7));
        assertTrue(found.isPresent());
        assertTrue(found.get().isSameInstance(z));

        assertEquals(interner.compact(), 0);
        assertEquals(interner.getStats().getEvictionCount(), 1);
    }

    @Test
    public void clear() {
        SliceInterner<Integer> interner = SliceInterner.newLocalInterner();
        InternedRef<List<Integer>> ref = interner.intern(new Integer[]{ 1 });

        assertEquals(interner.clear(), 1);
        assertTrue(interner.isEmpty());
        assertEquals(ref.refCnt(), 1);
        assertNotSame(interner.intern(new Integer[]{ 1 }), ref);
    }

    @Test
    public void referenceCountedElementsAreNotReleased() {
        SliceInterner<ByteBuf> interner = SliceInterner.newLocalInterner();
        ByteBuf canonical = Unpooled.copiedBuffer(new byte[]{ 1 });
        ByteBuf discarded = Unpooled.copiedBuffer(new byte[]{ 1 });

        InternedRef<List<ByteBuf>> ref1 = interner.internOwned(Lists.newArrayList(canonical));
        InternedRef<List<ByteBuf>> ref2 = interner.internOwned(Lists.newArrayList(discarded));
        assertSame(ref2, ref1);
        assertEquals(discarded.refCnt(), 1);

        ref1.release(2);
        assertEquals(interner.compact(), 1);
        assertEquals(ref1.refCnt(), 0);
        assertEquals(canonical.refCnt(), 1);

        canonical.release();
        discarded.release();
    }

    @Test
    public void nullElements() {
        SliceInterner<String> interner = SliceInterner.newLocalInterner();

        expectThrows(NullPointerException.class, () -> interner.intern(new String[]{ "a", null }));
        expectThrows(NullPointerException.class, () -> interner.internOwned(Arrays.asList("a", null)));
        expectThrows(NullPointerException.class, () -> interner.intern((List<String>) null));
        assertTrue(interner.isEmpty());
    }
}

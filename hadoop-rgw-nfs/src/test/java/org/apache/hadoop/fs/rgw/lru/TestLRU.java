/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.hadoop.fs.rgw.lru;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.apache.hadoop.fs.rgw.RGWTestRule;
import org.junit.Rule;
import org.junit.Test;

public class TestLRU {
    @Rule
    public RGWTestRule testRule = new RGWTestRule();

    static class Item extends LRUObject {
        String id;

        boolean refuseReclaim;

        int reclaimed;

        boolean lastReclaimBlocking;

        Item(String id) {
            this.id = id;
        }

        @Override
        public boolean reclaim(boolean blocking) {
            lastReclaimBlocking = blocking;
            if (refuseReclaim) {
                return false;
            }
            reclaimed++;
            return true;
        }

        @Override
        public String toString() {
            return id;
        }
    }

    static class ItemFactory implements ObjectFactory<Item> {
        final String id;

        int allocs;

        int recycles;

        ItemFactory(String id) {
            this.id = id;
        }

        @Override
        public Item alloc() {
            allocs++;
            return new Item(id);
        }

        @Override
        public Item recycle(Item o) {
            recycles++;
            o.id = id;
            return o;
        }
    }

    private static Item insert(LRU<Item> lru, String id, int flags) {
        return lru.insert(new ItemFactory(id), LRU.Edge.MRU, flags);
    }

    @Test
    public void testInitialReferenceIsOnTopOfSentinel() {
        LRU<Item> lru = new LRU<>(1, 10);
        Item caller = insert(lru, "a", LRU.FLAG_INITIAL);
        Item idle = insert(lru, "b", LRU.FLAG_NONE);
        assertEquals(LRU.SENTINEL_REFCNT + 1, caller.getRefcnt());
        assertEquals(LRU.SENTINEL_REFCNT, idle.getRefcnt());
        assertEquals(2, lru.size());
        assertEquals(0, caller.getLane());
    }

    @Test
    public void testUnrefToZeroReclaimsAndLeavesRing() {
        LRU<Item> lru = new LRU<>(1, 10);
        Item a = insert(lru, "a", LRU.FLAG_INITIAL);
        lru.unref(a, LRU.FLAG_NONE);
        assertEquals(0, a.reclaimed);
        assertEquals(1, lru.size());

        lru.unref(a, LRU.FLAG_NONE);
        assertEquals(1, a.reclaimed);
        assertTrue(a.lastReclaimBlocking);
        assertEquals(0, lru.size());
        assertEquals(-1, a.getLane());
        assertFalse("ref after release must report a lost race", lru.ref(a, LRU.FLAG_INITIAL));
    }

    @Test
    public void testUnrefOutsideRingIsFatal() {
        LRU<Item> lru = new LRU<>(1, 10);
        try {
            lru.unref(new Item("stray"), LRU.FLAG_NONE);
            fail("unref of an object never inserted");
        } catch (LRUInvariantException expected) {
            assertTrue(expected.getMessage().contains("outside the ring"));
        }
    }

    @Test
    public void testRefMovesToMruEnd() {
        LRU<Item> lru = new LRU<>(1, 10);
        Item a = insert(lru, "a", LRU.FLAG_NONE);
        Item b = insert(lru, "b", LRU.FLAG_NONE);
        Item c = insert(lru, "c", LRU.FLAG_NONE);
        assertEquals(Arrays.asList(c, b, a), lru.laneContents(0));

        assertTrue(lru.ref(a, LRU.FLAG_INITIAL));
        assertEquals(Arrays.asList(a, c, b), lru.laneContents(0));

        assertTrue(lru.ref(b, LRU.FLAG_NONE));
        assertEquals("a plain ref keeps the position", Arrays.asList(a, c, b), lru.laneContents(0));
    }

    @Test
    public void testLruEdgeInsertsAtTail() {
        LRU<Item> lru = new LRU<>(1, 10);
        Item a = insert(lru, "a", LRU.FLAG_NONE);
        Item b = lru.insert(new ItemFactory("b"), LRU.Edge.LRU, LRU.FLAG_NONE);
        assertEquals(Arrays.asList(a, b), lru.laneContents(0));
    }

    @Test
    public void testEvictionSkipsReferencedTail() {
        LRU<Item> lru = new LRU<>(1, 3);
        Item held = insert(lru, "held", LRU.FLAG_INITIAL);
        Item idle = insert(lru, "idle", LRU.FLAG_NONE);
        Item newer = insert(lru, "newer", LRU.FLAG_INITIAL);

        ItemFactory factory = new ItemFactory("next");
        Item next = lru.insert(factory, LRU.Edge.MRU, LRU.FLAG_INITIAL);

        assertEquals(1, idle.reclaimed);
        assertFalse(idle.lastReclaimBlocking);
        assertEquals(0, held.reclaimed);
        assertSame("evicted storage is recycled", idle, next);
        assertEquals("next", next.id);
        assertEquals(1, factory.recycles);
        assertEquals(0, factory.allocs);
        assertEquals(Arrays.asList(next, newer, held), lru.laneContents(0));
        assertEquals(1, lru.getEvictionCount());
        assertEquals(1, lru.getRecycleCount());
        assertEquals(LRU.SENTINEL_REFCNT + 1, next.getRefcnt());
    }

    @Test
    public void testNoIdleVictimAllocatesPastHighWaterMark() {
        LRU<Item> lru = new LRU<>(1, 2);
        Item a = insert(lru, "a", LRU.FLAG_INITIAL);
        Item b = insert(lru, "b", LRU.FLAG_INITIAL);
        ItemFactory factory = new ItemFactory("c");
        Item c = lru.insert(factory, LRU.Edge.MRU, LRU.FLAG_INITIAL);
        assertEquals(1, factory.allocs);
        assertNotSame(a, c);
        assertNotSame(b, c);
        assertEquals(3, lru.size());
        assertEquals(0, lru.getEvictionCount());
    }

    @Test
    public void testRefusedReclaimRestoresVictim() {
        LRU<Item> lru = new LRU<>(1, 1);
        Item stubborn = insert(lru, "stubborn", LRU.FLAG_NONE);
        stubborn.refuseReclaim = true;

        ItemFactory factory = new ItemFactory("fresh");
        Item fresh = lru.insert(factory, LRU.Edge.MRU, LRU.FLAG_NONE);
        assertNotSame(stubborn, fresh);
        assertEquals(1, factory.allocs);
        assertEquals(Arrays.asList(fresh, stubborn), lru.laneContents(0));
        assertTrue("restored victim can be referenced again", lru.ref(stubborn, LRU.FLAG_NONE));
    }

    @Test
    public void testEvictionStopsBelowHighWaterMark() {
        LRU<Item> lru = new LRU<>(1, 2);
        Item a = insert(lru, "a", LRU.FLAG_NONE);
        Item b = insert(lru, "b", LRU.FLAG_NONE);
        // lane is at the mark: a is taken, which brings the lane under it
        Item c = insert(lru, "c", LRU.FLAG_NONE);
        assertSame(a, c);
        assertEquals(Arrays.asList(c, b), lru.laneContents(0));
    }

    @Test
    public void testLanesAreFilledRoundRobin() {
        LRU<Item> lru = new LRU<>(3, 10);
        for (int i = 0; i < 6; i++) {
            insert(lru, "i" + i, LRU.FLAG_NONE);
        }
        assertEquals(3, lru.laneCount());
        for (int ix = 0; ix < 3; ix++) {
            assertEquals(2, lru.laneSize(ix));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsZeroLanes() {
        new LRU<Item>(0, 10);
    }
}

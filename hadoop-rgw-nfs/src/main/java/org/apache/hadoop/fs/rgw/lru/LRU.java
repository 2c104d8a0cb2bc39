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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference-counting LRU split into independently locked lanes.
 *
 * <p>Every object in the ring carries one sentinel reference owned by the
 * ring itself. An object whose count equals {@link #SENTINEL_REFCNT} is idle
 * and may be chosen as an eviction victim; an object whose count drops to
 * zero leaves the ring and is reclaimed.
 *
 * <p>Eviction happens on {@link #insert}: when the target lane is at its
 * high-water mark, idle objects are taken from the LRU end, oldest first.
 * Referenced objects are skipped and keep their position. Victims are
 * reclaimed after the lane lock has been dropped, so {@link
 * LRUObject#reclaim(boolean)} may take other locks.
 *
 * @param <T> object type
 */
public class LRU<T extends LRUObject> {
    private static final Logger LOG = LoggerFactory.getLogger(LRU.class);

    public static final int FLAG_NONE = 0x0000;

    /**
     * The caller takes a reference for itself; the object moves to the MRU
     * end.
     */
    public static final int FLAG_INITIAL = 0x0001;

    public static final long SENTINEL_REFCNT = 1;

    /**
     * End of a lane's recency list.
     */
    public enum Edge {
        MRU, LRU
    }

    private static final class Lane {
        private final ReentrantLock lock = new ReentrantLock();

        /** MRU end. */
        private LRUObject head;

        /** LRU end. */
        private LRUObject tail;

        private int size;
    }

    private final Lane[] lanes;

    private final int laneHiwat;

    private final AtomicInteger nextLane = new AtomicInteger();

    private final AtomicLong evictions = new AtomicLong();

    private final AtomicLong recycles = new AtomicLong();

    public LRU(final int nLanes, final int laneHiwat) {
        Preconditions.checkArgument(nLanes > 0, "lane count must be positive: %s", nLanes);
        Preconditions.checkArgument(laneHiwat > 0, "lane high-water mark must be positive: %s", laneHiwat);
        this.lanes = new Lane[nLanes];
        for (int i = 0; i < nLanes; i++) {
            lanes[i] = new Lane();
        }
        this.laneHiwat = laneHiwat;
    }

    /**
     * Insert a new object produced by {@code factory}.
     *
     * @param factory supplies a fresh or recycled object
     * @param edge    end of the lane to link the object at
     * @param flags   {@link #FLAG_INITIAL} to hand a reference to the caller
     * @return the inserted object, or null if the factory produced none
     */
    public T insert(final ObjectFactory<T> factory, final Edge edge, final int flags) {
        final int ix = Math.floorMod(nextLane.getAndIncrement(), lanes.length);
        final Lane lane = lanes[ix];

        T o = null;
        for (T victim : collectVictims(lane)) {
            // the caller may hold an index latch, so teardown must not block
            if (victim.reclaim(false)) {
                evictions.incrementAndGet();
                release(lane, victim);
                if (o == null) {
                    o = factory.recycle(victim);
                    recycles.incrementAndGet();
                }
            } else {
                restore(lane, victim);
            }
        }
        if (o == null) {
            o = factory.alloc();
        }
        if (o == null) {
            return null;
        }

        lane.lock.lock();
        try {
            o.lane = ix;
            o.reclaiming = false;
            o.refcnt = SENTINEL_REFCNT + (((flags & FLAG_INITIAL) != 0) ? 1 : 0);
            if (edge == Edge.MRU) {
                linkHead(lane, o);
            } else {
                linkTail(lane, o);
            }
        } finally {
            lane.lock.unlock();
        }
        return o;
    }

    /**
     * Take a reference.
     *
     * @param o     object
     * @param flags {@link #FLAG_INITIAL} moves the object to the MRU end
     * @return false if the object is being reclaimed; the caller lost a race
     *     and has to look the object up again
     */
    public boolean ref(final T o, final int flags) {
        final int ix = o.lane;
        if (ix < 0) {
            return false;
        }
        final Lane lane = lanes[ix];
        lane.lock.lock();
        try {
            if (o.lane != ix || o.reclaiming || o.refcnt < SENTINEL_REFCNT) {
                return false;
            }
            ++o.refcnt;
            if ((flags & FLAG_INITIAL) != 0 && lane.head != o) {
                unlink(lane, o);
                linkHead(lane, o);
            }
            return true;
        } finally {
            lane.lock.unlock();
        }
    }

    /**
     * Drop a reference. When the count reaches zero the object leaves the
     * ring and is reclaimed on the calling thread.
     *
     * @param o     object
     * @param flags unused, {@link #FLAG_NONE}
     */
    public void unref(final T o, final int flags) {
        final int ix = o.lane;
        if (ix < 0) {
            throw new LRUInvariantException("unref of an object outside the ring");
        }
        final Lane lane = lanes[ix];
        boolean free = false;
        lane.lock.lock();
        try {
            if (o.refcnt <= 0) {
                throw new LRUInvariantException("unref of an object with refcnt " + o.refcnt);
            }
            --o.refcnt;
            if (o.refcnt == 0 && !o.reclaiming) {
                if (o.linked) {
                    unlink(lane, o);
                }
                o.reclaiming = true;
                free = true;
            }
        } finally {
            lane.lock.unlock();
        }
        if (free) {
            LOG.debug("releasing {} from lane {}", o, ix);
            o.reclaim(true);
            release(lane, o);
        }
    }

    /**
     * @return number of objects currently linked into the ring
     */
    public int size() {
        int n = 0;
        for (Lane lane : lanes) {
            lane.lock.lock();
            try {
                n += lane.size;
            } finally {
                lane.lock.unlock();
            }
        }
        return n;
    }

    public int laneCount() {
        return lanes.length;
    }

    public int getLaneHiwat() {
        return laneHiwat;
    }

    public long getEvictionCount() {
        return evictions.get();
    }

    public long getRecycleCount() {
        return recycles.get();
    }

    @VisibleForTesting
    int laneSize(final int ix) {
        Lane lane = lanes[ix];
        lane.lock.lock();
        try {
            return lane.size;
        } finally {
            lane.lock.unlock();
        }
    }

    /**
     * Objects of a lane from MRU to LRU end.
     */
    @VisibleForTesting
    List<LRUObject> laneContents(final int ix) {
        Lane lane = lanes[ix];
        List<LRUObject> result = new ArrayList<>();
        lane.lock.lock();
        try {
            for (LRUObject o = lane.head; o != null; o = o.next) {
                result.add(o);
            }
        } finally {
            lane.lock.unlock();
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private List<T> collectVictims(final Lane lane) {
        lane.lock.lock();
        try {
            if (lane.size < laneHiwat) {
                return Collections.emptyList();
            }
            List<T> victims = new ArrayList<>();
            LRUObject o = lane.tail;
            while (o != null && lane.size >= laneHiwat) {
                LRUObject towardsMru = o.prev;
                if (!o.reclaiming && o.refcnt == SENTINEL_REFCNT) {
                    unlink(lane, o);
                    o.reclaiming = true;
                    victims.add((T) o);
                }
                o = towardsMru;
            }
            if (LOG.isDebugEnabled() && !victims.isEmpty()) {
                LOG.debug("lane at high-water mark {}, evicting {} objects", laneHiwat, victims.size());
            }
            return victims;
        } finally {
            lane.lock.unlock();
        }
    }

    /**
     * Put back a victim whose teardown was refused.
     */
    private void restore(final Lane lane, final T o) {
        lane.lock.lock();
        try {
            o.reclaiming = false;
            if (o.refcnt < SENTINEL_REFCNT) {
                // the ring's own reference was dropped by a drain meanwhile
                o.lane = -1;
                LOG.debug("dropping drained victim {}", o);
                return;
            }
            linkTail(lane, o);
        } finally {
            lane.lock.unlock();
        }
    }

    private void release(final Lane lane, final LRUObject o) {
        lane.lock.lock();
        try {
            o.resetLinks();
        } finally {
            lane.lock.unlock();
        }
    }

    private static void linkHead(final Lane lane, final LRUObject o) {
        if (o.linked) {
            throw new LRUInvariantException("object already linked into a lane");
        }
        o.prev = null;
        o.next = lane.head;
        if (lane.head != null) {
            lane.head.prev = o;
        } else {
            lane.tail = o;
        }
        lane.head = o;
        o.linked = true;
        ++lane.size;
    }

    private static void linkTail(final Lane lane, final LRUObject o) {
        if (o.linked) {
            throw new LRUInvariantException("object already linked into a lane");
        }
        o.next = null;
        o.prev = lane.tail;
        if (lane.tail != null) {
            lane.tail.next = o;
        } else {
            lane.head = o;
        }
        lane.tail = o;
        o.linked = true;
        ++lane.size;
    }

    private static void unlink(final Lane lane, final LRUObject o) {
        if (!o.linked) {
            throw new LRUInvariantException("removing an object that is not linked into a lane");
        }
        if (o.prev != null) {
            o.prev.next = o.next;
        } else {
            lane.head = o.next;
        }
        if (o.next != null) {
            o.next.prev = o.prev;
        } else {
            lane.tail = o.prev;
        }
        o.prev = null;
        o.next = null;
        o.linked = false;
        --lane.size;
    }
}

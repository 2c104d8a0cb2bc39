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
import java.util.Arrays;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * Ordered index split into partitions, each guarded by its own latch.
 *
 * <p>{@link #findLatch} returns with the partition latch held so that the
 * caller can complete a check-then-act sequence (take a reference, or insert
 * a new entry with {@link #insertLatched}) before any other thread can
 * observe or change the same key. Every partition also keeps a small
 * direct-mapped look-aside array in front of its tree.
 *
 * @param <K> key type
 * @param <T> entry type
 */
public class PartitionedIndex<K extends Comparable<K>, T> {
    private static final Logger LOG = LoggerFactory.getLogger(PartitionedIndex.class);

    public static final int FLAG_NONE = 0x0000;

    /**
     * Acquire the partition latch.
     */
    public static final int FLAG_LOCK = 0x0001;

    /**
     * Release the latch before returning.
     */
    public static final int FLAG_UNLOCK = 0x0002;

    /**
     * Give up instead of waiting for a busy latch.
     */
    public static final int FLAG_TRYLOCK = 0x0004;

    private static final class Partition<K, T> {
        private final ReentrantLock lock = new ReentrantLock();

        private final TreeMap<K, T> tree = new TreeMap<>();

        private final Object[] cache;

        private Partition(final int cacheSize) {
            this.cache = new Object[cacheSize];
        }
    }

    /**
     * A held (or released) partition latch.
     */
    public static final class Latch {
        private Partition<?, ?> partition;

        private ReentrantLock lock;

        public boolean isHeld() {
            return lock != null && lock.isHeldByCurrentThread();
        }

        /**
         * Release the latch taken by {@link PartitionedIndex#findLatch}.
         */
        public void unlock() {
            if (lock == null) {
                throw new LRUInvariantException("unlock of a latch that was never taken");
            }
            lock.unlock();
        }
    }

    private final Partition<K, T>[] partitions;

    private final int cacheSize;

    private final Function<T, K> keyOf;

    private final ToLongFunction<K> selectorOf;

    @SuppressWarnings("unchecked")
    public PartitionedIndex(final int nPartitions, final int cacheSize, final Function<T, K> keyOf,
        final ToLongFunction<K> selectorOf) {
        Preconditions.checkArgument(nPartitions > 0, "partition count must be positive: %s", nPartitions);
        Preconditions.checkArgument(cacheSize > 0, "cache size must be positive: %s", cacheSize);
        this.partitions = new Partition[nPartitions];
        for (int i = 0; i < nPartitions; i++) {
            partitions[i] = new Partition<>(cacheSize);
        }
        this.cacheSize = cacheSize;
        this.keyOf = Preconditions.checkNotNull(keyOf);
        this.selectorOf = Preconditions.checkNotNull(selectorOf);
    }

    /**
     * Look {@code key} up and leave its partition latched.
     *
     * @param key   key
     * @param latch receives the partition latch
     * @param flags {@link #FLAG_LOCK}; the latch is then held on return,
     *              whether or not an entry was found
     * @return the entry, or null
     */
    public T findLatch(final K key, final Latch latch, final int flags) {
        final long selector = selectorOf.applyAsLong(key);
        final Partition<K, T> p = partitionOf(selector);
        if ((flags & FLAG_LOCK) != 0) {
            p.lock.lock();
        }
        latch.partition = p;
        latch.lock = p.lock;

        final int slot = slotOf(selector);
        T entry = cached(p, slot);
        if (entry != null && keyOf.apply(entry).compareTo(key) == 0) {
            return entry;
        }
        entry = p.tree.get(key);
        if (entry != null) {
            p.cache[slot] = entry;
        }
        return entry;
    }

    /**
     * Insert {@code entry} into the partition latched by a preceding
     * {@link #findLatch} that found nothing.
     *
     * @param entry new entry
     * @param latch latch returned by {@code findLatch}
     * @param flags {@link #FLAG_UNLOCK} releases the latch afterwards
     */
    public void insertLatched(final T entry, final Latch latch, final int flags) {
        final K key = keyOf.apply(entry);
        final long selector = selectorOf.applyAsLong(key);
        final Partition<K, T> p = partitionOf(selector);
        if (latch.partition != p || !p.lock.isHeldByCurrentThread()) {
            throw new LRUInvariantException("insert without holding the partition latch");
        }
        try {
            T prior = p.tree.get(key);
            if (prior != null && prior != entry) {
                throw new LRUInvariantException("a live entry already exists for " + key);
            }
            p.tree.put(key, entry);
            p.cache[slotOf(selector)] = entry;
        } finally {
            if ((flags & FLAG_UNLOCK) != 0) {
                p.lock.unlock();
            }
        }
    }

    /**
     * Remove {@code entry} if it is still the entry published for its key.
     *
     * @param entry entry to remove
     * @param flags {@link #FLAG_LOCK} or {@link #FLAG_TRYLOCK}
     * @return false only when {@link #FLAG_TRYLOCK} was given and the latch
     *     was busy
     */
    public boolean remove(final T entry, final int flags) {
        final K key = keyOf.apply(entry);
        final long selector = selectorOf.applyAsLong(key);
        final Partition<K, T> p = partitionOf(selector);
        if ((flags & FLAG_TRYLOCK) != 0) {
            if (!p.lock.tryLock()) {
                return false;
            }
        } else {
            p.lock.lock();
        }
        try {
            if (p.tree.get(key) == entry) {
                p.tree.remove(key);
            }
            int slot = slotOf(selector);
            if (p.cache[slot] == entry) {
                p.cache[slot] = null;
            }
            return true;
        } finally {
            p.lock.unlock();
        }
    }

    /**
     * Remove every entry, then pass each of them to {@code visitor}. The
     * visitor runs without any latch held.
     *
     * @param visitor called once per removed entry
     * @param flags   {@link #FLAG_LOCK}
     */
    public void drain(final Consumer<T> visitor, final int flags) {
        for (Partition<K, T> p : partitions) {
            List<T> drained;
            if ((flags & FLAG_LOCK) != 0) {
                p.lock.lock();
            }
            try {
                drained = new ArrayList<>(p.tree.values());
                p.tree.clear();
                Arrays.fill(p.cache, null);
            } finally {
                if ((flags & FLAG_LOCK) != 0) {
                    p.lock.unlock();
                }
            }
            LOG.debug("drained {} entries from partition", drained.size());
            for (T entry : drained) {
                visitor.accept(entry);
            }
        }
    }

    /**
     * @return number of published entries
     */
    public int size() {
        int n = 0;
        for (Partition<K, T> p : partitions) {
            p.lock.lock();
            try {
                n += p.tree.size();
            } finally {
                p.lock.unlock();
            }
        }
        return n;
    }

    /**
     * @return whether {@code thread} is waiting for the latch of the
     *     partition {@code key} maps to
     */
    @VisibleForTesting
    public boolean isWaitingForLatch(final K key, final Thread thread) {
        return partitionOf(selectorOf.applyAsLong(key)).lock.hasQueuedThread(thread);
    }

    public int partitionCount() {
        return partitions.length;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    private Partition<K, T> partitionOf(final long selector) {
        return partitions[(int) Long.remainderUnsigned(selector, partitions.length)];
    }

    private int slotOf(final long selector) {
        return (int) Long.remainderUnsigned(selector, cacheSize);
    }

    @SuppressWarnings("unchecked")
    private T cached(final Partition<K, T> p, final int slot) {
        return (T) p.cache[slot];
    }
}

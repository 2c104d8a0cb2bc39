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

package org.apache.hadoop.fs.rgw;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the file handle cache of one {@link RGWFileSystem}.
 */
public class FhCacheStatistics {
    private static final Logger LOG = LoggerFactory.getLogger(FhCacheStatistics.class);

    public enum StatisticType {
        /** Lookup found a live handle. */
        HIT,
        /** Lookup had to create a handle. */
        MISS,
        /** Lookup found a handle that was being reclaimed and retried. */
        LOST_RACE,
        /** Handle storage reused for a new key. */
        RECYCLE,
        /** Idle handle evicted from the ring. */
        EVICTION,
        /** Handle released by close. */
        DRAINED
    }

    private final AtomicLong hits = new AtomicLong();

    private final AtomicLong misses = new AtomicLong();

    private final AtomicLong lostRaces = new AtomicLong();

    private final AtomicLong recycles = new AtomicLong();

    private final AtomicLong evictions = new AtomicLong();

    private final AtomicLong drained = new AtomicLong();

    public void increment(final StatisticType type) {
        counter(type).incrementAndGet();
    }

    public long getStatistics(final StatisticType type) {
        return counter(type).get();
    }

    public void clearStatistics() {
        for (StatisticType type : StatisticType.values()) {
            counter(type).set(0);
        }
        LOG.debug("Cleared all handle cache statistics.");
    }

    private AtomicLong counter(final StatisticType type) {
        switch (type) {
            case HIT:
                return hits;
            case MISS:
                return misses;
            case LOST_RACE:
                return lostRaces;
            case RECYCLE:
                return recycles;
            case EVICTION:
                return evictions;
            case DRAINED:
                return drained;
            default:
                throw new IllegalArgumentException("Unknown statistic " + type);
        }
    }

    @Override
    public String toString() {
        return "FhCacheStatistics{hits=" + hits
            + ", misses=" + misses
            + ", lostRaces=" + lostRaces
            + ", recycles=" + recycles
            + ", evictions=" + evictions
            + ", drained=" + drained + '}';
    }
}

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

/**
 * Base class of every object managed by an {@link LRU}.
 *
 * <p>The reference count and the recency links are owned by the ring and
 * are only read or written while the owning lane's lock is held. Subclasses
 * must never touch them directly.
 */
public abstract class LRUObject {
    /**
     * Lane index assigned on insert, -1 while the object is not in a ring.
     */
    volatile int lane = -1;

    /**
     * Reference count; {@link LRU#SENTINEL_REFCNT} means only the ring
     * holds the object.
     */
    long refcnt;

    /**
     * Set while the object is being torn down by the ring.
     */
    boolean reclaiming;

    /**
     * Towards the MRU end.
     */
    LRUObject prev;

    /**
     * Towards the LRU end.
     */
    LRUObject next;

    boolean linked;

    /**
     * Called by the ring once the object has been unlinked and before its
     * storage is recycled or dropped. Implementations remove the object from
     * any index it is published in and release attached resources.
     *
     * @param blocking whether the call may wait for other locks; when false
     *                 the implementation must give up instead of blocking
     * @return false if the object could not be torn down and must go back
     *     into the ring
     */
    public abstract boolean reclaim(boolean blocking);

    /**
     * Current reference count. Only meaningful for diagnostics: the value may
     * change as soon as it has been read.
     *
     * @return reference count including the ring's sentinel reference
     */
    public final long getRefcnt() {
        return refcnt;
    }

    /**
     * @return lane this object lives in, or -1
     */
    public final int getLane() {
        return lane;
    }

    /**
     * Clears ring state before a recycled object is handed out again.
     */
    final void resetLinks() {
        lane = -1;
        refcnt = 0;
        reclaiming = false;
        prev = null;
        next = null;
        linked = false;
    }
}

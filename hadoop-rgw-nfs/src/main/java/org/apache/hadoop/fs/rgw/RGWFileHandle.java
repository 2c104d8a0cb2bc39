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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;

import org.apache.hadoop.fs.rgw.lru.LRUObject;
import org.apache.hadoop.fs.rgw.lru.ObjectFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A cached handle of the gateway's hierarchical view: the root, a bucket, a
 * directory or a file.
 *
 * <p>Identity and hierarchy (key, name, parent and bucket keys, depth) are
 * written once by {@link #init} before the handle is published in the index
 * and never change afterwards. The parent and the owning bucket are kept as
 * keys and resolved through {@link RGWFileSystem#lookupParent} and
 * {@link RGWFileSystem#lookupBucket}, so a recycled handle never leaves a
 * dangling reference behind. Attributes, flags and the payload are guarded by
 * the handle's own lock. Reference count and recency links belong to the
 * {@link org.apache.hadoop.fs.rgw.lru.LRU}.
 */
public class RGWFileHandle extends LRUObject {
    private static final Logger LOG = LoggerFactory.getLogger(RGWFileHandle.class);

    public static final int FLAG_NONE = 0x0000;

    public static final int FLAG_OPEN = 0x0001;

    public static final int FLAG_ROOT = 0x0002;

    /**
     * Created by this gateway and not yet closed.
     */
    public static final int FLAG_CREATE = 0x0004;

    /**
     * Directory inferred from a common prefix; no object backs it.
     */
    public static final int FLAG_PSEUDO = 0x0008;

    public static final int FLAG_DIRECTORY = 0x0010;

    public static final int FLAG_BUCKET = 0x0020;

    /**
     * Caller already holds the handle lock.
     */
    public static final int FLAG_LOCK = 0x0040;

    /**
     * The object was removed while the handle was cached.
     */
    public static final int FLAG_DELETED = 0x0080;

    private static final Joiner PATH_JOINER = Joiner.on(RGWConstants.DELIMITER);

    private static final String[] NO_SEGMENTS = new String[0];

    /**
     * Payload of a file handle or a directory handle.
     */
    abstract static class Payload {
        abstract void addMarker(long cookie, String marker);

        abstract String findMarker(long cookie);

        abstract RGWWriteRequest getWriteRequest();

        abstract void setWriteRequest(RGWWriteRequest writeRequest);

        /**
         * Release whatever the payload holds.
         */
        abstract void clear();
    }

    /**
     * A file may have one write in flight.
     */
    static final class FilePayload extends Payload {
        private RGWWriteRequest writeRequest;

        @Override
        void addMarker(final long cookie, final String marker) {
        }

        @Override
        String findMarker(final long cookie) {
            return "";
        }

        @Override
        RGWWriteRequest getWriteRequest() {
            return writeRequest;
        }

        @Override
        void setWriteRequest(final RGWWriteRequest writeRequest) {
            this.writeRequest = writeRequest;
        }

        @Override
        void clear() {
            if (writeRequest != null) {
                writeRequest.abort();
                writeRequest = null;
            }
        }
    }

    /**
     * A directory remembers the backend marker of every entry it listed,
     * keyed by the cookie handed out for that entry.
     */
    static final class DirectoryPayload extends Payload {
        private final Map<Long, String> markerCache = new TreeMap<>(Long::compareUnsigned);

        @Override
        void addMarker(final long cookie, final String marker) {
            markerCache.put(cookie, marker);
        }

        @Override
        String findMarker(final long cookie) {
            String marker = markerCache.get(cookie);
            return marker == null ? "" : marker;
        }

        @Override
        RGWWriteRequest getWriteRequest() {
            return null;
        }

        @Override
        void setWriteRequest(final RGWWriteRequest writeRequest) {
            throw new RGWInvariantException("write request on a directory");
        }

        @Override
        void clear() {
            markerCache.clear();
        }

        int size() {
            return markerCache.size();
        }
    }

    private final RGWFileSystem fs;

    private final ReentrantLock mtx = new ReentrantLock();

    private FhKey key;

    private String name;

    private FhKey parentKey;

    private FhKey bucketKey;

    private String bucketName;

    /**
     * Names from the bucket (index 0) down to this handle.
     */
    private String[] segments;

    private int depth;

    private int flags;

    private Payload payload;

    private long size;

    private long nlink;

    private long ctime;

    private long mtime;

    private long atime;

    /**
     * Root handle of {@code fs}.
     */
    RGWFileHandle(final RGWFileSystem fs, final FhKey rootKey) {
        this.fs = fs;
        this.key = rootKey;
        this.name = RGWConstants.ROOT_NAME;
        this.bucketName = RGWConstants.ROOT_NAME;
        this.segments = NO_SEGMENTS;
        this.depth = 0;
        this.flags = FLAG_ROOT | FLAG_DIRECTORY;
        this.payload = new DirectoryPayload();
        this.nlink = 1;
    }

    RGWFileHandle(final RGWFileSystem fs, final RGWFileHandle parent, final FhKey key, final String name,
        final int flags) {
        this.fs = fs;
        init(parent, key, name, flags);
    }

    /**
     * (Re)initialise identity, hierarchy and attributes. Runs before the
     * handle is published, or on a victim that has left both the ring and the
     * index.
     */
    final void init(final RGWFileHandle parent, final FhKey newKey, final String newName, final int newFlags) {
        if (parent.depth + 1 > RGWConstants.MAX_DEPTH) {
            throw new RGWInvariantException(
                "handle " + newName + " would exceed the maximum depth " + RGWConstants.MAX_DEPTH);
        }
        this.key = newKey;
        this.name = newName;
        this.parentKey = parent.key;
        this.depth = parent.depth + 1;
        this.segments = Arrays.copyOf(parent.segments, parent.segments.length + 1);
        this.segments[parent.segments.length] = newName;

        int f = newFlags & ~(FLAG_OPEN | FLAG_ROOT | FLAG_LOCK | FLAG_DELETED);
        if (parent.isRoot()) {
            f |= FLAG_BUCKET | FLAG_DIRECTORY;
            this.bucketKey = null;
            this.bucketName = newName;
        } else {
            f &= ~FLAG_BUCKET;
            this.bucketKey = parent.isBucket() ? parent.key : parent.bucketKey;
            this.bucketName = parent.bucketName;
        }
        this.flags = f;
        this.payload = (f & FLAG_DIRECTORY) != 0 ? new DirectoryPayload() : new FilePayload();

        this.size = 0;
        this.nlink = 1;
        this.ctime = 0;
        this.mtime = 0;
        this.atime = 0;
    }

    public FhKey getKey() {
        return key;
    }

    /**
     * @return leaf name of this handle
     */
    public String getName() {
        return name;
    }

    /**
     * @return key of the parent, null for the root
     */
    public FhKey getParentKey() {
        return parentKey;
    }

    /**
     * @return key of the owning bucket, null for the root and for buckets
     */
    public FhKey getBucketKey() {
        return bucketKey;
    }

    /**
     * @return name of the bucket this handle lives in; a bucket's own name,
     *     and {@link RGWConstants#ROOT_NAME} for the root
     */
    public String getBucketName() {
        return bucketName;
    }

    public int getDepth() {
        return depth;
    }

    public RGWFileSystem getFs() {
        return fs;
    }

    public boolean isRoot() {
        return (getFlags() & FLAG_ROOT) != 0;
    }

    public boolean isBucket() {
        return (getFlags() & FLAG_BUCKET) != 0;
    }

    public boolean isDirectory() {
        return (getFlags() & (FLAG_DIRECTORY | FLAG_BUCKET | FLAG_ROOT)) != 0;
    }

    public boolean isFile() {
        return !isDirectory();
    }

    public boolean isPseudo() {
        return (getFlags() & FLAG_PSEUDO) != 0;
    }

    public boolean isOpen() {
        return (getFlags() & FLAG_OPEN) != 0;
    }

    public boolean isCreating() {
        return (getFlags() & FLAG_CREATE) != 0;
    }

    public boolean isDeleted() {
        return (getFlags() & FLAG_DELETED) != 0;
    }

    public int getFlags() {
        mtx.lock();
        try {
            return flags;
        } finally {
            mtx.unlock();
        }
    }

    /**
     * Object path of this handle below {@code minDepth}: the names of the
     * handles deeper than {@code minDepth} down to this one, joined by the
     * delimiter.
     *
     * @param minDepth depth of the last handle left out; 1 leaves out the
     *                 bucket and yields the object key
     * @return the path, empty when this handle is not deeper than
     *     {@code minDepth}
     */
    public String fullObjectName(final int minDepth) {
        if (depth <= minDepth) {
            return "";
        }
        return PATH_JOINER.join(Arrays.asList(segments).subList(Math.max(minDepth, 0), depth));
    }

    /**
     * @return object key of this handle inside its bucket
     */
    public String fullObjectName() {
        return fullObjectName(1);
    }

    /**
     * @param childName leaf name of a child
     * @return object key of that child inside the bucket
     */
    public String makeKeyName(final String childName) {
        String keyName = fullObjectName();
        if (keyName.isEmpty()) {
            return childName;
        }
        return keyName + RGWConstants.DELIMITER + childName;
    }

    /**
     * @param childName leaf name of a child
     * @return cache key of that child
     */
    public FhKey makeFhk(final String childName) {
        if (isRoot()) {
            return FhKey.forBucket(childName);
        }
        return FhKey.deriveChild(key.getBucket(), makeKeyName(childName));
    }

    /**
     * Project the attributes onto a POSIX-like record.
     *
     * @return attributes of this handle
     */
    public RGWStat stat() {
        mtx.lock();
        try {
            if (isDirectoryLocked()) {
                return new RGWStat(fs.getInstanceId(), key.getObject(), RGWStat.RWXMODE | RGWStat.S_IFDIR,
                    RGWStat.DIR_NLINK, 0, 0, 0, atime, mtime, ctime);
            }
            return new RGWStat(fs.getInstanceId(), key.getObject(), RGWStat.RWMODE | RGWStat.S_IFREG, nlink, size,
                RGWStat.BLKSIZE, size / 512, atime, mtime, ctime);
        } finally {
            mtx.unlock();
        }
    }

    /**
     * Remember the backend marker that resumes a listing after the entry
     * handed out with {@code cookie}. No-op on a file.
     */
    public void addMarker(final long cookie, final String marker) {
        mtx.lock();
        try {
            payload.addMarker(cookie, marker);
        } finally {
            mtx.unlock();
        }
    }

    /**
     * @param cookie cookie of a listed entry
     * @return the marker recorded for it, empty if unknown or on a file
     */
    public String findMarker(final long cookie) {
        mtx.lock();
        try {
            return payload.findMarker(cookie);
        } finally {
            mtx.unlock();
        }
    }

    /**
     * Advisory single-opener flag.
     *
     * @param openFlags {@link #FLAG_CREATE} to mark the open as a create
     * @return false if the handle is already open
     */
    public boolean open(final int openFlags) {
        mtx.lock();
        try {
            if ((flags & FLAG_OPEN) != 0) {
                return false;
            }
            flags |= FLAG_OPEN | (openFlags & FLAG_CREATE);
            return true;
        } finally {
            mtx.unlock();
        }
    }

    /**
     * Clear the open and create flags.
     *
     * @return false if the handle was not open
     */
    public boolean close() {
        mtx.lock();
        try {
            boolean wasOpen = (flags & FLAG_OPEN) != 0;
            flags &= ~(FLAG_OPEN | FLAG_CREATE);
            return wasOpen;
        } finally {
            mtx.unlock();
        }
    }

    public void openForCreate() {
        mtx.lock();
        try {
            flags |= FLAG_CREATE;
        } finally {
            mtx.unlock();
        }
    }

    /**
     * Mark the handle as no longer backed by an object. A write in flight is
     * dropped; holders keep their references.
     */
    void markDeleted() {
        mtx.lock();
        try {
            flags |= FLAG_DELETED;
            RGWWriteRequest req = payload.getWriteRequest();
            if (req != null) {
                req.abort();
                payload.setWriteRequest(null);
            }
        } finally {
            mtx.unlock();
        }
    }

    public void setPseudo() {
        mtx.lock();
        try {
            flags |= FLAG_PSEUDO;
        } finally {
            mtx.unlock();
        }
    }

    public long getSize() {
        mtx.lock();
        try {
            return size;
        } finally {
            mtx.unlock();
        }
    }

    public void setSize(final long newSize) {
        mtx.lock();
        try {
            this.size = newSize;
        } finally {
            mtx.unlock();
        }
    }

    public void setNlink(final long newNlink) {
        mtx.lock();
        try {
            this.nlink = newNlink;
        } finally {
            mtx.unlock();
        }
    }

    /**
     * Set all three timestamps, milliseconds since the epoch.
     */
    public void setTimes(final long time) {
        mtx.lock();
        try {
            this.ctime = time;
            this.mtime = time;
            this.atime = time;
        } finally {
            mtx.unlock();
        }
    }

    public void setCtime(final long time) {
        mtx.lock();
        try {
            this.ctime = time;
        } finally {
            mtx.unlock();
        }
    }

    public void setMtime(final long time) {
        mtx.lock();
        try {
            this.mtime = time;
        } finally {
            mtx.unlock();
        }
    }

    public void setAtime(final long time) {
        mtx.lock();
        try {
            this.atime = time;
        } finally {
            mtx.unlock();
        }
    }

    /**
     * Write request of a file, created on first use.
     *
     * @param executor   executor to upload through
     * @param maxPutSize largest object the request may produce
     * @return the in-flight request
     */
    RGWWriteRequest getOrCreateWriteRequest(final RGWRequestExecutor executor, final long maxPutSize) {
        mtx.lock();
        try {
            RGWWriteRequest req = payload.getWriteRequest();
            if (req == null || req.isDone()) {
                req = new RGWWriteRequest(executor, bucketName, fullObjectName(), maxPutSize);
                payload.setWriteRequest(req);
            }
            return req;
        } finally {
            mtx.unlock();
        }
    }

    /**
     * Detach the in-flight write request, if any.
     *
     * @return the request, or null
     */
    RGWWriteRequest takeWriteRequest() {
        mtx.lock();
        try {
            RGWWriteRequest req = payload.getWriteRequest();
            if (req != null) {
                payload.setWriteRequest(null);
            }
            return req;
        } finally {
            mtx.unlock();
        }
    }

    @VisibleForTesting
    Payload getPayload() {
        mtx.lock();
        try {
            return payload;
        } finally {
            mtx.unlock();
        }
    }

    /**
     * Unpublish the handle and release its payload before the ring recycles
     * or drops it.
     *
     * @param blocking false when called from an insert, whose caller may hold
     *                 an index latch
     * @return false if a lock was busy and the handle has to stay in the ring
     */
    @Override
    public boolean reclaim(final boolean blocking) {
        if (isRoot()) {
            throw new RGWInvariantException("reclaim of the root handle");
        }
        if (blocking) {
            mtx.lock();
        } else if (!mtx.tryLock()) {
            return false;
        }
        try {
            if (!fs.removeFromIndex(this, blocking)) {
                LOG.debug("index busy, keeping {}", this);
                return false;
            }
            payload.clear();
            flags &= ~(FLAG_OPEN | FLAG_CREATE);
        } finally {
            mtx.unlock();
        }
        LOG.debug("reclaimed {}", this);
        return true;
    }

    private boolean isDirectoryLocked() {
        return (flags & (FLAG_DIRECTORY | FLAG_BUCKET | FLAG_ROOT)) != 0;
    }

    @Override
    public String toString() {
        return "RGWFileHandle{" + bucketName + (depth > 1 ? RGWConstants.DELIMITER + fullObjectName() : "")
            + ", key=" + key + ", depth=" + depth + '}';
    }

    /**
     * Supplies the handle for one lookup miss: a fresh one, or an evicted one
     * re-initialised in place.
     */
    static final class Factory implements ObjectFactory<RGWFileHandle> {
        private final RGWFileSystem fs;

        private final RGWFileHandle parent;

        private final FhKey key;

        private final String name;

        private final int flags;

        Factory(final RGWFileSystem fs, final RGWFileHandle parent, final FhKey key, final String name,
            final int flags) {
            this.fs = fs;
            this.parent = parent;
            this.key = key;
            this.name = name;
            this.flags = flags;
        }

        @Override
        public RGWFileHandle alloc() {
            return new RGWFileHandle(fs, parent, key, name, flags);
        }

        @Override
        public RGWFileHandle recycle(final RGWFileHandle o) {
            if (o.fs != fs) {
                LOG.warn("not recycling {} owned by another filesystem", o);
                return alloc();
            }
            o.mtx.lock();
            try {
                o.init(parent, key, name, flags);
            } finally {
                o.mtx.unlock();
            }
            fs.recordRecycle();
            return o;
        }
    }
}

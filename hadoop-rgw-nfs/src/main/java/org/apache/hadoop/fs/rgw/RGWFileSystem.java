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
import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import com.obs.services.ObsClient;

import org.apache.hadoop.classification.InterfaceAudience;
import org.apache.hadoop.classification.InterfaceStability;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileAlreadyExistsException;
import org.apache.hadoop.fs.PathIOException;
import org.apache.hadoop.fs.rgw.lru.LRU;
import org.apache.hadoop.fs.rgw.lru.PartitionedIndex;
import org.apache.hadoop.util.ReflectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hierarchical, handle based view of the buckets and objects of a gateway.
 *
 * <p>The root lists buckets; buckets and the common prefixes inside them are
 * directories; objects are files. Every bucket, directory and file a client
 * has resolved is represented by one {@link RGWFileHandle}. Live handles are
 * published in a {@link PartitionedIndex} keyed by {@link FhKey}, and kept
 * alive by an {@link LRU} that evicts idle handles once its lanes fill up.
 *
 * <p>Handles returned by {@link #lookupFh}, {@link #lookupHandle} and the
 * protocol operations carry one reference owned by the caller, which has to
 * be dropped with {@link #unref}. The root handle is never counted.
 *
 * <p>Lock order: an index partition latch is taken before an LRU lane lock.
 * No lock is held across a request to the backend.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public class RGWFileSystem implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(RGWFileSystem.class);

    /**
     * Source of filesystem instance numbers.
     */
    private static final AtomicInteger FS_INST = new AtomicInteger();

    private final int instanceId;

    private final String fsid;

    private final RGWRequestExecutor executor;

    private final PartitionedIndex<FhKey, RGWFileHandle> fhCache;

    private final LRU<RGWFileHandle> fhLru;

    private final RGWFileHandle rootFh;

    private final int maxRetries;

    private final int readdirMaxKeys;

    private final long maxPutSize;

    private final FhCacheStatistics statistics = new FhCacheStatistics();

    /**
     * Handles taken out of the index by {@link #unlink} that still sit in the
     * ring.
     */
    private final Set<RGWFileHandle> unlinked = Sets.newConcurrentHashSet();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Create a filesystem over the executor.
     *
     * @param conf     configuration
     * @param executor backend requests; closed together with the filesystem
     * @throws IllegalArgumentException if a cache option is out of range
     */
    public RGWFileSystem(final Configuration conf, final RGWRequestExecutor executor) {
        this.executor = Preconditions.checkNotNull(executor, "executor");
        this.instanceId = FS_INST.incrementAndGet();
        // no bucket may be named rgw_fs_inst-(.*)
        this.fsid = RGWConstants.ROOT_NAME + RGWConstants.FS_INST_PREFIX + instanceId;

        int partitions = RGWCommonUtils.intOption(conf, RGWConstants.FHCACHE_PARTITIONS,
            RGWConstants.DEFAULT_FHCACHE_PARTITIONS, 1);
        int cacheSize = RGWCommonUtils.intOption(conf, RGWConstants.FHCACHE_SIZE, RGWConstants.DEFAULT_FHCACHE_SIZE,
            1);
        int lanes = RGWCommonUtils.intOption(conf, RGWConstants.LRU_LANES, RGWConstants.DEFAULT_LRU_LANES, 1);
        int laneHiwat = RGWCommonUtils.intOption(conf, RGWConstants.LRU_LANE_HIWAT,
            RGWConstants.DEFAULT_LRU_LANE_HIWAT, 1);
        this.maxRetries = RGWCommonUtils.intOption(conf, RGWConstants.LOOKUP_MAX_RETRIES,
            RGWConstants.DEFAULT_LOOKUP_MAX_RETRIES, 1);
        this.readdirMaxKeys = RGWCommonUtils.intOption(conf, RGWConstants.READDIR_MAX_KEYS,
            RGWConstants.DEFAULT_READDIR_MAX_KEYS, 1);
        this.maxPutSize = RGWCommonUtils.longOption(conf, RGWConstants.MAX_PUT_SIZE, RGWConstants.DEFAULT_MAX_PUT_SIZE,
            0);

        this.fhCache = new PartitionedIndex<>(partitions, cacheSize, RGWFileHandle::getKey,
            FhKey::partitionSelector);
        this.fhLru = new LRU<>(lanes, laneHiwat);
        this.rootFh = new RGWFileHandle(this, new FhKey(FhKey.hash(fsid), FhKey.hash(RGWConstants.ROOT_NAME)));
        LOG.info("Created gateway filesystem {} with {} index partitions and {} lanes of {} handles", fsid,
            partitions, lanes, laneHiwat);
    }

    /**
     * Create a filesystem talking to the endpoint in {@code conf} through the
     * client factory named by {@link RGWConstants#RGW_CLIENT_FACTORY_IMPL}.
     *
     * @param name URI of the filesystem, for the client factory
     * @param conf configuration
     * @return a new filesystem
     * @throws IOException if the client cannot be created
     */
    public static RGWFileSystem newInstance(final URI name, final Configuration conf) throws IOException {
        Class<? extends RGWClientFactory> clientFactoryClass = conf.getClass(RGWConstants.RGW_CLIENT_FACTORY_IMPL,
            RGWConstants.DEFAULT_RGW_CLIENT_FACTORY_IMPL, RGWClientFactory.class);
        ObsClient obs = ReflectionUtils.newInstance(clientFactoryClass, conf).createObsClient(name);
        return new RGWFileSystem(conf, new OBSRequestExecutor(obs));
    }

    /**
     * Find or create the handle of {@code name} under {@code parent}.
     *
     * @param parent referenced directory handle, or the root
     * @param name   leaf name
     * @param cflags {@link RGWFileHandle#FLAG_DIRECTORY} and other creation
     *               flags, applied only if the handle is created
     * @return the handle with one reference for the caller, or an empty
     *     result if the filesystem is closed or the lookup kept losing races
     * @throws RGWInvariantException if the handle would be deeper than
     *                               {@link RGWConstants#MAX_DEPTH}
     */
    public LookupFHResult lookupFh(final RGWFileHandle parent, final String name, final int cflags) {
        if (closed.get()) {
            return LookupFHResult.EMPTY;
        }
        Preconditions.checkArgument(name != null && !name.isEmpty(), "empty name under %s", parent);
        if (parent.getDepth() + 1 > RGWConstants.MAX_DEPTH) {
            throw new RGWInvariantException(
                "lookup of " + name + " under " + parent + " exceeds the maximum depth " + RGWConstants.MAX_DEPTH);
        }
        final FhKey fhk = parent.makeFhk(name);
        final PartitionedIndex.Latch lat = new PartitionedIndex.Latch();

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            RGWFileHandle fh = fhCache.findLatch(fhk, lat, PartitionedIndex.FLAG_LOCK);
            // LATCHED
            if (fh != null) {
                boolean referenced;
                try {
                    referenced = fhLru.ref(fh, LRU.FLAG_INITIAL);
                } finally {
                    lat.unlock();
                }
                if (referenced) {
                    statistics.increment(FhCacheStatistics.StatisticType.HIT);
                    return new LookupFHResult(fh, LookupFHResult.FLAG_NONE);
                }
                // being reclaimed; it is gone from the index once we look again
                statistics.increment(FhCacheStatistics.StatisticType.LOST_RACE);
                LOG.debug("lost race for {}, retrying", fh);
                continue;
            }

            RGWFileHandle created;
            try {
                created = fhLru.insert(new RGWFileHandle.Factory(this, parent, fhk, name, cflags), LRU.Edge.MRU,
                    LRU.FLAG_INITIAL);
            } catch (RuntimeException e) {
                lat.unlock();
                throw e;
            }
            if (created == null) {
                lat.unlock();
                continue;
            }
            fhCache.insertLatched(created, lat, PartitionedIndex.FLAG_UNLOCK);
            // !LATCHED
            statistics.increment(FhCacheStatistics.StatisticType.MISS);
            LOG.debug("created {}", created);
            return new LookupFHResult(created, LookupFHResult.FLAG_CREATE);
        }
        LOG.error("lookup of {} under {} gave up after {} attempts", name, parent, maxRetries);
        return LookupFHResult.EMPTY;
    }

    /**
     * Find a live handle by the identity previously handed to a client.
     *
     * @param fhk key of the handle
     * @return the handle with one reference for the caller, or null if it is
     *     unknown or the filesystem is closed
     */
    public RGWFileHandle lookupHandle(final FhKey fhk) {
        if (closed.get()) {
            return null;
        }
        if (rootFh.getKey().equals(fhk)) {
            return rootFh;
        }
        final PartitionedIndex.Latch lat = new PartitionedIndex.Latch();
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            RGWFileHandle fh = fhCache.findLatch(fhk, lat, PartitionedIndex.FLAG_LOCK);
            if (fh == null) {
                lat.unlock();
                // handles do not survive a restart
                LOG.info("handle lookup failed {} (need persistent handles)", fhk);
                return null;
            }
            boolean referenced;
            try {
                referenced = fhLru.ref(fh, LRU.FLAG_INITIAL);
            } finally {
                lat.unlock();
            }
            if (referenced) {
                statistics.increment(FhCacheStatistics.StatisticType.HIT);
                return fh;
            }
            statistics.increment(FhCacheStatistics.StatisticType.LOST_RACE);
        }
        LOG.error("lookup of handle {} gave up after {} attempts", fhk, maxRetries);
        return null;
    }

    /**
     * @see #lookupHandle(FhKey)
     */
    public RGWFileHandle lookupHandle(final long bucketHash, final long objectHash) {
        return lookupHandle(new FhKey(bucketHash, objectHash));
    }

    /**
     * Take another reference on a handle the caller already references.
     *
     * @param fh handle
     * @return false if the handle is being reclaimed
     */
    public boolean ref(final RGWFileHandle fh) {
        if (fh.isRoot()) {
            return true;
        }
        return fhLru.ref(fh, LRU.FLAG_NONE);
    }

    /**
     * Drop a reference.
     *
     * @param fh handle
     */
    public void unref(final RGWFileHandle fh) {
        if (fh == null || fh.isRoot()) {
            return;
        }
        fhLru.unref(fh, LRU.FLAG_NONE);
    }

    /**
     * @param fh handle
     * @return the referenced parent of {@code fh}, the root, or null when the
     *     parent is no longer cached
     */
    public RGWFileHandle lookupParent(final RGWFileHandle fh) {
        FhKey parentKey = fh.getParentKey();
        return parentKey == null ? null : lookupHandle(parentKey);
    }

    /**
     * @param fh handle
     * @return the referenced bucket {@code fh} lives in, {@code fh} itself
     *     (referenced again) if it is a bucket, or null for the root and
     *     when the bucket is no longer cached
     */
    public RGWFileHandle lookupBucket(final RGWFileHandle fh) {
        if (fh.isRoot()) {
            return null;
        }
        if (fh.isBucket()) {
            return ref(fh) ? fh : null;
        }
        return lookupHandle(fh.getBucketKey());
    }

    /**
     * Close the filesystem. Lookups fail fast from now on; every cached handle,
     * including handles of removed objects, is dropped from the index and
     * loses the reference the ring holds on it. Only the first call does any
     * work.
     *
     * @throws IOException if closing the backend client fails
     */
    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.debug("Closing gateway filesystem {}", fsid);
        try {
            // force cache drain, forces objects to evict
            fhCache.drain(fh -> {
                LOG.debug("draining {} refs={}", fh, fh.getRefcnt());
                statistics.increment(FhCacheStatistics.StatisticType.DRAINED);
                fhLru.unref(fh, LRU.FLAG_NONE);
            }, PartitionedIndex.FLAG_LOCK);
            for (RGWFileHandle fh : new ArrayList<>(unlinked)) {
                if (unlinked.remove(fh)) {
                    LOG.debug("draining removed {} refs={}", fh, fh.getRefcnt());
                    statistics.increment(FhCacheStatistics.StatisticType.DRAINED);
                    fhLru.unref(fh, LRU.FLAG_NONE);
                }
            }
        } finally {
            executor.close();
        }
        LOG.info("Finish closing gateway filesystem {}: {}", fsid, statistics);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Throws if the filesystem is closed.
     *
     * @throws IOException if closed
     */
    public void checkOpen() throws IOException {
        if (closed.get()) {
            throw new IOException("RGWFileSystem closed");
        }
    }

    /**
     * Resolve a bucket under the root.
     *
     * @param name bucket name
     * @return referenced bucket handle, or an empty result if the bucket does
     *     not exist
     * @throws IOException on backend failure or if closed
     */
    public LookupFHResult statBucket(final String name) throws IOException {
        checkOpen();
        checkName(rootFh, name);
        if (!executor.headBucket(name)) {
            return LookupFHResult.EMPTY;
        }
        return lookupFh(rootFh, name, RGWFileHandle.FLAG_BUCKET | RGWFileHandle.FLAG_DIRECTORY);
    }

    /**
     * Resolve an object or a directory below a bucket. A file object wins
     * over a directory placeholder object, which wins over a prefix that only
     * exists because longer keys share it.
     *
     * @param parent referenced bucket or directory handle
     * @param name   leaf name
     * @return referenced handle, or an empty result if nothing exists
     * @throws IOException on backend failure or if closed
     */
    public LookupFHResult statLeaf(final RGWFileHandle parent, final String name) throws IOException {
        checkOpen();
        checkName(parent, name);
        final String bucket = parent.getBucketName();
        final String keyName = parent.makeKeyName(name);

        RGWObjectAttributes attrs = headObject(bucket, keyName);
        if (attrs != null) {
            return withAttributes(lookupFh(parent, name, RGWFileHandle.FLAG_NONE), attrs);
        }
        final String dirKey = keyName + RGWConstants.DELIMITER;
        attrs = headObject(bucket, dirKey);
        if (attrs != null) {
            return withAttributes(lookupFh(parent, name, RGWFileHandle.FLAG_DIRECTORY), attrs);
        }
        RGWListing listing = executor.listObjects(bucket, dirKey, RGWConstants.DELIMITER, "", 1);
        if (listing.getEntries().isEmpty()) {
            return LookupFHResult.EMPTY;
        }
        LookupFHResult fhr = lookupFh(parent, name, RGWFileHandle.FLAG_DIRECTORY | RGWFileHandle.FLAG_PSEUDO);
        if (!fhr.isEmpty() && fhr.isCreated()) {
            fhr.getHandle().setPseudo();
        }
        return fhr;
    }

    /**
     * Resolve {@code name} under {@code parent}.
     *
     * @param parent referenced directory handle, or the root
     * @param name   leaf name
     * @return referenced handle
     * @throws FileNotFoundException if nothing is stored under that name
     * @throws PathIOException       if the path would be too deep
     * @throws IOException           on backend failure or if closed
     */
    public RGWFileHandle lookup(final RGWFileHandle parent, final String name) throws IOException {
        LookupFHResult fhr = parent.isRoot() ? statBucket(name) : statLeaf(parent, name);
        if (fhr.isEmpty()) {
            throw new FileNotFoundException(
                "No such file or directory: " + RGWCommonUtils.location(parent.getBucketName(),
                    parent.isRoot() ? name : parent.makeKeyName(name)));
        }
        return fhr.getHandle();
    }

    /**
     * @param fh referenced handle
     * @return attributes of the handle
     * @throws IOException if closed
     */
    public RGWStat getattr(final RGWFileHandle fh) throws IOException {
        checkOpen();
        return fh.stat();
    }

    /**
     * List one page of a directory.
     *
     * <p>Every entry is reported with a cookie, the hash of its name, and the
     * backend marker that resumes the listing after it is remembered under
     * that cookie. Passing the cookie back as {@code offset} continues the
     * listing; offset 0 starts it.
     *
     * @param dir    referenced directory handle, or the root
     * @param offset 0 or a cookie from an earlier call
     * @param cb     receives the entries
     * @return true when the listing is complete
     * @throws IOException on backend failure or if closed
     */
    public boolean readdir(final RGWFileHandle dir, final long offset, final RGWReaddirCallback cb)
        throws IOException {
        checkOpen();
        if (!dir.isDirectory()) {
            throw new PathIOException(RGWCommonUtils.location(dir.getBucketName(), dir.fullObjectName()),
                "Not a directory");
        }
        String marker = "";
        if (offset != 0) {
            marker = dir.findMarker(offset);
            if (marker.isEmpty()) {
                LOG.warn("unknown readdir cookie {} on {}, listing from the start", Long.toUnsignedString(offset),
                    dir);
            }
        }

        final RGWListing listing;
        final String prefix;
        if (dir.isRoot()) {
            listing = executor.listBuckets(marker, readdirMaxKeys);
            prefix = "";
        } else {
            String fullName = dir.fullObjectName();
            prefix = fullName.isEmpty() ? "" : fullName + RGWConstants.DELIMITER;
            listing = executor.listObjects(dir.getBucketName(), prefix, RGWConstants.DELIMITER, marker,
                readdirMaxKeys);
        }

        for (RGWListing.Entry entry : listing.getEntries()) {
            String name = leafName(prefix, entry.getName());
            // the directory's own placeholder object
            if (name.isEmpty()) {
                continue;
            }
            long cookie = FhKey.hash(name);
            dir.addMarker(cookie, entry.getMarker());
            boolean isDir = dir.isRoot() || entry.isCommonPrefix();
            if (!cb.onEntry(name, cookie, isDir)) {
                LOG.debug("readdir of {} stopped by the caller at {}", dir, name);
                return false;
            }
        }
        return !listing.isTruncated();
    }

    /**
     * Create a bucket under the root or a directory placeholder object below
     * a bucket.
     *
     * @param parent referenced parent directory, or the root
     * @param name   leaf name
     * @return referenced handle of the new directory
     * @throws IOException on backend failure or if closed
     */
    public RGWFileHandle mkdir(final RGWFileHandle parent, final String name) throws IOException {
        checkOpen();
        checkName(parent, name);
        LookupFHResult fhr;
        if (parent.isRoot()) {
            if (name.startsWith(RGWConstants.FS_INST_PREFIX)) {
                throw new PathIOException(name, "reserved bucket name");
            }
            executor.createBucket(name);
            fhr = lookupFh(rootFh, name, RGWFileHandle.FLAG_BUCKET | RGWFileHandle.FLAG_DIRECTORY);
        } else {
            checkDirectory(parent);
            executor.putObject(parent.getBucketName(), parent.makeKeyName(name) + RGWConstants.DELIMITER,
                new byte[0]);
            fhr = lookupFh(parent, name, RGWFileHandle.FLAG_DIRECTORY);
        }
        RGWFileHandle fh = requireHandle(fhr, parent, name);
        fh.setTimes(System.currentTimeMillis());
        return fh;
    }

    /**
     * Create an empty file and return its handle marked as being created.
     * The handle is not open: call {@link #open} before writing to it.
     *
     * @param parent referenced bucket or directory
     * @param name   leaf name
     * @return referenced handle of the new file
     * @throws FileAlreadyExistsException if an object of that name exists
     * @throws IOException                on backend failure or if closed
     */
    public RGWFileHandle create(final RGWFileHandle parent, final String name) throws IOException {
        checkOpen();
        checkName(parent, name);
        if (parent.isRoot()) {
            throw new PathIOException(name, "files cannot be created outside a bucket");
        }
        checkDirectory(parent);
        final String keyName = parent.makeKeyName(name);
        if (headObject(parent.getBucketName(), keyName) != null) {
            throw new FileAlreadyExistsException(RGWCommonUtils.location(parent.getBucketName(), keyName));
        }
        executor.putObject(parent.getBucketName(), keyName, new byte[0]);
        RGWFileHandle fh = requireHandle(lookupFh(parent, name, RGWFileHandle.FLAG_CREATE), parent, name);
        fh.openForCreate();
        fh.setSize(0);
        fh.setTimes(System.currentTimeMillis());
        return fh;
    }

    /**
     * Mark a file open.
     *
     * @param fh    referenced file handle
     * @param flags {@link RGWFileHandle#FLAG_CREATE} or none
     * @throws RGWBusyException if the file is already open
     * @throws IOException      if {@code fh} is a directory or closed
     */
    public void open(final RGWFileHandle fh, final int flags) throws IOException {
        checkOpen();
        checkFile(fh);
        if (!fh.open(flags)) {
            throw new RGWBusyException("File is already open: " + fh);
        }
    }

    /**
     * Write to an open file. Writes must be sequential; the data is stored
     * when the file is closed.
     *
     * @param fh     referenced open file handle
     * @param offset where {@code data} starts
     * @param data   bytes to write
     * @return number of bytes written
     * @throws IOException if the write is out of order or too large, or the
     *                     file is not open
     */
    public int write(final RGWFileHandle fh, final long offset, final byte[] data) throws IOException {
        checkOpen();
        checkFile(fh);
        if (!fh.isOpen()) {
            throw new PathIOException(location(fh), "write to a file that is not open");
        }
        if (fh.isDeleted()) {
            throw new PathIOException(location(fh), "write to a removed file");
        }
        RGWWriteRequest req = fh.getOrCreateWriteRequest(executor, maxPutSize);
        int written = req.put(offset, data);
        fh.setSize(req.getBytesWritten());
        return written;
    }

    /**
     * Close an open file, storing whatever was written to it. Data written to
     * a file that has been removed since is dropped.
     *
     * @param fh referenced file handle
     * @throws IOException if the upload fails; the file is closed anyway
     */
    public void close(final RGWFileHandle fh) throws IOException {
        RGWWriteRequest req = fh.takeWriteRequest();
        try {
            if (req != null && fh.isDeleted()) {
                LOG.debug("dropping write to removed {}", fh);
                req.abort();
            } else if (req != null) {
                long size = req.finish();
                fh.setSize(size);
                fh.setMtime(System.currentTimeMillis());
            }
        } finally {
            fh.close();
        }
    }

    /**
     * Read from a file.
     *
     * @param fh     referenced file handle
     * @param offset first byte
     * @param length maximum number of bytes
     * @return the bytes read, empty at end of file
     * @throws IOException on backend failure or if closed
     */
    public byte[] read(final RGWFileHandle fh, final long offset, final int length) throws IOException {
        checkOpen();
        checkFile(fh);
        Preconditions.checkArgument(offset >= 0 && length >= 0, "bad range %s+%s", offset, length);
        byte[] data = executor.getObject(fh.getBucketName(), fh.fullObjectName(), offset, length);
        fh.setAtime(System.currentTimeMillis());
        return data;
    }

    /**
     * Remove a file, an empty directory, or an empty bucket.
     *
     * @param parent referenced parent
     * @param name   leaf name
     * @throws FileNotFoundException if nothing of that name exists
     * @throws PathIOException       if the directory is not empty
     * @throws IOException           on backend failure or if closed
     */
    public void unlink(final RGWFileHandle parent, final String name) throws IOException {
        checkOpen();
        checkName(parent, name);
        if (parent.isRoot()) {
            executor.deleteBucket(name);
        } else {
            final String bucket = parent.getBucketName();
            final String keyName = parent.makeKeyName(name);
            if (headObject(bucket, keyName) != null) {
                executor.deleteObject(bucket, keyName);
            } else {
                final String dirKey = keyName + RGWConstants.DELIMITER;
                RGWListing listing = executor.listObjects(bucket, dirKey, RGWConstants.DELIMITER, "", 2);
                boolean hasPlaceholder = false;
                for (RGWListing.Entry entry : listing.getEntries()) {
                    if (entry.getName().equals(dirKey)) {
                        hasPlaceholder = true;
                    } else {
                        throw new PathIOException(RGWCommonUtils.location(bucket, keyName), "Directory not empty");
                    }
                }
                if (!hasPlaceholder) {
                    throw new FileNotFoundException(
                        "No such file or directory: " + RGWCommonUtils.location(bucket, keyName));
                }
                executor.deleteObject(bucket, dirKey);
            }
        }
        invalidate(parent.makeFhk(name));
    }

    /**
     * Unpublish the live handle of {@code fhk}, if any, and mark it deleted.
     * Holders keep their references; later lookups create a new handle. The
     * handle stays in the ring until it is evicted or the filesystem closes.
     */
    private void invalidate(final FhKey fhk) {
        final PartitionedIndex.Latch lat = new PartitionedIndex.Latch();
        RGWFileHandle fh = fhCache.findLatch(fhk, lat, PartitionedIndex.FLAG_LOCK);
        boolean referenced;
        try {
            // pinned so that it cannot be recycled under another key meanwhile
            referenced = fh != null && fhLru.ref(fh, LRU.FLAG_NONE);
        } finally {
            lat.unlock();
        }
        if (!referenced) {
            return;
        }
        try {
            unlinked.add(fh);
            fhCache.remove(fh, PartitionedIndex.FLAG_LOCK);
            fh.markDeleted();
            LOG.debug("invalidated {}", fh);
        } finally {
            fhLru.unref(fh, LRU.FLAG_NONE);
        }
    }

    /**
     * Called by {@link RGWFileHandle#reclaim(boolean)}.
     *
     * @return false if the partition was busy and {@code blocking} is false
     */
    boolean removeFromIndex(final RGWFileHandle fh, final boolean blocking) {
        boolean removed = fhCache.remove(fh, blocking ? PartitionedIndex.FLAG_LOCK : PartitionedIndex.FLAG_TRYLOCK);
        if (removed) {
            unlinked.remove(fh);
        }
        if (removed && !blocking) {
            statistics.increment(FhCacheStatistics.StatisticType.EVICTION);
        }
        return removed;
    }

    void recordRecycle() {
        statistics.increment(FhCacheStatistics.StatisticType.RECYCLE);
    }

    public RGWFileHandle getRootFh() {
        return rootFh;
    }

    /**
     * @return number of this filesystem instance, reported as the device of
     *     every handle
     */
    public int getInstanceId() {
        return instanceId;
    }

    public String getFsid() {
        return fsid;
    }

    public FhCacheStatistics getStatistics() {
        return statistics;
    }

    RGWRequestExecutor getExecutor() {
        return executor;
    }

    @VisibleForTesting
    PartitionedIndex<FhKey, RGWFileHandle> getFhCache() {
        return fhCache;
    }

    @VisibleForTesting
    LRU<RGWFileHandle> getFhLru() {
        return fhLru;
    }

    private RGWObjectAttributes headObject(final String bucket, final String key) throws IOException {
        try {
            return executor.getObjectMetadata(bucket, key);
        } catch (FileNotFoundException e) {
            LOG.debug("Not Found: {}", RGWCommonUtils.location(bucket, key));
            return null;
        }
    }

    private static LookupFHResult withAttributes(final LookupFHResult fhr, final RGWObjectAttributes attrs) {
        if (!fhr.isEmpty()) {
            RGWFileHandle fh = fhr.getHandle();
            if (fh.isFile()) {
                fh.setSize(attrs.getSize());
            }
            fh.setCtime(attrs.getMtime());
            fh.setMtime(attrs.getMtime());
        }
        return fhr;
    }

    private RGWFileHandle requireHandle(final LookupFHResult fhr, final RGWFileHandle parent, final String name)
        throws IOException {
        if (fhr.isEmpty()) {
            checkOpen();
            throw new PathIOException(RGWCommonUtils.location(parent.getBucketName(), parent.makeKeyName(name)),
                "no handle available");
        }
        return fhr.getHandle();
    }

    private static void checkName(final RGWFileHandle parent, final String name) throws PathIOException {
        if (name == null || name.isEmpty() || name.contains(RGWConstants.DELIMITER)) {
            throw new PathIOException(String.valueOf(name), "invalid name");
        }
        if (parent.getDepth() + 1 > RGWConstants.MAX_DEPTH) {
            throw new PathIOException(RGWCommonUtils.location(parent.getBucketName(), parent.makeKeyName(name)),
                "path is deeper than " + RGWConstants.MAX_DEPTH + " levels");
        }
    }

    private static void checkDirectory(final RGWFileHandle fh) throws PathIOException {
        if (!fh.isDirectory()) {
            throw new PathIOException(location(fh), "Not a directory");
        }
    }

    private static void checkFile(final RGWFileHandle fh) throws PathIOException {
        if (fh.isDirectory()) {
            throw new PathIOException(location(fh), "Is a directory");
        }
    }

    private static String location(final RGWFileHandle fh) {
        return RGWCommonUtils.location(fh.getBucketName(), fh.fullObjectName());
    }

    private static String leafName(final String prefix, final String entryName) {
        String name = entryName.startsWith(prefix) ? entryName.substring(prefix.length()) : entryName;
        if (name.endsWith(RGWConstants.DELIMITER)) {
            name = name.substring(0, name.length() - 1);
        }
        int lastDelimiter = name.lastIndexOf(RGWConstants.DELIMITER);
        return lastDelimiter < 0 ? name : name.substring(lastDelimiter + 1);
    }

    @Override
    public String toString() {
        return "RGWFileSystem{" + fsid + ", closed=" + closed.get() + '}';
    }
}

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

import org.apache.hadoop.fs.FileAlreadyExistsException;
import org.apache.hadoop.fs.PathIOException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bucket store kept in memory, listing with S3 prefix, delimiter and marker
 * semantics.
 */
public class InMemoryRequestExecutor implements RGWRequestExecutor {
    private static final class StoredObject {
        private final byte[] data;

        private final long mtime;

        private StoredObject(byte[] data, long mtime) {
            this.data = data;
            this.mtime = mtime;
        }
    }

    private final TreeMap<String, TreeMap<String, StoredObject>> buckets = new TreeMap<>();

    private final AtomicInteger listCalls = new AtomicInteger();

    private volatile boolean closed;

    public synchronized InMemoryRequestExecutor withBucket(String bucket) {
        buckets.computeIfAbsent(bucket, b -> new TreeMap<>());
        return this;
    }

    public synchronized InMemoryRequestExecutor withObject(String bucket, String key, byte[] data) {
        withBucket(bucket);
        buckets.get(bucket).put(key, new StoredObject(data.clone(), System.currentTimeMillis()));
        return this;
    }

    public InMemoryRequestExecutor withObject(String bucket, String key) {
        return withObject(bucket, key, new byte[0]);
    }

    /**
     * @return stored content, or null if there is no such object
     */
    public synchronized byte[] getContent(String bucket, String key) {
        TreeMap<String, StoredObject> objects = buckets.get(bucket);
        if (objects == null || !objects.containsKey(key)) {
            return null;
        }
        return objects.get(key).data.clone();
    }

    public synchronized boolean hasBucket(String bucket) {
        return buckets.containsKey(bucket);
    }

    public int getListCalls() {
        return listCalls.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized RGWListing listBuckets(String marker, int maxKeys) {
        listCalls.incrementAndGet();
        NavigableMap<String, TreeMap<String, StoredObject>> tail =
            marker == null || marker.isEmpty() ? buckets : buckets.tailMap(marker, false);
        List<RGWListing.Entry> entries = new ArrayList<>();
        boolean truncated = false;
        for (String name : tail.keySet()) {
            if (entries.size() >= maxKeys) {
                truncated = true;
                break;
            }
            entries.add(new RGWListing.Entry(name, true, name, 0, 0));
        }
        return new RGWListing(entries, lastMarker(entries), truncated);
    }

    @Override
    public synchronized RGWListing listObjects(String bucket, String prefix, String delimiter, String marker,
        int maxKeys) throws IOException {
        listCalls.incrementAndGet();
        TreeMap<String, StoredObject> objects = bucket(bucket);
        NavigableMap<String, StoredObject> tail =
            marker == null || marker.isEmpty() ? objects : objects.tailMap(marker, false);
        List<RGWListing.Entry> entries = new ArrayList<>();
        boolean truncated = false;
        String lastPrefix = null;
        for (Map.Entry<String, StoredObject> e : tail.entrySet()) {
            String key = e.getKey();
            if (!key.startsWith(prefix)) {
                if (key.compareTo(prefix) > 0) {
                    break;
                }
                continue;
            }
            String commonPrefix = null;
            if (delimiter != null) {
                int ix = key.indexOf(delimiter, prefix.length());
                if (ix >= 0) {
                    commonPrefix = key.substring(0, ix + delimiter.length());
                }
            }
            if (commonPrefix != null) {
                if (commonPrefix.equals(lastPrefix)
                    || marker != null && !marker.isEmpty() && marker.startsWith(commonPrefix)) {
                    continue;
                }
                if (entries.size() >= maxKeys) {
                    truncated = true;
                    break;
                }
                entries.add(new RGWListing.Entry(commonPrefix, true, commonPrefix, 0, 0));
                lastPrefix = commonPrefix;
            } else {
                if (entries.size() >= maxKeys) {
                    truncated = true;
                    break;
                }
                StoredObject o = e.getValue();
                entries.add(new RGWListing.Entry(key, false, key, o.data.length, o.mtime));
            }
        }
        return new RGWListing(entries, lastMarker(entries), truncated);
    }

    @Override
    public synchronized boolean headBucket(String bucket) {
        return buckets.containsKey(bucket);
    }

    @Override
    public synchronized RGWObjectAttributes getObjectMetadata(String bucket, String key) throws IOException {
        StoredObject o = bucket(bucket).get(key);
        if (o == null) {
            throw new FileNotFoundException("Not Found: " + bucket + "/" + key);
        }
        return new RGWObjectAttributes(o.data.length, o.mtime);
    }

    @Override
    public synchronized byte[] getObject(String bucket, String key, long offset, int length) throws IOException {
        StoredObject o = bucket(bucket).get(key);
        if (o == null) {
            throw new FileNotFoundException("Not Found: " + bucket + "/" + key);
        }
        if (offset >= o.data.length) {
            return new byte[0];
        }
        int end = (int) Math.min(o.data.length, offset + length);
        return Arrays.copyOfRange(o.data, (int) offset, end);
    }

    @Override
    public synchronized void putObject(String bucket, String key, byte[] data) throws IOException {
        bucket(bucket).put(key, new StoredObject(data.clone(), System.currentTimeMillis()));
    }

    @Override
    public synchronized void deleteObject(String bucket, String key) throws IOException {
        bucket(bucket).remove(key);
    }

    @Override
    public synchronized void createBucket(String bucket) throws IOException {
        if (buckets.containsKey(bucket)) {
            throw new FileAlreadyExistsException("Bucket exists: " + bucket);
        }
        buckets.put(bucket, new TreeMap<>());
    }

    @Override
    public synchronized void deleteBucket(String bucket) throws IOException {
        if (!bucket(bucket).isEmpty()) {
            throw new PathIOException(bucket, "bucket not empty");
        }
        buckets.remove(bucket);
    }

    @Override
    public void close() {
        closed = true;
    }

    private TreeMap<String, StoredObject> bucket(String bucket) throws FileNotFoundException {
        TreeMap<String, StoredObject> objects = buckets.get(bucket);
        if (objects == null) {
            throw new FileNotFoundException("No such bucket: " + bucket);
        }
        return objects;
    }

    private static String lastMarker(List<RGWListing.Entry> entries) {
        return entries.isEmpty() ? "" : entries.get(entries.size() - 1).getMarker();
    }
}

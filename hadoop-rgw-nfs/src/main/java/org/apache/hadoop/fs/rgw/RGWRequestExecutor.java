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

import java.io.Closeable;
import java.io.IOException;

/**
 * Requests the gateway issues against the bucket/object store.
 *
 * <p>Implementations translate every failure into an {@link IOException};
 * the handle cache passes those through to its callers unchanged.
 */
public interface RGWRequestExecutor extends Closeable {
    /**
     * List the buckets of the authenticated user in name order.
     *
     * @param marker  list buckets after this name; empty to start
     * @param maxKeys maximum number of entries returned
     * @return the bucket listing; every entry is a common prefix
     * @throws IOException on failure
     */
    RGWListing listBuckets(String marker, int maxKeys) throws IOException;

    /**
     * List the objects of a bucket.
     *
     * @param bucket    bucket name
     * @param prefix    only keys starting with this prefix
     * @param delimiter roll keys up to common prefixes at this delimiter, may
     *                  be null
     * @param marker    list keys after this marker; empty to start
     * @param maxKeys   maximum number of entries returned
     * @return objects and common prefixes merged in key order
     * @throws IOException on failure
     */
    RGWListing listObjects(String bucket, String prefix, String delimiter, String marker, int maxKeys)
        throws IOException;

    /**
     * @param bucket bucket name
     * @return true if the bucket exists
     * @throws IOException on failure other than absence
     */
    boolean headBucket(String bucket) throws IOException;

    /**
     * @param bucket bucket name
     * @param key    object key
     * @return attributes of the object
     * @throws java.io.FileNotFoundException if there is no such object
     * @throws IOException                   on other failures
     */
    RGWObjectAttributes getObjectMetadata(String bucket, String key) throws IOException;

    /**
     * Read a byte range of an object.
     *
     * @param bucket bucket name
     * @param key    object key
     * @param offset first byte
     * @param length number of bytes wanted
     * @return the bytes read; shorter than {@code length} at end of object
     * @throws IOException on failure
     */
    byte[] getObject(String bucket, String key, long offset, int length) throws IOException;

    /**
     * Upload a whole object.
     *
     * @param bucket bucket name
     * @param key    object key
     * @param data   object content
     * @throws IOException on failure
     */
    void putObject(String bucket, String key, byte[] data) throws IOException;

    void deleteObject(String bucket, String key) throws IOException;

    void createBucket(String bucket) throws IOException;

    void deleteBucket(String bucket) throws IOException;
}

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

import net.openhft.hashing.LongHashFunction;

import java.nio.charset.StandardCharsets;

/**
 * Identity of a file handle: the pair of 64-bit hashes of a bucket name and
 * of an object path inside that bucket.
 *
 * <p>Keys are ordered by bucket hash, then object hash, both compared as
 * unsigned values. Two different paths whose hashes collide alias to the
 * same handle; the hash is 64-bit XXH64 and this risk is accepted.
 */
public final class FhKey implements Comparable<FhKey> {
    /**
     * Seed shared by every key and directory cookie.
     */
    public static final long SEED = 8675309L;

    private static final LongHashFunction XX = LongHashFunction.xx(SEED);

    private final long bucket;

    private final long object;

    public FhKey(final long bucket, final long object) {
        this.bucket = bucket;
        this.object = object;
    }

    /**
     * @param bucketName     bucket name
     * @param fullObjectPath object path within the bucket, without a leading
     *                       slash
     * @return key of the object
     */
    public static FhKey derive(final String bucketName, final String fullObjectPath) {
        return new FhKey(hash(bucketName), hash(fullObjectPath));
    }

    /**
     * Derive a key when the owning bucket's hash is already known.
     *
     * @param bucketHash    hash of the owning bucket
     * @param childFullPath object path within the bucket
     * @return key of the object
     */
    public static FhKey deriveChild(final long bucketHash, final String childFullPath) {
        return new FhKey(bucketHash, hash(childFullPath));
    }

    /**
     * A bucket is the empty object path of its own namespace.
     *
     * @param bucketName bucket name
     * @return key of the bucket handle
     */
    public static FhKey forBucket(final String bucketName) {
        return derive(bucketName, "");
    }

    /**
     * Seeded XXH64 over the UTF-8 bytes of {@code s}. Also used for directory
     * cookies.
     *
     * @param s string to hash
     * @return 64-bit hash
     */
    public static long hash(final String s) {
        return XX.hashBytes(s.getBytes(StandardCharsets.UTF_8));
    }

    public long getBucket() {
        return bucket;
    }

    public long getObject() {
        return object;
    }

    /**
     * @return value used to pick the index partition of this key
     */
    public long partitionSelector() {
        return bucket ^ Long.rotateLeft(object, 32);
    }

    @Override
    public int compareTo(final FhKey o) {
        int c = Long.compareUnsigned(bucket, o.bucket);
        if (c != 0) {
            return c;
        }
        return Long.compareUnsigned(object, o.object);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FhKey)) {
            return false;
        }
        FhKey other = (FhKey) o;
        return bucket == other.bucket && object == other.object;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(bucket) + Long.hashCode(object);
    }

    @Override
    public String toString() {
        return "<" + Long.toUnsignedString(bucket) + "," + Long.toUnsignedString(object) + ">";
    }
}

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

import org.apache.hadoop.fs.PathIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * In-flight write of one file handle.
 *
 * <p>Data has to arrive in order: every {@link #put} must start where the
 * previous one ended. The buffered object is uploaded in one request by
 * {@link #finish()}.
 */
class RGWWriteRequest {
    private static final Logger LOG = LoggerFactory.getLogger(RGWWriteRequest.class);

    private final RGWRequestExecutor executor;

    private final String bucket;

    private final String key;

    private final long maxPutSize;

    private ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private long nextOffset;

    private boolean done;

    RGWWriteRequest(final RGWRequestExecutor executor, final String bucket, final String key,
        final long maxPutSize) {
        this.executor = executor;
        this.bucket = bucket;
        this.key = key;
        this.maxPutSize = maxPutSize;
    }

    /**
     * Append data.
     *
     * @param offset offset of {@code data} in the object
     * @param data   bytes to write
     * @return number of bytes accepted
     * @throws PathIOException if the write is not sequential, exceeds the
     *                         maximum object size or follows finish/abort
     */
    synchronized int put(final long offset, final byte[] data) throws PathIOException {
        if (done) {
            throw new PathIOException(location(), "write request already completed");
        }
        if (offset != nextOffset) {
            throw new PathIOException(location(),
                "non-sequential write at offset " + offset + ", expected " + nextOffset);
        }
        if (nextOffset + data.length > maxPutSize || nextOffset + data.length > Integer.MAX_VALUE - 8) {
            throw new PathIOException(location(),
                "object would exceed the maximum size " + maxPutSize);
        }
        buffer.write(data, 0, data.length);
        nextOffset += data.length;
        return data.length;
    }

    /**
     * Upload the buffered data.
     *
     * @return size of the stored object
     * @throws IOException on upload failure; the request stays completed
     */
    synchronized long finish() throws IOException {
        if (done) {
            throw new PathIOException(location(), "write request already completed");
        }
        done = true;
        byte[] data = buffer.toByteArray();
        buffer = null;
        LOG.debug("uploading {} bytes to {}", data.length, location());
        executor.putObject(bucket, key, data);
        return data.length;
    }

    /**
     * Drop the buffered data without uploading.
     */
    synchronized void abort() {
        if (!done) {
            LOG.debug("aborting write of {} after {} bytes", location(), nextOffset);
        }
        done = true;
        buffer = null;
    }

    synchronized long getBytesWritten() {
        return nextOffset;
    }

    synchronized boolean isDone() {
        return done;
    }

    private String location() {
        return RGWCommonUtils.location(bucket, key);
    }

    @Override
    public String toString() {
        return "RGWWriteRequest{" + location() + '}';
    }
}

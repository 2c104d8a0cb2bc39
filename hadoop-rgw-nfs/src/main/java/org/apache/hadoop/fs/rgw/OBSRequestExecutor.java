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

import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;
import com.obs.services.ObsClient;
import com.obs.services.exception.ObsException;
import com.obs.services.model.GetObjectRequest;
import com.obs.services.model.ListBucketsRequest;
import com.obs.services.model.ListObjectsRequest;
import com.obs.services.model.ObjectListing;
import com.obs.services.model.ObjectMetadata;
import com.obs.services.model.ObsBucket;
import com.obs.services.model.ObsObject;
import com.obs.services.model.PutObjectRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;

/**
 * {@link RGWRequestExecutor} on top of the OBS SDK, which speaks the S3
 * dialect understood by radosgw.
 */
public class OBSRequestExecutor implements RGWRequestExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(OBSRequestExecutor.class);

    /**
     * Requested range not satisfiable.
     */
    private static final int RANGE_NOT_SATISFIABLE_CODE = 416;

    private final ObsClient obsClient;

    public OBSRequestExecutor(final ObsClient obsClient) {
        this.obsClient = Preconditions.checkNotNull(obsClient, "obsClient");
    }

    /**
     * Return the OBS client used by this executor.
     *
     * @return OBS client
     */
    ObsClient getObsClient() {
        return obsClient;
    }

    @Override
    public RGWListing listBuckets(final String marker, final int maxKeys) throws IOException {
        List<ObsBucket> buckets;
        try {
            buckets = obsClient.listBuckets(new ListBucketsRequest());
        } catch (ObsException e) {
            throw RGWCommonUtils.translateException("listBuckets", "", e);
        }
        // the service returns every bucket, pagination is done here
        List<ObsBucket> sorted = new ArrayList<>(buckets);
        sorted.sort(Comparator.comparing(ObsBucket::getBucketName));
        List<RGWListing.Entry> entries = new ArrayList<>();
        boolean truncated = false;
        for (ObsBucket bucket : sorted) {
            String name = bucket.getBucketName();
            if (marker != null && !marker.isEmpty() && name.compareTo(marker) <= 0) {
                continue;
            }
            if (entries.size() >= maxKeys) {
                truncated = true;
                break;
            }
            entries.add(new RGWListing.Entry(name, true, name, 0, toMillis(bucket.getCreationDate())));
        }
        String nextMarker = entries.isEmpty() ? "" : entries.get(entries.size() - 1).getMarker();
        return new RGWListing(entries, nextMarker, truncated);
    }

    @Override
    public RGWListing listObjects(final String bucket, final String prefix, final String delimiter,
        final String marker, final int maxKeys) throws IOException {
        ListObjectsRequest request = new ListObjectsRequest();
        request.setBucketName(bucket);
        request.setPrefix(prefix);
        request.setDelimiter(delimiter);
        if (marker != null && !marker.isEmpty()) {
            request.setMarker(marker);
        }
        request.setMaxKeys(maxKeys);

        ObjectListing listing;
        try {
            listing = obsClient.listObjects(request);
        } catch (ObsException e) {
            throw RGWCommonUtils.translateException("listObjects", RGWCommonUtils.location(bucket, prefix), e);
        }

        List<RGWListing.Entry> entries = new ArrayList<>();
        for (ObsObject object : listing.getObjects()) {
            String key = object.getObjectKey();
            ObjectMetadata meta = object.getMetadata();
            long size = meta == null || meta.getContentLength() == null ? 0 : meta.getContentLength();
            long mtime = meta == null ? 0 : toMillis(meta.getLastModified());
            entries.add(new RGWListing.Entry(key, false, key, size, mtime));
        }
        for (String commonPrefix : listing.getCommonPrefixes()) {
            entries.add(new RGWListing.Entry(commonPrefix, true, commonPrefix, 0, 0));
        }
        entries.sort(Comparator.comparing(RGWListing.Entry::getName));
        if (LOG.isDebugEnabled()) {
            LOG.debug("listed {} entries under {} after [{}], truncated {}", entries.size(),
                RGWCommonUtils.location(bucket, prefix), marker, listing.isTruncated());
        }

        String nextMarker = listing.getNextMarker();
        if ((nextMarker == null || nextMarker.isEmpty()) && !entries.isEmpty()) {
            nextMarker = entries.get(entries.size() - 1).getMarker();
        }
        return new RGWListing(entries, nextMarker, listing.isTruncated());
    }

    @Override
    public boolean headBucket(final String bucket) throws IOException {
        try {
            return obsClient.headBucket(bucket);
        } catch (ObsException e) {
            throw RGWCommonUtils.translateException("headBucket", bucket, e);
        }
    }

    @Override
    public RGWObjectAttributes getObjectMetadata(final String bucket, final String key) throws IOException {
        try {
            ObjectMetadata meta = obsClient.getObjectMetadata(bucket, key);
            long size = meta.getContentLength() == null ? 0 : meta.getContentLength();
            return new RGWObjectAttributes(size, toMillis(meta.getLastModified()));
        } catch (ObsException e) {
            throw RGWCommonUtils.translateException("getObjectMetadata", RGWCommonUtils.location(bucket, key), e);
        }
    }

    @Override
    public byte[] getObject(final String bucket, final String key, final long offset, final int length)
        throws IOException {
        if (length == 0) {
            return new byte[0];
        }
        GetObjectRequest request = new GetObjectRequest(bucket, key);
        request.setRangeStart(offset);
        request.setRangeEnd(offset + length - 1);
        try {
            ObsObject object = obsClient.getObject(request);
            try (InputStream in = object.getObjectContent()) {
                return ByteStreams.toByteArray(ByteStreams.limit(in, length));
            }
        } catch (ObsException e) {
            if (e.getResponseCode() == RANGE_NOT_SATISFIABLE_CODE) {
                LOG.debug("read at {} is past the end of {}", offset, RGWCommonUtils.location(bucket, key));
                return new byte[0];
            }
            throw RGWCommonUtils.translateException("getObject", RGWCommonUtils.location(bucket, key), e);
        }
    }

    @Override
    public void putObject(final String bucket, final String key, final byte[] data) throws IOException {
        PutObjectRequest request = new PutObjectRequest(bucket, key);
        ObjectMetadata meta = new ObjectMetadata();
        meta.setContentLength((long) data.length);
        request.setMetadata(meta);
        request.setInput(new ByteArrayInputStream(data));
        try {
            obsClient.putObject(request);
        } catch (ObsException e) {
            throw RGWCommonUtils.translateException("putObject", RGWCommonUtils.location(bucket, key), e);
        }
    }

    @Override
    public void deleteObject(final String bucket, final String key) throws IOException {
        try {
            obsClient.deleteObject(bucket, key);
        } catch (ObsException e) {
            throw RGWCommonUtils.translateException("deleteObject", RGWCommonUtils.location(bucket, key), e);
        }
    }

    @Override
    public void createBucket(final String bucket) throws IOException {
        try {
            obsClient.createBucket(bucket);
        } catch (ObsException e) {
            throw RGWCommonUtils.translateException("createBucket", bucket, e);
        }
    }

    @Override
    public void deleteBucket(final String bucket) throws IOException {
        try {
            obsClient.deleteBucket(bucket);
        } catch (ObsException e) {
            throw RGWCommonUtils.translateException("deleteBucket", bucket, e);
        }
    }

    @Override
    public void close() throws IOException {
        obsClient.close();
    }

    private static long toMillis(final Date date) {
        return date == null ? 0 : date.getTime();
    }
}

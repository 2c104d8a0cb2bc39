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

import static org.apache.hadoop.fs.rgw.RGWTestUtils.resolve;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.PathIOException;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

/**
 * Directory listing and cookie to marker resumption.
 */
public class TestRGWReaddir {
    @Rule
    public RGWTestRule testRule = new RGWTestRule();

    private RGWFileSystem fs;

    private RGWFileHandle bucket;

    private final Listing listing = new Listing();

    static final class Listing implements RGWReaddirCallback {
        final List<String> names = new ArrayList<>();

        final List<Long> cookies = new ArrayList<>();

        final List<Boolean> dirs = new ArrayList<>();

        int stopAfter = Integer.MAX_VALUE;

        @Override
        public boolean onEntry(String name, long cookie, boolean isDir) {
            names.add(name);
            cookies.add(cookie);
            dirs.add(isDir);
            return names.size() < stopAfter;
        }

        long lastCookie() {
            return cookies.get(cookies.size() - 1);
        }

        void clear() {
            names.clear();
            cookies.clear();
            dirs.clear();
        }
    }

    @Before
    public void setUp() {
        InMemoryRequestExecutor executor = new InMemoryRequestExecutor()
            .withObject("bucket1", "dir1/")
            .withObject("bucket1", "dir1/a")
            .withObject("bucket1", "dir1/b")
            .withObject("bucket1", "dir1/sub/x")
            .withObject("bucket1", "top")
            .withBucket("bucket2")
            .withBucket("bucket3");
        Configuration conf = new Configuration(false);
        conf.setInt(RGWConstants.READDIR_MAX_KEYS, 2);
        fs = new RGWFileSystem(conf, executor);
        bucket = resolve(fs, fs.getRootFh(), "bucket1", RGWFileHandle.FLAG_BUCKET);
    }

    @After
    public void tearDown() throws Exception {
        if (fs != null) {
            fs.close();
        }
    }

    @Test
    public void testRootListsBucketsInPages() throws Exception {
        RGWFileHandle root = fs.getRootFh();
        assertFalse(fs.readdir(root, 0, listing));
        assertEquals(Arrays.asList("bucket1", "bucket2"), listing.names);
        assertEquals(Arrays.asList(true, true), listing.dirs);
        assertEquals(FhKey.hash("bucket2"), listing.lastCookie());
        assertEquals("bucket2", root.findMarker(listing.lastCookie()));

        long resume = listing.lastCookie();
        listing.clear();
        assertTrue(fs.readdir(root, resume, listing));
        assertEquals(Arrays.asList("bucket3"), listing.names);
    }

    @Test
    public void testBucketRollsUpPrefixes() throws Exception {
        fs.close();
        InMemoryRequestExecutor executor = new InMemoryRequestExecutor()
            .withObject("bucket1", "dir1/a")
            .withObject("bucket1", "dir1/b")
            .withObject("bucket1", "top");
        fs = RGWTestUtils.newFileSystem(executor);
        bucket = resolve(fs, fs.getRootFh(), "bucket1", RGWFileHandle.FLAG_BUCKET);

        assertTrue(fs.readdir(bucket, 0, listing));
        assertEquals(Arrays.asList("dir1", "top"), listing.names);
        assertEquals(Arrays.asList(true, false), listing.dirs);
        assertEquals("dir1/", bucket.findMarker(FhKey.hash("dir1")));
        assertEquals("top", bucket.findMarker(FhKey.hash("top")));
    }

    @Test
    public void testDirectoryPagesResumeFromCookie() throws Exception {
        RGWFileHandle dir = resolve(fs, bucket, "dir1", RGWFileHandle.FLAG_DIRECTORY);

        // the placeholder object dir1/ uses a slot of the first page
        assertFalse(fs.readdir(dir, 0, listing));
        assertEquals(Arrays.asList("a"), listing.names);
        assertEquals(FhKey.hash("a"), listing.lastCookie());
        assertEquals("dir1/a", dir.findMarker(listing.lastCookie()));

        long resume = listing.lastCookie();
        listing.clear();
        assertTrue(fs.readdir(dir, resume, listing));
        assertEquals(Arrays.asList("b", "sub"), listing.names);
        assertEquals(Arrays.asList(false, true), listing.dirs);
        assertEquals("dir1/sub/", dir.findMarker(FhKey.hash("sub")));
    }

    @Test
    public void testCallbackCanStopListing() throws Exception {
        listing.stopAfter = 1;
        assertFalse(fs.readdir(fs.getRootFh(), 0, listing));
        assertEquals(1, listing.names.size());
        assertEquals("bucket1", fs.getRootFh().findMarker(FhKey.hash("bucket1")));
    }

    @Test
    public void testUnknownCookieListsFromStart() throws Exception {
        RGWFileHandle dir = resolve(fs, bucket, "dir1", RGWFileHandle.FLAG_DIRECTORY);
        assertFalse(fs.readdir(dir, 12345L, listing));
        assertEquals(Arrays.asList("a"), listing.names);
    }

    @Test(expected = PathIOException.class)
    public void testReaddirOfFileFails() throws Exception {
        RGWFileHandle file = resolve(fs, bucket, "top", RGWFileHandle.FLAG_NONE);
        fs.readdir(file, 0, listing);
    }
}

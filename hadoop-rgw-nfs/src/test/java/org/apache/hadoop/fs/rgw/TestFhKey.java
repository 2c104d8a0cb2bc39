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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;

public class TestFhKey {
    @Rule
    public RGWTestRule testRule = new RGWTestRule();

    @Test
    public void testDeriveIsDeterministic() {
        for (String path : Arrays.asList("", "a", "dir1/file1", "été/café", "x/y/z/")) {
            assertEquals(FhKey.derive("bucket1", path), FhKey.derive("bucket1", path));
            assertEquals(FhKey.hash(path), FhKey.hash(path));
        }
    }

    @Test
    public void testDeriveChildMatchesDerive() {
        long bucketHash = FhKey.hash("bucket1");
        assertEquals(FhKey.derive("bucket1", "dir1/file1"), FhKey.deriveChild(bucketHash, "dir1/file1"));
        assertEquals(FhKey.derive("bucket1", ""), FhKey.forBucket("bucket1"));
    }

    @Test
    public void testBucketComponentUsesBucketNameOnly() {
        // equal-length object paths must not change the bucket component
        FhKey a = FhKey.derive("bucket1", "ab");
        FhKey b = FhKey.derive("bucket1", "a/b/c/d");
        assertEquals(a.getBucket(), b.getBucket());
        assertEquals(FhKey.hash("bucket1"), a.getBucket());
        assertNotEquals(FhKey.derive("b1", "xy").getBucket(), FhKey.derive("b2", "xy").getBucket());
    }

    @Test
    public void testOrderIsBucketThenObjectUnsigned() {
        FhKey small = new FhKey(1L, 5L);
        FhKey sameBucketLarger = new FhKey(1L, -1L);
        FhKey negativeBucket = new FhKey(-1L, 0L);
        List<FhKey> keys = new ArrayList<>(Arrays.asList(negativeBucket, sameBucketLarger, small));
        Collections.sort(keys);
        assertEquals(Arrays.asList(small, sameBucketLarger, negativeBucket), keys);
        assertEquals(0, new FhKey(7L, 8L).compareTo(new FhKey(7L, 8L)));
    }

    @Test
    public void testEqualityAndHashCode() {
        FhKey a = new FhKey(3L, 4L);
        FhKey b = new FhKey(3L, 4L);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new FhKey(4L, 3L));
        assertEquals(a.partitionSelector(), b.partitionSelector());
    }

    @Test
    public void testToStringIsUnsigned() {
        assertTrue(new FhKey(-1L, 1L).toString().startsWith("<18446744073709551615,"));
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of a bucket or object listing.
 */
public final class RGWListing {
    /**
     * An object or a common prefix.
     */
    public static final class Entry {
        private final String name;

        private final boolean commonPrefix;

        private final String marker;

        private final long size;

        private final long mtime;

        /**
         * @param name         full key, or the common prefix including its
         *                     trailing delimiter
         * @param commonPrefix whether the entry is a rolled-up prefix
         * @param marker       continuation marker that resumes the listing
         *                     right after this entry
         * @param size         object size, 0 for prefixes
         * @param mtime        last modification, milliseconds since the epoch
         */
        public Entry(final String name, final boolean commonPrefix, final String marker, final long size,
            final long mtime) {
            this.name = Preconditions.checkNotNull(name);
            this.commonPrefix = commonPrefix;
            this.marker = Preconditions.checkNotNull(marker);
            this.size = size;
            this.mtime = mtime;
        }

        public String getName() {
            return name;
        }

        public boolean isCommonPrefix() {
            return commonPrefix;
        }

        public String getMarker() {
            return marker;
        }

        public long getSize() {
            return size;
        }

        public long getMtime() {
            return mtime;
        }

        @Override
        public String toString() {
            return (commonPrefix ? "prefix " : "object ") + name;
        }
    }

    private final List<Entry> entries;

    private final String nextMarker;

    private final boolean truncated;

    public RGWListing(final List<Entry> entries, final String nextMarker, final boolean truncated) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.nextMarker = nextMarker == null ? "" : nextMarker;
        this.truncated = truncated;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public String getNextMarker() {
        return nextMarker;
    }

    public boolean isTruncated() {
        return truncated;
    }
}

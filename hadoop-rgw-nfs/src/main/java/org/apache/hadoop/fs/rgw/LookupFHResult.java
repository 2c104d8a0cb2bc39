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

/**
 * Result of {@link RGWFileSystem#lookupFh}: a referenced handle, or none.
 */
public final class LookupFHResult {
    /**
     * No flags.
     */
    public static final int FLAG_NONE = 0x0000;

    /**
     * The handle was created by this lookup.
     */
    public static final int FLAG_CREATE = 0x0001;

    static final LookupFHResult EMPTY = new LookupFHResult(null, FLAG_NONE);

    private final RGWFileHandle handle;

    private final int flags;

    LookupFHResult(final RGWFileHandle handle, final int flags) {
        this.handle = handle;
        this.flags = flags;
    }

    /**
     * @return the handle, carrying one reference owned by the caller, or null
     */
    public RGWFileHandle getHandle() {
        return handle;
    }

    public int getFlags() {
        return flags;
    }

    public boolean isCreated() {
        return (flags & FLAG_CREATE) != 0;
    }

    public boolean isEmpty() {
        return handle == null;
    }
}

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
 * Receives the entries produced by {@link RGWFileSystem#readdir}.
 */
@FunctionalInterface
public interface RGWReaddirCallback {
    /**
     * @param name   leaf name of the entry, without trailing delimiter
     * @param cookie offset that resumes the listing after this entry
     * @param isDir  whether the entry is a directory
     * @return false to stop the listing early
     */
    boolean onEntry(String name, long cookie, boolean isDir);
}

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

package org.apache.hadoop.fs.rgw.lru;

/**
 * Supplies objects to {@link LRU#insert}.
 *
 * @param <T> object type
 */
public interface ObjectFactory<T extends LRUObject> {
    /**
     * Allocate a new object.
     *
     * @return new object, or null when none can be created
     */
    T alloc();

    /**
     * Re-initialise an object the ring has just reclaimed so that it can be
     * reused for the new identity this factory describes.
     *
     * @param o reclaimed object
     * @return the re-initialised object
     */
    T recycle(T o);
}

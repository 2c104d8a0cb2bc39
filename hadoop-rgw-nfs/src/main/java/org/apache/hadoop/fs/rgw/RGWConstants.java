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

import org.apache.hadoop.classification.InterfaceAudience;
import org.apache.hadoop.classification.InterfaceStability;

/**
 * All constants used by {@link RGWFileSystem}.
 *
 * <p>Some of the strings are marked as {@code Unstable}. This means that they
 * may be unsupported in future; at which point they will be marked as
 * deprecated and simply ignored.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public final class RGWConstants {
    /**
     * Number of partitions of the file handle index.
     */
    public static final String FHCACHE_PARTITIONS = "fs.rgw.nfs.fhcache.partitions";

    /**
     * Default value of {@link #FHCACHE_PARTITIONS}.
     */
    public static final int DEFAULT_FHCACHE_PARTITIONS = 3;

    /**
     * Look-aside slots per index partition.
     */
    public static final String FHCACHE_SIZE = "fs.rgw.nfs.fhcache.size";

    /**
     * Default value of {@link #FHCACHE_SIZE}.
     */
    public static final int DEFAULT_FHCACHE_SIZE = 2017;

    /**
     * Number of independently locked lanes of the handle LRU.
     */
    public static final String LRU_LANES = "fs.rgw.nfs.lru.lanes";

    /**
     * Default value of {@link #LRU_LANES}.
     */
    public static final int DEFAULT_LRU_LANES = 5;

    /**
     * Lane size at which inserts start evicting idle handles.
     */
    public static final String LRU_LANE_HIWAT = "fs.rgw.nfs.lru.lane.hiwat";

    /**
     * Default value of {@link #LRU_LANE_HIWAT}.
     */
    public static final int DEFAULT_LRU_LANE_HIWAT = 911;

    /**
     * Upper bound on lookups retried after losing a race with eviction.
     */
    public static final String LOOKUP_MAX_RETRIES = "fs.rgw.nfs.lookup.max.retries";

    /**
     * Default value of {@link #LOOKUP_MAX_RETRIES}.
     */
    public static final int DEFAULT_LOOKUP_MAX_RETRIES = 1024;

    /**
     * Max number of entries requested per directory listing call.
     */
    public static final String READDIR_MAX_KEYS = "fs.rgw.nfs.readdir.max.keys";

    /**
     * Default value of {@link #READDIR_MAX_KEYS}.
     */
    public static final int DEFAULT_READDIR_MAX_KEYS = 1000;

    /**
     * Largest object a single write sequence may produce.
     */
    public static final String MAX_PUT_SIZE = "fs.rgw.max.put.size";

    /**
     * Default value of {@link #MAX_PUT_SIZE}, 5 GB.
     */
    public static final long DEFAULT_MAX_PUT_SIZE = 5L * 1024 * 1024 * 1024;

    /**
     * Object store endpoint.
     */
    public static final String ENDPOINT = "fs.rgw.endpoint";

    /**
     * Access key.
     */
    public static final String ACCESS_KEY = "fs.rgw.access.key";

    /**
     * Secret key.
     */
    public static final String SECRET_KEY = "fs.rgw.secret.key";

    /**
     * Connect over ssl.
     */
    public static final String SECURE_CONNECTIONS = "fs.rgw.connection.ssl.enabled";

    /**
     * Default value of {@link #SECURE_CONNECTIONS}.
     */
    public static final boolean DEFAULT_SECURE_CONNECTIONS = false;

    /**
     * Maximum number of simultaneous connections to the store.
     */
    public static final String MAXIMUM_CONNECTIONS = "fs.rgw.connection.maximum";

    /**
     * Default value of {@link #MAXIMUM_CONNECTIONS}.
     */
    public static final int DEFAULT_MAXIMUM_CONNECTIONS = 1000;

    /**
     * Milliseconds until a connection is established.
     */
    public static final String ESTABLISH_TIMEOUT = "fs.rgw.connection.establish.timeout";

    /**
     * Default value of {@link #ESTABLISH_TIMEOUT}.
     */
    public static final int DEFAULT_ESTABLISH_TIMEOUT = 120000;

    /**
     * Socket timeout in milliseconds.
     */
    public static final String SOCKET_TIMEOUT = "fs.rgw.connection.timeout";

    /**
     * Default value of {@link #SOCKET_TIMEOUT}.
     */
    public static final int DEFAULT_SOCKET_TIMEOUT = 120000;

    /**
     * Number of times the client retries a failed request on its own.
     */
    public static final String MAX_ERROR_RETRIES = "fs.rgw.attempts.maximum";

    /**
     * Default value of {@link #MAX_ERROR_RETRIES}.
     */
    public static final int DEFAULT_MAX_ERROR_RETRIES = 3;

    /**
     * Client factory implementation class.
     */
    @InterfaceAudience.Private
    @InterfaceStability.Unstable
    public static final String RGW_CLIENT_FACTORY_IMPL = "fs.rgw.client.factory.impl";

    /**
     * Default value of {@link #RGW_CLIENT_FACTORY_IMPL}.
     */
    @InterfaceAudience.Private
    @InterfaceStability.Unstable
    static final Class<? extends RGWClientFactory> DEFAULT_RGW_CLIENT_FACTORY_IMPL = DefaultRGWClientFactory.class;

    /**
     * Deepest handle nesting; the root is depth 0.
     */
    public static final int MAX_DEPTH = 256;

    /**
     * Name of the root handle.
     */
    public static final String ROOT_NAME = "/";

    /**
     * Prefix of the synthetic bucket name that identifies a filesystem
     * instance. No bucket may be named like this.
     */
    static final String FS_INST_PREFIX = "rgw_fs_inst-";

    /**
     * Path separator of object keys.
     */
    public static final String DELIMITER = "/";

    /**
     * Http prefix.
     */
    static final String HTTP_PREFIX = "http://";

    /**
     * Https prefix.
     */
    static final String HTTPS_PREFIX = "https://";

    private RGWConstants() {
    }
}

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

import com.obs.services.ObsClient;

import org.apache.hadoop.classification.InterfaceAudience;
import org.apache.hadoop.classification.InterfaceStability;

import java.io.IOException;
import java.net.URI;

/**
 * Factory for creating OBS SDK clients against a gateway endpoint.
 */
@InterfaceAudience.Private
@InterfaceStability.Unstable
public interface RGWClientFactory {
    /**
     * Creates a new {@link ObsClient}.
     *
     * @param name URI of the gateway filesystem, used for logging
     * @return client talking to the configured endpoint
     * @throws IOException IO problem
     */
    ObsClient createObsClient(URI name) throws IOException;
}

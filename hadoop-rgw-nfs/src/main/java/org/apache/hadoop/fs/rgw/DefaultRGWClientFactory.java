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
import com.obs.services.internal.ext.ExtObsConfiguration;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.conf.Configured;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

/**
 * The default factory implementation, which calls the OBS SDK to configure
 * and create an {@link ObsClient} for the gateway endpoint.
 */
class DefaultRGWClientFactory extends Configured implements RGWClientFactory {
    /**
     * Class logger.
     */
    private static final Logger LOG = LoggerFactory.getLogger(DefaultRGWClientFactory.class);

    /**
     * Initializes all OBS SDK settings related to connection management.
     *
     * @param conf    Hadoop configuration
     * @param obsConf OBS SDK configuration
     */
    private static void initConnectionSettings(final Configuration conf, final ExtObsConfiguration obsConf) {
        obsConf.setMaxConnections(
            RGWCommonUtils.intOption(conf, RGWConstants.MAXIMUM_CONNECTIONS, RGWConstants.DEFAULT_MAXIMUM_CONNECTIONS,
                1));

        boolean secureConnections = conf.getBoolean(RGWConstants.SECURE_CONNECTIONS,
            RGWConstants.DEFAULT_SECURE_CONNECTIONS);
        String endPoint = RGWCommonUtils.endpointWithScheme(conf.getTrimmed(RGWConstants.ENDPOINT, ""),
            secureConnections);
        obsConf.setEndPoint(endPoint);
        obsConf.setHttpsOnly(secureConnections);

        obsConf.setMaxErrorRetry(
            RGWCommonUtils.intOption(conf, RGWConstants.MAX_ERROR_RETRIES, RGWConstants.DEFAULT_MAX_ERROR_RETRIES, 0));

        obsConf.setConnectionTimeout(
            RGWCommonUtils.intOption(conf, RGWConstants.ESTABLISH_TIMEOUT, RGWConstants.DEFAULT_ESTABLISH_TIMEOUT, 0));

        obsConf.setSocketTimeout(
            RGWCommonUtils.intOption(conf, RGWConstants.SOCKET_TIMEOUT, RGWConstants.DEFAULT_SOCKET_TIMEOUT, 0));

        // radosgw speaks path-style requests
        obsConf.setPathStyle(true);
    }

    @Override
    public ObsClient createObsClient(final URI name) throws IOException {
        Configuration conf = getConf();
        ExtObsConfiguration obsConf = new ExtObsConfiguration();
        initConnectionSettings(conf, obsConf);

        String accessKey = RGWCommonUtils.getSecret(conf, RGWConstants.ACCESS_KEY);
        String secretKey = RGWCommonUtils.getSecret(conf, RGWConstants.SECRET_KEY);
        if (accessKey == null || secretKey == null) {
            LOG.warn("No credentials configured for {}, using anonymous access", name);
            return new ObsClient(obsConf);
        }
        LOG.debug("Creating client for {} at {}", name, obsConf.getEndPoint());
        return new ObsClient(accessKey, secretKey, obsConf);
    }
}

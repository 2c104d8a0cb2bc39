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
import com.obs.services.exception.ObsException;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileAlreadyExistsException;
import org.apache.hadoop.security.AccessControlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Locale;

/**
 * Common utils for the gateway filesystem.
 */
final class RGWCommonUtils {
    /**
     * Class logger.
     */
    private static final Logger LOG = LoggerFactory.getLogger(RGWCommonUtils.class);

    /**
     * Unauthorized error code.
     */
    static final int UNAUTHORIZED_CODE = 401;

    /**
     * Forbidden error code.
     */
    static final int FORBIDDEN_CODE = 403;

    /**
     * Not found error code.
     */
    static final int NOT_FOUND_CODE = 404;

    /**
     * Conflict error code.
     */
    static final int CONFLICT_CODE = 409;

    /**
     * Gone error code.
     */
    static final int GONE_CODE = 410;

    private RGWCommonUtils() {
    }

    /**
     * Translate an exception raised in an operation into an IOException. The
     * specific type of IOException depends on the class of {@link
     * ObsException} passed in, and any status codes included in the
     * operation.
     *
     * @param operation operation
     * @param path      bucket and key the operation was working on
     * @param exception obs exception raised
     * @return an IOE which wraps the caught exception
     */
    static IOException translateException(final String operation, final String path,
        final ObsException exception) {
        String errorCode = exception.getErrorCode();
        String message = String.format(Locale.ROOT, "%s%s: ResponseCode[%d],ErrorCode[%s],ErrorMessage[%s],RequestId[%s]",
            operation, path == null || path.isEmpty() ? "" : " on " + path, exception.getResponseCode(), errorCode,
            exception.getErrorMessage(), exception.getErrorRequestId());

        IOException ioe;
        int status = exception.getResponseCode();
        switch (status) {
            case UNAUTHORIZED_CODE:
            case FORBIDDEN_CODE:
                ioe = new AccessControlException(message);
                ioe.initCause(exception);
                break;
            case NOT_FOUND_CODE:
            case GONE_CODE:
                ioe = new FileNotFoundException(message);
                ioe.initCause(exception);
                break;
            case CONFLICT_CODE:
                ioe = new FileAlreadyExistsException(message);
                ioe.initCause(exception);
                break;
            default:
                RGWIOException rgwException = new RGWIOException(message, exception);
                rgwException.setErrCode(errorCode);
                ioe = rgwException;
                break;
        }
        LOG.debug("{} translated to {}", operation, ioe.getClass().getSimpleName());
        return ioe;
    }

    /**
     * Get a integer option not smaller than the minimum allowed value.
     *
     * @param conf   configuration
     * @param key    key to look up
     * @param defVal default value
     * @param min    minimum value
     * @return the value
     * @throws IllegalArgumentException if the value is below the minimum
     */
    static int intOption(final Configuration conf, final String key, final int defVal, final int min) {
        int v = conf.getInt(key, defVal);
        Preconditions.checkArgument(v >= min,
            String.format(Locale.ROOT, "Value of %s: %d is below the minimum value %d", key, v, min));
        LOG.debug("Value of {} is {}", key, v);
        return v;
    }

    /**
     * Get a long option not smaller than the minimum allowed value.
     */
    static long longOption(final Configuration conf, final String key, final long defVal, final long min) {
        long v = conf.getLong(key, defVal);
        Preconditions.checkArgument(v >= min,
            String.format(Locale.ROOT, "Value of %s: %d is below the minimum value %d", key, v, min));
        LOG.debug("Value of {} is {}", key, v);
        return v;
    }

    /**
     * Read a secret through the configuration's credential providers, falling
     * back to the clear-text value.
     *
     * @param conf configuration
     * @param key  key of the secret
     * @return trimmed secret, or null when unset or blank
     * @throws IOException if a credential provider fails
     */
    static String getSecret(final Configuration conf, final String key) throws IOException {
        char[] pass = conf.getPassword(key);
        if (pass == null) {
            return null;
        }
        String secret = new String(pass).trim();
        return secret.isEmpty() ? null : secret;
    }

    /**
     * Prefix a bare endpoint with the scheme chosen by the ssl switch.
     *
     * @param endPoint          configured endpoint, may already have a scheme
     * @param secureConnections whether to use https
     * @return endpoint with scheme, or empty if none was configured
     */
    static String endpointWithScheme(final String endPoint, final boolean secureConnections) {
        if (endPoint.isEmpty() || endPoint.startsWith(RGWConstants.HTTP_PREFIX)
            || endPoint.startsWith(RGWConstants.HTTPS_PREFIX)) {
            return endPoint;
        }
        return (secureConnections ? RGWConstants.HTTPS_PREFIX : RGWConstants.HTTP_PREFIX) + endPoint;
    }

    /**
     * @param bucket bucket name
     * @param key    object key, may be empty
     * @return printable location of an object
     */
    static String location(final String bucket, final String key) {
        return key == null || key.isEmpty() ? bucket : bucket + RGWConstants.DELIMITER + key;
    }
}

/*
 * ====================================================================
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 * ====================================================================
 *
 * This software consists of voluntary contributions made by many
 * individuals on behalf of the Apache Software Foundation.  For more
 * information on the Apache Software Foundation, please see
 * <http://www.apache.org/>.
 *
 */
package org.apache.hc.client5.wsclient.endpoint;

import java.net.URI;
import java.net.URISyntaxException;

import org.apache.hc.client5.wsclient.InvalidUriException;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.TextUtils;

/**
 * Default {@link EndpointResolver} backed by {@link URI}.
 * <p>
 * Accepts {@code ws} and {@code wss} URIs with a host, no user info and no
 * fragment. A missing path becomes {@code /}; the raw query is kept on the
 * resource name.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class UriEndpointResolver implements EndpointResolver {

    public static final UriEndpointResolver INSTANCE = new UriEndpointResolver();

    @Override
    public EndpointDescriptor resolve(final String uri) throws InvalidUriException {
        if (TextUtils.isBlank(uri)) {
            throw new InvalidUriException(String.valueOf(uri), "Empty WebSocket URI");
        }
        final URI parsed;
        try {
            parsed = new URI(uri);
        } catch (final URISyntaxException ex) {
            throw new InvalidUriException(uri, "Malformed WebSocket URI", ex);
        }
        final String scheme = parsed.getScheme();
        final boolean secure;
        if ("wss".equalsIgnoreCase(scheme)) {
            secure = true;
        } else if ("ws".equalsIgnoreCase(scheme)) {
            secure = false;
        } else {
            throw new InvalidUriException(uri, "Scheme must be ws or wss");
        }
        final String host = parsed.getHost();
        if (TextUtils.isBlank(host)) {
            throw new InvalidUriException(uri, "Host required");
        }
        if (parsed.getRawUserInfo() != null) {
            throw new InvalidUriException(uri, "User info not allowed");
        }
        if (parsed.getRawFragment() != null) {
            throw new InvalidUriException(uri, "Fragment not allowed");
        }
        final int port;
        if (parsed.getPort() == -1) {
            port = secure ? EndpointDescriptor.DEFAULT_SECURE_PORT : EndpointDescriptor.DEFAULT_PORT;
        } else if (parsed.getPort() < 1 || parsed.getPort() > 65535) {
            throw new InvalidUriException(uri, "Port out of range");
        } else {
            port = parsed.getPort();
        }
        String path = parsed.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        final String resourceName = parsed.getRawQuery() != null ? path + "?" + parsed.getRawQuery() : path;
        return new EndpointDescriptor(host, port, secure, resourceName);
    }

}

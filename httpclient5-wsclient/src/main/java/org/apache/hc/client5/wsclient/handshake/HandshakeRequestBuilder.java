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
package org.apache.hc.client5.wsclient.handshake;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

import org.apache.hc.client5.wsclient.ConfigurationException;
import org.apache.hc.client5.wsclient.endpoint.EndpointDescriptor;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.util.Args;

/**
 * Builds the HTTP/1.1 upgrade request of the opening handshake.
 * <p>
 * Header order is fixed: {@code Host}, {@code Upgrade}, {@code Connection},
 * optional {@code Origin}, optional extension and subprotocol offers, caller
 * headers, {@code User-Agent}, and finally {@code Sec-WebSocket-Key} and
 * {@code Sec-WebSocket-Version}. Building does no I/O.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.SAFE)
public final class HandshakeRequestBuilder {

    private final SecureRandom random;

    public HandshakeRequestBuilder() {
        this(new SecureRandom());
    }

    public HandshakeRequestBuilder(final SecureRandom random) {
        this.random = Args.notNull(random, "Random");
    }

    /**
     * @param endpoint            target endpoint.
     * @param origin              {@code Origin} header value, may be {@code null}.
     * @param extensionOffers     extensions in order of preference, may be {@code null}.
     * @param subprotocolOffers   subprotocols in order of decreasing preference, may be {@code null}.
     * @param extraHeaders        a {@code Map} or an {@code Iterable} of (name, value) pairs, may be {@code null}.
     * @param userAgent           {@code User-Agent} header value.
     * @throws ConfigurationException if {@code extraHeaders} has an unsupported shape or content.
     */
    public HandshakeRequest build(
            final EndpointDescriptor endpoint,
            final String origin,
            final List<String> extensionOffers,
            final List<String> subprotocolOffers,
            final Object extraHeaders,
            final String userAgent) throws ConfigurationException {
        Args.notNull(endpoint, "Endpoint");
        Args.notBlank(userAgent, "User agent");
        final List<Header> callerHeaders = ExtraHeaders.normalize(extraHeaders);

        final List<Header> headers = new ArrayList<>();
        headers.add(new BasicHeader(WebSocketHeaders.HOST, hostHeader(endpoint)));
        headers.add(new BasicHeader(WebSocketHeaders.UPGRADE, WebSocketHeaders.WEBSOCKET));
        headers.add(new BasicHeader(WebSocketHeaders.CONNECTION, WebSocketHeaders.UPGRADE_TOKEN));
        if (origin != null) {
            headers.add(new BasicHeader(WebSocketHeaders.ORIGIN, origin));
        }
        if (extensionOffers != null && !extensionOffers.isEmpty()) {
            headers.add(new BasicHeader(WebSocketHeaders.SEC_WEBSOCKET_EXTENSIONS, String.join(", ", extensionOffers)));
        }
        if (subprotocolOffers != null && !subprotocolOffers.isEmpty()) {
            headers.add(new BasicHeader(WebSocketHeaders.SEC_WEBSOCKET_PROTOCOL, String.join(", ", subprotocolOffers)));
        }
        headers.addAll(callerHeaders);
        headers.add(new BasicHeader(WebSocketHeaders.USER_AGENT, userAgent));

        final HandshakeKey key = HandshakeKey.generate(random);
        headers.add(new BasicHeader(WebSocketHeaders.SEC_WEBSOCKET_KEY, key.getValue()));
        headers.add(new BasicHeader(WebSocketHeaders.SEC_WEBSOCKET_VERSION, WebSocketHeaders.VERSION));

        return new HandshakeRequest(endpoint.getResourceName(), headers, key);
    }

    static String hostHeader(final EndpointDescriptor endpoint) {
        String host = endpoint.getHost();
        if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return endpoint.isDefaultPort() ? host : host + ":" + endpoint.getPort();
    }

}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.apache.hc.client5.wsclient.HandshakeException;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.util.Args;

/**
 * Validates the server's reply to the opening handshake.
 * <p>
 * Checks run in a fixed order and the first failure wins: status code,
 * {@code Upgrade} / {@code Connection} headers, {@code Sec-WebSocket-Accept},
 * selected extensions, selected subprotocol. Nothing is negotiated unless
 * every check passes.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class HandshakeResponseValidator {

    public static final HandshakeResponseValidator INSTANCE = new HandshakeResponseValidator();

    public HandshakeResult validate(
            final HandshakeResponse response,
            final HandshakeRequest request,
            final List<String> offeredExtensions,
            final List<String> offeredSubprotocols) throws HandshakeException {
        Args.notNull(request, "Request");
        return validate(response, request.getKey(), request.getHeaders(), offeredExtensions, offeredSubprotocols);
    }

    public HandshakeResult validate(
            final HandshakeResponse response,
            final HandshakeKey key,
            final List<Header> requestHeaders,
            final List<String> offeredExtensions,
            final List<String> offeredSubprotocols) throws HandshakeException {
        Args.notNull(response, "Response");
        Args.notNull(key, "Handshake key");

        if (response.getStatusCode() != HttpStatus.SC_SWITCHING_PROTOCOLS) {
            throw new HandshakeException("Bad status code: " + response.getStatusCode());
        }

        final String upgrade = response.getFirstHeaderValue(WebSocketHeaders.UPGRADE);
        if (upgrade == null || !WebSocketHeaders.WEBSOCKET.equalsIgnoreCase(upgrade.trim())) {
            throw new HandshakeException("Missing/invalid Upgrade header: " + upgrade);
        }
        if (!containsToken(response.getHeaderValues(WebSocketHeaders.CONNECTION), WebSocketHeaders.UPGRADE_TOKEN)) {
            throw new HandshakeException("Missing/invalid Connection header: "
                    + response.getHeaderValues(WebSocketHeaders.CONNECTION));
        }

        final List<String> accepts = response.getHeaderValues(WebSocketHeaders.SEC_WEBSOCKET_ACCEPT);
        if (accepts.isEmpty()) {
            throw new HandshakeException("Missing Sec-WebSocket-Accept header");
        }
        if (accepts.size() > 1 || !WebSocketAccept.matches(key.getValue(), accepts.get(0))) {
            throw new HandshakeException("Invalid Sec-WebSocket-Accept header: " + String.join(", ", accepts));
        }

        final List<String> negotiatedExtensions = negotiateExtensions(
                response.getHeaderValues(WebSocketHeaders.SEC_WEBSOCKET_EXTENSIONS), offeredExtensions);
        final String negotiatedSubprotocol = negotiateSubprotocol(
                response.getHeaderValues(WebSocketHeaders.SEC_WEBSOCKET_PROTOCOL), offeredSubprotocols);

        return new HandshakeResult(
                negotiatedExtensions,
                negotiatedSubprotocol,
                requestHeaders != null ? requestHeaders : Collections.emptyList(),
                response.getHeaders());
    }

    static List<String> negotiateExtensions(
            final List<String> selected,
            final List<String> offered) throws HandshakeException {
        if (selected.isEmpty()) {
            return Collections.emptyList();
        }
        final List<String> negotiated = new ArrayList<>();
        for (final String value : selected) {
            for (final String token : value.split(",", -1)) {
                final String extension = token.trim();
                if (offered == null || !offered.contains(extension)) {
                    throw new HandshakeException("Unknown extension: " + extension);
                }
                negotiated.add(extension);
            }
        }
        return negotiated;
    }

    static String negotiateSubprotocol(
            final List<String> selected,
            final List<String> offered) throws HandshakeException {
        if (selected.isEmpty()) {
            return null;
        }
        if (selected.size() > 1) {
            throw new HandshakeException("Multiple subprotocols selected: " + String.join(", ", selected));
        }
        final String subprotocol = selected.get(0).trim();
        if (offered == null || !offered.contains(subprotocol)) {
            throw new HandshakeException("Unknown subprotocol: " + subprotocol);
        }
        return subprotocol;
    }

    private static boolean containsToken(final List<String> values, final String token) {
        final String wanted = token.toLowerCase(Locale.ROOT);
        for (final String value : values) {
            for (final String element : value.split(",")) {
                if (element.trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                    return true;
                }
            }
        }
        return false;
    }

}

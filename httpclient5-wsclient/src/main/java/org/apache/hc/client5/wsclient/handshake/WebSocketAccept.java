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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import org.apache.hc.core5.util.Args;

/**
 * RFC 6455 section 4.2.2 accept computation.
 *
 * @since 5.6
 */
public final class WebSocketAccept {

    public static final String GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

    private WebSocketAccept() {
    }

    /**
     * Returns {@code base64(SHA-1(key + GUID))} for the given base64 encoded
     * {@code Sec-WebSocket-Key} value.
     */
    public static String compute(final String key) {
        Args.notNull(key, "Key");
        final byte[] digest = sha1().digest((key + GUID).getBytes(StandardCharsets.US_ASCII));
        return Base64.getEncoder().encodeToString(digest);
    }

    /**
     * Checks an {@code Sec-WebSocket-Accept} value against the key it should
     * have been derived from. Surrounding whitespace is ignored.
     */
    public static boolean matches(final String key, final String accept) {
        if (accept == null) {
            return false;
        }
        final byte[] expected = compute(key).getBytes(StandardCharsets.US_ASCII);
        final byte[] actual = accept.trim().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    private static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (final NoSuchAlgorithmException ex) {
            // every JRE is required to ship SHA-1
            throw new IllegalStateException("SHA-1 not available", ex);
        }
    }

}

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
import java.util.Arrays;
import java.util.Base64;

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;

/**
 * Nonce sent as {@code Sec-WebSocket-Key}. A fresh key is generated for every
 * handshake attempt and kept by the caller to verify the server's accept value.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class HandshakeKey {

    public static final int LENGTH = 16;

    private final byte[] nonce;
    private final String value;

    private HandshakeKey(final byte[] nonce) {
        this.nonce = nonce;
        this.value = Base64.getEncoder().encodeToString(nonce);
    }

    public static HandshakeKey generate(final SecureRandom random) {
        Args.notNull(random, "Random");
        final byte[] nonce = new byte[LENGTH];
        random.nextBytes(nonce);
        return new HandshakeKey(nonce);
    }

    public static HandshakeKey of(final byte[] nonce) {
        Args.notNull(nonce, "Nonce");
        Args.check(nonce.length == LENGTH, "Nonce must be %s bytes long", LENGTH);
        return new HandshakeKey(nonce.clone());
    }

    /**
     * Base64 encoded value as transmitted on the wire.
     */
    public String getValue() {
        return value;
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public String getExpectedAccept() {
        return WebSocketAccept.compute(value);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof HandshakeKey && Arrays.equals(nonce, ((HandshakeKey) obj).nonce);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(nonce);
    }

    @Override
    public String toString() {
        return value;
    }

}

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

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.http.Header;

/**
 * Outcome of a successfully validated opening handshake.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class HandshakeResult {

    private final List<String> negotiatedExtensions;
    private final String negotiatedSubprotocol;
    private final List<Header> requestHeaders;
    private final List<Header> responseHeaders;

    public HandshakeResult(
            final List<String> negotiatedExtensions,
            final String negotiatedSubprotocol,
            final List<Header> requestHeaders,
            final List<Header> responseHeaders) {
        this.negotiatedExtensions = Collections.unmodifiableList(new ArrayList<>(negotiatedExtensions));
        this.negotiatedSubprotocol = negotiatedSubprotocol;
        this.requestHeaders = Collections.unmodifiableList(new ArrayList<>(requestHeaders));
        this.responseHeaders = Collections.unmodifiableList(new ArrayList<>(responseHeaders));
    }

    /**
     * Extensions accepted by the server, in the order the server listed them. Never {@code null}.
     */
    public List<String> getNegotiatedExtensions() {
        return negotiatedExtensions;
    }

    /**
     * Subprotocol selected by the server or {@code null} if none.
     */
    public String getNegotiatedSubprotocol() {
        return negotiatedSubprotocol;
    }

    public List<Header> getRequestHeaders() {
        return requestHeaders;
    }

    public List<Header> getResponseHeaders() {
        return responseHeaders;
    }

    @Override
    public String toString() {
        return "HandshakeResult[extensions=" + negotiatedExtensions + ", subprotocol=" + negotiatedSubprotocol + "]";
    }

}

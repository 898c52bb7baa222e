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
 * Outbound opening handshake: resource name, ordered headers and the key they carry.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class HandshakeRequest {

    private final String resourceName;
    private final List<Header> headers;
    private final HandshakeKey key;

    public HandshakeRequest(final String resourceName, final List<Header> headers, final HandshakeKey key) {
        this.resourceName = resourceName;
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
        this.key = key;
    }

    public String getResourceName() {
        return resourceName;
    }

    public String getRequestLine() {
        return "GET " + resourceName + " HTTP/1.1";
    }

    public List<Header> getHeaders() {
        return headers;
    }

    public HandshakeKey getKey() {
        return key;
    }

    /**
     * First header with the given name, case-insensitive, or {@code null}.
     */
    public Header getFirstHeader(final String name) {
        for (final Header header : headers) {
            if (header.getName().equalsIgnoreCase(name)) {
                return header;
            }
        }
        return null;
    }

}

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

import java.util.Objects;

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;

/**
 * Structured form of a {@code ws://} or {@code wss://} URI.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class EndpointDescriptor {

    public static final int DEFAULT_PORT = 80;
    public static final int DEFAULT_SECURE_PORT = 443;

    private final String host;
    private final int port;
    private final boolean secure;
    private final String resourceName;

    public EndpointDescriptor(final String host, final int port, final boolean secure, final String resourceName) {
        this.host = Args.notBlank(host, "Host");
        this.port = Args.checkRange(port, 1, 65535, "Port");
        this.secure = secure;
        this.resourceName = Args.notBlank(resourceName, "Resource name");
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public boolean isSecure() {
        return secure;
    }

    /**
     * Path and query as sent on the request line, never empty.
     */
    public String getResourceName() {
        return resourceName;
    }

    public int getDefaultPort() {
        return secure ? DEFAULT_SECURE_PORT : DEFAULT_PORT;
    }

    public boolean isDefaultPort() {
        return port == getDefaultPort();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EndpointDescriptor)) {
            return false;
        }
        final EndpointDescriptor that = (EndpointDescriptor) obj;
        return port == that.port
                && secure == that.secure
                && host.equals(that.host)
                && resourceName.equals(that.resourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, secure, resourceName);
    }

    @Override
    public String toString() {
        return (secure ? "wss" : "ws") + "://" + host + ":" + port + resourceName;
    }

}

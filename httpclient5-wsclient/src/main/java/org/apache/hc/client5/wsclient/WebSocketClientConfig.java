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
package org.apache.hc.client5.wsclient;

import org.apache.hc.client5.wsclient.handshake.HandshakeWireExchange;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.apache.hc.core5.util.VersionInfo;

/**
 * Client wide settings of the opening handshake.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class WebSocketClientConfig {

    /**
     * Identifying {@code User-Agent} sent with every handshake unless configured otherwise.
     */
    public static final String DEFAULT_USER_AGENT = VersionInfo.getSoftwareInfo(
            "Apache-HttpClient-WebSocket", "org.apache.hc.client5.wsclient", WebSocketClientConfig.class);

    public static final WebSocketClientConfig DEFAULT = custom().build();

    private final Timeout connectTimeout;
    private final Timeout handshakeTimeout;
    private final int maxResponseHeadSize;
    private final String userAgent;
    private final boolean tcpNoDelay;

    private WebSocketClientConfig(
            final Timeout connectTimeout,
            final Timeout handshakeTimeout,
            final int maxResponseHeadSize,
            final String userAgent,
            final boolean tcpNoDelay) {
        this.connectTimeout = connectTimeout;
        this.handshakeTimeout = handshakeTimeout;
        this.maxResponseHeadSize = maxResponseHeadSize;
        this.userAgent = userAgent;
        this.tcpNoDelay = tcpNoDelay;
    }

    public static Builder custom() {
        return new Builder();
    }

    public Timeout getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Maximum time to wait for the complete response head after the request was written.
     */
    public Timeout getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public int getMaxResponseHeadSize() {
        return maxResponseHeadSize;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public boolean isTcpNoDelay() {
        return tcpNoDelay;
    }

    @Override
    public String toString() {
        return "WebSocketClientConfig[connectTimeout=" + connectTimeout
                + ", handshakeTimeout=" + handshakeTimeout
                + ", maxResponseHeadSize=" + maxResponseHeadSize
                + ", userAgent=" + userAgent
                + ", tcpNoDelay=" + tcpNoDelay + "]";
    }

    public static final class Builder {

        private Timeout connectTimeout = Timeout.ofSeconds(10);
        private Timeout handshakeTimeout = Timeout.ofSeconds(10);
        private int maxResponseHeadSize = HandshakeWireExchange.DEFAULT_MAX_HEAD_SIZE;
        private String userAgent;
        private boolean tcpNoDelay = true;

        private Builder() {
        }

        public Builder setConnectTimeout(final Timeout t) {
            this.connectTimeout = t;
            return this;
        }

        public Builder setHandshakeTimeout(final Timeout t) {
            this.handshakeTimeout = t;
            return this;
        }

        public Builder setMaxResponseHeadSize(final int bytes) {
            this.maxResponseHeadSize = Args.positive(bytes, "Max response head size");
            return this;
        }

        public Builder setUserAgent(final String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder setTcpNoDelay(final boolean v) {
            this.tcpNoDelay = v;
            return this;
        }

        public WebSocketClientConfig build() {
            return new WebSocketClientConfig(
                    connectTimeout != null ? connectTimeout : Timeout.DISABLED,
                    handshakeTimeout != null ? handshakeTimeout : Timeout.DISABLED,
                    maxResponseHeadSize,
                    userAgent != null ? userAgent : DEFAULT_USER_AGENT,
                    tcpNoDelay);
        }

    }

}

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

import java.security.SecureRandom;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.hc.client5.wsclient.endpoint.EndpointResolver;
import org.apache.hc.client5.wsclient.endpoint.UriEndpointResolver;
import org.apache.hc.client5.wsclient.engine.DefaultFrameEngine;
import org.apache.hc.client5.wsclient.engine.FrameEngine;
import org.apache.hc.client5.wsclient.handshake.HandshakeRequestBuilder;
import org.apache.hc.client5.wsclient.transport.JdkSocketConnectorBuilder;
import org.apache.hc.client5.wsclient.transport.TransportConnector;
import org.apache.hc.core5.concurrent.DefaultThreadFactory;

/**
 * Builder for {@link WebSocketClient}.
 *
 * @since 5.6
 */
public final class WebSocketClientBuilder {

    private WebSocketClientConfig config;
    private EndpointResolver endpointResolver;
    private TransportConnector connector;
    private FrameEngine frameEngine;
    private SecureRandom secureRandom;
    private ExecutorService executor;

    private WebSocketClientBuilder() {
    }

    public static WebSocketClientBuilder create() {
        return new WebSocketClientBuilder();
    }

    public WebSocketClientBuilder setConfig(final WebSocketClientConfig config) {
        this.config = config;
        return this;
    }

    public WebSocketClientBuilder setEndpointResolver(final EndpointResolver endpointResolver) {
        this.endpointResolver = endpointResolver;
        return this;
    }

    /**
     * Defaults to a {@link org.apache.hc.client5.wsclient.transport.JdkSocketConnector}
     * using the connect timeout and TCP_NODELAY setting of the client config.
     */
    public WebSocketClientBuilder setTransportConnector(final TransportConnector connector) {
        this.connector = connector;
        return this;
    }

    public WebSocketClientBuilder setFrameEngine(final FrameEngine frameEngine) {
        this.frameEngine = frameEngine;
        return this;
    }

    public WebSocketClientBuilder setSecureRandom(final SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
        return this;
    }

    /**
     * Executor used by {@link WebSocketClient#open}. A supplied executor is not
     * shut down when the client is closed.
     */
    public WebSocketClientBuilder setExecutor(final ExecutorService executor) {
        this.executor = executor;
        return this;
    }

    public WebSocketClient build() {
        final WebSocketClientConfig cfg = config != null ? config : WebSocketClientConfig.DEFAULT;
        final TransportConnector transportConnector = connector != null ? connector : JdkSocketConnectorBuilder.create()
                .connectTimeout(cfg.getConnectTimeout())
                .tcpNoDelay(cfg.isTcpNoDelay())
                .build();
        final boolean executorOwned = executor == null;
        final ExecutorService executorService = executorOwned
                ? Executors.newCachedThreadPool(new DefaultThreadFactory("ws-handshake", true))
                : executor;
        return new WebSocketClient(
                cfg,
                endpointResolver != null ? endpointResolver : UriEndpointResolver.INSTANCE,
                transportConnector,
                frameEngine != null ? frameEngine : DefaultFrameEngine.INSTANCE,
                secureRandom != null ? new HandshakeRequestBuilder(secureRandom) : new HandshakeRequestBuilder(),
                executorService,
                executorOwned);
    }

}

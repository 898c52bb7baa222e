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

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.hc.client5.wsclient.endpoint.EndpointDescriptor;
import org.apache.hc.client5.wsclient.endpoint.EndpointResolver;
import org.apache.hc.client5.wsclient.engine.FrameEngine;
import org.apache.hc.client5.wsclient.handshake.HandshakeRequestBuilder;
import org.apache.hc.client5.wsclient.handshake.HandshakeResponseValidator;
import org.apache.hc.client5.wsclient.handshake.HandshakeWireExchange;
import org.apache.hc.client5.wsclient.transport.TlsConfig;
import org.apache.hc.client5.wsclient.transport.TlsPolicy;
import org.apache.hc.client5.wsclient.transport.TransportConnector;
import org.apache.hc.client5.wsclient.transport.WebSocketTransport;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.concurrent.ComplexCancellable;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Asserts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of the WebSocket opening handshake.
 * <p>
 * {@link #connect(String, ConnectOptions)} is atomic from the caller's point
 * of view: it either returns a handle in the {@link ConnectionState#OPEN}
 * state or throws, in which case no transport is left open. No retries are
 * attempted. Concurrent connects share no mutable state.
 * <p>
 * Create instances with {@link WebSocketClients} or {@link WebSocketClientBuilder}.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.SAFE)
public final class WebSocketClient implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(WebSocketClient.class);

    private final WebSocketClientConfig config;
    private final EndpointResolver endpointResolver;
    private final TransportConnector connector;
    private final FrameEngine frameEngine;
    private final HandshakeRequestBuilder requestBuilder;
    private final HandshakeWireExchange wireExchange;
    private final HandshakeResponseValidator validator;
    private final ExecutorService executor;
    private final boolean executorOwned;
    private final Set<ComplexCancellable> inFlight;
    private final AtomicBoolean closed;

    WebSocketClient(
            final WebSocketClientConfig config,
            final EndpointResolver endpointResolver,
            final TransportConnector connector,
            final FrameEngine frameEngine,
            final HandshakeRequestBuilder requestBuilder,
            final ExecutorService executor,
            final boolean executorOwned) {
        this.config = Args.notNull(config, "Config");
        this.endpointResolver = Args.notNull(endpointResolver, "Endpoint resolver");
        this.connector = Args.notNull(connector, "Transport connector");
        this.frameEngine = Args.notNull(frameEngine, "Frame engine");
        this.requestBuilder = Args.notNull(requestBuilder, "Request builder");
        this.wireExchange = new HandshakeWireExchange(config.getMaxResponseHeadSize());
        this.validator = HandshakeResponseValidator.INSTANCE;
        this.executor = Args.notNull(executor, "Executor");
        this.executorOwned = executorOwned;
        this.inFlight = Collections.newSetFromMap(new ConcurrentHashMap<>());
        this.closed = new AtomicBoolean(false);
    }

    public WebSocketClientConfig getConfig() {
        return config;
    }

    public ConnectionHandle connect(final String uri) throws TransportException, HandshakeException {
        return connect(uri, ConnectOptions.DEFAULT);
    }

    public ConnectionHandle connect(final URI uri, final ConnectOptions options) throws TransportException, HandshakeException {
        Args.notNull(uri, "URI");
        return connect(uri.toASCIIString(), options);
    }

    /**
     * Opens a connection and performs the opening handshake.
     *
     * @throws InvalidUriException    if the URI is malformed; raised before any network activity.
     * @throws ConfigurationException if the options conflict with the endpoint; raised before any network activity.
     * @throws TransportException     on DNS, TCP or TLS failure, premature end of stream or timeout.
     * @throws HandshakeException     if the server's response fails validation.
     */
    public ConnectionHandle connect(final String uri, final ConnectOptions options) throws TransportException, HandshakeException {
        final ComplexCancellable cancellable = new ComplexCancellable();
        inFlight.add(cancellable);
        try {
            return doConnect(uri, options != null ? options : ConnectOptions.DEFAULT, cancellable);
        } finally {
            inFlight.remove(cancellable);
        }
    }

    /**
     * Runs {@link #connect(String, ConnectOptions)} on the client's executor.
     * Cancelling the returned future force-closes the transport of the attempt;
     * a handle completed after cancellation is aborted.
     */
    public CompletableFuture<ConnectionHandle> open(final String uri, final ConnectOptions options) {
        final CompletableFuture<ConnectionHandle> future = new CompletableFuture<>();
        final ComplexCancellable cancellable = new ComplexCancellable();
        future.whenComplete((handle, ex) -> {
            if (future.isCancelled()) {
                cancellable.cancel();
            }
        });
        try {
            executor.execute(() -> {
                inFlight.add(cancellable);
                try {
                    final ConnectionHandle handle = doConnect(
                            uri, options != null ? options : ConnectOptions.DEFAULT, cancellable);
                    if (!future.complete(handle)) {
                        if (LOG.isDebugEnabled()) {
                            LOG.debug("Connect to {} completed after cancellation; aborting", uri);
                        }
                        handle.abort();
                    }
                } catch (final Exception ex) {
                    future.completeExceptionally(ex);
                } finally {
                    inFlight.remove(cancellable);
                }
            });
        } catch (final RejectedExecutionException ex) {
            future.completeExceptionally(ex);
        }
        return future;
    }

    private ConnectionHandle doConnect(
            final String uri,
            final ConnectOptions options,
            final ComplexCancellable cancellable) throws TransportException, HandshakeException {
        Asserts.check(!closed.get(), "WebSocket client is closed");

        // fail fast before touching the network
        final EndpointDescriptor endpoint = endpointResolver.resolve(uri);
        final TlsConfig tlsConfig = TlsPolicy.resolve(endpoint, options.getTlsConfig());

        if (LOG.isDebugEnabled()) {
            LOG.debug("Connecting to {} (tls={})", endpoint, tlsConfig != null);
        }
        final WebSocketTransport transport;
        try {
            transport = connector.open(endpoint.getHost(), endpoint.getPort(), tlsConfig, cancellable);
        } catch (final TransportException ex) {
            throw ex;
        } catch (final IOException ex) {
            throw new TransportException("Unable to connect to " + endpoint + ": " + ex.getMessage(), ex);
        }

        final ClientConnection connection = new ClientConnection(
                endpoint, transport, options, config, requestBuilder, wireExchange, validator, frameEngine);
        // cancels the connection straight away if the attempt was already cancelled
        cancellable.setDependency(connection);
        return connection.establish();
    }

    /**
     * Aborts handshakes still in progress and releases the client's executor.
     * Connections already handed out are not affected.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Closing WebSocket client; {} handshake(s) in flight", inFlight.size());
            }
            for (final ComplexCancellable cancellable : inFlight) {
                cancellable.cancel();
            }
            inFlight.clear();
            if (executorOwned) {
                executor.shutdownNow();
            }
        }
    }

}

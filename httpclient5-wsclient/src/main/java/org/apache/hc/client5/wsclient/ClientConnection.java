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

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.hc.client5.wsclient.endpoint.EndpointDescriptor;
import org.apache.hc.client5.wsclient.engine.FrameEngine;
import org.apache.hc.client5.wsclient.handshake.HandshakeRequest;
import org.apache.hc.client5.wsclient.handshake.HandshakeRequestBuilder;
import org.apache.hc.client5.wsclient.handshake.HandshakeResponse;
import org.apache.hc.client5.wsclient.handshake.HandshakeResponseValidator;
import org.apache.hc.client5.wsclient.handshake.HandshakeResult;
import org.apache.hc.client5.wsclient.handshake.HandshakeWireExchange;
import org.apache.hc.client5.wsclient.transport.WebSocketTransport;
import org.apache.hc.core5.annotation.Internal;
import org.apache.hc.core5.concurrent.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One connection attempt bound to an open transport. Owns the connection
 * state and runs build, send, receive and validate in sequence. On any
 * failure, or when cancelled, the transport is force-closed and the state
 * ends {@link ConnectionState#CLOSED}.
 */
@Internal
final class ClientConnection implements Cancellable {

    private static final Logger LOG = LoggerFactory.getLogger(ClientConnection.class);

    private final EndpointDescriptor endpoint;
    private final WebSocketTransport transport;
    private final ConnectOptions options;
    private final WebSocketClientConfig config;
    private final HandshakeRequestBuilder requestBuilder;
    private final HandshakeWireExchange wireExchange;
    private final HandshakeResponseValidator validator;
    private final FrameEngine frameEngine;
    private final AtomicReference<ConnectionState> state;

    ClientConnection(
            final EndpointDescriptor endpoint,
            final WebSocketTransport transport,
            final ConnectOptions options,
            final WebSocketClientConfig config,
            final HandshakeRequestBuilder requestBuilder,
            final HandshakeWireExchange wireExchange,
            final HandshakeResponseValidator validator,
            final FrameEngine frameEngine) {
        this.endpoint = endpoint;
        this.transport = transport;
        this.options = options;
        this.config = config;
        this.requestBuilder = requestBuilder;
        this.wireExchange = wireExchange;
        this.validator = validator;
        this.frameEngine = frameEngine;
        this.state = new AtomicReference<>(ConnectionState.CONNECTING);
    }

    ConnectionState getState() {
        return state.get();
    }

    /**
     * Runs the opening handshake and hands the transport to the frame engine.
     */
    ConnectionHandle establish() throws TransportException, HandshakeException {
        try {
            transport.setReadTimeout(config.getHandshakeTimeout());
            final HandshakeRequest request = requestBuilder.build(
                    endpoint,
                    options.getOrigin(),
                    options.getExtensions(),
                    options.getSubprotocols(),
                    options.getExtraHeaders(),
                    config.getUserAgent());
            ensureConnecting();
            wireExchange.send(transport, request);

            ensureConnecting();
            final HandshakeResponse response = wireExchange.receive(transport);

            ensureConnecting();
            final HandshakeResult result = validator.validate(
                    response, request, options.getExtensions(), options.getSubprotocols());

            if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
                throw new TransportException("Handshake with " + endpoint + " cancelled");
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("Handshake with {} complete: {}", endpoint, result);
            }
            try {
                return frameEngine.start(transport, result);
            } catch (final IOException | RuntimeException ex) {
                state.set(ConnectionState.CLOSED);
                frameEngine.forceClose(transport);
                throw ex;
            }
        } catch (final TransportException | HandshakeException | RuntimeException ex) {
            fail(ex);
            throw ex;
        } catch (final IOException ex) {
            fail(ex);
            throw new TransportException("I/O error during handshake with " + endpoint, ex);
        }
    }

    /**
     * Aborts an attempt that has not reached the open state.
     */
    @Override
    public boolean cancel() {
        if (state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CLOSED)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Handshake with {} cancelled", endpoint);
            }
            frameEngine.forceClose(transport);
            return true;
        }
        return false;
    }

    private void ensureConnecting() throws TransportException {
        if (state.get() != ConnectionState.CONNECTING) {
            throw new TransportException("Handshake with " + endpoint + " cancelled");
        }
    }

    private void fail(final Exception cause) {
        if (state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CLOSED)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Handshake with {} failed: {}", endpoint, cause.getMessage());
            }
            frameEngine.forceClose(transport);
        }
    }

}

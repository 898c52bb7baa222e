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
import java.security.SecureRandom;
import java.util.Arrays;

import org.apache.hc.client5.wsclient.endpoint.EndpointDescriptor;
import org.apache.hc.client5.wsclient.engine.DefaultFrameEngine;
import org.apache.hc.client5.wsclient.engine.FrameEngine;
import org.apache.hc.client5.wsclient.handshake.HandshakeRequestBuilder;
import org.apache.hc.client5.wsclient.handshake.HandshakeResponseValidator;
import org.apache.hc.client5.wsclient.handshake.HandshakeResult;
import org.apache.hc.client5.wsclient.handshake.HandshakeWireExchange;
import org.apache.hc.client5.wsclient.handshake.WebSocketAccept;
import org.apache.hc.client5.wsclient.transport.InMemoryTransport;
import org.apache.hc.core5.util.Timeout;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ClientConnectionTest {

    static final String ZERO_KEY = "AAAAAAAAAAAAAAAAAAAAAA==";

    static final String SWITCHING_PROTOCOLS = "HTTP/1.1 101 Switching Protocols\r\n"
            + "Upgrade: websocket\r\n"
            + "Connection: Upgrade\r\n"
            + "Sec-WebSocket-Accept: " + WebSocketAccept.compute(ZERO_KEY) + "\r\n"
            + "\r\n";

    static SecureRandom zeroRandom() {
        return new SecureRandom() {

            private static final long serialVersionUID = 1L;

            @Override
            public void nextBytes(final byte[] bytes) {
                Arrays.fill(bytes, (byte) 0);
            }

        };
    }

    private final EndpointDescriptor endpoint = new EndpointDescriptor("example.com", 80, false, "/chat");
    private final WebSocketClientConfig config = WebSocketClientConfig.custom()
            .setHandshakeTimeout(Timeout.ofSeconds(3))
            .build();

    private FrameEngine frameEngine;
    private ConnectionHandle handle;

    @BeforeEach
    void setUp() throws Exception {
        frameEngine = Mockito.mock(FrameEngine.class);
        handle = Mockito.mock(ConnectionHandle.class);
        Mockito.when(frameEngine.start(Mockito.any(), Mockito.any())).thenReturn(handle);
    }

    private ClientConnection connection(final InMemoryTransport transport, final ConnectOptions options) {
        return new ClientConnection(
                endpoint,
                transport,
                options,
                config,
                new HandshakeRequestBuilder(zeroRandom()),
                new HandshakeWireExchange(),
                HandshakeResponseValidator.INSTANCE,
                frameEngine);
    }

    @Test
    void successfulHandshakeOpensAndStartsEngine() throws Exception {
        final InMemoryTransport transport = new InMemoryTransport(SWITCHING_PROTOCOLS);
        final ClientConnection connection = connection(transport, ConnectOptions.DEFAULT);
        Assertions.assertEquals(ConnectionState.CONNECTING, connection.getState());

        Assertions.assertSame(handle, connection.establish());

        Assertions.assertEquals(ConnectionState.OPEN, connection.getState());
        Assertions.assertEquals(Timeout.ofSeconds(3), transport.getReadTimeout());
        Assertions.assertTrue(transport.getWritten().startsWith("GET /chat HTTP/1.1\r\nHost: example.com\r\n"));
        Mockito.verify(frameEngine).start(Mockito.same(transport), Mockito.any(HandshakeResult.class));
        Mockito.verify(frameEngine, Mockito.never()).forceClose(Mockito.any());
    }

    @Test
    void rejectedResponseClosesTransport() throws Exception {
        final InMemoryTransport transport = new InMemoryTransport("HTTP/1.1 200 OK\r\nContent-Length: 0\r\n\r\n");
        final ClientConnection connection = connection(transport, ConnectOptions.DEFAULT);

        final HandshakeException ex = Assertions.assertThrows(HandshakeException.class, connection::establish);

        Assertions.assertEquals("Bad status code: 200", ex.getMessage());
        Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
        Mockito.verify(frameEngine).forceClose(transport);
        Mockito.verify(frameEngine, Mockito.never()).start(Mockito.any(), Mockito.any());
    }

    @Test
    void unofferedSubprotocolClosesTransport() throws Exception {
        final InMemoryTransport transport = new InMemoryTransport(SWITCHING_PROTOCOLS.replace(
                "\r\n\r\n", "\r\nSec-WebSocket-Protocol: superchat\r\n\r\n"));
        final ClientConnection connection = connection(transport, ConnectOptions.custom()
                .setSubprotocols("chat")
                .build());

        final HandshakeException ex = Assertions.assertThrows(HandshakeException.class, connection::establish);

        Assertions.assertEquals("Unknown subprotocol: superchat", ex.getMessage());
        Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
        Mockito.verify(frameEngine).forceClose(transport);
    }

    @Test
    void prematureEndOfStreamClosesTransport() throws Exception {
        final InMemoryTransport transport = new InMemoryTransport("HTTP/1.1 101 Switching");
        final ClientConnection connection = connection(transport, ConnectOptions.DEFAULT);

        Assertions.assertThrows(TransportException.class, connection::establish);

        Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
        Mockito.verify(frameEngine).forceClose(transport);
    }

    @Test
    void cancelledAttemptNeverSendsRequest() throws Exception {
        final InMemoryTransport transport = new InMemoryTransport(SWITCHING_PROTOCOLS);
        final ClientConnection connection = connection(transport, ConnectOptions.DEFAULT);

        Assertions.assertTrue(connection.cancel());
        Assertions.assertFalse(connection.cancel());
        Assertions.assertThrows(TransportException.class, connection::establish);

        Assertions.assertEquals("", transport.getWritten());
        Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
        Mockito.verify(frameEngine, Mockito.times(1)).forceClose(transport);
        Mockito.verify(frameEngine, Mockito.never()).start(Mockito.any(), Mockito.any());
    }

    @Test
    void cancelAfterOpenHasNoEffect() throws Exception {
        final InMemoryTransport transport = new InMemoryTransport(SWITCHING_PROTOCOLS);
        final ClientConnection connection = connection(transport, ConnectOptions.DEFAULT);
        connection.establish();

        Assertions.assertFalse(connection.cancel());
        Assertions.assertEquals(ConnectionState.OPEN, connection.getState());
        Mockito.verify(frameEngine, Mockito.never()).forceClose(Mockito.any());
    }

    @Test
    void engineStartFailureClosesTransport() throws Exception {
        Mockito.when(frameEngine.start(Mockito.any(), Mockito.any())).thenThrow(new IOException("engine down"));
        final InMemoryTransport transport = new InMemoryTransport(SWITCHING_PROTOCOLS);
        final ClientConnection connection = connection(transport, ConnectOptions.DEFAULT);

        final TransportException ex = Assertions.assertThrows(TransportException.class, connection::establish);

        Assertions.assertEquals("engine down", ex.getCause().getMessage());
        Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
        Mockito.verify(frameEngine, Mockito.times(1)).forceClose(transport);
    }

    @Test
    void defaultEngineAbortsTransportOnFailure() {
        frameEngine = DefaultFrameEngine.INSTANCE;
        final InMemoryTransport transport = new InMemoryTransport("HTTP/1.1 404 Not Found\r\n\r\n");

        Assertions.assertThrows(HandshakeException.class, connection(transport, ConnectOptions.DEFAULT)::establish);

        Assertions.assertTrue(transport.isAborted());
        Assertions.assertFalse(transport.isOpen());
    }

}

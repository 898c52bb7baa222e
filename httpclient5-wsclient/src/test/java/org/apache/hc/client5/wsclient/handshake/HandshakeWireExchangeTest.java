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

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.Arrays;
import java.util.Collections;

import org.apache.hc.client5.wsclient.HandshakeException;
import org.apache.hc.client5.wsclient.TransportException;
import org.apache.hc.client5.wsclient.transport.InMemoryTransport;
import org.apache.hc.client5.wsclient.transport.WebSocketTransport;
import org.apache.hc.core5.http.message.BasicHeader;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class HandshakeWireExchangeTest {

    private final HandshakeWireExchange exchange = new HandshakeWireExchange();

    @Test
    void sendWritesRequestLineHeadersAndBlankLine() throws Exception {
        final InMemoryTransport transport = new InMemoryTransport("");
        exchange.send(transport, "/chat", Arrays.asList(
                new BasicHeader("Host", "example.com"),
                new BasicHeader("Cookie", "a=1"),
                new BasicHeader("Cookie", "b=2")));

        Assertions.assertEquals(
                "GET /chat HTTP/1.1\r\n"
                        + "Host: example.com\r\n"
                        + "Cookie: a=1\r\n"
                        + "Cookie: b=2\r\n"
                        + "\r\n",
                transport.getWritten());
    }

    @Test
    void receiveParsesStatusAndHeadersInOrder() throws Exception {
        final InMemoryTransport transport = new InMemoryTransport(
                "HTTP/1.1 101 Switching Protocols\r\n"
                        + "Upgrade: websocket\r\n"
                        + "Connection: Upgrade\r\n"
                        + "Sec-WebSocket-Extensions: a\r\n"
                        + "Sec-WebSocket-Extensions: b\r\n"
                        + "\r\n");

        final HandshakeResponse response = exchange.receive(transport);

        Assertions.assertEquals(101, response.getStatusCode());
        Assertions.assertEquals("Switching Protocols", response.getReasonPhrase());
        Assertions.assertEquals(4, response.getHeaders().size());
        Assertions.assertEquals("Upgrade", response.getHeaders().get(0).getName());
        Assertions.assertEquals(Arrays.asList("a", "b"), response.getHeaderValues("sec-websocket-extensions"));
    }

    @Test
    void receiveLeavesBytesAfterTheHeadUnread() throws Exception {
        final InMemoryTransport transport = new InMemoryTransport(
                "HTTP/1.1 101 Switching Protocols\r\nUpgrade: websocket\r\n\r\n\u0081\u0002hi");

        exchange.receive(transport);

        final InputStream in = transport.getInputStream();
        Assertions.assertEquals(0x81, in.read());
        Assertions.assertEquals(0x02, in.read());
    }

    @Test
    void garbageIsMalformedHttpMessage() {
        final InMemoryTransport transport = new InMemoryTransport("SSH-2.0-OpenSSH_9.0\r\n\r\n");

        final HandshakeException ex = Assertions.assertThrows(HandshakeException.class,
                () -> exchange.receive(transport));
        Assertions.assertEquals("Malformed HTTP message", ex.getMessage());
    }

    @Test
    void oversizedHeadIsMalformedHttpMessage() {
        final StringBuilder sb = new StringBuilder("HTTP/1.1 101 Switching Protocols\r\n");
        for (int i = 0; i < 100; i++) {
            sb.append("X-Padding-").append(i).append(": 0123456789012345678901234567890123456789\r\n");
        }
        sb.append("\r\n");
        final HandshakeWireExchange small = new HandshakeWireExchange(1024);

        final HandshakeException ex = Assertions.assertThrows(HandshakeException.class,
                () -> small.receive(new InMemoryTransport(sb.toString())));
        Assertions.assertEquals("Malformed HTTP message", ex.getMessage());
    }

    @Test
    void prematureEndOfStreamIsTransportFailure() {
        Assertions.assertThrows(TransportException.class,
                () -> exchange.receive(new InMemoryTransport("HTTP/1.1 101 Switching Protocols\r\nUpgr")));
        Assertions.assertThrows(TransportException.class,
                () -> exchange.receive(new InMemoryTransport("")));
    }

    @Test
    void readTimeoutIsTransportFailure() throws Exception {
        final InputStream in = Mockito.mock(InputStream.class);
        Mockito.when(in.read()).thenThrow(new SocketTimeoutException("Read timed out"));
        final WebSocketTransport transport = Mockito.mock(WebSocketTransport.class);
        Mockito.when(transport.getInputStream()).thenReturn(in);

        final TransportException ex = Assertions.assertThrows(TransportException.class,
                () -> exchange.receive(transport));
        Assertions.assertInstanceOf(SocketTimeoutException.class, ex.getCause());
    }

    @Test
    void writeFailurePropagates() throws Exception {
        final WebSocketTransport transport = Mockito.mock(WebSocketTransport.class);
        Mockito.doThrow(new IOException("Broken pipe")).when(transport).write(Mockito.any());

        Assertions.assertThrows(IOException.class,
                () -> exchange.send(transport, "/", Collections.emptyList()));
    }

}

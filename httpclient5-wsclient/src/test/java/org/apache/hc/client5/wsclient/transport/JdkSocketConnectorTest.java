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
package org.apache.hc.client5.wsclient.transport;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;

import org.apache.hc.core5.concurrent.ComplexCancellable;
import org.apache.hc.core5.util.Timeout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdkSocketConnectorTest {

    // never accepts: the kernel backlog completes TCP connects, nobody ever answers
    private ServerSocket silent;

    @BeforeEach
    void setUp() throws IOException {
        silent = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    }

    @AfterEach
    void tearDown() throws IOException {
        silent.close();
    }

    @Test
    void plainConnect() throws Exception {
        final JdkSocketConnector connector = JdkSocketConnectorBuilder.create().build();
        final ComplexCancellable cancellable = new ComplexCancellable();

        try (WebSocketTransport transport = connector.open("127.0.0.1", silent.getLocalPort(), null, cancellable)) {
            Assertions.assertInstanceOf(SocketTransport.class, transport);
            final Socket socket = ((SocketTransport) transport).getSocket();
            Assertions.assertTrue(transport.isOpen());
            Assertions.assertTrue(socket.getTcpNoDelay());
        }
    }

    @Test
    void cancelledAttemptNeverConnects() {
        final JdkSocketConnector connector = JdkSocketConnectorBuilder.create().build();
        final ComplexCancellable cancellable = new ComplexCancellable();
        cancellable.cancel();

        Assertions.assertThrows(IOException.class,
                () -> connector.open("127.0.0.1", silent.getLocalPort(), null, cancellable));
    }

    @Test
    void tlsHandshakeBoundedByConnectTimeout() {
        final JdkSocketConnector connector = JdkSocketConnectorBuilder.create()
                .connectTimeout(Timeout.ofMilliseconds(200))
                .build();

        Assertions.assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> Assertions.assertThrows(IOException.class,
                        () -> connector.open("127.0.0.1", silent.getLocalPort(), TlsConfig.createDefault(), null)));
    }

}

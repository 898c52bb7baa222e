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
package org.apache.hc.client5.wsclient.engine;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.hc.client5.wsclient.ConnectionHandle;
import org.apache.hc.client5.wsclient.ConnectionState;
import org.apache.hc.client5.wsclient.handshake.HandshakeResult;
import org.apache.hc.client5.wsclient.transport.WebSocketTransport;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;

/**
 * {@link ConnectionHandle} exposing the upgraded transport.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.SAFE)
public final class BasicConnectionHandle implements ConnectionHandle {

    private final WebSocketTransport transport;
    private final HandshakeResult handshakeResult;
    private final AtomicReference<ConnectionState> state;

    public BasicConnectionHandle(final WebSocketTransport transport, final HandshakeResult handshakeResult) {
        this.transport = Args.notNull(transport, "Transport");
        this.handshakeResult = Args.notNull(handshakeResult, "Handshake result");
        this.state = new AtomicReference<>(ConnectionState.OPEN);
    }

    public WebSocketTransport getTransport() {
        return transport;
    }

    @Override
    public ConnectionState getState() {
        return state.get();
    }

    @Override
    public HandshakeResult getHandshakeResult() {
        return handshakeResult;
    }

    @Override
    public void close() throws IOException {
        if (state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSED)) {
            transport.close();
        }
    }

    @Override
    public void abort() {
        if (state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSED)) {
            transport.abort();
        }
    }

    @Override
    public String toString() {
        return "BasicConnectionHandle[" + state.get() + ", " + transport + "]";
    }

}

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
import java.util.List;

import org.apache.hc.client5.wsclient.handshake.HandshakeResult;

/**
 * An established WebSocket connection as handed out by
 * {@link WebSocketClient#connect(String, ConnectOptions)}. Handles are only
 * ever returned in the {@link ConnectionState#OPEN} state.
 * <p>
 * Message exchange is provided by the frame engine that created the handle.
 *
 * @since 5.6
 */
public interface ConnectionHandle extends Closeable {

    ConnectionState getState();

    HandshakeResult getHandshakeResult();

    default List<String> getNegotiatedExtensions() {
        return getHandshakeResult().getNegotiatedExtensions();
    }

    /**
     * @return the selected subprotocol or {@code null}.
     */
    default String getNegotiatedSubprotocol() {
        return getHandshakeResult().getNegotiatedSubprotocol();
    }

    /**
     * Releases the connection.
     */
    @Override
    void close() throws IOException;

    /**
     * Tears the connection down immediately.
     */
    void abort();

}

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

import org.apache.hc.client5.wsclient.ConnectionHandle;
import org.apache.hc.client5.wsclient.handshake.HandshakeResult;
import org.apache.hc.client5.wsclient.transport.WebSocketTransport;

/**
 * Frame level protocol engine that takes over a transport once the opening
 * handshake has succeeded. The client handshake runs first and then calls
 * {@link #start}; on failure it calls {@link #forceClose} instead.
 *
 * @since 5.6
 */
public interface FrameEngine {

    /**
     * Takes ownership of a transport whose handshake was fully validated.
     */
    ConnectionHandle start(WebSocketTransport transport, HandshakeResult result) throws IOException;

    /**
     * Aborts a transport that never reached the open state. Must not throw.
     */
    void forceClose(WebSocketTransport transport);

}

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
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands the upgraded transport to the caller unchanged through a
 * {@link BasicConnectionHandle}, for applications that plug in their own
 * framing layer.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.STATELESS)
public final class DefaultFrameEngine implements FrameEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultFrameEngine.class);

    public static final DefaultFrameEngine INSTANCE = new DefaultFrameEngine();

    @Override
    public ConnectionHandle start(final WebSocketTransport transport, final HandshakeResult result) throws IOException {
        Args.notNull(transport, "Transport");
        Args.notNull(result, "Handshake result");
        // the handshake read timeout does not apply to the message phase
        transport.setReadTimeout(Timeout.DISABLED);
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} open: {}", transport, result);
        }
        return new BasicConnectionHandle(transport, result);
    }

    @Override
    public void forceClose(final WebSocketTransport transport) {
        if (transport != null) {
            transport.abort();
        }
    }

}

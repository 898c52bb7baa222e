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
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.hc.core5.annotation.Internal;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WebSocketTransport} over a connected (optionally TLS layered) {@link Socket}.
 */
@Internal
public final class SocketTransport implements WebSocketTransport {

    private static final Logger LOG = LoggerFactory.getLogger(SocketTransport.class);

    private final Socket socket;
    private final AtomicBoolean closed;

    public SocketTransport(final Socket socket) {
        this.socket = Args.notNull(socket, "Socket");
        this.closed = new AtomicBoolean(false);
    }

    public Socket getSocket() {
        return socket;
    }

    @Override
    public InputStream getInputStream() throws IOException {
        return socket.getInputStream();
    }

    @Override
    public OutputStream getOutputStream() throws IOException {
        return socket.getOutputStream();
    }

    @Override
    public void write(final byte[] data) throws IOException {
        final OutputStream os = socket.getOutputStream();
        os.write(data);
        os.flush();
    }

    @Override
    public void setReadTimeout(final Timeout timeout) throws IOException {
        socket.setSoTimeout(timeout != null ? timeout.toMillisecondsIntBound() : 0);
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !socket.isClosed();
    }

    @Override
    public void abort() {
        if (closed.compareAndSet(false, true)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Aborting transport to {}", socket.getRemoteSocketAddress());
            }
            try {
                // RST instead of FIN
                socket.setSoLinger(true, 0);
            } catch (final IOException ex) {
                LOG.debug("Unable to set SO_LINGER before abort", ex);
            }
            try {
                socket.close();
            } catch (final IOException ex) {
                LOG.debug("I/O error aborting transport", ex);
            }
        }
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Closing transport to {}", socket.getRemoteSocketAddress());
            }
            socket.close();
        }
    }

    @Override
    public String toString() {
        return "SocketTransport[" + socket.getRemoteSocketAddress() + (isOpen() ? "" : ", closed") + "]";
    }

}

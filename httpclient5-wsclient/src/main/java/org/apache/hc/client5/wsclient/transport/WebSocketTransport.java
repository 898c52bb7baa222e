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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.apache.hc.core5.util.Timeout;

/**
 * Byte stream to a WebSocket server, plain or TLS protected.
 * <p>
 * During the opening handshake the handshake layer is the only reader and
 * writer; afterwards ownership passes to the frame engine.
 *
 * @since 5.6
 */
public interface WebSocketTransport extends Closeable {

    InputStream getInputStream() throws IOException;

    OutputStream getOutputStream() throws IOException;

    /**
     * Writes and flushes the given bytes.
     */
    void write(byte[] data) throws IOException;

    /**
     * Bounds blocking reads. {@link Timeout#DISABLED} waits forever.
     */
    void setReadTimeout(Timeout timeout) throws IOException;

    boolean isOpen();

    /**
     * Tears the connection down immediately without any graceful shutdown.
     * Unblocks threads stuck in a read or write. Never throws.
     */
    void abort();

}

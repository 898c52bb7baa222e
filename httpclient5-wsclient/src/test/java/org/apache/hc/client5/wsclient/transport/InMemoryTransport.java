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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.apache.hc.core5.util.Timeout;

/**
 * Transport fed from a fixed byte array that records what was written.
 */
public class InMemoryTransport implements WebSocketTransport {

    private final InputStream in;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private Timeout readTimeout;
    private boolean open = true;
    private boolean aborted;
    private boolean closed;

    public InMemoryTransport(final byte[] response) {
        this.in = new ByteArrayInputStream(response);
    }

    public InMemoryTransport(final String response) {
        this(response.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Override
    public InputStream getInputStream() {
        return in;
    }

    @Override
    public OutputStream getOutputStream() {
        return out;
    }

    @Override
    public void write(final byte[] data) throws IOException {
        if (!open) {
            throw new IOException("Transport closed");
        }
        out.write(data);
    }

    @Override
    public void setReadTimeout(final Timeout timeout) {
        this.readTimeout = timeout;
    }

    public Timeout getReadTimeout() {
        return readTimeout;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void abort() {
        open = false;
        aborted = true;
    }

    @Override
    public void close() {
        open = false;
        closed = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getWritten() {
        return new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
    }

}

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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.hc.client5.wsclient.HandshakeException;
import org.apache.hc.client5.wsclient.TransportException;
import org.apache.hc.client5.wsclient.transport.WebSocketTransport;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.http.MessageConstraintException;
import org.apache.hc.core5.http.impl.io.DefaultHttpResponseParser;
import org.apache.hc.core5.http.impl.io.SessionInputBufferImpl;
import org.apache.hc.core5.util.Args;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking HTTP/1.1 exchange of the opening handshake.
 * <p>
 * {@link #send} writes the request line and headers. {@link #receive} reads
 * exactly up to CRLF CRLF, so frames the server sends right after its 101
 * stay unread on the transport, and hands the head to httpcore's
 * {@link DefaultHttpResponseParser}.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class HandshakeWireExchange {

    private static final Logger LOG = LoggerFactory.getLogger(HandshakeWireExchange.class);

    public static final int DEFAULT_MAX_HEAD_SIZE = 16 * 1024;

    private static final byte[] CRLFCRLF = "\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1);

    private final int maxHeadSize;

    public HandshakeWireExchange() {
        this(DEFAULT_MAX_HEAD_SIZE);
    }

    public HandshakeWireExchange(final int maxHeadSize) {
        this.maxHeadSize = Args.positive(maxHeadSize, "Max head size");
    }

    public void send(final WebSocketTransport transport, final HandshakeRequest request) throws IOException {
        send(transport, request.getResourceName(), request.getHeaders());
    }

    public void send(final WebSocketTransport transport,
                     final String resourceName,
                     final List<Header> headers) throws IOException {
        Args.notNull(transport, "Transport");
        if (LOG.isDebugEnabled()) {
            LOG.debug("Dispatching HTTP/1.1 Upgrade: GET {} with headers:", resourceName);
            for (final Header h : headers) {
                LOG.debug("  {}: {}", h.getName(), h.getValue());
            }
        }
        transport.write(encode(resourceName, headers));
    }

    /**
     * Serializes {@code GET {resourceName} HTTP/1.1}, one {@code Name: value}
     * line per header and the terminating blank line.
     */
    public static byte[] encode(final String resourceName, final List<Header> headers) {
        Args.notBlank(resourceName, "Resource name");
        Args.notNull(headers, "Headers");
        final StringBuilder sb = new StringBuilder(256);
        sb.append("GET ").append(resourceName).append(" HTTP/1.1\r\n");
        for (final Header h : headers) {
            sb.append(h.getName()).append(": ").append(h.getValue()).append("\r\n");
        }
        sb.append("\r\n");
        return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    /**
     * Reads and parses the response status line and headers.
     *
     * @throws TransportException if the transport fails, times out or reaches
     *                            end of stream before the head is complete.
     * @throws HandshakeException if the head cannot be parsed as an HTTP response.
     */
    public HandshakeResponse receive(final WebSocketTransport transport) throws TransportException, HandshakeException {
        Args.notNull(transport, "Transport");
        final byte[] head;
        try {
            head = readHead(transport.getInputStream());
        } catch (final MessageConstraintException ex) {
            throw new HandshakeException("Malformed HTTP message", ex);
        } catch (final SocketTimeoutException ex) {
            throw new TransportException("Timed out waiting for handshake response", ex);
        } catch (final TransportException ex) {
            throw ex;
        } catch (final IOException ex) {
            throw new TransportException("I/O error reading handshake response", ex);
        }

        final ClassicHttpResponse response;
        try {
            final SessionInputBufferImpl buffer = new SessionInputBufferImpl(head.length);
            response = new DefaultHttpResponseParser().parse(buffer, new ByteArrayInputStream(head));
        } catch (final HttpException | IOException ex) {
            throw new HandshakeException("Malformed HTTP message", ex);
        }
        if (response == null) {
            throw new HandshakeException("Malformed HTTP message");
        }
        final HandshakeResponse result = new HandshakeResponse(
                response.getCode(), response.getReasonPhrase(), Arrays.asList(response.getHeaders()));
        if (LOG.isDebugEnabled()) {
            LOG.debug("Handshake response: {} {}", result.getStatusCode(), result.getReasonPhrase());
            for (final Header h : result.getHeaders()) {
                LOG.debug("  {}: {}", h.getName(), h.getValue());
            }
        }
        return result;
    }

    private byte[] readHead(final InputStream is) throws IOException {
        final ByteArrayOutputStream bos = new ByteArrayOutputStream(512);
        int matched = 0;
        while (true) {
            // one byte at a time: anything past the head belongs to the frame engine
            final int b = is.read();
            if (b < 0) {
                throw new TransportException("Connection closed before handshake response was complete");
            }
            bos.write(b);
            if (bos.size() > maxHeadSize) {
                throw new MessageConstraintException("Handshake response head exceeds " + maxHeadSize + " bytes");
            }
            if (b == CRLFCRLF[matched]) {
                matched++;
                if (matched == CRLFCRLF.length) {
                    return bos.toByteArray();
                }
            } else {
                matched = b == CRLFCRLF[0] ? 1 : 0;
            }
        }
    }

}

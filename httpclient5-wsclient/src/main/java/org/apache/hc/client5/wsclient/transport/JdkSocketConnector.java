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
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Collections;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.concurrent.Cancellable;
import org.apache.hc.core5.concurrent.CancellableDependency;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking {@link TransportConnector} over {@link Socket}. TLS, when
 * requested, is layered over the connected socket with SNI and, unless
 * disabled, HTTPS endpoint identification.
 * <p>
 * The connect timeout bounds both the TCP connect and the TLS handshake.
 * While either is in progress the socket is registered with the caller's
 * {@link CancellableDependency}, so cancelling the attempt closes it.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class JdkSocketConnector implements TransportConnector {

    private static final Logger LOG = LoggerFactory.getLogger(JdkSocketConnector.class);

    private final Timeout connectTimeout;
    private final boolean tcpNoDelay;

    JdkSocketConnector(final Timeout connectTimeout, final boolean tcpNoDelay) {
        this.connectTimeout = connectTimeout != null ? connectTimeout : Timeout.DISABLED;
        this.tcpNoDelay = tcpNoDelay;
    }

    @Override
    public WebSocketTransport open(
            final String host,
            final int port,
            final TlsConfig tlsConfig,
            final CancellableDependency cancellable) throws IOException {
        Args.notBlank(host, "Host");

        final Socket socket = new Socket();
        try {
            // closing the plain socket also breaks a pending TLS handshake layered over it
            register(cancellable, socket);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Connecting to {}:{} (connect timeout {})", host, port, connectTimeout);
            }
            socket.connect(new InetSocketAddress(host, port), connectTimeout.toMillisecondsIntBound());
            socket.setTcpNoDelay(tcpNoDelay);

            if (tlsConfig == null) {
                return new SocketTransport(socket);
            }
            return new SocketTransport(startTls(socket, host, port, tlsConfig));
        } catch (final IOException | RuntimeException ex) {
            socket.close();
            throw ex;
        }
    }

    private SSLSocket startTls(
            final Socket plain,
            final String host,
            final int port,
            final TlsConfig tlsConfig) throws IOException {
        final SSLSocket ssl = (SSLSocket) tlsConfig.getSslContext().getSocketFactory()
                .createSocket(plain, host, port, true);
        try {
            if (tlsConfig.getSupportedProtocols() != null) {
                ssl.setEnabledProtocols(tlsConfig.getSupportedProtocols());
            }
            if (tlsConfig.getSupportedCipherSuites() != null) {
                ssl.setEnabledCipherSuites(tlsConfig.getSupportedCipherSuites());
            }

            final SSLParameters params = ssl.getSSLParameters();
            try {
                params.setServerNames(Collections.singletonList(new SNIHostName(host)));
            } catch (final IllegalArgumentException ex) {
                LOG.debug("No SNI for {}", host);
            }
            if (tlsConfig.isHostnameVerification()) {
                params.setEndpointIdentificationAlgorithm("HTTPS");
            }
            ssl.setSSLParameters(params);

            // handshake bounded by the connect timeout; reads unbounded again once the session is up
            ssl.setSoTimeout(connectTimeout.toMillisecondsIntBound());
            ssl.startHandshake();
            ssl.setSoTimeout(0);
            if (LOG.isDebugEnabled()) {
                LOG.debug("TLS session established with {}:{} using {}", host, port, ssl.getSession().getProtocol());
            }
            return ssl;
        } catch (final IOException | RuntimeException ex) {
            ssl.close();
            throw ex;
        }
    }

    private static void register(final CancellableDependency cancellable, final Socket socket) {
        if (cancellable != null) {
            cancellable.setDependency(closer(socket));
        }
    }

    private static Cancellable closer(final Socket socket) {
        return () -> {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Connect to {} cancelled", socket.getInetAddress());
            }
            try {
                socket.close();
            } catch (final IOException ex) {
                LOG.debug("I/O error closing cancelled socket", ex);
            }
            return true;
        };
    }

}

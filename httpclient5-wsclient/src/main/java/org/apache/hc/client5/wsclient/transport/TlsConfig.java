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

import java.util.Arrays;

import javax.net.ssl.SSLContext;

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Args;

/**
 * TLS settings for {@code wss} connections.
 * <p>
 * The default uses the system trust store and verifies the server host name.
 * Turning host name verification off has to be requested explicitly through
 * {@link Builder#setHostnameVerification(boolean)}.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class TlsConfig {

    private final SSLContext sslContext;
    private final boolean hostnameVerification;
    private final String[] supportedProtocols;
    private final String[] supportedCipherSuites;

    private TlsConfig(
            final SSLContext sslContext,
            final boolean hostnameVerification,
            final String[] supportedProtocols,
            final String[] supportedCipherSuites) {
        this.sslContext = sslContext;
        this.hostnameVerification = hostnameVerification;
        this.supportedProtocols = supportedProtocols;
        this.supportedCipherSuites = supportedCipherSuites;
    }

    /**
     * System default trust material with host name verification.
     */
    public static TlsConfig createDefault() {
        return custom().build();
    }

    public static Builder custom() {
        return new Builder();
    }

    public SSLContext getSslContext() {
        return sslContext;
    }

    public boolean isHostnameVerification() {
        return hostnameVerification;
    }

    /**
     * @return enabled protocols or {@code null} for the provider defaults.
     */
    public String[] getSupportedProtocols() {
        return supportedProtocols != null ? supportedProtocols.clone() : null;
    }

    /**
     * @return enabled cipher suites or {@code null} for the provider defaults.
     */
    public String[] getSupportedCipherSuites() {
        return supportedCipherSuites != null ? supportedCipherSuites.clone() : null;
    }

    @Override
    public String toString() {
        return "TlsConfig[hostnameVerification=" + hostnameVerification
                + ", protocols=" + Arrays.toString(supportedProtocols)
                + ", cipherSuites=" + Arrays.toString(supportedCipherSuites) + "]";
    }

    public static final class Builder {

        private SSLContext sslContext;
        private boolean hostnameVerification = true;
        private String[] supportedProtocols;
        private String[] supportedCipherSuites;

        private Builder() {
        }

        /**
         * Supply a pre-built (initialized) SSLContext, for instance one made with
         * {@link org.apache.hc.core5.ssl.SSLContextBuilder}.
         */
        public Builder setSslContext(final SSLContext sslContext) {
            this.sslContext = Args.notNull(sslContext, "SSL context");
            return this;
        }

        public Builder setHostnameVerification(final boolean hostnameVerification) {
            this.hostnameVerification = hostnameVerification;
            return this;
        }

        public Builder setSupportedProtocols(final String... protocols) {
            this.supportedProtocols = protocols != null ? protocols.clone() : null;
            return this;
        }

        public Builder setSupportedCipherSuites(final String... cipherSuites) {
            this.supportedCipherSuites = cipherSuites != null ? cipherSuites.clone() : null;
            return this;
        }

        public TlsConfig build() {
            return new TlsConfig(
                    sslContext != null ? sslContext : SSLContexts.createSystemDefault(),
                    hostnameVerification,
                    supportedProtocols,
                    supportedCipherSuites);
        }

    }

}

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.hc.client5.wsclient.handshake.ExtraHeaders;
import org.apache.hc.client5.wsclient.transport.TlsConfig;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.util.Args;

/**
 * Per connection options of {@link WebSocketClient#connect(String, ConnectOptions)}.
 * <p>
 * Offer lists are copied on {@link Builder#build()}; later changes to the
 * caller's lists have no effect. Extra headers are validated when they are set.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class ConnectOptions {

    public static final ConnectOptions DEFAULT = custom().build();

    private final String origin;
    private final List<String> extensions;
    private final List<String> subprotocols;
    private final List<Header> extraHeaders;
    private final TlsConfig tlsConfig;

    private ConnectOptions(
            final String origin,
            final List<String> extensions,
            final List<String> subprotocols,
            final List<Header> extraHeaders,
            final TlsConfig tlsConfig) {
        this.origin = origin;
        this.extensions = extensions;
        this.subprotocols = subprotocols;
        this.extraHeaders = extraHeaders;
        this.tlsConfig = tlsConfig;
    }

    public static Builder custom() {
        return new Builder();
    }

    public String getOrigin() {
        return origin;
    }

    /**
     * Extensions offered, in order of preference.
     */
    public List<String> getExtensions() {
        return extensions;
    }

    /**
     * Subprotocols offered, in order of decreasing preference.
     */
    public List<String> getSubprotocols() {
        return subprotocols;
    }

    public List<Header> getExtraHeaders() {
        return extraHeaders;
    }

    /**
     * Explicit TLS settings or {@code null}.
     */
    public TlsConfig getTlsConfig() {
        return tlsConfig;
    }

    @Override
    public String toString() {
        return "ConnectOptions[origin=" + origin
                + ", extensions=" + extensions
                + ", subprotocols=" + subprotocols
                + ", extraHeaders=" + extraHeaders
                + ", tlsConfig=" + tlsConfig + "]";
    }

    public static final class Builder {

        private String origin;
        private final List<String> extensions = new ArrayList<>();
        private final List<String> subprotocols = new ArrayList<>();
        private List<Header> extraHeaders = Collections.emptyList();
        private TlsConfig tlsConfig;

        private Builder() {
        }

        public Builder setOrigin(final String origin) {
            this.origin = origin;
            return this;
        }

        public Builder setExtensions(final String... extensions) {
            return setExtensions(extensions != null ? Arrays.asList(extensions) : null);
        }

        public Builder setExtensions(final List<String> extensions) {
            this.extensions.clear();
            if (extensions != null) {
                for (final String extension : extensions) {
                    addExtension(extension);
                }
            }
            return this;
        }

        public Builder addExtension(final String extension) {
            this.extensions.add(Args.notBlank(extension, "Extension"));
            return this;
        }

        public Builder setSubprotocols(final String... subprotocols) {
            return setSubprotocols(subprotocols != null ? Arrays.asList(subprotocols) : null);
        }

        public Builder setSubprotocols(final List<String> subprotocols) {
            this.subprotocols.clear();
            if (subprotocols != null) {
                for (final String subprotocol : subprotocols) {
                    addSubprotocol(subprotocol);
                }
            }
            return this;
        }

        public Builder addSubprotocol(final String subprotocol) {
            this.subprotocols.add(Args.notBlank(subprotocol, "Subprotocol"));
            return this;
        }

        /**
         * Extra request headers, each key emitted once in the map's iteration order.
         *
         * @throws ConfigurationException on blank names or line breaks in values.
         */
        public Builder setExtraHeaders(final Map<String, String> headers) {
            this.extraHeaders = ExtraHeaders.normalize(headers);
            return this;
        }

        /**
         * Extra request headers as ordered (name, value) pairs; repeated names are kept.
         *
         * @throws ConfigurationException if an element is not a pair or is malformed.
         * @see ExtraHeaders#normalize(Object)
         */
        public Builder setExtraHeaders(final Iterable<?> headers) {
            this.extraHeaders = ExtraHeaders.normalize(headers);
            return this;
        }

        public Builder addExtraHeader(final String name, final String value) {
            final List<Header> merged = new ArrayList<>(this.extraHeaders);
            merged.addAll(ExtraHeaders.normalize(Collections.singletonList(new String[] {name, value})));
            this.extraHeaders = Collections.unmodifiableList(merged);
            return this;
        }

        public Builder setTlsConfig(final TlsConfig tlsConfig) {
            this.tlsConfig = tlsConfig;
            return this;
        }

        public ConnectOptions build() {
            return new ConnectOptions(
                    origin,
                    Collections.unmodifiableList(new ArrayList<>(extensions)),
                    Collections.unmodifiableList(new ArrayList<>(subprotocols)),
                    extraHeaders,
                    tlsConfig);
        }

    }

}

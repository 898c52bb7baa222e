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

import org.apache.hc.client5.wsclient.ConfigurationException;
import org.apache.hc.client5.wsclient.endpoint.EndpointDescriptor;
import org.apache.hc.core5.util.Args;

/**
 * Decides which TLS settings, if any, a connection attempt uses.
 *
 * @since 5.6
 */
public final class TlsPolicy {

    private TlsPolicy() {
    }

    /**
     * @param endpoint  resolved endpoint.
     * @param requested caller supplied TLS settings, may be {@code null}.
     * @return TLS settings to use, or {@code null} for a plain connection.
     * @throws ConfigurationException if TLS settings were supplied for a {@code ws} endpoint.
     */
    public static TlsConfig resolve(final EndpointDescriptor endpoint, final TlsConfig requested) {
        Args.notNull(endpoint, "Endpoint");
        if (endpoint.isSecure()) {
            return requested != null ? requested : TlsConfig.createDefault();
        }
        if (requested != null) {
            throw new ConfigurationException("TLS configuration supplied for a ws:// URI; use a wss:// URI to enable TLS");
        }
        return null;
    }

}

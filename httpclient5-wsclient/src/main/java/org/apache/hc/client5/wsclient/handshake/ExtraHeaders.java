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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.hc.client5.wsclient.ConfigurationException;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.message.BasicHeader;

/**
 * Normalizes caller supplied request headers into an ordered header list.
 * <p>
 * Two shapes are accepted: a {@link Map}, where every key is emitted once in
 * the map's iteration order, or an {@link Iterable} of pairs, where order and
 * repeated names are kept as given. A pair is a {@link Header} (or any
 * {@link NameValuePair}), a {@link Map.Entry} or a two element array.
 *
 * @since 5.6
 */
public final class ExtraHeaders {

    private ExtraHeaders() {
    }

    public static List<Header> normalize(final Object extraHeaders) throws ConfigurationException {
        if (extraHeaders == null) {
            return Collections.emptyList();
        }
        final List<Header> headers = new ArrayList<>();
        if (extraHeaders instanceof Map) {
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) extraHeaders).entrySet()) {
                headers.add(header(entry.getKey(), entry.getValue()));
            }
        } else if (extraHeaders instanceof Iterable) {
            for (final Object pair : (Iterable<?>) extraHeaders) {
                headers.add(fromPair(pair));
            }
        } else {
            throw new ConfigurationException("Extra headers must be a mapping or an iterable of (name, value) pairs, got "
                    + extraHeaders.getClass().getName());
        }
        return Collections.unmodifiableList(headers);
    }

    private static Header fromPair(final Object pair) {
        if (pair instanceof NameValuePair) {
            final NameValuePair nvp = (NameValuePair) pair;
            return header(nvp.getName(), nvp.getValue());
        }
        if (pair instanceof Map.Entry) {
            final Map.Entry<?, ?> entry = (Map.Entry<?, ?>) pair;
            return header(entry.getKey(), entry.getValue());
        }
        if (pair instanceof Object[]) {
            final Object[] array = (Object[]) pair;
            if (array.length == 2) {
                return header(array[0], array[1]);
            }
        }
        throw new ConfigurationException("Not a (name, value) pair: " + pair);
    }

    private static Header header(final Object name, final Object value) {
        if (!(name instanceof String) || ((String) name).trim().isEmpty()) {
            throw new ConfigurationException("Header name must be a non-blank string: " + name);
        }
        if (!(value instanceof String)) {
            throw new ConfigurationException("Value of header '" + name + "' must be a string: " + value);
        }
        final String n = (String) name;
        final String v = (String) value;
        if (!isToken(n)) {
            throw new ConfigurationException("Invalid header name: " + n);
        }
        if (v.indexOf('\r') >= 0 || v.indexOf('\n') >= 0) {
            throw new ConfigurationException("Line break in value of header '" + n + "'");
        }
        return new BasicHeader(n, v);
    }

    private static boolean isToken(final String s) {
        for (int i = 0; i < s.length(); i++) {
            final char ch = s.charAt(i);
            if (ch <= 0x20 || ch >= 0x7f || ch == ':' || "()<>@,;\\\"/[]?={}".indexOf(ch) >= 0) {
                return false;
            }
        }
        return true;
    }

}

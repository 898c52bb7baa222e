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

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.hc.client5.wsclient.ConfigurationException;
import org.apache.hc.client5.wsclient.endpoint.EndpointDescriptor;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.message.BasicHeader;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HandshakeRequestBuilderTest {

    private static final String UA = "test-agent/1.0";

    private final HandshakeRequestBuilder builder = new HandshakeRequestBuilder(new SecureRandom());

    private static List<String> names(final HandshakeRequest request) {
        return request.getHeaders().stream().map(Header::getName).collect(Collectors.toList());
    }

    @Test
    void hostOmitsDefaultPorts() {
        Assertions.assertEquals("example.com", HandshakeRequestBuilder.hostHeader(
                new EndpointDescriptor("example.com", 80, false, "/")));
        Assertions.assertEquals("example.com", HandshakeRequestBuilder.hostHeader(
                new EndpointDescriptor("example.com", 443, true, "/")));
    }

    @Test
    void hostKeepsNonDefaultPorts() {
        Assertions.assertEquals("example.com:8080", HandshakeRequestBuilder.hostHeader(
                new EndpointDescriptor("example.com", 8080, false, "/")));
        Assertions.assertEquals("example.com:443", HandshakeRequestBuilder.hostHeader(
                new EndpointDescriptor("example.com", 443, false, "/")));
        Assertions.assertEquals("example.com:80", HandshakeRequestBuilder.hostHeader(
                new EndpointDescriptor("example.com", 80, true, "/")));
    }

    @Test
    void hostBracketsIpv6Literals() {
        Assertions.assertEquals("[::1]:9000", HandshakeRequestBuilder.hostHeader(
                new EndpointDescriptor("[::1]", 9000, false, "/")));
        Assertions.assertEquals("[::1]", HandshakeRequestBuilder.hostHeader(
                new EndpointDescriptor("::1", 80, false, "/")));
    }

    @Test
    void minimalRequest() {
        final HandshakeRequest request = builder.build(
                new EndpointDescriptor("example.com", 80, false, "/chat"), null, null, null, null, UA);

        Assertions.assertEquals("GET /chat HTTP/1.1", request.getRequestLine());
        Assertions.assertEquals(
                Arrays.asList("Host", "Upgrade", "Connection", "User-Agent", "Sec-WebSocket-Key", "Sec-WebSocket-Version"),
                names(request));
        Assertions.assertEquals("example.com", request.getFirstHeader("Host").getValue());
        Assertions.assertEquals("websocket", request.getFirstHeader("Upgrade").getValue());
        Assertions.assertEquals("Upgrade", request.getFirstHeader("Connection").getValue());
        Assertions.assertEquals("13", request.getFirstHeader("Sec-WebSocket-Version").getValue());
        Assertions.assertNull(request.getFirstHeader("Origin"));
        Assertions.assertNull(request.getFirstHeader("Sec-WebSocket-Extensions"));
        Assertions.assertNull(request.getFirstHeader("Sec-WebSocket-Protocol"));
    }

    @Test
    void keyIsSixteenRandomBytesAndFreshPerBuild() {
        final EndpointDescriptor endpoint = new EndpointDescriptor("example.com", 80, false, "/");
        final HandshakeRequest first = builder.build(endpoint, null, null, null, null, UA);
        final HandshakeRequest second = builder.build(endpoint, null, null, null, null, UA);

        final String value = first.getFirstHeader("Sec-WebSocket-Key").getValue();
        Assertions.assertEquals(16, Base64.getDecoder().decode(value).length);
        Assertions.assertEquals(first.getKey().getValue(), value);
        Assertions.assertArrayEquals(Base64.getDecoder().decode(value), first.getKey().getNonce());
        Assertions.assertNotEquals(first.getKey(), second.getKey());
    }

    @Test
    void offersAndOriginInCallerOrder() {
        final HandshakeRequest request = builder.build(
                new EndpointDescriptor("example.com", 443, true, "/feed?x=1"),
                "https://example.com",
                Arrays.asList("permessage-deflate", "x-webkit-deflate-frame"),
                Arrays.asList("chat.v2", "chat.v1"),
                null,
                UA);

        Assertions.assertEquals("GET /feed?x=1 HTTP/1.1", request.getRequestLine());
        Assertions.assertEquals("https://example.com", request.getFirstHeader("Origin").getValue());
        Assertions.assertEquals("permessage-deflate, x-webkit-deflate-frame",
                request.getFirstHeader("Sec-WebSocket-Extensions").getValue());
        Assertions.assertEquals("chat.v2, chat.v1", request.getFirstHeader("Sec-WebSocket-Protocol").getValue());
    }

    @Test
    void emptyOfferListsAreNotSent() {
        final HandshakeRequest request = builder.build(
                new EndpointDescriptor("example.com", 80, false, "/"),
                null, Collections.emptyList(), Collections.emptyList(), null, UA);
        Assertions.assertNull(request.getFirstHeader("Sec-WebSocket-Extensions"));
        Assertions.assertNull(request.getFirstHeader("Sec-WebSocket-Protocol"));
    }

    @Test
    void mappingHeadersEmittedOnceBeforeUserAgentAndKey() {
        final Map<String, String> extra = new LinkedHashMap<>();
        extra.put("X-Trace", "abc");
        extra.put("Cookie", "a=b");

        final HandshakeRequest request = builder.build(
                new EndpointDescriptor("example.com", 80, false, "/"), null, null, null, extra, UA);

        Assertions.assertEquals(
                Arrays.asList("Host", "Upgrade", "Connection", "X-Trace", "Cookie", "User-Agent",
                        "Sec-WebSocket-Key", "Sec-WebSocket-Version"),
                names(request));
        Assertions.assertEquals(1, names(request).stream().filter("X-Trace"::equals).count());
        Assertions.assertEquals(UA, request.getFirstHeader("User-Agent").getValue());
    }

    @Test
    void orderedPairsKeepDuplicates() {
        final List<Header> extra = Arrays.asList(
                new BasicHeader("Cookie", "a=1"),
                new BasicHeader("X-Other", "o"),
                new BasicHeader("Cookie", "b=2"));

        final HandshakeRequest request = builder.build(
                new EndpointDescriptor("example.com", 80, false, "/"), null, null, null, extra, UA);

        final List<String> cookies = request.getHeaders().stream()
                .filter(h -> h.getName().equals("Cookie"))
                .map(Header::getValue)
                .collect(Collectors.toList());
        Assertions.assertEquals(Arrays.asList("a=1", "b=2"), cookies);
        Assertions.assertEquals(
                Arrays.asList("Host", "Upgrade", "Connection", "Cookie", "X-Other", "Cookie", "User-Agent",
                        "Sec-WebSocket-Key", "Sec-WebSocket-Version"),
                names(request));
    }

    @Test
    void rejectsExtraHeadersOfUnsupportedShape() {
        final EndpointDescriptor endpoint = new EndpointDescriptor("example.com", 80, false, "/");
        Assertions.assertThrows(ConfigurationException.class,
                () -> builder.build(endpoint, null, null, null, "X-Foo: bar", UA));
        Assertions.assertThrows(ConfigurationException.class,
                () -> builder.build(endpoint, null, null, null, Arrays.asList("X-Foo", "bar"), UA));
    }

}

package com.facet.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientAddressResolverTest {

    @Test
    void ignoresProxyHeadersUnlessTrusted() {
        MockHttpServletRequest request = request("10.0.0.5");
        request.addHeader("X-Real-IP", "203.0.113.9");
        request.addHeader("X-Forwarded-For", "198.51.100.1");

        assertThat(new ClientAddressResolver(false).resolve(request)).isEqualTo("10.0.0.5");
    }

    @Test
    void prefersRealIpWhenTrusted() {
        MockHttpServletRequest request = request("10.0.0.5");
        request.addHeader("X-Real-IP", " 203.0.113.9 ");
        request.addHeader("X-Forwarded-For", "198.51.100.1");

        assertThat(new ClientAddressResolver(true).resolve(request)).isEqualTo("203.0.113.9");
    }

    @Test
    void fallsBackToHopAppendedByProxy() {
        MockHttpServletRequest request = request("10.0.0.5");
        request.addHeader("X-Forwarded-For", "198.51.100.1");

        assertThat(new ClientAddressResolver(true).resolve(request)).isEqualTo("198.51.100.1");
    }

    @Test
    void clientSuppliedForwardedEntriesDoNotChangeTheKey() {
        MockHttpServletRequest first = request("10.0.0.5");
        first.addHeader("X-Forwarded-For", "192.0.2.1, 198.51.100.1");
        MockHttpServletRequest second = request("10.0.0.5");
        second.addHeader("X-Forwarded-For", "192.0.2.77, 198.51.100.1");

        ClientAddressResolver resolver = new ClientAddressResolver(true);
        assertThat(resolver.resolve(first)).isEqualTo("198.51.100.1");
        assertThat(resolver.resolve(second)).isEqualTo("198.51.100.1");
    }

    @Test
    void emptyForwardedListFallsBackToSocketAddress() {
        MockHttpServletRequest request = request("10.0.0.5");
        request.addHeader("X-Forwarded-For", ",");

        assertThat(new ClientAddressResolver(true).resolve(request)).isEqualTo("10.0.0.5");
    }

    @Test
    void usesSocketAddressWhenNoHeaders() {
        assertThat(new ClientAddressResolver(true).resolve(request("10.0.0.5"))).isEqualTo("10.0.0.5");
        assertThat(new ClientAddressResolver(false).resolve(request(""))).isEqualTo("unknown");
    }

    private static MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/auth/admin/verify");
        request.setRemoteAddr(remoteAddr);
        return request;
    }
}

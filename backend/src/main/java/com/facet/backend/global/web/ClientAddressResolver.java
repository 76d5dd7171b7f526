package com.facet.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Derives the source key used for login throttling.
 * Proxy headers are only honoured when the deployment sits behind a trusted reverse proxy,
 * otherwise any client could rotate its key per request.
 * <p>
 * A trusted proxy appends the address it saw to {@code X-Forwarded-For}, so only the rightmost entry is
 * taken; entries left of it are whatever the client sent.
 */
@Component
public class ClientAddressResolver {

    static final String REAL_IP_HEADER = "X-Real-IP";
    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final boolean trustProxyHeaders;

    public ClientAddressResolver(@Value("${facet.security.trust-proxy-headers:false}") boolean trustProxyHeaders) {
        this.trustProxyHeaders = trustProxyHeaders;
    }

    public String resolve(HttpServletRequest request) {
        if (trustProxyHeaders) {
            String realIp = request.getHeader(REAL_IP_HEADER);
            if (StringUtils.hasText(realIp)) {
                return realIp.trim();
            }
            String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
            if (StringUtils.hasText(forwardedFor)) {
                String[] hops = forwardedFor.split(",");
                String last = hops.length == 0 ? "" : hops[hops.length - 1].trim();
                if (!last.isEmpty()) {
                    return last;
                }
            }
        }
        String remote = request.getRemoteAddr();
        return StringUtils.hasText(remote) ? remote : "unknown";
    }
}

package com.facet.backend.global.security;

import java.io.IOException;

import com.facet.backend.modules.auth.application.GateDecision;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.domain.SessionKind;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the session header for the route family: admin routes and the management endpoints read
 * {@code X-Admin-Session}, everything else reads {@code X-Employee-Session}. Unknown or expired tokens leave the request
 * unauthenticated so the entry point answers 401.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    static final String ADMIN_PATH_PREFIX = "/api/v1/admin/";
    static final String ACTUATOR_PATH_PREFIX = "/actuator/";

    private final RequestGate requestGate;

    public SessionAuthenticationFilter(RequestGate requestGate) {
        this.requestGate = requestGate;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        SessionKind kind = sessionKindFor(pathOf(request));
        String token = request.getHeader(kind.headerName());
        if (StringUtils.hasText(token)) {
            GateDecision decision = requestGate.authenticate(kind, token.trim());
            if (decision.proceeds()) {
                UsernamePasswordAuthenticationToken authentication = SessionAuthentication.of(decision.principal());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = pathOf(request);
        return path.startsWith("/api/v1/auth/") || path.startsWith("/actuator/health");
    }

    static SessionKind sessionKindFor(String path) {
        if (path.startsWith(ADMIN_PATH_PREFIX) || path.startsWith(ACTUATOR_PATH_PREFIX)) {
            return SessionKind.ADMIN;
        }
        return SessionKind.EMPLOYEE;
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (StringUtils.hasLength(contextPath) && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}

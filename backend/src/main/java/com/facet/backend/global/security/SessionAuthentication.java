package com.facet.backend.global.security;

import java.util.ArrayList;
import java.util.List;

import com.facet.backend.modules.auth.domain.Permission;
import com.facet.backend.modules.auth.domain.SessionKind;
import com.facet.backend.modules.auth.domain.SessionPrincipal;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * Maps a validated session principal to Spring Security authorities.
 */
public final class SessionAuthentication {

    public static final String SESSION_ADMIN = "SESSION_ADMIN";
    public static final String SESSION_EMPLOYEE = "SESSION_EMPLOYEE";

    private SessionAuthentication() {
    }

    public static UsernamePasswordAuthenticationToken of(SessionPrincipal principal) {
        return UsernamePasswordAuthenticationToken.authenticated(principal, null, authoritiesOf(principal));
    }

    static List<GrantedAuthority> authoritiesOf(SessionPrincipal principal) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority(
                principal.kind() == SessionKind.ADMIN ? SESSION_ADMIN : SESSION_EMPLOYEE));
        authorities.add(new SimpleGrantedAuthority("ROLE_" + principal.role().name()));
        for (Permission permission : principal.permissions()) {
            authorities.add(new SimpleGrantedAuthority(permission.name()));
        }
        return authorities;
    }
}

package com.facet.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.facet.backend.modules.auth.application.GateDecision;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.domain.SessionKind;
import com.facet.backend.support.TestEmployees;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class SessionAuthenticationFilterTest {

    @Mock
    private RequestGate requestGate;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void managementEndpointsReadTheAdminSessionHeader() throws Exception {
        when(requestGate.authenticate(SessionKind.ADMIN, "admin-token"))
                .thenReturn(GateDecision.proceed(TestEmployees.adminSession()));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/info");
        request.addHeader(SessionKind.ADMIN.headerName(), "admin-token");

        new SessionAuthenticationFilter(requestGate).doFilter(request, new MockHttpServletResponse(),
                new MockFilterChain());

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .contains(SessionAuthentication.SESSION_ADMIN);
    }

    @Test
    void employeeHeaderDoesNotOpenManagementEndpoints() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/info");
        request.addHeader(SessionKind.EMPLOYEE.headerName(), "alice-token");

        new SessionAuthenticationFilter(requestGate).doFilter(request, new MockHttpServletResponse(),
                new MockFilterChain());

        verify(requestGate, never()).authenticate(any(), any());
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void routeFamiliesPickTheirSessionKind() {
        assertThat(SessionAuthenticationFilter.sessionKindFor("/api/v1/admin/employees")).isEqualTo(SessionKind.ADMIN);
        assertThat(SessionAuthenticationFilter.sessionKindFor("/actuator/metrics")).isEqualTo(SessionKind.ADMIN);
        assertThat(SessionAuthenticationFilter.sessionKindFor("/api/v1/tickets")).isEqualTo(SessionKind.EMPLOYEE);
    }
}

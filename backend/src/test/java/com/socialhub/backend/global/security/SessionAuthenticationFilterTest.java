package com.socialhub.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.global.error.ProblemResponseWriter;
import com.socialhub.backend.modules.auth.application.SessionResolution;
import com.socialhub.backend.modules.auth.application.SessionResolver;
import com.socialhub.backend.modules.auth.application.TokenPair;
import com.socialhub.backend.modules.auth.domain.SocialUser;
import com.socialhub.backend.support.TestUsers;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class SessionAuthenticationFilterTest {

    @Mock
    private SessionResolver sessionResolver;

    private SessionAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new SessionAuthenticationFilter(
                sessionResolver, new SessionCookies(true, "Lax"), new ProblemResponseWriter(new ObjectMapper()));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void acceptedSessionAttachesPrincipal() throws Exception {
        SocialUser moderator = TestUsers.user(2);
        when(sessionResolver.resolve("access-value", null)).thenReturn(SessionResolution.accepted(moderator, null));
        MockHttpServletRequest request = request("/action/timeout");
        request.setCookies(new Cookie("access_token", "access-value"));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getHeaders("Set-Cookie")).isEmpty();
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        SessionPrincipal principal = (SessionPrincipal) authentication.getPrincipal();
        assertThat(principal.userId()).isEqualTo(moderator.getId());
        assertThat(principal.roleLevel()).isEqualTo(2);
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("ROLE_USER", "ROLE_MODERATOR");
    }

    @Test
    void rotatedTokensAreWrittenAsCookies() throws Exception {
        SocialUser user = TestUsers.user(1);
        when(sessionResolver.resolve(null, "refresh-value"))
                .thenReturn(SessionResolution.accepted(user, new TokenPair("new-access", "new-refresh")));
        MockHttpServletRequest request = request("/auth/me");
        request.setCookies(new Cookie("refresh_token", "refresh-value"));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        List<String> cookies = response.getHeaders("Set-Cookie");
        assertThat(cookies).hasSize(2);
        assertThat(cookies.get(0)).startsWith("access_token=new-access").contains("Max-Age=1800", "Path=/",
                "Secure", "HttpOnly");
        assertThat(cookies.get(1)).startsWith("refresh_token=new-refresh").contains("Max-Age=21600");
    }

    @Test
    void rejectionStopsChainWithProblemBody() throws Exception {
        when(sessionResolver.resolve(null, null)).thenReturn(SessionResolution.rejected(
                new ProblemException(HttpStatus.UNAUTHORIZED, "unauthorized.missing_auth_tokens", "missing auth tokens")));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/action/timeout"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("unauthorized.missing_auth_tokens");
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void publicEndpointsSkipResolution() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/auth/login"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        verify(sessionResolver, never()).resolve(any(), any());
    }

    private static MockHttpServletRequest request(String path) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
        request.setServletPath(path);
        return request;
    }
}

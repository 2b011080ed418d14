package com.socialhub.backend.modules.ratelimit.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialhub.backend.global.error.ProblemResponseWriter;
import com.socialhub.backend.global.web.ClientIpResolver;
import com.socialhub.backend.modules.ratelimit.application.RateLimitDecision;
import com.socialhub.backend.modules.ratelimit.application.RateLimiter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
class RateLimitFilterTest {

    @Mock
    private RateLimiter rateLimiter;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RateLimitFilter(rateLimiter, new ClientIpResolver(true), new ProblemResponseWriter(objectMapper));
    }

    @Test
    void admittedRequestContinues() throws Exception {
        when(rateLimiter.admit("203.0.113.7")).thenReturn(new RateLimitDecision(true, 1, 100, 0));
        MockHttpServletRequest request = request("/action/timeout");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void throttledRequestGets429WithRetryAfter() throws Exception {
        when(rateLimiter.admit("127.0.0.1")).thenReturn(new RateLimitDecision(false, 101, 100, 42));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/auth/login"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("42");
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.get("code").asText()).isEqualTo("too_many_requests");
    }

    @Test
    void storeFailureIsInternalError() throws Exception {
        when(rateLimiter.admit(anyString())).thenThrow(new QueryTimeoutException("redis timeout"));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/action/ban/1"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(500);
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.get("code").asText()).isEqualTo("internal_error");
        assertThat(response.getContentAsString()).doesNotContain("redis timeout");
    }

    @Test
    void healthProbeIsNotThrottled() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/actuator/health"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        verify(rateLimiter, never()).admit(anyString());
    }

    private static MockHttpServletRequest request(String path) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
        request.setServletPath(path);
        request.setRemoteAddr("127.0.0.1");
        return request;
    }
}

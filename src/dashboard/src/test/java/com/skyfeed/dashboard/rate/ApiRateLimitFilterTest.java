package com.skyfeed.dashboard.rate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.skyfeed.dashboard.config.DashboardProperties;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class ApiRateLimitFilterTest {
  private final InMemoryRateLimiter limiter = mock(InMemoryRateLimiter.class);
  private final ApiRateLimitFilter filter = new ApiRateLimitFilter(new DashboardProperties(), limiter);

  @Test
  void rejectedSubmissionGets429() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/setregions");
    request.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");
    MockHttpServletResponse response = new MockHttpServletResponse();
    FilterChain chain = mock(FilterChain.class);
    when(limiter.allow(eq("203.0.113.9"), anyInt(), anyInt())).thenReturn(false);

    filter.doFilter(request, response, chain);

    assertThat(response.getStatus()).isEqualTo(429);
    assertThat(response.getContentAsString()).contains("too_many_requests");
    verify(chain, never()).doFilter(request, response);
  }

  @Test
  void flightReadsPassEvenWhenLimitIsExhausted() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/flights");
    MockHttpServletResponse response = new MockHttpServletResponse();
    FilterChain chain = mock(FilterChain.class);
    // An unstubbed limiter mock answers false for every client.

    filter.doFilter(request, response, chain);

    assertThat(response.getStatus()).isEqualTo(200);
    verify(chain).doFilter(request, response);
    verifyNoInteractions(limiter);
  }

  @Test
  void nonApiPathsAreNotLimited() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
    MockHttpServletResponse response = new MockHttpServletResponse();
    FilterChain chain = mock(FilterChain.class);

    filter.doFilter(request, response, chain);

    verify(chain).doFilter(request, response);
    verifyNoInteractions(limiter);
  }
}

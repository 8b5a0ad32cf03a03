package com.example.mcpauth.security.filter;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class CorsHeaderFilterTest {

  private final CorsHeaderFilter filter = new CorsHeaderFilter();

  @Test
  void preflightIsAnsweredWithoutReachingTheChain() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("OPTIONS", "/mcp/tools");
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, response, chain);

    assertThat(response.getStatus()).isEqualTo(204);
    assertThat(response.getHeader(CorsHeaderFilter.ALLOW_ORIGIN)).isEqualTo("*");
    assertThat(response.getHeader(CorsHeaderFilter.ALLOW_METHODS)).isEqualTo("GET, POST, PUT, DELETE, OPTIONS");
    assertThat(response.getHeader(CorsHeaderFilter.ALLOW_HEADERS)).isEqualTo("Content-Type, Authorization");
    assertThat(response.getHeader(CorsHeaderFilter.MAX_AGE)).isEqualTo("86400");
    assertThat(chain.getRequest()).isNull();
  }

  @Test
  void regularRequestGetsHeadersAndContinues() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(new MockHttpServletRequest("POST", "/token"), response, chain);

    assertThat(response.getHeader(CorsHeaderFilter.ALLOW_ORIGIN)).isEqualTo("*");
    assertThat(response.getHeader(CorsHeaderFilter.MAX_AGE)).isNull();
    assertThat(chain.getRequest()).isNotNull();
  }

  @Test
  void existingHeaderIsNotOverwritten() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    response.setHeader(CorsHeaderFilter.ALLOW_ORIGIN, "https://app.example");

    filter.doFilter(new MockHttpServletRequest("GET", "/health"), response, new MockFilterChain());

    assertThat(response.getHeader(CorsHeaderFilter.ALLOW_ORIGIN)).isEqualTo("https://app.example");
  }
}

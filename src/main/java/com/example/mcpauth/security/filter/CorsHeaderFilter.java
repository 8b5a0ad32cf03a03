package com.example.mcpauth.security.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Open CORS for browser-based MCP clients. Runs ahead of Spring Security so preflights never
 * need a token. Headers already present on the response are left alone.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorsHeaderFilter extends OncePerRequestFilter {

  static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
  static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
  static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";
  static final String MAX_AGE = "Access-Control-Max-Age";

  private static final String ANY_ORIGIN = "*";
  private static final String METHODS = "GET, POST, PUT, DELETE, OPTIONS";
  private static final String HEADERS = "Content-Type, Authorization";
  private static final String PREFLIGHT_MAX_AGE = "86400";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    setIfAbsent(response, ALLOW_ORIGIN, ANY_ORIGIN);
    setIfAbsent(response, ALLOW_METHODS, METHODS);
    setIfAbsent(response, ALLOW_HEADERS, HEADERS);

    if (HttpMethod.OPTIONS.matches(request.getMethod())) {
      setIfAbsent(response, MAX_AGE, PREFLIGHT_MAX_AGE);
      response.setStatus(HttpServletResponse.SC_NO_CONTENT);
      return;
    }

    filterChain.doFilter(request, response);
  }

  private static void setIfAbsent(HttpServletResponse response, String name, String value) {
    if (!response.containsHeader(name)) {
      response.setHeader(name, value);
    }
  }
}

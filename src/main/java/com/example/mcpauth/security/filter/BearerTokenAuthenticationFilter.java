package com.example.mcpauth.security.filter;

import com.example.mcpauth.domain.entity.IssuedToken;
import com.example.mcpauth.exception.StoreException;
import com.example.mcpauth.service.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.io.IOException;
import java.util.Collections;
import java.util.Optional;

/**
 * Authenticates {@code Authorization: Bearer} requests through the {@link TokenService}.
 * Requests without a live token continue unauthenticated and are rejected by the entry point.
 * A store failure is handed to the MVC exception handlers and answered as a server error.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final String BEARER_PREFIX = "Bearer ";

  private final TokenService tokenService;
  private final HandlerExceptionResolver handlerExceptionResolver;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      String tokenValue = header.substring(BEARER_PREFIX.length()).trim();
      Optional<IssuedToken> token;
      try {
        token = tokenService.verify(tokenValue);
      } catch (StoreException e) {
        log.error("Token store unavailable while authenticating {}", request.getRequestURI());
        handlerExceptionResolver.resolveException(request, response, null, e);
        return;
      }

      if (token.isPresent()) {
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
            token.get().principal(), null, Collections.emptyList());
        authentication.setDetails(token.get().clientId());
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.trace("Authenticated bearer token for user {}", token.get().principal().userId());
      } else {
        log.debug("Bearer token rejected for {}", request.getRequestURI());
      }
    }

    filterChain.doFilter(request, response);
  }
}

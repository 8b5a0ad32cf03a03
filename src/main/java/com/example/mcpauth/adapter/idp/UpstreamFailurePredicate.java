package com.example.mcpauth.adapter.idp;

import com.example.mcpauth.exception.UpstreamIdentityException;

import java.io.IOException;
import java.util.function.Predicate;

/**
 * Decides which upstream failures count against the {@code google} and {@code github}
 * circuit breakers. Network errors, 5xx answers and malformed payloads do; a provider
 * refusing a caller-supplied code does not, so garbage callbacks cannot open the breaker
 * for everyone.
 */
public class UpstreamFailurePredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    if (throwable instanceof UpstreamIdentityException upstream) {
      return !upstream.isRejectedRequest();
    }
    return throwable instanceof IOException;
  }
}

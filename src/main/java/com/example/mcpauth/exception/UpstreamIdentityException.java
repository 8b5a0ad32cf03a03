package com.example.mcpauth.exception;

import lombok.Getter;

/**
 * The upstream identity provider rejected a call or answered with something unusable.
 * Upstream status and body are kept for diagnosis and never sent to the client as-is.
 */
@Getter
public class UpstreamIdentityException extends RuntimeException {

  public static final String INVALID_RESPONSE = "invalid_response";

  public enum Phase {
    TOKEN_EXCHANGE,
    PROFILE
  }

  private final Phase phase;
  private final int upstreamStatus;
  private final String upstreamError;
  private final String upstreamBody;

  public UpstreamIdentityException(Phase phase, int upstreamStatus, String upstreamError,
                                   String upstreamBody, String message) {
    super(message);
    this.phase = phase;
    this.upstreamStatus = upstreamStatus;
    this.upstreamError = upstreamError;
    this.upstreamBody = upstreamBody;
  }

  public UpstreamIdentityException(Phase phase, String message, Throwable cause) {
    super(message, cause);
    this.phase = phase;
    this.upstreamStatus = 0;
    this.upstreamError = null;
    this.upstreamBody = null;
  }

  /**
   * True when the provider answered with a 4xx or an OAuth {@code error} payload: it refused
   * what the caller sent (a bad or spent code, a revoked token) while itself being healthy.
   */
  public boolean isRejectedRequest() {
    if (upstreamStatus >= 400 && upstreamStatus < 500) {
      return true;
    }
    return upstreamStatus > 0 && upstreamStatus < 400 && upstreamError != null
        && !INVALID_RESPONSE.equals(upstreamError);
  }
}

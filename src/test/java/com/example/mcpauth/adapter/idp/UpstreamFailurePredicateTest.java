package com.example.mcpauth.adapter.idp;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.mcpauth.exception.UpstreamIdentityException;
import com.example.mcpauth.exception.UpstreamIdentityException.Phase;
import java.io.IOException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;

class UpstreamFailurePredicateTest {

  private final UpstreamFailurePredicate predicate = new UpstreamFailurePredicate();

  @Test
  void callerCausedRejectionsAreNotFailures() {
    assertThat(predicate.test(upstream(400, "invalid_grant"))).isFalse();
    assertThat(predicate.test(upstream(401, null))).isFalse();
    assertThat(predicate.test(upstream(200, "bad_verification_code"))).isFalse();
  }

  @Test
  void providerOutagesAreFailures() {
    assertThat(predicate.test(upstream(500, null))).isTrue();
    assertThat(predicate.test(upstream(503, "temporarily_unavailable"))).isTrue();
    assertThat(predicate.test(upstream(200, UpstreamIdentityException.INVALID_RESPONSE))).isTrue();
    assertThat(predicate.test(new UpstreamIdentityException(Phase.TOKEN_EXCHANGE, "network error",
                                                            new SocketTimeoutException("read timed out"))))
        .isTrue();
    assertThat(predicate.test(new IOException("connection reset"))).isTrue();
  }

  @Test
  void unrelatedExceptionsAreNotRecorded() {
    assertThat(predicate.test(new IllegalArgumentException("bad argument"))).isFalse();
  }

  private static UpstreamIdentityException upstream(int status, String error) {
    return new UpstreamIdentityException(Phase.TOKEN_EXCHANGE, status, error, "{}", "rejected");
  }
}

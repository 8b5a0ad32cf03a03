package com.example.mcpauth.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.mcpauth.domain.entity.UserPrincipal;
import java.util.List;
import org.junit.jupiter.api.Test;

class AccessPolicyTest {

  private final AccessPolicy policy = new AccessPolicy(List.of("12345", " Ops@Example.com ", ""));

  @Test
  void matchesUserIdExactly() {
    assertThat(policy.isAllowed(new UserPrincipal("12345", "n", null, null))).isTrue();
    assertThat(policy.isAllowed(new UserPrincipal("123456", "n", null, null))).isFalse();
  }

  @Test
  void matchesEmailIgnoringCase() {
    assertThat(policy.isAllowed(new UserPrincipal("1", "n", "ops@example.COM", null))).isTrue();
    assertThat(policy.isAllowed(new UserPrincipal("1", "n", "dev@example.com", null))).isFalse();
  }

  @Test
  void emptyListAllowsNobody() {
    AccessPolicy empty = new AccessPolicy(List.of());

    assertThat(empty.isAllowed(new UserPrincipal("12345", "n", "ops@example.com", null))).isFalse();
    assertThat(empty.isAllowed(null)).isFalse();
  }
}

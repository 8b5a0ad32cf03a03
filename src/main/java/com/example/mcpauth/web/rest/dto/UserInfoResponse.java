package com.example.mcpauth.web.rest.dto;

import com.example.mcpauth.domain.entity.UserPrincipal;

/**
 * Public view of the authenticated principal, without the upstream credential.
 */
public record UserInfoResponse(
    String id,
    String name,
    String email
) {

  public static UserInfoResponse from(UserPrincipal principal) {
    return new UserInfoResponse(principal.userId(), principal.displayName(), principal.email());
  }
}

package com.example.mcpauth.domain.entity;

/**
 * Authenticated identity resolved from the upstream provider profile.
 * Handed to access decisions; the upstream credential never leaves the server.
 */
public record UserPrincipal(
    String userId,
    String displayName,
    String email,
    String upstreamAccessToken
) {

  /**
   * Copy of this principal that is safe to expose to clients.
   */
  public UserPrincipal withoutCredential() {
    return new UserPrincipal(userId, displayName, email, null);
  }

  @Override
  public String toString() {
    return "UserPrincipal[userId=" + userId + ", displayName=" + displayName + ", email=" + email + "]";
  }
}

package com.example.mcpauth.service;

import com.example.mcpauth.domain.entity.UserPrincipal;
import com.example.mcpauth.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which principals may use restricted tools.
 * An entry matches the principal's user id exactly or its email case-insensitively.
 */
@Slf4j
@Component
public class AccessPolicy {

  private final Set<String> allowedUsers;

  @Autowired
  public AccessPolicy(ApplicationProperties properties) {
    this(properties.access().allowedUsers());
  }

  public AccessPolicy(Collection<String> allowedUsers) {
    this.allowedUsers = allowedUsers.stream()
        .filter(entry -> entry != null && !entry.isBlank())
        .map(String::trim)
        .collect(Collectors.toUnmodifiableSet());
    log.info("Access policy loaded with {} allow-listed principal(s)", this.allowedUsers.size());
  }

  public boolean isAllowed(UserPrincipal principal) {
    if (principal == null) {
      return false;
    }
    if (principal.userId() != null && allowedUsers.contains(principal.userId())) {
      return true;
    }
    String email = principal.email();
    return email != null && allowedUsers.stream()
        .anyMatch(entry -> entry.toLowerCase(Locale.ROOT).equals(email.toLowerCase(Locale.ROOT)));
  }
}

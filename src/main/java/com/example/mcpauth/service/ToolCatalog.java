package com.example.mcpauth.service;

import com.example.mcpauth.domain.entity.ToolDescriptor;
import com.example.mcpauth.domain.entity.UserPrincipal;
import com.example.mcpauth.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Tools offered to authenticated callers, filtered through the {@link AccessPolicy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolCatalog {

  private static final List<ToolDescriptor> TOOLS = List.of(
      new ToolDescriptor("add", "Add two numbers", false),
      new ToolDescriptor("user_info", "Show the authenticated user's profile", false),
      new ToolDescriptor("list_segments", "List mailing list segments", true),
      new ToolDescriptor("add_subscriber", "Create or update a subscriber", true),
      new ToolDescriptor("get_subscriber", "Look up a subscriber by email or id", true));

  private final AccessPolicy accessPolicy;

  public List<ToolDescriptor> visibleTo(UserPrincipal principal) {
    boolean allowed = accessPolicy.isAllowed(principal);
    return TOOLS.stream()
        .filter(tool -> !tool.restricted() || allowed)
        .toList();
  }

  /**
   * @throws ResourceNotFoundException for unknown tools
   * @throws AccessDeniedException for restricted tools the principal may not use
   */
  public ToolDescriptor resolve(String name, UserPrincipal principal) {
    ToolDescriptor tool = TOOLS.stream()
        .filter(candidate -> candidate.name().equals(name))
        .findFirst()
        .orElseThrow(() -> new ResourceNotFoundException("Unknown tool: " + name));
    if (tool.restricted() && !accessPolicy.isAllowed(principal)) {
      log.warn("User {} denied restricted tool {}", principal.userId(), name);
      throw new AccessDeniedException("Tool " + name + " requires an allow-listed user");
    }
    return tool;
  }
}

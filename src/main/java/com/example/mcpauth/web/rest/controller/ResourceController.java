package com.example.mcpauth.web.rest.controller;

import com.example.mcpauth.domain.entity.ToolDescriptor;
import com.example.mcpauth.domain.entity.UserPrincipal;
import com.example.mcpauth.service.ToolCatalog;
import com.example.mcpauth.web.rest.dto.UserInfoResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class ResourceController implements ResourceAPI {

  private final ToolCatalog toolCatalog;

  @Override
  public ResponseEntity<UserInfoResponse> userInfo(UserPrincipal principal) {
    return ResponseEntity.ok(UserInfoResponse.from(principal));
  }

  @Override
  public ResponseEntity<List<ToolDescriptor>> tools(UserPrincipal principal) {
    return ResponseEntity.ok(toolCatalog.visibleTo(principal));
  }

  @Override
  public ResponseEntity<ToolDescriptor> tool(String name, UserPrincipal principal) {
    return ResponseEntity.ok(toolCatalog.resolve(name, principal));
  }
}

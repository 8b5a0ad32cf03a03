package com.example.mcpauth.web.rest.controller;

import static com.example.mcpauth.web.rest.ApiConstants.ApiPath.*;

import com.example.mcpauth.domain.entity.ToolDescriptor;
import com.example.mcpauth.domain.entity.UserPrincipal;
import com.example.mcpauth.web.rest.dto.UserInfoResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;

@Tag(
    name = "MCP resources",
    description = "Bearer-protected resources for authenticated MCP clients"
)
@RequestMapping(
    value = MCP_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface ResourceAPI {

  @Operation(summary = "Authenticated user profile")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Profile of the token's user"),
      @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token")
  })
  @GetMapping(value = USER_INFO)
  ResponseEntity<UserInfoResponse> userInfo(@Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal);

  @Operation(summary = "Tools available to the caller")
  @GetMapping(value = TOOLS)
  ResponseEntity<List<ToolDescriptor>> tools(@Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal);

  @Operation(summary = "Describe one tool")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Tool descriptor"),
      @ApiResponse(responseCode = "403", description = "Restricted tool, caller not allow-listed"),
      @ApiResponse(responseCode = "404", description = "Unknown tool")
  })
  @GetMapping(value = TOOL)
  ResponseEntity<ToolDescriptor> tool(
      @PathVariable("name") String name,
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal);
}

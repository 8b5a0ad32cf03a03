package com.example.mcpauth.web.rest.dto;

import com.example.mcpauth.domain.entity.TokenGrant;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("scope") String scope
) {

  public static TokenResponse from(TokenGrant grant) {
    return new TokenResponse(grant.accessToken(), grant.tokenType(), grant.expiresIn(), grant.scope());
  }
}

package com.example.mcpauth.web.rest.dto;

import com.example.mcpauth.domain.entity.ClientRegistration;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientRegistrationResponse(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_secret") String clientSecret,
    @JsonProperty("client_id_issued_at") long clientIdIssuedAt,
    @JsonProperty("client_secret_expires_at") long clientSecretExpiresAt,
    @JsonProperty("client_name") String clientName,
    @JsonProperty("redirect_uris") List<String> redirectUris,
    @JsonProperty("grant_types") List<String> grantTypes,
    @JsonProperty("response_types") List<String> responseTypes,
    @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
    @JsonProperty("scope") String scope
) {

  /**
   * Secrets never expire, signalled by {@code client_secret_expires_at = 0}.
   */
  public static ClientRegistrationResponse from(ClientRegistration registration) {
    return new ClientRegistrationResponse(
        registration.clientId(),
        registration.clientSecret(),
        registration.issuedAt(),
        0,
        registration.clientName(),
        registration.redirectUris(),
        registration.grantTypes(),
        registration.responseTypes(),
        registration.tokenEndpointAuthMethod(),
        registration.scope());
  }
}

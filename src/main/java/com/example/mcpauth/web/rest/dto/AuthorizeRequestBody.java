package com.example.mcpauth.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON form of a {@code POST /authorize} submission.
 */
public record AuthorizeRequestBody(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("redirect_uri") String redirectUri,
    @JsonProperty("response_type") String responseType,
    @JsonProperty("state") String state,
    @JsonProperty("code_challenge") String codeChallenge,
    @JsonProperty("code_challenge_method") String codeChallengeMethod,
    @JsonProperty("scope") String scope,
    @JsonProperty("action") String action
) {}

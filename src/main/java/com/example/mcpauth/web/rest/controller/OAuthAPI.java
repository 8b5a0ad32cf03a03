package com.example.mcpauth.web.rest.controller;

import static com.example.mcpauth.web.rest.ApiConstants.ApiPath.*;
import static com.example.mcpauth.web.rest.ApiConstants.OAuthParam;

import com.example.mcpauth.web.rest.dto.AuthorizeRequestBody;
import com.example.mcpauth.web.rest.dto.ClientRegistrationRequest;
import com.example.mcpauth.web.rest.dto.ClientRegistrationResponse;
import com.example.mcpauth.web.rest.dto.TokenResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "OAuth",
    description = "Authorization server endpoints for downstream MCP clients"
)
public interface OAuthAPI {

  @Operation(
      summary = "Begin authorization",
      description = "Shows the consent page, or redirects upstream when the client is already approved"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Consent page"),
      @ApiResponse(responseCode = "302", description = "Redirect to the upstream identity provider"),
      @ApiResponse(responseCode = "400", description = "invalid_request"),
      @ApiResponse(responseCode = "405", description = "Method not allowed")
  })
  @GetMapping(value = AUTHORIZE)
  ResponseEntity<String> authorize(
      @Parameter(description = "Downstream client id", required = true)
      @RequestParam(name = OAuthParam.CLIENT_ID, required = false) String clientId,
      @Parameter(description = "Downstream redirect URI", required = true)
      @RequestParam(name = OAuthParam.REDIRECT_URI, required = false) String redirectUri,
      @Parameter(description = "Must be 'code'", required = true)
      @RequestParam(name = OAuthParam.RESPONSE_TYPE, required = false) String responseType,
      @RequestParam(name = OAuthParam.STATE, required = false) String state,
      @RequestParam(name = OAuthParam.CODE_CHALLENGE, required = false) String codeChallenge,
      @RequestParam(name = OAuthParam.CODE_CHALLENGE_METHOD, required = false) String codeChallengeMethod,
      @RequestParam(name = OAuthParam.SCOPE, required = false) String scope,
      HttpServletRequest request
                                  );

  @Operation(
      summary = "Submit consent (form)",
      description = "action=approve records the approval cookie and redirects upstream; action=deny returns access_denied to the client"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Consent page when no action is given"),
      @ApiResponse(responseCode = "302", description = "Redirect upstream or back to the client"),
      @ApiResponse(responseCode = "400", description = "invalid_request")
  })
  @PostMapping(value = AUTHORIZE, consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  ResponseEntity<String> submitAuthorization(
      @RequestParam(name = OAuthParam.CLIENT_ID, required = false) String clientId,
      @RequestParam(name = OAuthParam.REDIRECT_URI, required = false) String redirectUri,
      @RequestParam(name = OAuthParam.RESPONSE_TYPE, required = false) String responseType,
      @RequestParam(name = OAuthParam.STATE, required = false) String state,
      @RequestParam(name = OAuthParam.CODE_CHALLENGE, required = false) String codeChallenge,
      @RequestParam(name = OAuthParam.CODE_CHALLENGE_METHOD, required = false) String codeChallengeMethod,
      @RequestParam(name = OAuthParam.SCOPE, required = false) String scope,
      @RequestParam(name = OAuthParam.ACTION, required = false) String action,
      HttpServletRequest request,
      HttpServletResponse response
                                            );

  @Operation(summary = "Submit consent (JSON)")
  @PostMapping(value = AUTHORIZE, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<String> submitAuthorizationJson(
      @RequestBody AuthorizeRequestBody body,
      HttpServletRequest request,
      HttpServletResponse response
                                                );

  @Operation(
      summary = "Upstream callback",
      description = "Exchanges the upstream code, mints the downstream token and redirects to the client"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "302", description = "Redirect to the downstream redirect_uri with code and state"),
      @ApiResponse(responseCode = "400", description = "Invalid session or parameters"),
      @ApiResponse(responseCode = "500", description = "Profile lookup failed"),
      @ApiResponse(responseCode = "502", description = "Upstream token exchange failed")
  })
  @GetMapping(value = CALLBACK)
  ResponseEntity<Void> callback(
      @RequestParam(name = OAuthParam.CODE, required = false) String code,
      @RequestParam(name = OAuthParam.STATE, required = false) String state,
      @RequestParam(name = OAuthParam.ERROR, required = false) String error,
      @RequestParam(name = OAuthParam.ERROR_DESCRIPTION, required = false) String errorDescription
                               );

  @Operation(summary = "Exchange an authorization code for a bearer token")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Token issued"),
      @ApiResponse(responseCode = "400", description = "invalid_request or invalid_grant"),
      @ApiResponse(responseCode = "401", description = "invalid_client")
  })
  @PostMapping(value = TOKEN, consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<TokenResponse> token(
      @RequestParam(name = OAuthParam.GRANT_TYPE, required = false) String grantType,
      @RequestParam(name = OAuthParam.CODE, required = false) String code,
      @RequestParam(name = OAuthParam.CLIENT_ID, required = false) String clientId,
      @RequestParam(name = OAuthParam.CLIENT_SECRET, required = false) String clientSecret,
      @RequestParam(name = OAuthParam.CODE_VERIFIER, required = false) String codeVerifier,
      @RequestParam(name = OAuthParam.REDIRECT_URI, required = false) String redirectUri
                                     );

  @Operation(summary = "Dynamic client registration")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Client registered"),
      @ApiResponse(responseCode = "400", description = "invalid_request")
  })
  @PostMapping(value = REGISTER, consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<ClientRegistrationResponse> register(@RequestBody ClientRegistrationRequest registrationRequest);
}

package com.example.mcpauth.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;

/**
 * OAuth2 protocol error returned to the downstream client as {@code {error, error_description}}.
 */
@Getter
public class OAuth2Exception extends RuntimeException {

  public static final String INVALID_SESSION = "invalid_session";

  private final String errorCode;
  private final HttpStatus status;

  public OAuth2Exception(String errorCode, String message, HttpStatus status) {
    super(message);
    this.errorCode = errorCode;
    this.status = status;
  }

  public OAuth2Exception(String errorCode, String message) {
    this(errorCode, message, HttpStatus.BAD_REQUEST);
  }

  public static OAuth2Exception invalidRequest(String message) {
    return new OAuth2Exception(OAuth2ErrorCodes.INVALID_REQUEST, message);
  }

  public static OAuth2Exception invalidGrant(String message) {
    return new OAuth2Exception(OAuth2ErrorCodes.INVALID_GRANT, message);
  }

  public static OAuth2Exception invalidClient(String message) {
    return new OAuth2Exception(OAuth2ErrorCodes.INVALID_CLIENT, message, HttpStatus.UNAUTHORIZED);
  }

  public static OAuth2Exception invalidSession(String message) {
    return new OAuth2Exception(INVALID_SESSION, message);
  }
}

package com.example.mcpauth.web.rest.errors;

import com.example.mcpauth.exception.EncryptionException;
import com.example.mcpauth.exception.OAuth2Exception;
import com.example.mcpauth.exception.ResourceNotFoundException;
import com.example.mcpauth.exception.StoreException;
import com.example.mcpauth.exception.UpstreamIdentityException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global Error Handler
 *
 * Every failure becomes {@code {error, error_description, status, timestamp, path}}.
 * Upstream bodies and internal messages stay in the logs.
 */
@Slf4j
@RestControllerAdvice
public class GlobalErrorHandler {

  private static final String UPSTREAM_ERROR = "upstream_error";
  private static final String GENERIC_MESSAGE = "An error occurred processing your request";

  @ExceptionHandler(OAuth2Exception.class)
  public ResponseEntity<ErrorResponse> handleOAuth2Exception(OAuth2Exception ex, HttpServletRequest request) {
    log.warn("OAuth2 error {} on {}: {}", ex.getErrorCode(), request.getRequestURI(), ex.getMessage());
    return respond(ex.getStatus(), ex.getErrorCode(), ex.getMessage(), request);
  }

  @ExceptionHandler(UpstreamIdentityException.class)
  public ResponseEntity<ErrorResponse> handleUpstreamIdentityException(
      UpstreamIdentityException ex, HttpServletRequest request) {
    log.error("Upstream identity provider failure. Phase: {}, status: {}, error: {}, body: {}",
              ex.getPhase(), ex.getUpstreamStatus(), ex.getUpstreamError(), ex.getUpstreamBody(), ex);

    HttpStatus status = ex.getPhase() == UpstreamIdentityException.Phase.TOKEN_EXCHANGE
        ? HttpStatus.BAD_GATEWAY
        : HttpStatus.INTERNAL_SERVER_ERROR;
    return respond(status, UPSTREAM_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ErrorResponse> handleStoreException(StoreException ex, HttpServletRequest request) {
    log.error("Store error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, OAuth2ErrorCodes.SERVER_ERROR, "Storage temporarily unavailable",
                   request);
  }

  @ExceptionHandler(EncryptionException.class)
  public ResponseEntity<ErrorResponse> handleEncryptionException(EncryptionException ex, HttpServletRequest request) {
    log.error("Encryption error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, OAuth2ErrorCodes.SERVER_ERROR, GENERIC_MESSAGE, request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ErrorResponse> handleAccessDeniedException(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());
    return respond(HttpStatus.FORBIDDEN, ErrorResponse.FORBIDDEN, ex.getMessage(), request);
  }

  @ExceptionHandler({ResourceNotFoundException.class, NoResourceFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(Exception ex, HttpServletRequest request) {
    return respond(HttpStatus.NOT_FOUND, ErrorResponse.NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ErrorResponse> handleMissingParams(
      MissingServletRequestParameterException ex, HttpServletRequest request) {
    return respond(HttpStatus.BAD_REQUEST, OAuth2ErrorCodes.INVALID_REQUEST,
                   String.format("Missing required parameter: %s", ex.getParameterName()), request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    log.debug("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, OAuth2ErrorCodes.INVALID_REQUEST, "Malformed request body", request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, ErrorResponse.METHOD_NOT_ALLOWED,
                   String.format("Method %s not allowed", ex.getMethod()), request);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
    return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ErrorResponse.UNSUPPORTED_MEDIA_TYPE,
                   String.format("Content type %s not supported", ex.getContentType()), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
    log.error("Unexpected error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, OAuth2ErrorCodes.SERVER_ERROR, GENERIC_MESSAGE, request);
  }

  private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String description,
                                                       HttpServletRequest request) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(ErrorResponse.of(status, error, description, request.getRequestURI()));
  }
}

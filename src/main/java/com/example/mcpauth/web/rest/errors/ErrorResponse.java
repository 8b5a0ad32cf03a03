package com.example.mcpauth.web.rest.errors;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * JSON error body shared by the error handler and the security entry point.
 */
public record ErrorResponse(
    String error,
    @JsonProperty("error_description") String errorDescription,
    int status,
    Instant timestamp,
    String path
) {

  public static final String UNAUTHORIZED = "unauthorized";
  public static final String FORBIDDEN = "forbidden";
  public static final String NOT_FOUND = "not_found";
  public static final String METHOD_NOT_ALLOWED = "method_not_allowed";
  public static final String UNSUPPORTED_MEDIA_TYPE = "unsupported_media_type";
  public static final String SERVER_ERROR = "server_error";

  public static ErrorResponse of(HttpStatus status, String error, String description, String path) {
    return new ErrorResponse(error, description, status.value(), Instant.now(), path);
  }
}

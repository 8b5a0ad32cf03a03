package com.example.mcpauth.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Cookie helpers built on Spring's {@link ResponseCookie}.
 * Values are URL-encoded on write and decoded on read.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  private static final String COOKIE_PATH = "/";
  private static final String SAME_SITE_LAX = "Lax";

  public static Optional<Cookie> getCookie(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, name));
  }

  /**
   * Get decoded cookie value safely
   */
  public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
    return getCookie(request, name)
        .map(Cookie::getValue)
        .filter(value -> !value.isEmpty())
        .map(CookieUtil::decodeCookieValue);
  }

  /**
   * Sets an HttpOnly cookie. SameSite=Lax so it survives the top-level redirect back from
   * the identity provider.
   */
  public static void setCookie(HttpServletResponse response, String name, String value,
                               Duration maxAge, boolean secure) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Cookie value cannot be null or empty");
    }

    ResponseCookie cookie = ResponseCookie
        .from(name, encodeCookieValue(value))
        .httpOnly(true)
        .secure(secure)
        .path(COOKIE_PATH)
        .maxAge(maxAge)
        .sameSite(SAME_SITE_LAX)
        .build();

    response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    log.debug("Set cookie: name={}, secure={}, sameSite={}", name, secure, SAME_SITE_LAX);
  }

  private static String encodeCookieValue(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String decodeCookieValue(String encodedValue) {
    try {
      return URLDecoder.decode(encodedValue, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      log.debug("Failed to decode cookie value: {}", e.getMessage());
      return encodedValue;
    }
  }
}

package com.example.mcpauth.service;

import com.example.mcpauth.properties.ApplicationProperties;
import com.example.mcpauth.util.CookieUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Signs and verifies the consent cookie listing the client ids a browser has approved.
 *
 * <p>Cookie value: {@code base64(json list) + "." + base64(HMAC-SHA256(base64 payload))}.
 */
@Slf4j
@Service
public class ApprovalCookieSigner {

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final TypeReference<List<String>> CLIENT_ID_LIST = new TypeReference<>() {};

  private final ApplicationProperties.ApprovalProperties approval;
  private final ObjectMapper objectMapper;
  private final SecretKeySpec signingKey;

  public ApprovalCookieSigner(ApplicationProperties properties, ObjectMapper objectMapper) {
    this.approval = properties.approval();
    this.objectMapper = objectMapper;
    this.signingKey = new SecretKeySpec(
        approval.signingKey().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
  }

  public String sign(List<String> clientIds) {
    try {
      String payload = Base64.getEncoder().encodeToString(objectMapper.writeValueAsBytes(clientIds));
      return payload + "." + Base64.getEncoder().encodeToString(hmac(payload));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize approved client list", e);
    }
  }

  /**
   * @return the approved client ids, or empty when the value is malformed or its signature
   *     does not match
   */
  public Optional<List<String>> verify(String cookieValue) {
    if (cookieValue == null) {
      return Optional.empty();
    }
    int separator = cookieValue.indexOf('.');
    if (separator <= 0 || separator == cookieValue.length() - 1) {
      return Optional.empty();
    }
    String payload = cookieValue.substring(0, separator);
    String signature = cookieValue.substring(separator + 1);

    try {
      byte[] expected = hmac(payload);
      byte[] actual = Base64.getDecoder().decode(signature);
      if (!MessageDigest.isEqual(expected, actual)) {
        log.debug("Approval cookie signature mismatch");
        return Optional.empty();
      }
      List<String> clientIds = objectMapper.readValue(Base64.getDecoder().decode(payload), CLIENT_ID_LIST);
      return Optional.ofNullable(clientIds);
    } catch (IllegalArgumentException | IOException e) {
      log.debug("Malformed approval cookie: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public boolean isApproved(HttpServletRequest request, String clientId) {
    return readApprovedClients(request).contains(clientId);
  }

  /**
   * Adds {@code clientId} to the browser's approved set and re-signs the cookie.
   * A cookie that fails verification is replaced, not merged.
   */
  public void approve(HttpServletRequest request, HttpServletResponse response, String clientId) {
    List<String> approved = new ArrayList<>(readApprovedClients(request));
    if (!approved.contains(clientId)) {
      approved.add(clientId);
    }
    CookieUtil.setCookie(response, approval.cookieName(), sign(approved),
                         approval.cookieMaxAge(), approval.secureCookie());
    log.info("Client {} approved by user, {} client(s) in approval cookie", clientId, approved.size());
  }

  private List<String> readApprovedClients(HttpServletRequest request) {
    return CookieUtil.getCookieValue(request, approval.cookieName())
        .flatMap(this::verify)
        .orElse(List.of());
  }

  private byte[] hmac(String payload) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(signingKey);
      return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }
}

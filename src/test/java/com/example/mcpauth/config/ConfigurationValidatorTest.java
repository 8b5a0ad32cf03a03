package com.example.mcpauth.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.mcpauth.TestProperties;
import com.example.mcpauth.domain.entity.IdpProvider;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConfigurationValidatorTest {

  @Test
  void defaultTestConfigurationIsValid() {
    assertThat(validator(TestProperties.defaults()).validate()).isEmpty();
  }

  @Test
  void plainHttpIsOnlyAllowedForLocalhost() {
    assertThat(validator(TestProperties.defaults().baseUrl("http://127.0.0.1:8080")).validate()).isEmpty();
    assertThat(validator(TestProperties.defaults().baseUrl("http://gateway.example.com")).validate())
        .singleElement().asString().contains("HTTPS");
  }

  @Test
  void baseUrlMustBeAbsoluteWithoutTrailingSlash() {
    assertThat(validator(TestProperties.defaults().baseUrl("https://gateway.example.com/")).validate())
        .singleElement().asString().contains("must not end with '/'");
    assertThat(validator(TestProperties.defaults().baseUrl("gateway")).validate()).hasSize(1);
  }

  @Test
  void activeProviderCredentialsAreRequired() {
    assertThat(validator(TestProperties.defaults().googleCredentials("", null)).validate()).hasSize(2);
    assertThat(validator(TestProperties.defaults().provider(IdpProvider.GITHUB).googleCredentials("", null))
                   .validate()).isEmpty();
  }

  @Test
  void sessionTtlMustBePositiveAndShorterThanTokenTtl() {
    assertThat(validator(TestProperties.defaults().ttls(Duration.ofDays(8), Duration.ofDays(7))).validate())
        .singleElement().asString().contains("Session TTL");
    assertThat(validator(TestProperties.defaults().ttls(Duration.ZERO, Duration.ofDays(7))).validate())
        .isNotEmpty();
  }

  @Test
  void redirectEnforcementNeedsRegisteredClients() {
    assertThat(validator(TestProperties.defaults().strictClients(false, true)).validate()).hasSize(1);
    assertThat(validator(TestProperties.defaults().strictClients(true, true)).validate()).isEmpty();
  }

  @Test
  void shortSigningKeyIsRejected() {
    assertThat(validator(TestProperties.defaults().signingKey("too-short")).validate())
        .singleElement().asString().contains("signing-key");
  }

  @Test
  void encryptionKeyMustBe256Bits() {
    assertThat(validator(TestProperties.defaults().encryptionKey("c2hvcnQ=")).validate()).hasSize(1);
    assertThat(validator(TestProperties.defaults().encryptionKey("%%%")).validate())
        .singleElement().asString().contains("Base64");
  }

  @Test
  void afterPropertiesSetListsEveryViolation() {
    ConfigurationValidator validator = validator(TestProperties.defaults()
                                                     .baseUrl("http://gateway.example.com")
                                                     .requestLimits(5, 10));

    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("2 error(s)")
        .hasMessageContaining("HTTPS")
        .hasMessageContaining("max requests per host");
  }

  private static ConfigurationValidator validator(TestProperties properties) {
    return new ConfigurationValidator(properties.build());
  }
}

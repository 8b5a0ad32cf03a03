package com.example.mcpauth;

import com.example.mcpauth.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * MCP Auth Gateway
 *
 * OAuth 2.0 authorization bridge for tool-calling clients:
 * - authorization server toward downstream MCP clients (inspector, assistants, proxies)
 * - OAuth client toward the upstream identity provider (Google or GitHub)
 * - key-value store with TTL as the only shared state
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class McpAuthGatewayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(McpAuthGatewayApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}

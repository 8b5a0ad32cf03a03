package com.example.mcpauth.config;

import com.example.mcpauth.adapter.store.InMemoryKeyValueStore;
import com.example.mcpauth.adapter.store.KeyValueStore;
import com.example.mcpauth.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-local store for development and tests. State is lost on restart and not shared
 * between instances.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "app.store", name = "type", havingValue = "memory")
public class InMemoryStoreConfig {

  @Bean
  public KeyValueStore inMemoryKeyValueStore(ApplicationProperties properties) {
    log.warn("Using in-memory store; do not run more than one instance with this setting");
    return new InMemoryKeyValueStore(properties.store().maxEntries());
  }
}

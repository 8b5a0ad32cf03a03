package com.example.mcpauth.adapter.idp;

import com.example.mcpauth.domain.entity.IdpProvider;
import com.example.mcpauth.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the {@link IdpClient} for the configured upstream provider.
 */
@Slf4j
@Component
public class IdpClientRegistry {

  private final Map<IdpProvider, IdpClient> clients = new EnumMap<>(IdpProvider.class);
  private final IdpProvider activeProvider;

  public IdpClientRegistry(List<IdpClient> idpClients, ApplicationProperties properties) {
    idpClients.forEach(client -> clients.put(client.provider(), client));
    this.activeProvider = properties.upstream().provider();
    if (!clients.containsKey(activeProvider)) {
      throw new IllegalStateException("No IdP client registered for provider " + activeProvider);
    }
    log.info("Upstream identity provider: {}", activeProvider);
  }

  public IdpClient active() {
    return get(activeProvider);
  }

  public IdpClient get(IdpProvider provider) {
    IdpClient client = clients.get(provider);
    if (client == null) {
      throw new IllegalArgumentException("Unsupported identity provider: " + provider);
    }
    return client;
  }
}

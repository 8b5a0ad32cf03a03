package com.example.mcpauth.config;

import com.example.mcpauth.adapter.store.KeyValueStore;
import com.example.mcpauth.adapter.store.RedisKeyValueStore;
import com.example.mcpauth.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis-backed store wiring with a pooled Lettuce connection.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "app.store", name = "type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisConfig {

  private final ApplicationProperties properties;

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.StoreProperties.RedisProperties.PoolProperties poolProps =
        properties.store().redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());
    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    return config;
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {
    ApplicationProperties.StoreProperties.RedisProperties redisProps = properties.store().redis();

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisProps.host());
    redisConfig.setPort(redisProps.port());
    redisConfig.setDatabase(redisProps.database());
    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      redisConfig.setPassword(redisProps.password());
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(ClientOptions.builder()
                               .socketOptions(SocketOptions.builder()
                                                  .connectTimeout(redisProps.timeout())
                                                  .keepAlive(true)
                                                  .build())
                               .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                               .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()))
                               .build());

    if (redisProps.ssl()) {
      builder.useSsl();
    }

    log.info("Using Redis store at {}:{} (ssl={})", redisProps.host(), redisProps.port(), redisProps.ssl());
    return new LettuceConnectionFactory(redisConfig, builder.build());
  }

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    StringRedisTemplate template = new StringRedisTemplate();
    template.setConnectionFactory(connectionFactory);
    template.afterPropertiesSet();
    return template;
  }

  @Bean
  public KeyValueStore redisKeyValueStore(StringRedisTemplate stringRedisTemplate) {
    return new RedisKeyValueStore(stringRedisTemplate);
  }
}

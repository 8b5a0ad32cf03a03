package com.example.mcpauth.adapter.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mcpauth.exception.StoreException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisKeyValueStoreTest {

  @Mock
  private StringRedisTemplate redisTemplate;

  @Mock
  private ValueOperations<String, String> valueOperations;

  @InjectMocks
  private RedisKeyValueStore store;

  @BeforeEach
  void setUp() {
    lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
  }

  @Test
  void getReturnsStoredValue() {
    when(valueOperations.get("client:abc")).thenReturn("{}");

    assertThat(store.get("client:abc")).contains("{}");
  }

  @Test
  void getReturnsEmptyForMissingKey() {
    assertThat(store.get("client:missing")).isEmpty();
  }

  @Test
  void putDelegatesTtlToRedis() {
    store.put("session:abc", "value", Duration.ofHours(1));

    verify(valueOperations).set("session:abc", "value", Duration.ofHours(1));
  }

  @Test
  void putIfAbsentMapsSetNxResult() {
    when(valueOperations.setIfAbsent("used_code:a", "1", Duration.ofMinutes(15))).thenReturn(true);
    when(valueOperations.setIfAbsent("used_code:b", "1", Duration.ofMinutes(15))).thenReturn(false);

    assertThat(store.putIfAbsent("used_code:a", "1", Duration.ofMinutes(15))).isTrue();
    assertThat(store.putIfAbsent("used_code:b", "1", Duration.ofMinutes(15))).isFalse();
  }

  @Test
  void connectionFailureBecomesStoreException() {
    when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

    assertThatThrownBy(() -> store.get("session:abc"))
        .isInstanceOf(StoreException.class)
        .hasCauseInstanceOf(RedisConnectionFailureException.class);
  }

  @Test
  void deleteFailureBecomesStoreException() {
    when(redisTemplate.delete("session:abc")).thenThrow(new RedisConnectionFailureException("down"));

    assertThatThrownBy(() -> store.delete("session:abc")).isInstanceOf(StoreException.class);
  }
}

package com.example.mcpauth.adapter.store;

import com.example.mcpauth.exception.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON codec for records kept in the {@link KeyValueStore}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreRecordMapper {

  private final ObjectMapper objectMapper;

  public String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new StoreException("Cannot serialize " + value.getClass().getSimpleName(), e);
    }
  }

  /**
   * A stored value that no longer parses is treated as corrupt and reported as a store failure.
   */
  public <T> T read(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      log.error("Corrupt {} record in store: {}", type.getSimpleName(), e.getOriginalMessage());
      throw new StoreException("Cannot deserialize " + type.getSimpleName(), e);
    }
  }
}

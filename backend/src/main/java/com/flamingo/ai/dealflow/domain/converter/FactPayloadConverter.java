package com.flamingo.ai.dealflow.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * JPA converter for fact payloads. Keys are written in sorted order so the stored JSON of equal
 * payloads is byte-identical.
 */
@Converter
@Slf4j
public class FactPayloadConverter implements AttributeConverter<Map<String, String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<TreeMap<String, String>> MAP_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(Map<String, String> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return "{}";
    }
    try {
      return MAPPER.writeValueAsString(new TreeMap<>(attribute));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize fact payload", e);
    }
  }

  @Override
  public Map<String, String> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return Collections.emptyMap();
    }
    try {
      return Collections.unmodifiableMap(MAPPER.readValue(dbData, MAP_TYPE));
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize fact payload: {}", e.getMessage());
      return Collections.emptyMap();
    }
  }
}

package com.gentoro.verifier.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Map;

/** Shared, pre-configured Jackson mappers. Both instances are thread-safe once built. */
public final class JacksonUtility {
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private static final ObjectMapper JSON_MAPPER =
      JsonMapper.builder()
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .serializationInclusion(JsonInclude.Include.NON_NULL)
          .build();

  // Same logical content always yields the same bytes: keys sorted, no whitespace.
  private static final ObjectMapper CANONICAL_MAPPER =
      JsonMapper.builder()
          .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
          .disable(SerializationFeature.INDENT_OUTPUT)
          .serializationInclusion(JsonInclude.Include.NON_NULL)
          .build();

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static ObjectMapper getCanonicalMapper() {
    return CANONICAL_MAPPER;
  }

  /** Convert records, beans and nested values into a plain map tree. */
  public static Map<String, Object> toMap(Object value) {
    return JSON_MAPPER.convertValue(value, MAP_TYPE);
  }
}

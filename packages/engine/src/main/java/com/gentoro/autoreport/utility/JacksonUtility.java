package com.gentoro.autoreport.utility;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared, preconfigured Jackson mappers. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory())
          .registerModule(new JavaTimeModule())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  /** Serialize to pretty-printed JSON, falling back to {@code toString()} on failure. */
  public static String toPrettyJson(Object value) {
    try {
      return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (Exception e) {
      return String.valueOf(value);
    }
  }
}

package com.bluecollar.rest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** The Jackson configuration shared by request parsing and Javalin's JSON responses. */
public final class JsonMappers {

  private static final ObjectMapper DEFAULT = newObjectMapper();

  private JsonMappers() {
    // Utility class, no instances
  }

  /** Request bodies may carry fields the API does not know; they are ignored. */
  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
  }

  /** Returns the shared, fully configured mapper. Do not reconfigure it. */
  public static ObjectMapper shared() {
    return DEFAULT;
  }
}

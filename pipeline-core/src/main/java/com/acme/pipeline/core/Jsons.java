package com.acme.pipeline.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;

public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private Jsons() {}

  public static ObjectMapper mapper() {
    return M;
  }

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static byte[] toBytes(Object o) {
    try {
      return M.writeValueAsBytes(o);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Reads a value, failing with {@link IOException} on malformed or mismatched input. */
  public static <T> T fromBytes(byte[] json, Class<T> type) throws IOException {
    return M.readValue(json, type);
  }

  public static <T> T fromJson(String json, Class<T> type) {
    try {
      return M.readValue(json, type);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

package io.jobworker.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Objects;

/**
 * Jackson-backed codec for job payloads.
 *
 * <p>Payloads are arbitrary nested JSON objects. {@link #decode} accepts only a JSON object
 * at the top level; anything else (arrays, scalars, blank text, syntax errors) raises
 * {@link IllegalArgumentException}.
 */
public final class PayloadCodec {
  private static final PayloadCodec DEFAULT = new PayloadCodec(new ObjectMapper());

  private final ObjectMapper mapper;

  public PayloadCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static PayloadCodec getDefault() {
    return DEFAULT;
  }

  /**
   * Parses a payload into a JSON object tree.
   *
   * @throws IllegalArgumentException if the text is not a JSON object
   */
  public ObjectNode decode(String payloadJson) {
    if (payloadJson == null || payloadJson.isBlank()) {
      throw new IllegalArgumentException("Payload is empty");
    }
    JsonNode node;
    try {
      node = mapper.readTree(payloadJson);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Payload is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Payload must be a JSON object");
    }
    return (ObjectNode) node;
  }

  public String encode(Map<String, ?> payload) {
    Objects.requireNonNull(payload, "payload");
    try {
      return mapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Payload cannot be encoded", e);
    }
  }

  public ObjectNode newObject() {
    return mapper.createObjectNode();
  }

  public String encode(JsonNode payload) {
    Objects.requireNonNull(payload, "payload");
    try {
      return mapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Payload cannot be encoded", e);
    }
  }

  /**
   * Returns the text value of {@code field}, or {@code null} when absent, null or blank.
   */
  public static String text(JsonNode node, String field) {
    if (node == null) {
      return null;
    }
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    String text = value.asText();
    return text.isBlank() ? null : text;
  }
}

package org.chucc.configstore.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import org.chucc.configstore.exception.InvariantViolationException;
import org.springframework.stereotype.Component;

/**
 * JSON codec for configuration events.
 * Payloads carry the {@code eventType} discriminator next to the event fields,
 * timestamps are written as ISO-8601 strings.
 */
@Component
public class ConfigEventSerializer {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;

  /**
   * Constructs a ConfigEventSerializer.
   *
   * @param objectMapper the Jackson object mapper
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a Spring-managed bean and is intentionally shared")
  public ConfigEventSerializer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Creates a serializer with a standalone mapper configured like the application's.
   *
   * @return a new serializer
   */
  public static ConfigEventSerializer withDefaultMapper() {
    ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return new ConfigEventSerializer(mapper);
  }

  /**
   * Serializes an event to JSON.
   *
   * @param event the event
   * @return the JSON payload
   * @throws InvariantViolationException if the event cannot be serialized
   */
  public String serialize(ConfigEvent event) {
    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new InvariantViolationException(
          "Failed to serialize event " + event.eventId() + ": " + e.getOriginalMessage());
    }
  }

  /**
   * Deserializes an event from JSON.
   *
   * @param json the JSON payload
   * @return the event
   * @throws InvariantViolationException if the payload is not a known event
   */
  public ConfigEvent deserialize(String json) {
    try {
      return objectMapper.readValue(json, ConfigEvent.class);
    } catch (JsonProcessingException e) {
      throw new InvariantViolationException(
          "Failed to deserialize event payload: " + e.getOriginalMessage());
    }
  }

  /**
   * Converts an event to its field map, without the type discriminator.
   *
   * @param event the event
   * @return the event fields keyed by their JSON names
   */
  public Map<String, Object> toMap(ConfigEvent event) {
    Map<String, Object> fields = objectMapper.convertValue(event, MAP_TYPE);
    fields.remove("eventType");
    return fields;
  }
}

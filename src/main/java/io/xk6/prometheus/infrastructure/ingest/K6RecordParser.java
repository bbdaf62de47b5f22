package io.xk6.prometheus.infrastructure.ingest;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming parser for one line of k6 JSON output.
 * <p>Only the fields the exporter consumes are materialized; everything else is skipped with
 * {@link JsonParser#skipChildren()}.</p>
 */
final class K6RecordParser {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Fields of one {@code Metric} or {@code Point} record.
   *
   * @param type record type ({@code Metric}, {@code Point}, ...)
   * @param metric top-level metric name
   * @param dataName {@code data.name} of a Metric record
   * @param dataType {@code data.type} of a Metric record
   * @param time {@code data.time} as text
   * @param value {@code data.value}; {@code null} when absent
   * @param tags {@code data.tags} with null values dropped and scalars stringified
   * @param hasData whether a {@code data} object was present
   */
  record K6Record(
      String type,
      String metric,
      String dataName,
      String dataType,
      String time,
      Double value,
      Map<String, String> tags,
      boolean hasData) {}

  /**
   * Parses one record.
   *
   * @param line JSON object text
   * @return extracted fields
   * @throws IllegalArgumentException when the line is not a JSON object or a consumed field has the wrong type
   */
  K6Record parse(String line) {
    Objects.requireNonNull(line, "line");
    try (JsonParser parser = factory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("record is not a JSON object");
      }
      String type = null;
      String metric = null;
      Fields data = null;
      JsonToken token;
      while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken valueToken = parser.nextToken();
        switch (field) {
          case "type" -> type = textOrNull(parser, valueToken, field);
          case "metric" -> metric = textOrNull(parser, valueToken, field);
          case "data" -> data = readData(parser, valueToken);
          default -> parser.skipChildren();
        }
      }
      if (token != JsonToken.END_OBJECT || parser.nextToken() != null) {
        throw new IllegalArgumentException("record has trailing content");
      }
      Fields fields = data == null ? new Fields() : data;
      return new K6Record(type, metric, fields.name, fields.type, fields.time, fields.value,
          fields.tags, data != null);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException("unreadable record: " + ex.getMessage(), ex);
    }
  }

  private static Fields readData(JsonParser parser, JsonToken token) throws IOException {
    if (token != JsonToken.START_OBJECT) {
      throw new IllegalArgumentException("data must be a JSON object");
    }
    Fields fields = new Fields();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      switch (field) {
        case "name" -> fields.name = textOrNull(parser, valueToken, "data.name");
        case "type" -> fields.type = textOrNull(parser, valueToken, "data.type");
        case "time" -> fields.time = textOrNull(parser, valueToken, "data.time");
        case "value" -> fields.value = numberOrNull(parser, valueToken);
        case "tags" -> readTags(parser, valueToken, fields.tags);
        default -> parser.skipChildren();
      }
    }
    return fields;
  }

  private static void readTags(JsonParser parser, JsonToken token, Map<String, String> tags) throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return;
    }
    if (token != JsonToken.START_OBJECT) {
      throw new IllegalArgumentException("data.tags must be a JSON object");
    }
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String key = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      if (valueToken.isScalarValue() && valueToken != JsonToken.VALUE_NULL) {
        tags.put(key, parser.getText());
      } else {
        parser.skipChildren();
      }
    }
  }

  private static String textOrNull(JsonParser parser, JsonToken token, String field) throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (token != JsonToken.VALUE_STRING) {
      throw new IllegalArgumentException(field + " must be a string");
    }
    return parser.getText();
  }

  private static Double numberOrNull(JsonParser parser, JsonToken token) throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (!token.isNumeric()) {
      throw new IllegalArgumentException("data.value is not a number: " + parser.getText());
    }
    return parser.getDoubleValue();
  }

  private static final class Fields {
    private String name;
    private String type;
    private String time;
    private Double value;
    private final Map<String, String> tags = new LinkedHashMap<>();
  }
}

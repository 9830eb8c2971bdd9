package ca.gc.cra.vantage.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper that parses documents into {@link Map}/{@link List} structures and reads typed fields
 * from them with path-qualified diagnostics.
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a JSON document whose root must be an object.
   *
   * @param reader source of the document; closed by this call
   * @return parsed root object
   * @throws IOException when reading fails
   * @throws IllegalArgumentException when the document is malformed or its root is not an object
   */
  public Map<String, Object> parseObject(Reader reader) throws IOException {
    Objects.requireNonNull(reader, "reader");
    try (JsonParser parser = factory.createParser(reader)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("JSON root must be an object but was " + token);
      }
      Map<String, Object> root = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return root;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON document: " + ex.getOriginalMessage(), ex);
    }
  }

  /**
   * Returns the list stored under {@code key}, or an empty list when absent or {@code null}.
   *
   * @param node object to read from
   * @param key field name
   * @param path diagnostic path of {@code node}
   * @return list value
   * @throws IllegalArgumentException when the field is not an array
   */
  public static List<Object> optionalList(Map<String, Object> node, String key, String path) {
    Object value = node.get(key);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw new IllegalArgumentException(path + "." + key + " must be an array");
    }
    return new ArrayList<>(list);
  }

  /**
   * Casts an element to an object node.
   *
   * @param value element
   * @param path diagnostic path of the element
   * @return object node
   * @throws IllegalArgumentException when the element is not an object
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object value, String path) {
    if (!(value instanceof Map<?, ?>)) {
      throw new IllegalArgumentException(path + " must be an object");
    }
    return (Map<String, Object>) value;
  }

  /**
   * Reads a required integer field.
   *
   * @param node object to read from
   * @param key field name
   * @param path diagnostic path of {@code node}
   * @return integer value
   * @throws IllegalArgumentException when the field is missing or not an integral number in int range
   */
  public static int requireInt(Map<String, Object> node, String key, String path) {
    Object value = node.get(key);
    if (value == null) {
      throw new IllegalArgumentException(path + "." + key + " is required");
    }
    return toInt(value, path + "." + key);
  }

  /**
   * Reads an optional integer field.
   *
   * @param node object to read from
   * @param key field name
   * @param path diagnostic path of {@code node}
   * @param defaultValue value returned when the field is absent or {@code null}
   * @return integer value
   */
  public static int optionalInt(Map<String, Object> node, String key, String path, int defaultValue) {
    Object value = node.get(key);
    return value == null ? defaultValue : toInt(value, path + "." + key);
  }

  /**
   * Reads an optional string field.
   *
   * @param node object to read from
   * @param key field name
   * @param path diagnostic path of {@code node}
   * @return string value, or {@code ""} when absent or {@code null}
   */
  public static String optionalString(Map<String, Object> node, String key, String path) {
    Object value = node.get(key);
    if (value == null) {
      return "";
    }
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException(path + "." + key + " must be a string");
    }
    return text;
  }

  /**
   * Converts an element to an int.
   *
   * @param value numeric element
   * @param path diagnostic path
   * @return integer value
   */
  public static int toInt(Object value, String path) {
    if (!(value instanceof Integer) && !(value instanceof Long)) {
      throw new IllegalArgumentException(path + " must be an integer");
    }
    long number = ((Number) value).longValue();
    if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(path + " is out of range: " + number);
    }
    return (int) number;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}

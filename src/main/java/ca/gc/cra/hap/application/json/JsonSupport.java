package ca.gc.cra.hap.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Streaming JSON helper shared by the canonicalizers, payload codec, and decision-file reader.
 *
 * <p>Parsing yields plain {@link Map}/{@link List}/scalar graphs. Writing is always compact (no
 * insignificant whitespace) so the output can be hashed or signed directly.</p>
 *
 * @since 0.3.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /** Callback that writes members or elements into an open generator. */
  @FunctionalInterface
  public interface JsonBody {
    void write(JsonGenerator generator) throws IOException;
  }

  /**
   * Parses the supplied JSON string into an object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException("JSON document is empty");
      }
      Object value = readValue(parser, token);
      ensureNoTrailing(parser);
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON object and returns it as a map.
   *
   * @param json JSON document
   * @return parsed members in document order
   * @throws IllegalArgumentException when the document is not an object
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> parseObject(String json) {
    Object value = parse(json);
    if (!(value instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("JSON document is not an object");
    }
    return (Map<String, Object>) value;
  }

  /**
   * Splits a top-level JSON object into its members, keeping the exact source text of each value.
   *
   * <p>Used where a nested document was signed as bytes: re-serializing the parsed value could
   * change escaping or member order and invalidate the signature.</p>
   *
   * @param json JSON object document
   * @return member name to verbatim value text, in document order
   * @throws IllegalArgumentException when the document is not an object or has duplicate members
   */
  public Map<String, String> rawMembers(String json) {
    Objects.requireNonNull(json, "json");
    Map<String, String> members = new LinkedHashMap<>();
    try (JsonParser parser = factory.createParser(json)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("JSON document is not an object");
      }
      while (true) {
        JsonToken token = parser.nextToken();
        if (token == JsonToken.END_OBJECT) {
          break;
        }
        if (token != JsonToken.FIELD_NAME) {
          throw new IllegalArgumentException("Expected field name but found " + token);
        }
        String name = parser.currentName();
        JsonToken valueToken = parser.nextToken();
        if (valueToken == null) {
          throw new IllegalArgumentException("Unexpected end of JSON document");
        }
        String raw;
        if (valueToken == JsonToken.START_OBJECT || valueToken == JsonToken.START_ARRAY) {
          int start = (int) parser.currentTokenLocation().getCharOffset();
          parser.skipChildren();
          int end = (int) parser.currentLocation().getCharOffset();
          raw = json.substring(start, end);
        } else {
          raw = write(readValue(parser, valueToken), false);
        }
        if (members.put(name, raw) != null) {
          throw new IllegalArgumentException("Duplicate member: " + name);
        }
      }
      ensureNoTrailing(parser);
      return members;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Writes a compact JSON object whose members are emitted by {@code body}, in the order it writes them.
   *
   * @param body member writer
   * @return compact JSON text
   */
  public String writeObject(JsonBody body) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      body.write(generator);
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write JSON", ex);
    }
    return out.toString();
  }

  /**
   * Serializes a map/list/scalar graph as compact JSON.
   *
   * @param value graph to write
   * @param sortKeys whether object keys are written in lexicographic order at every depth
   * @return compact JSON text
   */
  public String write(Object value, boolean sortKeys) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      writeValue(generator, value, sortKeys);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write JSON", ex);
    }
    return out.toString();
  }

  private void writeValue(JsonGenerator generator, Object value, boolean sortKeys) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number number) {
      generator.writeNumber(number.toString());
    } else if (value instanceof Map<?, ?> map) {
      Map<?, ?> ordered = map;
      if (sortKeys) {
        Map<String, Object> sorted = new TreeMap<>();
        map.forEach((key, member) -> sorted.put(String.valueOf(key), member));
        ordered = sorted;
      }
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : ordered.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue(), sortKeys);
      }
      generator.writeEndObject();
    } else if (value instanceof Collection<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item, sortKeys);
      }
      generator.writeEndArray();
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
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
      String fieldName = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      if (valueToken == null) {
        throw new IllegalArgumentException("Unexpected end of JSON document");
      }
      if (map.containsKey(fieldName)) {
        throw new IllegalArgumentException("Duplicate member: " + fieldName);
      }
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
      if (token == null) {
        throw new IllegalArgumentException("Unexpected end of JSON document");
      }
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static void ensureNoTrailing(JsonParser parser) throws IOException {
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new IllegalArgumentException("JSON document contains trailing content");
    }
  }
}

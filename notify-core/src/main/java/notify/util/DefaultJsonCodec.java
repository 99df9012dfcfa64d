package notify.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat string-to-string JSON objects.
 *
 * <p>Obtain it through {@link JsonCodec#getDefault()}. Nested objects, arrays, numbers
 * and booleans are rejected; callers store such values as strings.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder out = new StringBuilder(values.size() * 16).append('{');
    String separator = "";
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object keys cannot be null");
      }
      out.append(separator);
      separator = ",";
      writeString(out, entry.getKey());
      out.append(':');
      if (entry.getValue() == null) {
        out.append("null");
      } else {
        writeString(out, entry.getValue());
      }
    }
    return out.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    return new Cursor(json).readObject();
  }

  private static void writeString(StringBuilder out, String value) {
    out.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\b' -> out.append("\\b");
        case '\f' -> out.append("\\f");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> {
          if (c < 0x20) {
            out.append(String.format("\\u%04x", (int) c));
          } else {
            out.append(c);
          }
        }
      }
    }
    out.append('"');
  }

  /** Single-pass reader over one JSON document. */
  private static final class Cursor {
    private final String input;
    private int pos;

    private Cursor(String input) {
      this.input = input;
    }

    Map<String, String> readObject() {
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      if (peek() == '}') {
        pos++;
        return finish(result);
      }
      while (true) {
        if (peek() != '"') {
          throw fail("Expected string key");
        }
        pos++;
        String key = readString();
        expect(':');
        if (input.startsWith("null", skipWhitespace())) {
          pos += 4;
        } else if (peek() == '"') {
          pos++;
          result.put(key, readString());
        } else {
          throw fail("Expected string value or null for key '" + key + "'");
        }
        char next = peek();
        pos++;
        if (next == '}') {
          return finish(result);
        }
        if (next != ',') {
          throw fail("Expected ',' or '}'");
        }
        skipWhitespace();
      }
    }

    private Map<String, String> finish(Map<String, String> result) {
      if (skipWhitespace() != input.length()) {
        throw fail("Trailing content after JSON object");
      }
      return result;
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw fail("Invalid escape sequence");
        }
        char escaped = input.charAt(pos++);
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> sb.append(readUnicode());
          default -> throw fail("Unsupported escape sequence: \\" + escaped);
        }
      }
      throw fail("Unterminated string");
    }

    private char readUnicode() {
      if (pos + 4 > input.length()) {
        throw fail("Invalid unicode escape");
      }
      String hex = input.substring(pos, pos + 4);
      pos += 4;
      try {
        return (char) Integer.parseInt(hex, 16);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid unicode escape: \\u" + hex, e);
      }
    }

    private void expect(char expected) {
      if (peek() != expected) {
        throw fail("Expected '" + expected + "'");
      }
      pos++;
    }

    private char peek() {
      skipWhitespace();
      if (pos >= input.length()) {
        throw fail("Unexpected end of JSON object");
      }
      return input.charAt(pos);
    }

    private int skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
      return pos;
    }

    private IllegalArgumentException fail(String message) {
      return new IllegalArgumentException(message + " at offset " + pos);
    }
  }
}

package revision.codec;

import revision.model.EntityModel;
import revision.spi.SerializationCodec;

import java.util.List;
import java.util.Objects;

/**
 * Lightweight JSON encoder for entity snapshots. Has no external dependencies.
 *
 * <p>An entity is written as a one-element array:
 * <pre>{@code
 * [{"model":"shop.order","pk":"42","fields":{"reference":"A-1","total":12.5,"tags":["x","y"]}}]
 * }</pre>
 *
 * <p>{@code null}, booleans and finite numbers are written as JSON literals,
 * {@link Iterable} values (e.g. the ids of a many-to-many relation) as arrays,
 * and everything else as the string returned by {@code toString()}. The model
 * label is the entity's own model, not its concrete model.
 */
public final class JsonSerializationCodec implements SerializationCodec {
  public static final String FORMAT = "json";

  public static final JsonSerializationCodec INSTANCE = new JsonSerializationCodec();

  private JsonSerializationCodec() {
  }

  @Override
  public boolean supports(String format) {
    return FORMAT.equals(format);
  }

  @Override
  public <T> String serialize(String format, EntityModel<T> model, T entity, List<String> fields) {
    if (!supports(format)) {
      throw new IllegalArgumentException("Unsupported serialization format: " + format);
    }
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(fields, "fields");
    StringBuilder sb = new StringBuilder();
    sb.append("[{\"model\":\"").append(escape(model.label())).append("\",\"pk\":");
    writeValue(sb, stringOrNull(model.id(entity)));
    sb.append(",\"fields\":{");
    boolean first = true;
    for (String field : fields) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(field)).append('"').append(':');
      writeValue(sb, model.fieldValue(entity, field));
    }
    sb.append("}}]");
    return sb.toString();
  }

  private static void writeValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Number number && isFinite(number)) {
      sb.append(number);
    } else if (value instanceof Iterable<?> items) {
      sb.append('[');
      boolean first = true;
      for (Object item : items) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeValue(sb, item);
      }
      sb.append(']');
    } else {
      sb.append('"').append(escape(value.toString())).append('"');
    }
  }

  private static boolean isFinite(Number number) {
    if (number instanceof Double d) {
      return Double.isFinite(d);
    }
    if (number instanceof Float f) {
      return Float.isFinite(f);
    }
    return true;
  }

  private static String stringOrNull(Object value) {
    return value == null ? null : value.toString();
  }

  static String escape(String value) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }
}

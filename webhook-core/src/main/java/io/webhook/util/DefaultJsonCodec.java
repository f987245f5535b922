package io.webhook.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

/**
 * Zero-dependency canonical JSON encoder.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private static final int MAX_DEPTH = 64;

  DefaultJsonCodec() {
  }

  @Override
  public String canonicalize(Map<String, ?> payload) {
    if (payload == null) {
      throw new IllegalArgumentException("payload cannot be null");
    }
    StringBuilder sb = new StringBuilder();
    writeObject(sb, payload, 0);
    return sb.toString();
  }

  private static void writeValue(StringBuilder sb, Object value, int depth) {
    if (depth > MAX_DEPTH) {
      throw new IllegalArgumentException("Payload nesting exceeds " + MAX_DEPTH + " levels");
    }
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence s) {
      writeString(sb, s.toString());
    } else if (value instanceof Character c) {
      writeString(sb, c.toString());
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue() ? "true" : "false");
    } else if (value instanceof Number n) {
      writeNumber(sb, n);
    } else if (value instanceof Enum<?> e) {
      writeString(sb, e.name());
    } else if (value instanceof Map<?, ?> m) {
      writeObject(sb, m, depth + 1);
    } else if (value instanceof Iterable<?> it) {
      List<Object> items = new ArrayList<>();
      it.forEach(items::add);
      writeArray(sb, items, depth + 1);
    } else if (value instanceof Object[] array) {
      writeArray(sb, Arrays.asList(array), depth + 1);
    } else if (value instanceof int[] ints) {
      writeArray(sb, IntStream.of(ints).boxed().toList(), depth + 1);
    } else if (value instanceof long[] longs) {
      writeArray(sb, LongStream.of(longs).boxed().toList(), depth + 1);
    } else if (value instanceof double[] doubles) {
      writeArray(sb, DoubleStream.of(doubles).boxed().toList(), depth + 1);
    } else if (value instanceof boolean[] booleans) {
      List<Object> items = new ArrayList<>(booleans.length);
      for (boolean b : booleans) {
        items.add(b);
      }
      writeArray(sb, items, depth + 1);
    } else {
      throw new IllegalArgumentException("Unsupported payload value type: " + value.getClass().getName());
    }
  }

  private static void writeObject(StringBuilder sb, Map<?, ?> map, int depth) {
    TreeMap<String, Object> sorted = new TreeMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("payload cannot contain null keys");
      }
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException("payload keys must be strings, got: "
            + entry.getKey().getClass().getName());
      }
      sorted.put(key, entry.getValue());
    }
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, Object> entry : sorted.entrySet()) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      writeString(sb, entry.getKey());
      sb.append(':');
      writeValue(sb, entry.getValue(), depth);
    }
    sb.append('}');
  }

  private static void writeArray(StringBuilder sb, List<?> items, int depth) {
    sb.append('[');
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      writeValue(sb, items.get(i), depth);
    }
    sb.append(']');
  }

  private static void writeNumber(StringBuilder sb, Number n) {
    if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
        || n instanceof BigInteger || n instanceof AtomicInteger || n instanceof AtomicLong) {
      sb.append(n);
    } else if (n instanceof BigDecimal bd) {
      sb.append(bd.toString());
    } else {
      double d = n.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Non-finite numbers are not valid JSON: " + n);
      }
      writeFloatingPoint(sb, n instanceof Float ? Float.toString(n.floatValue()) : Double.toString(d));
    }
  }

  /**
   * Writes the shortest round-trip digits of a binary floating-point value. Decimal
   * exponents from -4 to 15 print positionally with at least one fractional digit
   * ({@code 0.0001}, {@code 1.0}); others print as {@code 1e-05}, {@code 1.5e+16}.
   */
  private static void writeFloatingPoint(StringBuilder sb, String shortest) {
    BigDecimal value = new BigDecimal(shortest);
    if (value.signum() == 0) {
      sb.append(shortest.startsWith("-") ? "-0.0" : "0.0");
      return;
    }
    value = value.stripTrailingZeros();
    String digits = value.unscaledValue().abs().toString();
    int exponent = digits.length() - 1 - value.scale();
    if (exponent < -4 || exponent >= 16) {
      if (value.signum() < 0) {
        sb.append('-');
      }
      sb.append(digits.charAt(0));
      if (digits.length() > 1) {
        sb.append('.').append(digits, 1, digits.length());
      }
      sb.append('e').append(exponent < 0 ? '-' : '+');
      int magnitude = Math.abs(exponent);
      if (magnitude < 10) {
        sb.append('0');
      }
      sb.append(magnitude);
    } else {
      String plain = value.toPlainString();
      sb.append(plain);
      if (plain.indexOf('.') < 0) {
        sb.append(".0");
      }
    }
  }

  private static void writeString(StringBuilder sb, String value) {
    sb.append('"');
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
          // output stays 7-bit ASCII
          if (c < 0x20 || c > 0x7f) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }
}

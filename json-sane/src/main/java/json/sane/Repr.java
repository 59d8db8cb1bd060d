package json.sane;

import java.util.List;
import java.util.Map;

/// Abbreviated, JSON-like rendering of values for exception messages.
///
/// Long strings and large containers are cut with `...` so that a message naming a
/// huge payload stays readable. Limits come from the system properties
/// `json.sane.repr.maxString` (default 40) and `json.sane.repr.maxItems` (default 6).
final class Repr {

    static final int MAX_STRING = Integer.getInteger("json.sane.repr.maxString", 40);
    static final int MAX_ITEMS = Integer.getInteger("json.sane.repr.maxItems", 6);
    static final int MAX_DEPTH = 4;

    private Repr() {
    }

    static String of(Object value) {
        final var sb = new StringBuilder();
        append(sb, value, 0);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Object value, int depth) {
        if (value instanceof JsonContainer container) {
            value = container.unwrap();
        }
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            final var shown = s.length() > MAX_STRING ? s.substring(0, MAX_STRING) : s;
            JsonValues.appendQuoted(sb, shown);
            if (shown.length() < s.length()) {
                sb.append("...");
            }
        } else if (value instanceof Map<?, ?> map) {
            if (depth >= MAX_DEPTH) {
                sb.append(map.isEmpty() ? "{}" : "{...}");
                return;
            }
            sb.append('{');
            int n = 0;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (n > 0) {
                    sb.append(", ");
                }
                if (n == MAX_ITEMS) {
                    sb.append("...");
                    break;
                }
                append(sb, entry.getKey(), depth + 1);
                sb.append(": ");
                append(sb, entry.getValue(), depth + 1);
                n++;
            }
            sb.append('}');
        } else if (value instanceof List<?> list) {
            if (depth >= MAX_DEPTH) {
                sb.append(list.isEmpty() ? "[]" : "[...]");
                return;
            }
            sb.append('[');
            int n = 0;
            for (Object item : list) {
                if (n > 0) {
                    sb.append(", ");
                }
                if (n == MAX_ITEMS) {
                    sb.append("...");
                    break;
                }
                append(sb, item, depth + 1);
                n++;
            }
            sb.append(']');
        } else if (value instanceof Class<?> type) {
            sb.append(type.getSimpleName()).append(".class");
        } else if (value instanceof JsonKind kind) {
            sb.append("JsonKind.").append(kind.name());
        } else if (value instanceof TypeSpec spec) {
            sb.append(spec);
        } else if (JsonKind.of(value) != null) {
            sb.append(value);
        } else {
            // outside the JSON model
            final var text = String.valueOf(value);
            sb.append('<').append(value.getClass().getSimpleName()).append(' ')
                    .append(text.length() > MAX_STRING ? text.substring(0, MAX_STRING) + "..." : text)
                    .append('>');
        }
    }
}

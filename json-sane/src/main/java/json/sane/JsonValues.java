package json.sane;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Static helpers over raw JSON values: structural equality and hashing, ordering,
/// deep copies and JSON text rendering.
///
/// `INT` and `FLOAT` values are never equal to each other, mirroring their distinct
/// tags; within one tag numbers compare by numeric value, so `Integer` 1 equals `Long` 1.
public final class JsonValues {

    /// Natural ordering of JSON values as used by `JsonList.sort()` and `JsonList.compareTo`.
    /// Numbers (either tag) compare numerically, strings lexicographically, booleans
    /// `false < true`, lists element by element. Any other pairing throws `ClassCastException`.
    public static final Comparator<Object> NATURAL_ORDER = JsonValues::compare;

    private JsonValues() {
    }

    /// Deep structural equality, unwrapping facades.
    public static boolean deepEquals(Object a, Object b) {
        a = Sane.unwrapIfWrapped(a);
        b = Sane.unwrapIfWrapped(b);
        if (a == b) {
            return true;
        }
        final var kind = JsonKind.of(a);
        if (kind == null || kind != JsonKind.of(b)) {
            return Objects.equals(a, b);
        }
        switch (kind) {
            case INT, FLOAT -> {
                final var x = decimal(a);
                final var y = decimal(b);
                return x == null || y == null ? a.equals(b) : x.compareTo(y) == 0;
            }
            case OBJECT -> {
                final var x = (Map<?, ?>) a;
                final var y = (Map<?, ?>) b;
                if (x.size() != y.size()) {
                    return false;
                }
                for (Map.Entry<?, ?> entry : x.entrySet()) {
                    if (!y.containsKey(entry.getKey()) || !deepEquals(entry.getValue(), y.get(entry.getKey()))) {
                        return false;
                    }
                }
                return true;
            }
            case ARRAY -> {
                final var x = (List<?>) a;
                final var y = (List<?>) b;
                if (x.size() != y.size()) {
                    return false;
                }
                final Iterator<?> i = x.iterator();
                final Iterator<?> j = y.iterator();
                while (i.hasNext()) {
                    if (!deepEquals(i.next(), j.next())) {
                        return false;
                    }
                }
                return true;
            }
            default -> {
                return a.equals(b);
            }
        }
    }

    /// Hash code consistent with {@link #deepEquals(Object, Object)}.
    public static int deepHashCode(Object value) {
        value = Sane.unwrapIfWrapped(value);
        final var kind = JsonKind.of(value);
        if (kind == null) {
            return Objects.hashCode(value);
        }
        switch (kind) {
            case INT, FLOAT -> {
                final var d = decimal(value);
                return 31 * kind.ordinal() + (d == null ? value.hashCode() : d.stripTrailingZeros().hashCode());
            }
            case OBJECT -> {
                int h = 0;
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                    h += Objects.hashCode(entry.getKey()) ^ deepHashCode(entry.getValue());
                }
                return h;
            }
            case ARRAY -> {
                int h = 1;
                for (Object item : (List<?>) value) {
                    h = 31 * h + deepHashCode(item);
                }
                return h;
            }
            case NULL -> {
                return 0;
            }
            default -> {
                return value.hashCode();
            }
        }
    }

    /// Compares two values; see {@link #NATURAL_ORDER}.
    /// @throws ClassCastException if the two values cannot be ordered against each other
    public static int compare(Object a, Object b) {
        a = Sane.unwrapIfWrapped(a);
        b = Sane.unwrapIfWrapped(b);
        final var x = JsonKind.of(a);
        final var y = JsonKind.of(b);
        if (x == null || y == null) {
            throw unorderable(a, b);
        }
        final boolean numbers = (x == JsonKind.INT || x == JsonKind.FLOAT)
                && (y == JsonKind.INT || y == JsonKind.FLOAT);
        if (numbers) {
            final var p = decimal(a);
            final var q = decimal(b);
            if (p == null || q == null) {
                return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            }
            return p.compareTo(q);
        }
        if (x != y) {
            throw unorderable(a, b);
        }
        switch (x) {
            case NULL -> {
                return 0;
            }
            case BOOL -> {
                return Boolean.compare((Boolean) a, (Boolean) b);
            }
            case STRING -> {
                return ((String) a).compareTo((String) b);
            }
            case ARRAY -> {
                final Iterator<?> i = ((List<?>) a).iterator();
                final Iterator<?> j = ((List<?>) b).iterator();
                while (i.hasNext() && j.hasNext()) {
                    final int c = compare(i.next(), j.next());
                    if (c != 0) {
                        return c;
                    }
                }
                return Boolean.compare(i.hasNext(), j.hasNext());
            }
            default -> throw unorderable(a, b);
        }
    }

    private static ClassCastException unorderable(Object a, Object b) {
        return new ClassCastException("cannot order " + JsonKind.describe(a) + " against " + JsonKind.describe(b)
                + ": " + Repr.of(a) + " and " + Repr.of(b));
    }

    /// Exact decimal form of a number, or `null` for non-finite floats.
    static BigDecimal decimal(Object number) {
        if (number instanceof BigDecimal d) {
            return d;
        }
        if (number instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (number instanceof Double || number instanceof Float) {
            final double d = ((Number) number).doubleValue();
            // floats compare by their widened double value
            return Double.isFinite(d) ? new BigDecimal(Double.toString(d)) : null;
        }
        return BigDecimal.valueOf(((Number) number).longValue());
    }

    /// Copies containers recursively into fresh `LinkedHashMap`s and `ArrayList`s; atoms are shared.
    public static Object deepCopy(Object value) {
        value = Sane.unwrapIfWrapped(value);
        if (value instanceof Map<?, ?> map) {
            final Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put((String) entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            final List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    /// Compact JSON text, no whitespace.
    static String toJson(Object value) {
        final var sb = new StringBuilder();
        appendJson(sb, Sane.unwrapIfWrapped(value));
        return sb.toString();
    }

    private static void appendJson(StringBuilder sb, Object value) {
        if (value instanceof String s) {
            appendQuoted(sb, s);
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendQuoted(sb, String.valueOf(entry.getKey()));
                sb.append(':');
                appendJson(sb, entry.getValue());
            }
            sb.append('}');
        } else if (value instanceof List<?> list) {
            sb.append('[');
            boolean first = true;
            for (Object item : list) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendJson(sb, item);
            }
            sb.append(']');
        } else {
            sb.append(value);
        }
    }

    static void appendQuoted(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}

package json.sane;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A non-empty, ordered sequence of path segments into nested JSON data.
///
/// Each segment is either a `String` (dict key) or an `Integer` (list index, negative
/// indices count from the end). There is no delimiter syntax: `"a.b"` is one key.
/// ```java
/// KeyPath.of("items", 0, "name");
/// KeyPath.parse(List.of("items", 0, "name"));
/// KeyPath.parse("items");   // one segment
/// ```
public record KeyPath(List<Object> segments) {

    public KeyPath {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new PathSyntaxException("empty path: " + segments);
        }
        for (Object segment : segments) {
            if (!(segment instanceof String) && !(segment instanceof Integer)) {
                final var type = segment == null ? "" : segment.getClass().getSimpleName() + " ";
                throw new PathSyntaxException("path must contain only String or Integer segments, got "
                        + type + Repr.of(segment) + " in " + Repr.of(segments));
            }
        }
        segments = List.copyOf(segments);
    }

    public static KeyPath of(Object... segments) {
        if (segments == null) {
            throw new PathSyntaxException("invalid path: null");
        }
        return new KeyPath(Arrays.asList(segments));
    }

    /// Normalizes a path-like argument: a bare key or index, a `KeyPath`, a `List` or an `Object[]`.
    public static KeyPath parse(Object pathLike) {
        if (pathLike instanceof KeyPath path) {
            return path;
        }
        if (pathLike instanceof String || pathLike instanceof Integer) {
            return new KeyPath(List.of(pathLike));
        }
        if (pathLike instanceof List<?> list) {
            return new KeyPath(new ArrayList<>(list));
        }
        if (pathLike instanceof Object[] array) {
            return of(array);
        }
        throw new PathSyntaxException("invalid path: " + Repr.of(pathLike));
    }

    public int size() {
        return segments.size();
    }

    public Object get(int index) {
        return segments.get(index);
    }

    public Object first() {
        return segments.get(0);
    }

    public Object last() {
        return segments.get(segments.size() - 1);
    }

    /// The sub-path made of the first `length` segments; `length` must be at least 1.
    public KeyPath prefix(int length) {
        if (length == segments.size()) {
            return this;
        }
        return new KeyPath(segments.subList(0, length));
    }

    public KeyPath append(Object segment) {
        final var extended = new ArrayList<>(segments);
        extended.add(segment);
        return new KeyPath(extended);
    }

    /// Renders as a JSON-style list, e.g. `["items", 0, "name"]`.
    @Override
    public String toString() {
        final var sb = new StringBuilder("[");
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            final var segment = segments.get(i);
            if (segment instanceof String key) {
                JsonValues.appendQuoted(sb, key);
            } else {
                sb.append(segment);
            }
        }
        return sb.append(']').toString();
    }
}

package json.sane;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Checks raw values against the JSON value model and against a {@link TypeSpec}.
///
/// Structural validation walks the whole value with an explicit stack and stops at the
/// first offender, reporting its path relative to a base path supplied by the caller.
final class JsonValidator {

    private static final Logger LOG = Logger.getLogger(JsonValidator.class.getName());

    private JsonValidator() {
    }

    /// Stack frame for iterative validation
    private record Frame(Object value, KeyPath path) {
    }

    /// Validates a value and everything it contains.
    /// @param value the raw value; facades are not accepted here
    /// @param base the path the value lives at, or `null` for a free-standing value
    /// @throws InvalidValueException naming the first offending path and value
    static void validate(Object value, KeyPath base) {
        final Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(value, base));
        int visited = 0;
        while (!stack.isEmpty()) {
            final var frame = stack.pop();
            visited++;
            final var kind = JsonKind.of(frame.value());
            if (kind == null) {
                throw new InvalidValueException(
                        "invalid value of type " + frame.value().getClass().getSimpleName()
                                + at(frame.path()) + ": " + Repr.of(frame.value()),
                        frame.path(), frame.value());
            }
            switch (kind) {
                case FLOAT -> checkFinite(frame);
                case OBJECT -> pushMembers((Map<?, ?>) frame.value(), frame.path(), stack);
                case ARRAY -> pushElements((List<?>) frame.value(), frame.path(), stack);
                default -> {
                    // atomic and well-formed
                }
            }
        }
        final int count = visited;
        LOG.finer(() -> "Validated " + count + " value(s) at " + (base == null ? "[]" : base));
    }

    private static void checkFinite(Frame frame) {
        final var value = frame.value();
        final boolean finite = value instanceof Double d ? Double.isFinite(d)
                : !(value instanceof Float f) || Float.isFinite(f);
        if (!finite) {
            throw new InvalidValueException(
                    "invalid value: non-finite float" + at(frame.path()) + ": " + value,
                    frame.path(), value);
        }
    }

    private static void pushMembers(Map<?, ?> map, KeyPath path, Deque<Frame> stack) {
        // push in reverse so members pop in insertion order
        final Object[] keys = map.keySet().toArray();
        for (int i = keys.length - 1; i >= 0; i--) {
            final var key = keys[i];
            if (!(key instanceof String name)) {
                throw new InvalidValueException(
                        "invalid dict key " + Repr.of(key) + at(path), path, key);
            }
            stack.push(new Frame(map.get(name), child(path, name)));
        }
    }

    private static void pushElements(List<?> list, KeyPath path, Deque<Frame> stack) {
        for (int i = list.size() - 1; i >= 0; i--) {
            stack.push(new Frame(list.get(i), child(path, i)));
        }
    }

    /// Checks a value against a spec.
    /// @param path where the value lives, or `null` for a free-standing value
    /// @throws InvalidValueException naming the value's path (or the offending element's path)
    static void checkType(Object value, TypeSpec spec, KeyPath path) {
        if (spec.matches(value)) {
            return;
        }
        final var offender = spec.firstMismatch(value);
        if (offender != null) {
            final var element = value instanceof List<?> list
                    ? list.get((Integer) offender)
                    : ((Map<?, ?>) value).get(offender);
            final var elementPath = child(path, offender);
            throw new InvalidValueException(
                    "expected " + spec + ", got non-conforming " + JsonKind.describe(value)
                            + " with " + JsonKind.describe(element) + at(elementPath) + ": " + Repr.of(element),
                    elementPath, element);
        }
        throw new InvalidValueException(
                "expected " + spec + ", got " + JsonKind.describe(value) + at(path) + ": " + Repr.of(value),
                path, value);
    }

    static KeyPath child(KeyPath path, Object segment) {
        return path == null ? KeyPath.of(segment) : path.append(segment);
    }

    private static String at(KeyPath path) {
        return path == null ? "" : " at path " + path;
    }
}

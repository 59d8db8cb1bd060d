package json.sane;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Walks a {@link KeyPath} through raw nested maps and lists.
///
/// Every walk checks, segment by segment, that a string segment meets a dict and an
/// integer segment meets a list, and reports the walked sub-path when it does not.
///
/// Writes are two-phase. The dry walk proves that every link is either present and of
/// the right kind, or a missing dict key that can be created, and the value is checked;
/// only then is anything mutated, and the existing structure receives exactly one
/// mutation. A failed write therefore leaves the data untouched. Lists are never created
/// or extended by a path write.
final class PathResolver {

    private static final Logger LOG = Logger.getLogger(PathResolver.class.getName());

    /// Returned by {@link #find} when the path does not resolve
    private static final Object MISSING = new Object() {
        @Override
        public String toString() {
            return "<missing>";
        }
    };

    private PathResolver() {
    }

    /// Resolves a path and returns the raw value there.
    /// @param spec optional type the value must satisfy, may be `null`
    static Object read(Object root, KeyPath path, TypeSpec spec) {
        Object node = root;
        for (int i = 0; i < path.size(); i++) {
            node = step(node, path, i);
        }
        if (spec != null) {
            JsonValidator.checkType(node, spec, path);
        }
        return node;
    }

    /// Like {@link #read} but never throws for data reasons.
    static boolean contains(Object root, KeyPath path, TypeSpec spec) {
        final var value = find(root, path);
        if (value == MISSING) {
            return false;
        }
        return spec == null || spec.matches(value);
    }

    /// Resolves a path without throwing; {@link #MISSING} when any link is absent or of the wrong kind.
    private static Object find(Object root, KeyPath path) {
        Object node = root;
        for (Object segment : path.segments()) {
            if (segment instanceof String key) {
                if (!(node instanceof Map<?, ?> map) || !map.containsKey(key)) {
                    return MISSING;
                }
                node = map.get(key);
            } else {
                if (!(node instanceof List<?> list)) {
                    return MISSING;
                }
                final int index = normalize((Integer) segment, list.size());
                if (index < 0) {
                    return MISSING;
                }
                node = list.get(index);
            }
        }
        return node;
    }

    /// Sets the value at a path, creating missing intermediate dicts.
    /// @param value a raw value (facades already unwrapped)
    /// @param spec optional type the value must satisfy, may be `null`
    static void write(Object root, KeyPath path, Object value, TypeSpec spec) {
        JsonValidator.validate(value, path);
        if (spec != null) {
            JsonValidator.checkType(value, spec, path);
        }

        // phase 1: dry walk over all but the last segment
        final int last = path.size() - 1;
        Object node = root;
        int firstMissing = -1;
        for (int i = 0; i < last; i++) {
            requireContainer(node, path, i);
            final var segment = path.get(i);
            if (node instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) {
                    firstMissing = i;
                    break;
                }
                node = map.get(segment);
            } else {
                final var list = (List<?>) node;
                final int index = normalize((Integer) segment, list.size());
                if (index < 0) {
                    throw new IndexNotFoundException(path.prefix(i + 1));
                }
                node = list.get(index);
            }
            LOG.finer(() -> "Write walk passed " + segment + " of " + path);
        }

        if (firstMissing >= 0) {
            for (int j = firstMissing + 1; j <= last; j++) {
                if (!(path.get(j) instanceof String)) {
                    final var missing = path.prefix(j);
                    throw new InvalidStructureException(
                            "cannot create list at subpath " + missing + " of " + path
                                    + ": only missing dicts are created",
                            path, missing, null);
                }
            }
            // phase 2: build the missing chain, then attach it with a single put
            final Map<String, Object> chain = new LinkedHashMap<>();
            Map<String, Object> tip = chain;
            for (int j = firstMissing + 1; j < last; j++) {
                final Map<String, Object> child = new LinkedHashMap<>();
                tip.put((String) path.get(j), child);
                tip = child;
            }
            tip.put((String) path.last(), value);
            asMap(node).put((String) path.get(firstMissing), chain);
            final int from = firstMissing;
            LOG.fine(() -> "Autovivified " + (last - from) + " dict(s) from " + path.prefix(from + 1)
                    + " for " + path);
            return;
        }

        requireContainer(node, path, last);
        if (node instanceof Map<?, ?>) {
            asMap(node).put((String) path.last(), value);
        } else {
            final var list = asList(node);
            final int index = normalize((Integer) path.last(), list.size());
            if (index < 0) {
                throw new IndexNotFoundException(path);
            }
            list.set(index, value);
        }
        LOG.finer(() -> "Wrote " + path);
    }

    /// Removes the value at a path and returns it. Never creates anything.
    /// @param spec optional type the value must satisfy before removal, may be `null`
    static Object delete(Object root, KeyPath path, TypeSpec spec) {
        final int last = path.size() - 1;
        Object node = root;
        for (int i = 0; i < last; i++) {
            node = step(node, path, i);
        }
        requireContainer(node, path, last);
        if (node instanceof Map<?, ?> map) {
            final var key = (String) path.last();
            if (!map.containsKey(key)) {
                throw new KeyNotFoundException(path);
            }
            final var value = map.get(key);
            if (spec != null) {
                JsonValidator.checkType(value, spec, path);
            }
            map.remove(key);
            LOG.finer(() -> "Deleted " + path);
            return value;
        }
        final var list = (List<?>) node;
        final int index = normalize((Integer) path.last(), list.size());
        if (index < 0) {
            throw new IndexNotFoundException(path);
        }
        final var value = list.get(index);
        if (spec != null) {
            JsonValidator.checkType(value, spec, path);
        }
        list.remove(index);
        LOG.finer(() -> "Deleted " + path);
        return value;
    }

    /// Descends one segment for read and delete walks.
    private static Object step(Object node, KeyPath path, int i) {
        requireContainer(node, path, i);
        final var segment = path.get(i);
        if (node instanceof Map<?, ?> map) {
            if (!map.containsKey(segment)) {
                throw new KeyNotFoundException(path.prefix(i + 1));
            }
            return map.get(segment);
        }
        final var list = (List<?>) node;
        final int index = normalize((Integer) segment, list.size());
        if (index < 0) {
            throw new IndexNotFoundException(path.prefix(i + 1));
        }
        return list.get(index);
    }

    /// Segment `i` must address `node`: a string needs a dict, an integer needs a list.
    private static void requireContainer(Object node, KeyPath path, int i) {
        final var segment = path.get(i);
        final var subPath = i == 0 ? null : path.prefix(i);
        if (segment instanceof String) {
            if (!(node instanceof Map<?, ?>)) {
                throw InvalidStructureException.mismatch(JsonKind.OBJECT, node, subPath, path);
            }
        } else if (!(node instanceof List<?>)) {
            throw InvalidStructureException.mismatch(JsonKind.ARRAY, node, subPath, path);
        }
    }

    /// Native list indexing: negative counts from the end. Returns -1 when out of range.
    static int normalize(int index, int size) {
        final int resolved = index < 0 ? size + index : index;
        return resolved >= 0 && resolved < size ? resolved : -1;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node) {
        return (Map<String, Object>) node;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object node) {
        return (List<Object>) node;
    }
}

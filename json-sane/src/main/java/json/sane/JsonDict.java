package json.sane;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Dict-like facade over a raw `Map<String, Object>` with nested lookups and type checking.
///
/// ```java
/// JsonDict d = JsonDict.wrap(parsedMap);
/// String login = d.getString(List.of("user", "login"));
/// d.set(KeyPath.of("user", "profile", "name"), "Octocat");   // creates "profile"
/// for (Object label : d.getList("labels").iter(JsonKind.OBJECT)) { ... }
/// ```
///
/// Paths into a dict must start with a key. See {@link JsonContainer} for aliasing semantics.
public final class JsonDict extends JsonContainer implements Iterable<String> {

    private static final Logger LOG = Logger.getLogger(JsonDict.class.getName());

    private final Map<String, Object> data;

    /// Creates an empty dict backed by a new `LinkedHashMap`.
    public JsonDict() {
        this.data = new LinkedHashMap<>();
    }

    /// Creates a dict holding a validated shallow copy of `source`.
    /// @throws InvalidValueException if `source` holds anything that is not JSON data
    public JsonDict(Map<String, ?> source) {
        this();
        Objects.requireNonNull(source, "source must not be null");
        update(source);
        LOG.fine(() -> "Constructed dict with " + data.size() + " key(s)");
    }

    /// Wrapping constructor: `data` is used as is, never copied.
    private JsonDict(Map<String, Object> data, boolean byReference) {
        this.data = data;
    }

    /// Same as {@link #JsonDict(Map)}.
    public static JsonDict copyOf(Map<String, ?> source) {
        return new JsonDict(source);
    }

    /// Builds a dict from key/value pairs, validating every value.
    public static JsonDict fromEntries(Iterable<? extends Map.Entry<String, ?>> entries) {
        final var dict = new JsonDict();
        dict.update(entries);
        return dict;
    }

    /// Builds a dict mapping every key to the same value.
    public static JsonDict fromKeys(Iterable<String> keys, Object value) {
        Objects.requireNonNull(keys, "keys must not be null");
        final var cleaned = clean(value, null, null);
        final var dict = new JsonDict();
        for (String key : keys) {
            dict.data.put(requireKey(key), cleaned);
        }
        return dict;
    }

    /// Wraps an existing map without copying, validating its whole content.
    public static JsonDict wrap(Map<String, Object> raw) {
        return wrap(raw, true);
    }

    /// Wraps an existing map without copying.
    /// @param check whether to validate the content; pass `false` only for data known to be good
    /// @throws InvalidValueException if `check` is set and the map holds anything that is not JSON data
    public static JsonDict wrap(Map<String, Object> raw, boolean check) {
        Objects.requireNonNull(raw, "raw must not be null");
        if (check) {
            JsonValidator.validate(raw, null);
            LOG.fine(() -> "Wrapped and validated dict with " + raw.size() + " key(s)");
        }
        return new JsonDict(raw, true);
    }

    @SuppressWarnings("unchecked")
    static JsonDict wrapUnchecked(Map<?, ?> raw) {
        return new JsonDict((Map<String, Object>) raw, true);
    }

    @Override
    Object raw() {
        return data;
    }

    @Override
    Class<?> firstSegmentType() {
        return String.class;
    }

    /// Returns the underlying map without copying.
    ///
    /// The dict stays usable afterwards as long as the map is not modified in a way that
    /// breaks the JSON model.
    @Override
    public Map<String, Object> unwrap() {
        return data;
    }

    @Override
    public int size() {
        return data.size();
    }

    public boolean containsKey(String key) {
        return data.containsKey(key);
    }

    /// Iterates over the keys.
    @Override
    public Iterator<String> iterator() {
        return data.keySet().iterator();
    }

    /// Live, read-only view of the keys.
    public Set<String> keys() {
        return Collections.unmodifiableSet(data.keySet());
    }

    /// The values, nested containers wrapped.
    public Iterable<Object> values() {
        return values(null);
    }

    /// The values, each checked against `type` as iteration reaches it.
    public Iterable<Object> values(Object type) {
        final var spec = TypeSpecs.resolveOptional(type);
        return () -> new CheckedIterator<Map.Entry<String, Object>, Object>(
                data.entrySet().iterator(), spec, Map.Entry::getValue,
                entry -> KeyPath.of(entry.getKey()), entry -> wrapOut(entry.getValue()));
    }

    /// The entries, values wrapped.
    public Iterable<Map.Entry<String, Object>> items() {
        return items(null);
    }

    /// The entries, each value checked against `type` as iteration reaches it.
    public Iterable<Map.Entry<String, Object>> items(Object type) {
        final var spec = TypeSpecs.resolveOptional(type);
        return () -> new CheckedIterator<Map.Entry<String, Object>, Map.Entry<String, Object>>(
                data.entrySet().iterator(), spec, Map.Entry::getValue,
                entry -> KeyPath.of(entry.getKey()),
                entry -> new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), wrapOut(entry.getValue())));
    }

    @Override
    public void checkTypes(Object type) {
        final var spec = TypeSpecs.resolve(type);
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            JsonValidator.checkType(entry.getValue(), spec, KeyPath.of(entry.getKey()));
        }
    }

    /// Adds all entries of `other`. Every value is validated before any is stored.
    public void update(Map<String, ?> other) {
        Objects.requireNonNull(other, "other must not be null");
        update(other.entrySet());
    }

    /// Adds all key/value pairs. Every value is validated before any is stored.
    public void update(Iterable<? extends Map.Entry<String, ?>> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        final Map<String, Object> staged = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : entries) {
            final var key = requireKey(entry.getKey());
            staged.put(key, clean(entry.getValue(), null, KeyPath.of(key)));
        }
        data.putAll(staged);
    }

    /// Removes the value at a path and returns it.
    /// @throws KeyNotFoundException if the key (or a key along the path) is missing
    /// @throws PathSyntaxException if the path does not end in a key
    public Object pop(Object path) {
        return pop(path, null);
    }

    /// Removes the value at a path if it has the expected type, and returns it.
    public Object pop(Object path, Object type) {
        return wrapOut(PathResolver.delete(data, keyPathOf(path), TypeSpecs.resolveOptional(type)));
    }

    /// Removes and returns the value at a path, or returns `defaultValue` if it is missing.
    public Object popOrDefault(Object path, Object defaultValue) {
        return popOrDefault(path, defaultValue, null);
    }

    public Object popOrDefault(Object path, Object defaultValue, Object type) {
        final var spec = TypeSpecs.resolveOptional(type);
        final var keyPath = keyPathOf(path);
        try {
            return wrapOut(PathResolver.delete(data, keyPath, spec));
        } catch (JsonLookupException e) {
            return defaultValue;
        }
    }

    /// Removes and returns the first entry in iteration order.
    /// @throws KeyNotFoundException if the dict is empty
    public Map.Entry<String, Object> popItem() {
        return popItem(null);
    }

    public Map.Entry<String, Object> popItem(Object type) {
        if (data.isEmpty()) {
            throw new KeyNotFoundException("dictionary is empty");
        }
        final var key = data.keySet().iterator().next();
        return new AbstractMap.SimpleImmutableEntry<>(key, pop(key, type));
    }

    public void clear() {
        data.clear();
    }

    @Override
    public JsonDict copy() {
        return new JsonDict(new LinkedHashMap<>(data), true);
    }

    @Override
    @SuppressWarnings("unchecked")
    public JsonDict deepCopy() {
        return new JsonDict((Map<String, Object>) JsonValues.deepCopy(data), true);
    }

    private KeyPath keyPathOf(Object path) {
        final var keyPath = pathOf(path);
        if (!(keyPath.last() instanceof String)) {
            throw new PathSyntaxException("path must lead to a dict key: " + keyPath);
        }
        return keyPath;
    }

    private static String requireKey(Object key) {
        if (!(key instanceof String name)) {
            throw new InvalidValueException("invalid dict key: " + Repr.of(key), null, key);
        }
        return name;
    }
}

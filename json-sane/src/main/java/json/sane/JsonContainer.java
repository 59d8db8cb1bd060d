package json.sane;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/// Common base of {@link JsonDict} and {@link JsonList}: path-addressed, type-checked access
/// to a raw `Map` or `List`.
///
/// A container holds a non-owning handle to its raw data. Two containers may wrap the same
/// raw structure, and a mutation through one is visible through the other (and through any
/// caller holding the raw reference). Nested maps and lists are handed out as fresh facades
/// on every access; facade identity is not cached.
///
/// Paths are a bare key or index, a {@link KeyPath}, a `List` or an `Object[]` of keys and
/// indices. Types are anything {@link TypeSpecs#resolve(Object)} accepts.
///
/// Not thread-safe; concurrent mutation of shared raw data must be serialized by the caller.
public abstract sealed class JsonContainer permits JsonDict, JsonList {

    JsonContainer() {
    }

    /// The raw data, typed for internal use.
    abstract Object raw();

    /// Kind of segment a path into this container must start with.
    abstract Class<?> firstSegmentType();

    /// Returns the underlying raw container without copying.
    public abstract Object unwrap();

    public abstract int size();

    public boolean isEmpty() {
        return size() == 0;
    }

    /// Looks up the value a path points to.
    /// @throws KeyNotFoundException if a key along the path is missing
    /// @throws IndexNotFoundException if an index along the path is out of range
    /// @throws InvalidStructureException if the data does not nest the way the path says
    public Object get(Object path) {
        return wrapOut(PathResolver.read(raw(), pathOf(path), null));
    }

    /// Looks up the value a path points to and checks its type.
    /// @throws InvalidValueException if the value (or an element, for container types) has the wrong type
    public Object get(Object path, Object type) {
        return wrapOut(PathResolver.read(raw(), pathOf(path), TypeSpecs.resolveOptional(type)));
    }

    /// Like {@link #get(Object)} but returns `defaultValue` for missing data.
    /// Structure and type errors still propagate.
    public Object getOrDefault(Object path, Object defaultValue) {
        return getOrDefault(path, defaultValue, null);
    }

    /// Like {@link #get(Object, Object)} but returns `defaultValue` for missing data.
    /// A value of the wrong type is an error, never a reason to fall back to the default.
    public Object getOrDefault(Object path, Object defaultValue, Object type) {
        final var spec = TypeSpecs.resolveOptional(type);
        final var keyPath = pathOf(path);
        final Object value;
        try {
            value = PathResolver.read(raw(), keyPath, null);
        } catch (JsonLookupException e) {
            return defaultValue;
        }
        if (spec != null) {
            JsonValidator.checkType(value, spec, keyPath);
        }
        return wrapOut(value);
    }

    public String getString(Object path) {
        return (String) get(path, TypeSpec.STRING);
    }

    public boolean getBoolean(Object path) {
        return (Boolean) get(path, TypeSpec.BOOL);
    }

    /// Reads an integer value.
    /// @throws ArithmeticException if a `BigInteger` value does not fit a `long`
    public long getLong(Object path) {
        final var number = (Number) get(path, TypeSpec.INT);
        return number instanceof BigInteger big ? big.longValueExact() : number.longValue();
    }

    /// Reads an integer value.
    /// @throws ArithmeticException if the value does not fit an `int`
    public int getInt(Object path) {
        return Math.toIntExact(getLong(path));
    }

    public double getDouble(Object path) {
        return ((Number) get(path, TypeSpec.FLOAT)).doubleValue();
    }

    public JsonDict getDict(Object path) {
        return (JsonDict) get(path, TypeSpec.OBJECT);
    }

    public JsonList getList(Object path) {
        return (JsonList) get(path, TypeSpec.ARRAY);
    }

    /// Sets the value at a path. Missing intermediate dicts are created; lists never are.
    /// On failure nothing is modified.
    /// @throws InvalidValueException if the value is not JSON data
    /// @throws InvalidStructureException if the path crosses a node of the wrong kind, or would need a new list
    /// @throws IndexNotFoundException if an index along the path is out of range
    public void set(Object path, Object value) {
        PathResolver.write(raw(), pathOf(path), Sane.unwrapIfWrapped(value), null);
    }

    /// Sets the value at a path after checking it against a type.
    public void set(Object path, Object value, Object type) {
        PathResolver.write(raw(), pathOf(path), Sane.unwrapIfWrapped(value), TypeSpecs.resolveOptional(type));
    }

    /// Returns the existing value at a path, or stores and returns `defaultValue`.
    public Object setDefault(Object path, Object defaultValue) {
        return setDefault(path, defaultValue, null);
    }

    /// Returns the existing value at a path, or stores and returns `defaultValue`.
    ///
    /// The default is validated (and type-checked) even when a value already exists,
    /// so a bad default fails regardless of the current contents.
    public Object setDefault(Object path, Object defaultValue, Object type) {
        final var spec = TypeSpecs.resolveOptional(type);
        final var keyPath = pathOf(path);
        final var cleaned = clean(defaultValue, spec, keyPath);
        final Object existing;
        try {
            existing = PathResolver.read(raw(), keyPath, spec);
        } catch (JsonLookupException e) {
            PathResolver.write(raw(), keyPath, cleaned, spec);
            return wrapOut(cleaned);
        }
        return wrapOut(existing);
    }

    /// Removes the value at a path.
    /// @throws KeyNotFoundException if a key along the path is missing
    /// @throws IndexNotFoundException if an index along the path is out of range
    public void delete(Object path) {
        PathResolver.delete(raw(), pathOf(path), null);
    }

    /// Removes the value at a path if it has the expected type; otherwise nothing is removed.
    public void delete(Object path, Object type) {
        PathResolver.delete(raw(), pathOf(path), TypeSpecs.resolveOptional(type));
    }

    /// Tells whether a path resolves. Never throws for data reasons.
    public boolean containsPath(Object path) {
        return PathResolver.contains(raw(), pathOf(path), null);
    }

    /// Tells whether a path resolves to a value of the given type. Never throws for data reasons.
    public boolean containsPath(Object path, Object type) {
        return PathResolver.contains(raw(), pathOf(path), TypeSpecs.resolveOptional(type));
    }

    /// Checks every top-level value against a type.
    /// @throws InvalidValueException naming the first offender
    public abstract void checkTypes(Object type);

    /// Shallow copy: a new raw container holding the same values.
    public abstract JsonContainer copy();

    /// Deep copy: nested dicts and lists are copied too.
    public abstract JsonContainer deepCopy();

    /// Two containers of the same kind are equal when their contents are deeply equal,
    /// whatever the wrapper instances.
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        final var that = (JsonContainer) other;
        return raw() == that.raw() || JsonValues.deepEquals(raw(), that.raw());
    }

    @Override
    public int hashCode() {
        return JsonValues.deepHashCode(raw());
    }

    /// The class name followed by the content as compact JSON.
    @Override
    public String toString() {
        return getClass().getSimpleName() + JsonValues.toJson(raw());
    }

    /// Parses a path argument and checks it can address this kind of container.
    final KeyPath pathOf(Object path) {
        final var keyPath = KeyPath.parse(path);
        if (!firstSegmentType().isInstance(keyPath.first())) {
            throw new PathSyntaxException(getClass().getSimpleName() + " path must start with "
                    + (firstSegmentType() == String.class ? "a key" : "an index") + ": " + keyPath);
        }
        return keyPath;
    }

    /// Wraps raw nested containers on their way out to the caller.
    static Object wrapOut(Object value) {
        if (value instanceof Map<?, ?> map) {
            return JsonDict.wrapUnchecked(map);
        }
        if (value instanceof List<?> list) {
            return JsonList.wrapUnchecked(list);
        }
        return value;
    }

    /// Prepares a caller-supplied value for insertion: facades are unwrapped, anything else is
    /// validated against the JSON model, then the optional type is checked.
    static Object clean(Object value, TypeSpec spec, KeyPath at) {
        final Object raw;
        if (value instanceof JsonContainer container) {
            raw = container.raw();
        } else {
            JsonValidator.validate(value, at);
            raw = value;
        }
        if (spec != null) {
            JsonValidator.checkType(raw, spec, at);
        }
        return raw;
    }

    /// Iterator that maps raw values through {@link #wrapOut} and, when a type is given,
    /// checks each value as it is produced. A mismatch throws from `next()` and the
    /// values before it have already been handed out.
    static final class CheckedIterator<R, T> implements Iterator<T> {

        private final Iterator<R> source;
        private final TypeSpec spec;
        private final Function<R, Object> valueOf;
        private final Function<R, KeyPath> pathOf;
        private final Function<R, T> output;

        CheckedIterator(Iterator<R> source, TypeSpec spec, Function<R, Object> valueOf,
                        Function<R, KeyPath> pathOf, Function<R, T> output) {
            this.source = Objects.requireNonNull(source, "source must not be null");
            this.spec = spec;
            this.valueOf = valueOf;
            this.pathOf = pathOf;
            this.output = output;
        }

        @Override
        public boolean hasNext() {
            return source.hasNext();
        }

        @Override
        public T next() {
            final var item = source.next();
            if (spec != null) {
                JsonValidator.checkType(valueOf.apply(item), spec, pathOf.apply(item));
            }
            return output.apply(item);
        }
    }
}

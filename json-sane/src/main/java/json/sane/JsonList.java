package json.sane;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.logging.Logger;

/// List-like facade over a raw `List<Object>` with nested lookups and type checking.
///
/// Lists compare lexicographically, element by element, using {@link JsonValues#NATURAL_ORDER}.
/// Paths into a list must start with an index. See {@link JsonContainer} for aliasing semantics.
public final class JsonList extends JsonContainer implements Iterable<Object>, Comparable<JsonList> {

    private static final Logger LOG = Logger.getLogger(JsonList.class.getName());

    private final List<Object> data;

    /// Creates an empty list backed by a new `ArrayList`.
    public JsonList() {
        this.data = new ArrayList<>();
    }

    /// Creates a list holding a validated shallow copy of `source`.
    /// @throws InvalidValueException if `source` holds anything that is not JSON data
    public JsonList(Iterable<?> source) {
        this();
        Objects.requireNonNull(source, "source must not be null");
        extend(source);
        LOG.fine(() -> "Constructed list with " + data.size() + " element(s)");
    }

    /// Wrapping constructor: `data` is used as is, never copied.
    private JsonList(List<Object> data, boolean byReference) {
        this.data = data;
    }

    /// Same as {@link #JsonList(Iterable)}.
    public static JsonList copyOf(Iterable<?> source) {
        return new JsonList(source);
    }

    /// Creates a list of the given values, validating each; `null` elements are JSON null.
    public static JsonList of(Object... values) {
        return new JsonList(Arrays.asList(values));
    }

    /// Wraps an existing list without copying, validating its whole content.
    public static JsonList wrap(List<Object> raw) {
        return wrap(raw, true);
    }

    /// Wraps an existing list without copying.
    /// @param check whether to validate the content; pass `false` only for data known to be good
    /// @throws InvalidValueException if `check` is set and the list holds anything that is not JSON data
    public static JsonList wrap(List<Object> raw, boolean check) {
        Objects.requireNonNull(raw, "raw must not be null");
        if (check) {
            JsonValidator.validate(raw, null);
            LOG.fine(() -> "Wrapped and validated list with " + raw.size() + " element(s)");
        }
        return new JsonList(raw, true);
    }

    @SuppressWarnings("unchecked")
    static JsonList wrapUnchecked(List<?> raw) {
        return new JsonList((List<Object>) raw, true);
    }

    @Override
    Object raw() {
        return data;
    }

    @Override
    Class<?> firstSegmentType() {
        return Integer.class;
    }

    /// Returns the underlying list without copying.
    ///
    /// The list stays usable afterwards as long as it is not modified in a way that
    /// breaks the JSON model.
    @Override
    public List<Object> unwrap() {
        return data;
    }

    @Override
    public int size() {
        return data.size();
    }

    /// Iterates over the values, nested containers wrapped.
    @Override
    public Iterator<Object> iterator() {
        return iter(null).iterator();
    }

    /// The values, each checked against `type` as iteration reaches it.
    public Iterable<Object> iter(Object type) {
        final var spec = TypeSpecs.resolveOptional(type);
        return () -> new CheckedIterator<Indexed, Object>(indexed(), spec, Indexed::value,
                item -> KeyPath.of(item.index()), item -> wrapOut(item.value()));
    }

    private Iterator<Indexed> indexed() {
        final ListIterator<Object> source = data.listIterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public Indexed next() {
                final int index = source.nextIndex();
                return new Indexed(index, source.next());
            }
        };
    }

    /// The values in reverse order, nested containers wrapped.
    public Iterable<Object> reversed() {
        return () -> {
            final ListIterator<Object> source = data.listIterator(data.size());
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return source.hasPrevious();
                }

                @Override
                public Object next() {
                    return wrapOut(source.previous());
                }
            };
        };
    }

    private record Indexed(int index, Object value) {
    }

    @Override
    public void checkTypes(Object type) {
        final var spec = TypeSpecs.resolve(type);
        for (int i = 0; i < data.size(); i++) {
            JsonValidator.checkType(data.get(i), spec, KeyPath.of(i));
        }
    }

    public void append(Object value) {
        append(value, null);
    }

    /// Appends a value after checking it against a type.
    public void append(Object value, Object type) {
        data.add(clean(value, TypeSpecs.resolveOptional(type), KeyPath.of(data.size())));
    }

    public void extend(Iterable<?> values) {
        extend(values, null);
    }

    /// Appends all values. Every value is checked before any is appended.
    public void extend(Iterable<?> values, Object type) {
        Objects.requireNonNull(values, "values must not be null");
        final var spec = TypeSpecs.resolveOptional(type);
        if (values instanceof JsonList other && spec == null) {
            data.addAll(new ArrayList<>(other.data));
            return;
        }
        final List<Object> staged = new ArrayList<>();
        for (Object value : values) {
            staged.add(clean(value, spec, KeyPath.of(data.size() + staged.size())));
        }
        data.addAll(staged);
    }

    public void insert(int index, Object value) {
        insert(index, value, null);
    }

    /// Inserts a value before `index`. Negative indices count from the end, and `size()`
    /// appends.
    /// @throws IndexNotFoundException if the index is outside `-size()..size()`
    public void insert(int index, Object value, Object type) {
        final int position = index < 0 ? data.size() + index : index;
        if (position < 0 || position > data.size()) {
            throw new IndexNotFoundException(KeyPath.of(index));
        }
        data.add(position, clean(value, TypeSpecs.resolveOptional(type), KeyPath.of(position)));
    }

    /// Removes and returns the last value.
    /// @throws IndexNotFoundException if the list is empty
    public Object pop() {
        return pop(-1, null);
    }

    /// Removes and returns the value at a path.
    /// @throws PathSyntaxException if the path does not end in an index
    public Object pop(Object path) {
        return pop(path, null);
    }

    /// Removes and returns the value at a path if it has the expected type.
    public Object pop(Object path, Object type) {
        final var spec = TypeSpecs.resolveOptional(type);
        final var keyPath = pathOf(path);
        if (!(keyPath.last() instanceof Integer)) {
            throw new PathSyntaxException("path must lead to a list index: " + keyPath);
        }
        if (keyPath.size() == 1 && data.isEmpty()) {
            throw new IndexNotFoundException("pop from empty list");
        }
        return wrapOut(PathResolver.delete(data, keyPath, spec));
    }

    /// Removes the first occurrence of a value, like `List.remove(Object)`.
    /// @return whether a value was removed
    public boolean remove(Object value) {
        return remove(value, null);
    }

    public boolean remove(Object value, Object type) {
        final int index = indexOf(value, type);
        if (index < 0) {
            return false;
        }
        data.remove(index);
        return true;
    }

    /// Tells whether an equal value is present.
    /// @throws InvalidValueException if `value` is not JSON data
    public boolean contains(Object value) {
        return indexOf(value) >= 0;
    }

    /// Tells whether an equal value of the given type is present. A value of another type,
    /// or one that is not JSON data, is simply not contained.
    public boolean contains(Object value, Object type) {
        final var spec = TypeSpecs.resolveOptional(type);
        try {
            return indexOf(value, spec) >= 0;
        } catch (InvalidValueException e) {
            return false;
        }
    }

    /// Index of the first equal value, or -1, like `List.indexOf`.
    public int indexOf(Object value) {
        return indexOf(value, null);
    }

    public int indexOf(Object value, Object type) {
        return indexOf(value, 0, data.size(), type);
    }

    public int indexOf(Object value, int start, int stop) {
        return indexOf(value, start, stop, null);
    }

    /// Index of the first equal value between `start` (inclusive) and `stop` (exclusive), or -1.
    /// The bounds are resolved like {@link #slice(int, int)} bounds; the returned index is
    /// relative to the whole list.
    public int indexOf(Object value, int start, int stop, Object type) {
        final var needle = clean(value, TypeSpecs.resolveOptional(type), null);
        final int end = clamp(stop);
        for (int i = clamp(start); i < end; i++) {
            if (JsonValues.deepEquals(data.get(i), needle)) {
                return i;
            }
        }
        return -1;
    }

    public int count(Object value) {
        return count(value, null);
    }

    public int count(Object value, Object type) {
        final var needle = clean(value, TypeSpecs.resolveOptional(type), null);
        int n = 0;
        for (Object item : data) {
            if (JsonValues.deepEquals(item, needle)) {
                n++;
            }
        }
        return n;
    }

    /// A new list holding the values from `from` (inclusive) to `to` (exclusive).
    /// Negative bounds count from the end and out-of-range bounds are clamped, so this never throws.
    public JsonList slice(int from, int to) {
        final int start = clamp(from);
        final int end = clamp(to);
        final List<Object> copy = start < end ? new ArrayList<>(data.subList(start, end)) : new ArrayList<>();
        return new JsonList(copy, true);
    }

    public void setSlice(int from, int to, Iterable<?> values) {
        setSlice(from, to, values, null);
    }

    /// Replaces the values from `from` (inclusive) to `to` (exclusive) with `values`, which
    /// may be longer or shorter than the replaced range. Bounds are resolved like
    /// {@link #slice(int, int)} bounds; an empty range inserts at `from`.
    /// Every value is checked before the list changes.
    public void setSlice(int from, int to, Iterable<?> values, Object type) {
        Objects.requireNonNull(values, "values must not be null");
        final var spec = TypeSpecs.resolveOptional(type);
        final int start = clamp(from);
        final int end = Math.max(start, clamp(to));
        final List<Object> staged = new ArrayList<>();
        for (Object value : values) {
            staged.add(clean(value, spec, KeyPath.of(start + staged.size())));
        }
        final List<Object> range = data.subList(start, end);
        range.clear();
        range.addAll(staged);
        LOG.finer(() -> "Replaced [" + start + ":" + end + "] with " + staged.size() + " value(s)");
    }

    /// Removes the values from `from` (inclusive) to `to` (exclusive), bounds resolved like
    /// {@link #slice(int, int)} bounds. Never throws.
    public void deleteSlice(int from, int to) {
        final int start = clamp(from);
        final int end = clamp(to);
        if (start < end) {
            data.subList(start, end).clear();
        }
    }

    /// A new list holding `times` shallow copies of this list's values in sequence;
    /// empty when `times` is zero or negative.
    /// @throws ArithmeticException if the result would hold more than `Integer.MAX_VALUE` values
    public JsonList repeat(int times) {
        if (times <= 0 || data.isEmpty()) {
            return new JsonList();
        }
        final List<Object> repeated = new ArrayList<>(Math.multiplyExact(data.size(), times));
        for (int i = 0; i < times; i++) {
            repeated.addAll(data);
        }
        return new JsonList(repeated, true);
    }

    private int clamp(int bound) {
        final int resolved = bound < 0 ? data.size() + bound : bound;
        return Math.max(0, Math.min(resolved, data.size()));
    }

    /// A new list with the values of this list followed by `other`'s.
    public JsonList concat(Iterable<?> other) {
        final var result = copy();
        result.extend(other);
        return result;
    }

    /// Sorts in place using {@link JsonValues#NATURAL_ORDER}.
    /// @throws ClassCastException if two values cannot be ordered against each other
    public void sort() {
        data.sort(JsonValues.NATURAL_ORDER);
    }

    /// Sorts the raw values in place.
    public void sort(Comparator<Object> comparator) {
        data.sort(comparator);
    }

    public void reverse() {
        Collections.reverse(data);
    }

    public void clear() {
        data.clear();
    }

    @Override
    public JsonList copy() {
        return new JsonList(new ArrayList<>(data), true);
    }

    @Override
    @SuppressWarnings("unchecked")
    public JsonList deepCopy() {
        return new JsonList((List<Object>) JsonValues.deepCopy(data), true);
    }

    /// Lexicographic comparison of the contents.
    /// @throws ClassCastException if two elements cannot be ordered against each other
    @Override
    public int compareTo(JsonList other) {
        return JsonValues.compare(data, other.data);
    }
}

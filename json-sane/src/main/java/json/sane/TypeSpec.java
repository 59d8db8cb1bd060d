package json.sane;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// Canonical description of an acceptable value shape.
///
/// Three forms exist and they are closed:
/// - {@link Kinds}: one tag, or a union of tags such as `int|float`
/// - {@link ArrayOf}: a list whose every element matches a {@link Kinds}
/// - {@link ObjectOf}: a dict whose every value matches a {@link Kinds}
///
/// Container forms only nest one level deep; `ArrayOf(ArrayOf(...))` cannot be expressed.
/// Build instances with the factories below or from a loose descriptor via {@link TypeSpecs#resolve(Object)}.
public sealed interface TypeSpec permits TypeSpec.Kinds, TypeSpec.ArrayOf, TypeSpec.ObjectOf {

    Kinds NULL = new Kinds(EnumSet.of(JsonKind.NULL));
    Kinds BOOL = new Kinds(EnumSet.of(JsonKind.BOOL));
    Kinds INT = new Kinds(EnumSet.of(JsonKind.INT));
    Kinds FLOAT = new Kinds(EnumSet.of(JsonKind.FLOAT));
    Kinds STRING = new Kinds(EnumSet.of(JsonKind.STRING));
    Kinds OBJECT = new Kinds(EnumSet.of(JsonKind.OBJECT));
    Kinds ARRAY = new Kinds(EnumSet.of(JsonKind.ARRAY));

    /// The explicit numeric union; `INT` and `FLOAT` never widen into each other on their own.
    Kinds NUMBER = new Kinds(EnumSet.of(JsonKind.INT, JsonKind.FLOAT));

    /// {@return true if the raw value (and, for container forms, every element) matches}
    boolean matches(Object raw);

    /// For container forms whose outer shape matches but an element does not,
    /// returns the index (`Integer`) or key (`String`) of the first offending element.
    /// Returns `null` otherwise.
    Object firstMismatch(Object raw);

    static Kinds of(JsonKind kind, JsonKind... more) {
        final var set = EnumSet.of(kind, more);
        return new Kinds(set);
    }

    static ArrayOf arrayOf(JsonKind kind, JsonKind... more) {
        return new ArrayOf(of(kind, more));
    }

    static ObjectOf objectOf(JsonKind kind, JsonKind... more) {
        return new ObjectOf(of(kind, more));
    }

    /// A single tag or a union of tags.
    record Kinds(Set<JsonKind> kinds) implements TypeSpec {
        public Kinds {
            Objects.requireNonNull(kinds, "kinds must not be null");
            if (kinds.isEmpty()) {
                throw new TypeSpecException("a type union needs at least one kind");
            }
            kinds = Collections.unmodifiableSet(EnumSet.copyOf(kinds));
        }

        public boolean accepts(JsonKind kind) {
            return kind != null && kinds.contains(kind);
        }

        @Override
        public boolean matches(Object raw) {
            return accepts(JsonKind.of(raw));
        }

        @Override
        public Object firstMismatch(Object raw) {
            return null;
        }

        @Override
        public String toString() {
            return kinds.stream().map(JsonKind::label).collect(Collectors.joining("|"));
        }
    }

    /// Homogeneous list.
    record ArrayOf(Kinds element) implements TypeSpec {
        public ArrayOf {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public boolean matches(Object raw) {
            return raw instanceof List<?> && firstMismatch(raw) == null;
        }

        @Override
        public Object firstMismatch(Object raw) {
            if (raw instanceof List<?> list) {
                int index = 0;
                for (Object item : list) {
                    if (!element.matches(item)) {
                        return index;
                    }
                    index++;
                }
            }
            return null;
        }

        @Override
        public String toString() {
            return "[" + element + "]";
        }
    }

    /// Homogeneous dict; keys are always strings.
    record ObjectOf(Kinds value) implements TypeSpec {
        public ObjectOf {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean matches(Object raw) {
            return raw instanceof Map<?, ?> && firstMismatch(raw) == null;
        }

        @Override
        public Object firstMismatch(Object raw) {
            if (raw instanceof Map<?, ?> map) {
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    if (!value.matches(entry.getValue())) {
                        return entry.getKey();
                    }
                }
            }
            return null;
        }

        @Override
        public String toString() {
            return "{str: " + value + "}";
        }
    }
}

package json.sane;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/// The seven tags of the JSON value model and the discriminant used by the traversal engine.
///
/// Raw data is plain Java objects. {@link #of(Object)} classifies one of them:
///
/// | Tag | Java representation |
/// |-----|---------------------|
/// | `NULL` | `null` |
/// | `BOOL` | `Boolean` |
/// | `INT` | `Byte`, `Short`, `Integer`, `Long`, `BigInteger` |
/// | `FLOAT` | `Float`, `Double`, `BigDecimal` |
/// | `STRING` | `String` |
/// | `OBJECT` | `Map` |
/// | `ARRAY` | `List` |
///
/// `BOOL`, `INT` and `FLOAT` are disjoint: a `Boolean` is never an integer and an
/// integer never satisfies a float check.
public enum JsonKind {
    NULL("null"),
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STRING("str"),
    OBJECT("dict"),
    ARRAY("list");

    private final String label;

    JsonKind(String label) {
        this.label = label;
    }

    /// Short name used in error messages and `TypeSpec` renderings.
    public String label() {
        return label;
    }

    public boolean isContainer() {
        return this == OBJECT || this == ARRAY;
    }

    /// Classifies a raw value by its shape only; nested content is not inspected.
    /// @return the tag, or `null` when the value is not part of the JSON model at all
    public static JsonKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof String) {
            return STRING;
        }
        if (value instanceof Boolean) {
            return BOOL;
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return INT;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return FLOAT;
        }
        if (value instanceof Map) {
            return OBJECT;
        }
        if (value instanceof List) {
            return ARRAY;
        }
        return null;
    }

    /// Like {@link #of(Object)} but facades count as the container they wrap.
    static JsonKind ofWrapped(Object value) {
        if (value instanceof JsonDict) {
            return OBJECT;
        }
        if (value instanceof JsonList) {
            return ARRAY;
        }
        return of(value);
    }

    /// Label of whatever the value is, including values outside the model.
    static String describe(Object value) {
        final var kind = of(value);
        return kind != null ? kind.label : value.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return label;
    }
}

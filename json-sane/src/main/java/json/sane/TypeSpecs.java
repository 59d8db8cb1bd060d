package json.sane;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Resolves loose, caller-friendly type descriptors into a canonical {@link TypeSpec}.
///
/// Accepted descriptors:
/// ```java
/// TypeSpecs.resolve(JsonKind.STRING);                        // str
/// TypeSpecs.resolve(Long.class);                             // int
/// TypeSpecs.resolve(EnumSet.of(JsonKind.INT, JsonKind.FLOAT)); // int|float
/// TypeSpecs.resolve(List.of(JsonKind.OBJECT));               // [dict]
/// TypeSpecs.resolve(Map.of(String.class, Boolean.class));    // {str: bool}
/// ```
/// Anything else is a {@link TypeSpecException}.
public final class TypeSpecs {

    private static final String EXPECTED =
            "expected a JsonKind, a class token, a set of JsonKind, [...] (for lists) or {str: ...} (for dicts)";

    private TypeSpecs() {
    }

    public static TypeSpec resolve(Object descriptor) {
        if (descriptor instanceof TypeSpec spec) {
            return spec;
        }
        if (descriptor instanceof List<?> list) {
            if (list.size() != 1) {
                throw invalid(descriptor);
            }
            return new TypeSpec.ArrayOf(scalar(list.get(0), descriptor));
        }
        if (descriptor instanceof Map<?, ?> map) {
            if (map.size() != 1) {
                throw invalid(descriptor);
            }
            final var entry = map.entrySet().iterator().next();
            if (!isStringKind(entry.getKey())) {
                throw new TypeSpecException("dict type descriptors must use the string kind as key, got "
                        + Repr.of(entry.getKey()));
            }
            return new TypeSpec.ObjectOf(scalar(entry.getValue(), descriptor));
        }
        return scalar(descriptor, descriptor);
    }

    /// Resolves `null` to `null` so optional type arguments can pass straight through.
    static TypeSpec resolveOptional(Object descriptor) {
        return descriptor == null ? null : resolve(descriptor);
    }

    private static TypeSpec.Kinds scalar(Object token, Object descriptor) {
        if (token instanceof TypeSpec.Kinds kinds) {
            return kinds;
        }
        if (token instanceof Set<?> set) {
            if (set.isEmpty()) {
                throw invalid(descriptor);
            }
            final var kinds = EnumSet.noneOf(JsonKind.class);
            for (Object member : set) {
                final var kind = kindOf(member);
                if (kind == null) {
                    throw invalid(descriptor);
                }
                kinds.add(kind);
            }
            return new TypeSpec.Kinds(kinds);
        }
        final var kind = kindOf(token);
        if (kind == null) {
            throw invalid(descriptor);
        }
        return new TypeSpec.Kinds(EnumSet.of(kind));
    }

    private static boolean isStringKind(Object token) {
        if (token instanceof TypeSpec.Kinds kinds) {
            return kinds.kinds().equals(EnumSet.of(JsonKind.STRING));
        }
        return kindOf(token) == JsonKind.STRING;
    }

    private static JsonKind kindOf(Object token) {
        if (token instanceof JsonKind kind) {
            return kind;
        }
        if (token instanceof Class<?> type) {
            if (type == String.class) {
                return JsonKind.STRING;
            }
            if (type == Boolean.class) {
                return JsonKind.BOOL;
            }
            if (type == Long.class || type == Integer.class) {
                return JsonKind.INT;
            }
            if (type == Double.class || type == Float.class) {
                return JsonKind.FLOAT;
            }
            if (type == Map.class || type == JsonDict.class) {
                return JsonKind.OBJECT;
            }
            if (type == List.class || type == JsonList.class) {
                return JsonKind.ARRAY;
            }
        }
        return null;
    }

    private static TypeSpecException invalid(Object descriptor) {
        return new TypeSpecException(EXPECTED + ", got " + Repr.of(descriptor));
    }
}

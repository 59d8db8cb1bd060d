package json.sane;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Entry points for moving between raw data and facades.
///
/// ```java
/// Map<String, Object> parsed = ...;          // e.g. from any JSON parser
/// JsonDict doc = (JsonDict) Sane.wrap(parsed);
/// Object raw = Sane.unwrapIfWrapped(doc);    // the same map instance
/// ```
public final class Sane {

    private static final Logger LOG = Logger.getLogger(Sane.class.getName());

    private Sane() {
    }

    /// Wraps a raw `Map` or `List` after validating its whole content. Facades are returned as is.
    /// @throws IllegalArgumentException if `value` is not a container
    /// @throws InvalidValueException if the content is not JSON data
    public static JsonContainer wrap(Object value) {
        return wrap(value, true);
    }

    /// Wraps a raw `Map` or `List`, optionally skipping validation. Facades are returned as is.
    /// @throws IllegalArgumentException if `value` is not a container
    public static JsonContainer wrap(Object value, boolean check) {
        if (value instanceof JsonContainer container) {
            return container;
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            if (check) {
                JsonValidator.validate(value, null);
            }
            LOG.finer(() -> "Wrapping " + JsonKind.describe(value) + (check ? " (validated)" : ""));
            return (JsonContainer) JsonContainer.wrapOut(value);
        }
        throw new IllegalArgumentException("cannot wrap " + JsonKind.describe(value) + ": " + Repr.of(value));
    }

    /// Returns the raw data of a facade, or the value itself.
    public static Object unwrapIfWrapped(Object value) {
        return value instanceof JsonContainer container ? container.unwrap() : value;
    }
}

package json.sane;

/// A value fails its `TypeSpec`, or is not a JSON value at all.
public final class InvalidValueException extends DataException {

    private static final long serialVersionUID = 1L;

    private final transient Object value;

    InvalidValueException(String message, KeyPath path, Object value) {
        super(message, path);
        this.value = value;
    }

    /// The offending value, as found in the data.
    public Object value() {
        return value;
    }
}

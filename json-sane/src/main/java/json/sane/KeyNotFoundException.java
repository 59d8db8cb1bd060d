package json.sane;

/// A dict key is missing along a path.
public final class KeyNotFoundException extends JsonLookupException {

    private static final long serialVersionUID = 1L;

    public KeyNotFoundException(KeyPath path) {
        super("key not found: " + path, path);
    }

    KeyNotFoundException(String message) {
        super(message, null);
    }
}

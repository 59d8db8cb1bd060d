package json.sane;

/// A list index is out of range along a path.
public final class IndexNotFoundException extends JsonLookupException {

    private static final long serialVersionUID = 1L;

    public IndexNotFoundException(KeyPath path) {
        super("index out of range: " + path, path);
    }

    IndexNotFoundException(String message) {
        super(message, null);
    }
}

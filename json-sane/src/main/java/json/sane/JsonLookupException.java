package json.sane;

/// A key or index is absent somewhere along a path.
///
/// Missing data is expected and recoverable: callers that have a sensible fallback
/// catch this type, or use `getOrDefault`/`containsPath` which never let it escape.
public abstract class JsonLookupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient KeyPath path;

    JsonLookupException(String message, KeyPath path) {
        super(message);
        this.path = path;
    }

    /// The path up to and including the missing segment.
    public KeyPath path() {
        return path;
    }
}

package json.sane;

/// Base class for data errors: the data does not have the shape or types the caller asked for.
///
/// These are input-validation failures rather than bugs at the call site, so catching
/// `DataException` to reject a malformed document is reasonable.
public abstract class DataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient KeyPath path;

    DataException(String message, KeyPath path) {
        super(message);
        this.path = path;
    }

    /// The path being resolved, or `null` when a free-standing value was checked.
    public KeyPath path() {
        return path;
    }
}

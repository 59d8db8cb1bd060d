package json.sane;

/// A path argument is malformed. This signals an incorrect call site and is not meant to be caught.
public final class PathSyntaxException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public PathSyntaxException(String message) {
        super(message);
    }
}

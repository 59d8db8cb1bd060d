package json.sane;

/// A type descriptor is malformed. This signals an incorrect call site and is not meant to be caught.
public final class TypeSpecException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public TypeSpecException(String message) {
        super(message);
    }
}

package json.sane;

/// An intermediate node along a path is not the container kind the next segment needs,
/// or a write would have to create a list.
public final class InvalidStructureException extends DataException {

    private static final long serialVersionUID = 1L;

    private final transient KeyPath subPath;
    private final JsonKind actualKind;

    InvalidStructureException(String message, KeyPath path, KeyPath subPath, JsonKind actualKind) {
        super(message, path);
        this.subPath = subPath;
        this.actualKind = actualKind;
    }

    /// Expected one container kind but found another at `subPath` (`null` for the root).
    static InvalidStructureException mismatch(JsonKind expected, Object node, KeyPath subPath, KeyPath path) {
        return new InvalidStructureException(
                "expected " + expected.label() + ", got " + JsonKind.describe(node)
                        + " at subpath " + (subPath == null ? "[]" : subPath.toString()) + " of " + path,
                path, subPath, JsonKind.of(node));
    }

    /// The walked part of the path where the mismatch was found; `null` means the root.
    public KeyPath subPath() {
        return subPath;
    }

    /// The kind actually found; `null` if nothing was there or the node is outside the JSON model.
    public JsonKind actualKind() {
        return actualKind;
    }
}

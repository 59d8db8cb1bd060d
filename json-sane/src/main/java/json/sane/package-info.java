/// Dict and list facades over plain nested `Map`/`List` JSON data.
///
/// ## Paths
/// Nested values are addressed with a {@link json.sane.KeyPath}: a list of `String` keys
/// and `Integer` indices. Every method that takes a path also accepts a bare key or index,
/// a `List` or an `Object[]`.
/// ```java
/// JsonDict doc = JsonDict.wrap(parsed);
/// doc.get(List.of("items", 0, "name"));
/// doc.set(KeyPath.of("meta", "source"), "import");   // creates "meta" if missing
/// ```
///
/// ## Types
/// Reads, writes and iteration take an optional type: a {@link json.sane.JsonKind}, a class
/// token such as `String.class`, a union (`EnumSet`), `[kind]` for homogeneous lists or
/// `{str: kind}` for homogeneous dicts. A mismatch raises
/// {@link json.sane.InvalidValueException} naming the full path and the offending value.
///
/// ## Errors
/// - {@link json.sane.JsonLookupException}: a key or index is missing
/// - {@link json.sane.DataException}: the data has the wrong structure or types
/// - {@link json.sane.PathSyntaxException}, {@link json.sane.TypeSpecException}: the call itself is malformed
///
/// ## Logging
/// The package logs through `java.util.logging` at `FINE` and below; nothing is logged at
/// `INFO` or above during normal operation.
package json.sane;

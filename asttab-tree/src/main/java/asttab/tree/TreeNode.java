package asttab.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A syntax tree node such as `Name` or `FunctionDef`.
///
/// `fields` holds the node's grammar fields and `attributes` its location attributes
/// (`lineno`, `col_offset`, ...). Both keep insertion order. A field that was never
/// set is absent from the map, which is not the same as holding `None`.
public record TreeNode(String type, Map<String, TreeValue> fields, Map<String, TreeValue> attributes)
        implements TreeValue {

    public TreeNode {
        Objects.requireNonNull(type, "type must not be null");
        fields = freeze(fields);
        attributes = freeze(attributes);
    }

    public TreeNode(String type, Map<String, TreeValue> fields) {
        this(type, fields, Map.of());
    }

    private static Map<String, TreeValue> freeze(Map<String, TreeValue> map) {
        Objects.requireNonNull(map, "map must not be null");
        final var copy = new LinkedHashMap<String, TreeValue>();
        map.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "name must not be null"),
                Objects.requireNonNull(value, () -> "value of " + name + " must not be null")));
        return Collections.unmodifiableMap(copy);
    }

    /// Returns the field value, or null if the field is not set.
    public TreeValue field(String name) {
        return fields.get(name);
    }

    /// Returns the attribute value, or null if the attribute is not set.
    public TreeValue attribute(String name) {
        return attributes.get(name);
    }
}

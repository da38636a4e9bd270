package asttab.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Location attribute repair, the counterpart of `ast.fix_missing_locations`.
public final class TreeLocations {

    private TreeLocations() {}

    private record Location(TreeValue lineno, TreeValue colOffset, TreeValue endLineno, TreeValue endColOffset) {}

    public static TreeNode fixMissing(TreeNode root) {
        return fixMissing(root, NodeSchema.standard());
    }

    /// Returns a copy of `root` in which every node whose category carries location
    /// attributes has them all set. A missing value is inherited from the nearest
    /// ancestor, starting from line 1, column 0.
    public static TreeNode fixMissing(TreeNode root, NodeSchema schema) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        final var start = new Location(TreeConstant.integer(1), TreeConstant.integer(0),
                TreeConstant.integer(1), TreeConstant.integer(0));
        return fix(root, start, schema);
    }

    private static TreeNode fix(TreeNode node, Location inherited, NodeSchema schema) {
        final List<String> names = schema.attributesOf(node.type()).stream().map(NodeSchema.FieldSpec::name).toList();
        final Map<String, TreeValue> attributes = new LinkedHashMap<>(node.attributes());

        TreeValue lineno = inherited.lineno();
        TreeValue colOffset = inherited.colOffset();
        TreeValue endLineno = inherited.endLineno();
        TreeValue endColOffset = inherited.endColOffset();
        if (names.contains("lineno")) {
            lineno = inheritIfAbsent(attributes, "lineno", lineno, false);
        }
        if (names.contains("end_lineno")) {
            endLineno = inheritIfAbsent(attributes, "end_lineno", endLineno, true);
        }
        if (names.contains("col_offset")) {
            colOffset = inheritIfAbsent(attributes, "col_offset", colOffset, false);
        }
        if (names.contains("end_col_offset")) {
            endColOffset = inheritIfAbsent(attributes, "end_col_offset", endColOffset, true);
        }
        final var here = new Location(lineno, colOffset, endLineno, endColOffset);

        final Map<String, TreeValue> fields = new LinkedHashMap<>();
        node.fields().forEach((name, value) -> fields.put(name, fixChild(value, here, schema)));
        return new TreeNode(node.type(), fields, attributes);
    }

    /// Sets the attribute from `inherited` when unset (or None, for the end positions)
    /// and returns the value now in effect.
    private static TreeValue inheritIfAbsent(Map<String, TreeValue> attributes, String name,
                                             TreeValue inherited, boolean noneCountsAsMissing) {
        final TreeValue current = attributes.get(name);
        final boolean missing = current == null
                || (noneCountsAsMissing && current instanceof TreeConstant constant && constant.isNone());
        if (missing) {
            attributes.put(name, inherited);
            return inherited;
        }
        return current;
    }

    private static TreeValue fixChild(TreeValue value, Location inherited, NodeSchema schema) {
        if (value instanceof TreeNode child) {
            return fix(child, inherited, schema);
        }
        if (value instanceof TreeSequence sequence && sequence.kind() == TreeSequence.Kind.LIST) {
            final List<TreeValue> elements = new ArrayList<>(sequence.elements().size());
            for (TreeValue element : sequence.elements()) {
                elements.add(element instanceof TreeNode child ? fix(child, inherited, schema) : element);
            }
            return new TreeSequence(sequence.kind(), elements);
        }
        return value;
    }
}

package asttab.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// Renders a tree exactly as Python 3.12's `ast.dump(node, indent=...)` does.
///
/// Fields are written in schema order with `name=` annotations. Unset fields and
/// optional fields holding `None` are left out. A node whose arguments are all simple
/// and number at most three is written on one line; lists always open a new indent
/// level. With no indent the whole dump is a single line.
public final class TreeDumper {

    private final NodeSchema schema;
    private final String indent;
    private final boolean includeAttributes;

    /// @param indent spaces per level, or null for single-line output
    public TreeDumper(NodeSchema schema, Integer indent, boolean includeAttributes) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        if (indent != null && indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        this.indent = indent == null ? null : " ".repeat(indent);
        this.includeAttributes = includeAttributes;
    }

    public static String dump(TreeValue value) {
        return new TreeDumper(NodeSchema.standard(), null, false).render(value);
    }

    public static String dump(TreeValue value, int indent) {
        return new TreeDumper(NodeSchema.standard(), indent, false).render(value);
    }

    public String render(TreeValue value) {
        return format(Objects.requireNonNull(value, "value must not be null"), 0).text();
    }

    private record Formatted(String text, boolean simple) {}

    private Formatted format(TreeValue value, int level) {
        final String prefix;
        final String sep;
        if (indent != null) {
            level++;
            prefix = "\n" + indent.repeat(level);
            sep = ",\n" + indent.repeat(level);
        } else {
            prefix = "";
            sep = ", ";
        }
        if (value instanceof TreeNode node) {
            final List<String> args = new ArrayList<>();
            boolean allSimple = true;
            for (Map.Entry<String, TreeValue> entry : fieldsInOrder(node)) {
                final Formatted formatted = format(entry.getValue(), level);
                allSimple &= formatted.simple();
                args.add(entry.getKey() + "=" + formatted.text());
            }
            if (includeAttributes) {
                for (NodeSchema.FieldSpec spec : schema.attributesOf(node.type())) {
                    final TreeValue attribute = node.attribute(spec.name());
                    if (attribute == null || (spec.optional() && isNone(attribute))) {
                        continue;
                    }
                    final Formatted formatted = format(attribute, level);
                    allSimple &= formatted.simple();
                    args.add(spec.name() + "=" + formatted.text());
                }
            }
            if (allSimple && args.size() <= 3) {
                return new Formatted(node.type() + "(" + String.join(", ", args) + ")", args.isEmpty());
            }
            return new Formatted(node.type() + "(" + prefix + String.join(sep, args) + ")", false);
        }
        if (value instanceof TreeSequence sequence) {
            if (sequence.kind() == TreeSequence.Kind.TUPLE) {
                return new Formatted(tupleRepr(sequence), true);
            }
            if (sequence.isEmpty()) {
                return new Formatted("[]", true);
            }
            final int childLevel = level;
            final String body = sequence.elements().stream()
                    .map(element -> format(element, childLevel).text())
                    .collect(Collectors.joining(sep));
            return new Formatted("[" + prefix + body + "]", false);
        }
        return new Formatted(((TreeConstant) value).repr(), true);
    }

    private List<Map.Entry<String, TreeValue>> fieldsInOrder(TreeNode node) {
        final var type = schema.type(node.type());
        if (type.isEmpty()) {
            return List.copyOf(node.fields().entrySet());
        }
        final List<Map.Entry<String, TreeValue>> entries = new ArrayList<>();
        for (NodeSchema.FieldSpec spec : type.get().fields()) {
            final TreeValue value = node.field(spec.name());
            if (value == null || (spec.optional() && isNone(value))) {
                continue;
            }
            entries.add(Map.entry(spec.name(), value));
        }
        return entries;
    }

    /// Tuples are printed with `repr`, as `ast.dump` does for anything that is not a node or list.
    private String tupleRepr(TreeSequence tuple) {
        final String body = tuple.elements().stream()
                .map(element -> new TreeDumper(schema, null, includeAttributes).render(element))
                .collect(Collectors.joining(", "));
        return tuple.elements().size() == 1 ? "(" + body + ",)" : "(" + body + ")";
    }

    private static boolean isNone(TreeValue value) {
        return value instanceof TreeConstant constant && constant.isNone();
    }
}

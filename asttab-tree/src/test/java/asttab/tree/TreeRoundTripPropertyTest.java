package asttab.tree;

import asttab.core.DumpParser;
import net.jqwik.api.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Dumps random expression trees, converts the dump to builder text and rebuilds the
/// tree from it; the rebuilt tree must dump identically.
class TreeRoundTripPropertyTest extends TreeLoggingConfig {

    static final Logger LOG = Logger.getLogger(TreeRoundTripPropertyTest.class.getName());

    private static final TreeBuilder BUILDER = TreeBuilder.standard();

    @Provide
    Arbitrary<TreeNode> statements() {
        return expressions(3).map(value -> node("Expr", "value", value));
    }

    private static Arbitrary<TreeNode> expressions(int depth) {
        final Arbitrary<TreeNode> leaves = Arbitraries.oneOf(
                Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(6)
                        .map(id -> name(id)),
                constants().map(value -> node("Constant", "value", value)));
        if (depth == 0) {
            return leaves;
        }
        final Arbitrary<TreeNode> child = expressions(depth - 1);
        final Arbitrary<TreeNode> binOps = Combinators.combine(child, Arbitraries.of("Add", "Sub", "Mult", "BitOr"), child)
                .as((left, op, right) -> {
                    final Map<String, TreeValue> fields = new LinkedHashMap<>();
                    fields.put("left", left);
                    fields.put("op", new TreeNode(op, Map.of()));
                    fields.put("right", right);
                    return new TreeNode("BinOp", fields);
                });
        final Arbitrary<TreeNode> lists = child.list().ofMaxSize(4).map(elements -> {
            final Map<String, TreeValue> fields = new LinkedHashMap<>();
            fields.put("elts", TreeSequence.list(List.<TreeValue>copyOf(elements)));
            fields.put("ctx", new TreeNode("Load", Map.of()));
            return new TreeNode("List", fields);
        });
        return Arbitraries.oneOf(leaves, binOps, lists);
    }

    private static Arbitrary<TreeConstant> constants() {
        return Arbitraries.oneOf(
                Arbitraries.integers().between(-1000, 1000).map(TreeConstant::integer),
                Arbitraries.of("0.5", "1e-05", "3.25", "2j").map(text -> text.endsWith("j")
                        ? new TreeConstant(TreeConstant.Kind.IMAGINARY, text)
                        : new TreeConstant(TreeConstant.Kind.FLOAT, text)),
                Arbitraries.strings().withCharRange('a', 'z').withChars(' ', '\'', '"').ofMaxLength(8)
                        .filter(s -> !(s.indexOf('\'') >= 0 && s.indexOf('"') >= 0))
                        .map(TreeConstant::string),
                Arbitraries.of(TreeConstant.NONE, TreeConstant.ELLIPSIS, TreeConstant.bool(true), TreeConstant.bool(false)));
    }

    private static TreeNode name(String id) {
        final Map<String, TreeValue> fields = new LinkedHashMap<>();
        fields.put("id", TreeConstant.string(id));
        fields.put("ctx", new TreeNode("Load", Map.of()));
        return new TreeNode("Name", fields);
    }

    private static TreeNode node(String type, String field, TreeValue value) {
        return new TreeNode(type, Map.of(field, value));
    }

    @Property(tries = 200)
    void singleLineDumpRebuildsIdentically(@ForAll("statements") TreeNode tree) {
        final String dump = TreeDumper.dump(tree);
        final TreeNode rebuilt = BUILDER.build(DumpParser.parse(dump));

        assertThat(TreeDumper.dump(rebuilt)).isEqualTo(dump);
    }

    @Property(tries = 100)
    void indentedDumpRebuildsIdentically(@ForAll("statements") TreeNode tree) {
        final String dump = TreeDumper.dump(tree, 4);
        final TreeNode rebuilt = BUILDER.build(DumpParser.parse(dump));

        assertThat(TreeDumper.dump(rebuilt, 4)).isEqualTo(dump);
        assertThat(rebuilt).isEqualTo(BUILDER.build(DumpParser.parse(TreeDumper.dump(tree))));
    }

    @Example
    void emptyListStaysInline() {
        LOG.info(() -> "EXAMPLE: emptyListStaysInline");
        final TreeNode module = BUILDER.build("ast.Module(body=[], type_ignores=[])");

        assertThat(TreeDumper.dump(module, 4)).isEqualTo("Module(body=[], type_ignores=[])");
    }
}

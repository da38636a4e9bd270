package asttab.tree;

import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class TreeLocationsTest extends TreeLoggingConfig {

    private static final Logger LOG = Logger.getLogger(TreeLocationsTest.class.getName());

    private final TreeBuilder builder = TreeBuilder.standard();
    private final TreeDumper dumper = new TreeDumper(NodeSchema.standard(), null, true);

    @Test
    void testMissingLocationsStartAtLineOne() {
        LOG.info(() -> "TEST: testMissingLocationsStartAtLineOne");
        final TreeNode fixed = TreeLocations.fixMissing(builder.build(
                "ast.Module(body=[ast.Expr(value=ast.Name(id='x', ctx=ast.Load()))], type_ignores=[])"));

        assertThat(dumper.render(fixed)).isEqualTo(
                "Module(body=[Expr(value=Name(id='x', ctx=Load(), lineno=1, col_offset=0, end_lineno=1, end_col_offset=0),"
                        + " lineno=1, col_offset=0, end_lineno=1, end_col_offset=0)], type_ignores=[])");
    }

    @Test
    void testChildrenInheritFromNearestAncestor() {
        LOG.info(() -> "TEST: testChildrenInheritFromNearestAncestor");
        final TreeNode fixed = TreeLocations.fixMissing(builder.build(
                "ast.Expr(value=ast.Name(id='x', ctx=ast.Load(), col_offset=7), lineno=3, col_offset=2, end_lineno=None)"));
        final TreeNode name = (TreeNode) fixed.field("value");

        assertThat(fixed.attribute("lineno")).isEqualTo(TreeConstant.integer(3));
        assertThat(fixed.attribute("end_lineno")).isEqualTo(TreeConstant.integer(1));
        assertThat(name.attribute("lineno")).isEqualTo(TreeConstant.integer(3));
        assertThat(name.attribute("col_offset")).isEqualTo(TreeConstant.integer(7));
        assertThat(name.attribute("end_lineno")).isEqualTo(TreeConstant.integer(1));
        assertThat(((TreeNode) name.field("ctx")).attributes()).isEmpty();
    }

    @Test
    void testInputIsNotModified() {
        LOG.info(() -> "TEST: testInputIsNotModified");
        final TreeNode original = builder.build("ast.Pass()");

        TreeLocations.fixMissing(original);

        assertThat(original.attributes()).isEmpty();
    }
}

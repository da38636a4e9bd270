package asttab.tree;

import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class TreeDumperTest extends TreeLoggingConfig {

    private static final Logger LOG = Logger.getLogger(TreeDumperTest.class.getName());

    private static final String ASSIGNMENT =
            "ast.Module(body=[ast.Assign(targets=[ast.Name(id='x', ctx=ast.Store())], value=ast.Constant(value=1))], type_ignores=[])";

    private final TreeBuilder builder = TreeBuilder.standard();

    @Test
    void testSingleLineDump() {
        LOG.info(() -> "TEST: testSingleLineDump");
        assertThat(TreeDumper.dump(builder.build(ASSIGNMENT))).isEqualTo(
                "Module(body=[Assign(targets=[Name(id='x', ctx=Store())], value=Constant(value=1))], type_ignores=[])");
    }

    @Test
    void testIndentedDumpMatchesPythonLayout() {
        LOG.info(() -> "TEST: testIndentedDumpMatchesPythonLayout");
        assertThat(TreeDumper.dump(builder.build(ASSIGNMENT), 4)).isEqualTo("""
                Module(
                    body=[
                        Assign(
                            targets=[
                                Name(id='x', ctx=Store())],
                            value=Constant(value=1))],
                    type_ignores=[])""");
    }

    @Test
    void testOptionalNoneAndUnsetFieldsAreOmitted() {
        LOG.info(() -> "TEST: testOptionalNoneAndUnsetFieldsAreOmitted");
        final TreeNode ret = builder.build("ast.Return(value=None)");
        final TreeNode constant = builder.build("ast.Constant(value=None, kind=None)");

        assertThat(TreeDumper.dump(ret)).isEqualTo("Return()");
        assertThat(TreeDumper.dump(constant)).isEqualTo("Constant(value=None)");
        assertThat(TreeDumper.dump(builder.build("ast.Name(id='y')"))).isEqualTo("Name(id='y')");
    }

    @Test
    void testMoreThanThreeArgumentsBreakTheLine() {
        LOG.info(() -> "TEST: testMoreThanThreeArgumentsBreakTheLine");
        final TreeNode alias = builder.build("ast.ImportFrom(module='m', names=[], level=0)");
        final TreeNode args = builder.build(
                "ast.arguments(posonlyargs=[], args=[], kwonlyargs=[], kw_defaults=[], defaults=[])");

        assertThat(TreeDumper.dump(alias, 2)).isEqualTo("ImportFrom(module='m', names=[], level=0)");
        assertThat(TreeDumper.dump(args, 2)).isEqualTo("""
                arguments(
                  posonlyargs=[],
                  args=[],
                  kwonlyargs=[],
                  kw_defaults=[],
                  defaults=[])""");
    }

    @Test
    void testConstantsUseRepr() {
        LOG.info(() -> "TEST: testConstantsUseRepr");
        final TreeNode node = builder.build(
                "ast.Expr(value=ast.Tuple(elts=[ast.Constant(value=\"it's\"), ast.Constant(value=b'\\n'), ast.Constant(value=Ellipsis)], ctx=ast.Load()))");

        assertThat(TreeDumper.dump(node)).isEqualTo(
                "Expr(value=Tuple(elts=[Constant(value=\"it's\"), Constant(value=b'\\n'), Constant(value=Ellipsis)], ctx=Load()))");
    }

    @Test
    void testOverflowingFloatsDumpAsInfinity() {
        LOG.info(() -> "TEST: testOverflowingFloatsDumpAsInfinity");
        assertThat(TreeDumper.dump(builder.build("ast.Constant(value=1e309)"))).isEqualTo("Constant(value=inf)");
        assertThat(TreeDumper.dump(builder.build("ast.Constant(value=-1e400)"))).isEqualTo("Constant(value=-inf)");
        assertThat(TreeDumper.dump(builder.build("ast.Constant(value=1e309j)"))).isEqualTo("Constant(value=infj)");
        assertThat(TreeDumper.dump(builder.build("ast.Constant(value=1e308)"))).isEqualTo("Constant(value=1e308)");
    }

    @Test
    void testTupleConstantsPrintAsTuples() {
        LOG.info(() -> "TEST: testTupleConstantsPrintAsTuples");
        assertThat(TreeDumper.dump(builder.build("ast.Constant(value=(1,))"))).isEqualTo("Constant(value=(1,))");
        assertThat(TreeDumper.dump(builder.build("ast.Constant(value=(1, 'a'))"))).isEqualTo("Constant(value=(1, 'a'))");
    }

    @Test
    void testAttributesAreDumpedOnRequest() {
        LOG.info(() -> "TEST: testAttributesAreDumpedOnRequest");
        final TreeNode pass = builder.build("ast.Pass(lineno=1, col_offset=0, end_lineno=None, end_col_offset=4)");
        final var dumper = new TreeDumper(NodeSchema.standard(), null, true);

        assertThat(dumper.render(pass)).isEqualTo("Pass(lineno=1, col_offset=0, end_col_offset=4)");
        assertThat(TreeDumper.dump(pass)).isEqualTo("Pass()");
    }

    @Test
    void testZeroIndentStillBreaksLines() {
        LOG.info(() -> "TEST: testZeroIndentStillBreaksLines");
        assertThat(TreeDumper.dump(builder.build("ast.Module(body=[ast.Pass()], type_ignores=[])"), 0))
                .isEqualTo("Module(\nbody=[\nPass()],\ntype_ignores=[])");
    }
}

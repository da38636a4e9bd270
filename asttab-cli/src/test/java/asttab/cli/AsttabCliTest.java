package asttab.cli;

import asttab.roundtrip.Bindings;
import asttab.roundtrip.CallableKind;
import asttab.roundtrip.ReconstructedCallable;
import asttab.roundtrip.RoundTrip;
import asttab.roundtrip.TreeServices;
import asttab.tree.TreeBuilder;
import asttab.tree.TreeNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class AsttabCliTest extends CliLoggingConfig {

    private static final Logger LOG = Logger.getLogger(AsttabCliTest.class.getName());

    private static final String ASSIGNMENT =
            "ast.Module(body=[ast.Assign(targets=[ast.Name(id='x', ctx=ast.Store())], value=ast.Constant(value=1))], type_ignores=[])";

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final List<String> hostCalls = new ArrayList<>();

    /// Answers every parse with the `x = 1` module and unparses to a fixed marker.
    private final TreeServices services = new TreeServices() {
        @Override
        public TreeNode parseSource(String source) {
            hostCalls.add("parse:" + source);
            return TreeBuilder.standard().build(ASSIGNMENT);
        }

        @Override
        public String unparse(TreeNode tree) {
            hostCalls.add("unparse:" + tree.type());
            return "x = 1";
        }

        @Override
        public ReconstructedCallable compileAndExecute(TreeNode module, String name, Bindings bindings) {
            hostCalls.add("exec:" + name);
            return new ReconstructedCallable(name, CallableKind.FUNCTION, "def " + name + "(): pass");
        }
    };

    private int run(String... args) {
        return AsttabCli.run(args, new PrintWriter(out), new PrintWriter(err), () -> new RoundTrip(services));
    }

    @Test
    void testParseEmitsValidationScript(@TempDir Path dir) throws Exception {
        LOG.info(() -> "TEST: testParseEmitsValidationScript");
        final Path dump = Files.writeString(dir.resolve("dump.txt"), "Expr(value=Constant(value=None))");

        assertThat(run("parse", dump.toString())).isEqualTo(AsttabCli.OK);
        assertThat(out.toString()).isEqualToNormalizingNewlines("""
                import ast

                node = ast.Expr(value=ast.Constant(value=None))

                print(ast.dump(node, indent=4))  # validation
                """);
        assertThat(hostCalls).isEmpty();
    }

    @Test
    void testParsePretty(@TempDir Path dir) throws Exception {
        LOG.info(() -> "TEST: testParsePretty");
        final Path dump = Files.writeString(dir.resolve("dump.txt"), "Name(id='x', ctx=Load())");

        assertThat(run("parse", "--pretty", dump.toString())).isEqualTo(AsttabCli.OK);
        assertThat(out.toString()).contains("node = ast.Name(\n    id='x',\n    ctx=ast.Load(),\n)");
    }

    @Test
    void testParseErrorExitsWithOne(@TempDir Path dir) throws Exception {
        LOG.info(() -> "TEST: testParseErrorExitsWithOne");
        final Path dump = Files.writeString(dir.resolve("dump.txt"), "Constant(value=Maybe)");

        assertThat(run("parse", dump.toString())).isEqualTo(AsttabCli.FAILED);
        assertThat(err.toString()).contains("Unknown atom");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testMissingFileExitsWithOne(@TempDir Path dir) {
        LOG.info(() -> "TEST: testMissingFileExitsWithOne");
        assertThat(run("parse", dir.resolve("absent.txt").toString())).isEqualTo(AsttabCli.FAILED);
        assertThat(run("there", "--file", dir.resolve("absent.py").toString())).isEqualTo(AsttabCli.FAILED);
    }

    @Test
    void testThereWithCodeAndIndent() {
        LOG.info(() -> "TEST: testThereWithCodeAndIndent");
        assertThat(run("there", "--code", "x = 1", "-i", "2")).isEqualTo(AsttabCli.OK);
        assertThat(out.toString()).startsWith("Module(\n  body=[");
        assertThat(hostCalls).containsExactly("parse:x = 1");
    }

    @Test
    void testThereReadsFile(@TempDir Path dir) throws Exception {
        LOG.info(() -> "TEST: testThereReadsFile");
        final Path source = Files.writeString(dir.resolve("snippet.py"), "value = 42");

        assertThat(run("there", "-f", source.toString())).isEqualTo(AsttabCli.OK);
        assertThat(out.toString()).contains("Module(");
        assertThat(hostCalls).containsExactly("parse:value = 42");
    }

    @Test
    void testBackPrintsSource(@TempDir Path dir) throws Exception {
        LOG.info(() -> "TEST: testBackPrintsSource");
        final Path builder = Files.writeString(dir.resolve("builder.txt"), ASSIGNMENT);

        assertThat(run("back", "--builder", ASSIGNMENT)).isEqualTo(AsttabCli.OK);
        assertThat(run("back", "--file", builder.toString())).isEqualTo(AsttabCli.OK);
        assertThat(out.toString()).isEqualToNormalizingNewlines("x = 1\nx = 1\n");
    }

    @Test
    void testBackCallable() {
        LOG.info(() -> "TEST: testBackCallable");
        final String module = "ast.Module(body=[ast.FunctionDef(name='greet', args=ast.arguments(posonlyargs=[], args=[], "
                + "kwonlyargs=[], kw_defaults=[], defaults=[]), body=[ast.Pass()], decorator_list=[])], type_ignores=[])";

        assertThat(run("back", "-b", module, "--callable")).isEqualTo(AsttabCli.OK);
        assertThat(out.toString()).isEqualToNormalizingNewlines("Callable reconstructed: greet\n");
    }

    @Test
    void testBackCallableWithoutFunctionFails() {
        LOG.info(() -> "TEST: testBackCallableWithoutFunctionFails");
        assertThat(run("back", "-b", ASSIGNMENT, "--callable")).isEqualTo(AsttabCli.FAILED);
        assertThat(err.toString()).contains("no function");
    }

    @Test
    void testInvalidBuilderFails() {
        LOG.info(() -> "TEST: testInvalidBuilderFails");
        assertThat(run("back", "-b", "ast.Nope()")).isEqualTo(AsttabCli.FAILED);
        assertThat(err.toString()).contains("Nope");
    }

    @Test
    void testUsageErrors() {
        LOG.info(() -> "TEST: testUsageErrors");
        assertThat(run()).isEqualTo(AsttabCli.USAGE);
        assertThat(run("frobnicate")).isEqualTo(AsttabCli.USAGE);
        assertThat(run("parse")).isEqualTo(AsttabCli.USAGE);
        assertThat(run("parse", "a", "b")).isEqualTo(AsttabCli.USAGE);
        assertThat(run("there")).isEqualTo(AsttabCli.USAGE);
        assertThat(run("there", "-c", "x", "-f", "y")).isEqualTo(AsttabCli.USAGE);
        assertThat(run("there", "-c", "x", "--indent", "wide")).isEqualTo(AsttabCli.USAGE);
        assertThat(run("there", "-c")).isEqualTo(AsttabCli.USAGE);
        assertThat(run("back", "-b", "x", "--verbose")).isEqualTo(AsttabCli.USAGE);
        assertThat(err.toString()).contains("Usage: asttab");
        assertThat(hostCalls).isEmpty();
    }

    @Test
    void testHelp() {
        LOG.info(() -> "TEST: testHelp");
        assertThat(run("--help")).isEqualTo(AsttabCli.OK);
        assertThat(out.toString()).contains("there (--code|-c <text> | --file|-f <path>)");
    }
}

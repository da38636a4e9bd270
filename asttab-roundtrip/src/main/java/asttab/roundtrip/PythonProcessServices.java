package asttab.roundtrip;

import asttab.core.BuilderExpressionPrinter;
import asttab.tree.TreeBuilder;
import asttab.tree.TreeExpressions;
import asttab.tree.TreeNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// [TreeServices] backed by a Python interpreter subprocess, started once per call.
///
/// Trees travel in both directions as builder text: the host prints `repr`-based
/// builder expressions which [TreeBuilder] evaluates, and receives compact builder text
/// produced by [TreeExpressions].
///
/// Configuration (system properties):
/// - `asttab.python.executable`: interpreter to run, default `python3`
/// - `asttab.python.timeout`: seconds to wait for one call, default 60
public final class PythonProcessServices implements TreeServices {

    private static final Logger LOG = Logger.getLogger(PythonProcessServices.class.getName());

    /// System property key for the interpreter
    public static final String EXECUTABLE_PROPERTY = "asttab.python.executable";

    /// System property key for the per-call timeout in seconds
    public static final String TIMEOUT_PROPERTY = "asttab.python.timeout";

    public static final String DEFAULT_EXECUTABLE = "python3";
    public static final long DEFAULT_TIMEOUT_SECONDS = 60;

    private static final String HOST_SCRIPT_RESOURCE = "/asttab/roundtrip/ast_host.py";
    private static final int SYNTAX_ERROR_EXIT = 3;

    private static final String CONFIGURED_EXECUTABLE = System.getProperty(EXECUTABLE_PROPERTY, DEFAULT_EXECUTABLE);
    private static final long CONFIGURED_TIMEOUT = Long.getLong(TIMEOUT_PROPERTY, DEFAULT_TIMEOUT_SECONDS);

    private static final class Script {
        static final String TEXT = load();

        private static String load() {
            try (InputStream in = PythonProcessServices.class.getResourceAsStream(HOST_SCRIPT_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Host script not found: " + HOST_SCRIPT_RESOURCE);
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read host script", e);
            }
        }
    }

    private final String executable;
    private final long timeoutSeconds;
    private final TreeBuilder builder;

    public PythonProcessServices() {
        this(CONFIGURED_EXECUTABLE);
    }

    public PythonProcessServices(String executable) {
        this(executable, CONFIGURED_TIMEOUT, TreeBuilder.standard());
    }

    public PythonProcessServices(String executable, long timeoutSeconds, TreeBuilder builder) {
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
        this.timeoutSeconds = timeoutSeconds;
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        LOG.config(() -> "Python host executable: " + executable + ", timeout " + timeoutSeconds + "s");
    }

    public String executable() {
        return executable;
    }

    /// Whether the configured interpreter can be started.
    public static boolean isAvailable() {
        return isAvailable(CONFIGURED_EXECUTABLE);
    }

    public static boolean isAvailable(String executable) {
        try {
            final var p = new ProcessBuilder(executable, "--version")
                    .redirectErrorStream(true)
                    .start();
            p.getInputStream().readAllBytes();
            return p.waitFor(10, TimeUnit.SECONDS) && p.exitValue() == 0;
        } catch (IOException e) {
            LOG.fine(() -> "Python host " + executable + " is not available: " + e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public TreeNode parseSource(String source) {
        Objects.requireNonNull(source, "source must not be null");
        final String builderText = call(List.of("parse"), source);
        LOG.finer(() -> "Host returned " + builderText.length() + " chars of builder text");
        return builder.build(builderText);
    }

    @Override
    public String unparse(TreeNode tree) {
        return call(List.of("unparse"), toHost(tree));
    }

    @Override
    public ReconstructedCallable compileAndExecute(TreeNode module, String name, Bindings bindings) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(bindings, "bindings must not be null");
        final List<String> args = new ArrayList<>();
        args.add("exec");
        args.add(name);
        args.addAll(bindings.importStatements());
        final String output = call(args, toHost(module));

        final int newline = output.indexOf('\n');
        final String status = newline < 0 ? output : output.substring(0, newline);
        final String source = newline < 0 ? "" : output.substring(newline + 1);
        return switch (status) {
            case "missing" -> throw new ReconstructionException("Failed to locate callable '" + name + "' in rebuilt source");
            case "notcallable" -> throw new ReconstructionException("'" + name + "' in rebuilt source is not callable");
            case "function", "generator", "coroutine", "async_generator" ->
                    new ReconstructedCallable(name, CallableKind.valueOf(status.toUpperCase(Locale.ROOT)), source);
            default -> throw new HostServiceException("Unexpected host reply for '" + name + "'", status);
        };
    }

    private String toHost(TreeNode tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        return BuilderExpressionPrinter.compact(TreeExpressions.toBuilder(tree, "ast", true));
    }

    private String call(List<String> args, String input) {
        final List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-c");
        command.add(Script.TEXT);
        command.addAll(args);
        LOG.fine(() -> "Running Python host command " + args.get(0) + " with " + input.length() + " chars of input");

        final Process process;
        try {
            final var pb = new ProcessBuilder(command);
            pb.environment().put("PYTHONIOENCODING", "utf-8");
            process = pb.start();
        } catch (IOException e) {
            throw new HostServiceException("Failed to start Python host '" + executable + "'", e);
        }
        final CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        final CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(input.getBytes(StandardCharsets.UTF_8));
            }
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                LOG.warning(() -> "Python host " + args.get(0) + " killed after " + timeoutSeconds + "s");
                throw new HostServiceException("Python host timed out after " + timeoutSeconds + "s", "");
            }
            final int code = process.exitValue();
            if (code == SYNTAX_ERROR_EXIT) {
                throw new SourceSyntaxException(stderr.join());
            }
            if (code != 0) {
                throw new HostServiceException("Python host exited with status " + code, stderr.join());
            }
            return stdout.join();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new HostServiceException("Failed to talk to Python host", e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new HostServiceException("Interrupted while waiting for Python host", e);
        }
    }

    private static String readAll(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

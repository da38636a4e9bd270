package asttab.cli;

import asttab.core.AstTab;
import asttab.roundtrip.Bindings;
import asttab.roundtrip.ReconstructedCallable;
import asttab.roundtrip.RoundTrip;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Command line entry point.
///
/// Usage:
/// ```
/// asttab parse <dump_file> [--pretty]
/// asttab there (--code|-c <text> | --file|-f <path>) [--indent|-i N]
/// asttab back (--builder|-b <text> | --file|-f <path>) [--callable]
/// ```
/// Exit status is 0 on success, 2 on a usage error and 1 when the command fails.
public final class AsttabCli {

    private static final Logger LOG = Logger.getLogger(AsttabCli.class.getName());

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    static final String USAGE_TEXT = """
            Usage: asttab <command> [options]
              parse <dump_file> [--pretty]
              there (--code|-c <text> | --file|-f <path>) [--indent|-i N]
              back (--builder|-b <text> | --file|-f <path>) [--callable]""";

    private AsttabCli() {}

    public static void main(String[] args) {
        final var out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        System.exit(run(args, out, err));
    }

    public static int run(String[] args, PrintWriter out, PrintWriter err) {
        return run(args, out, err, RoundTrip::standard);
    }

    static int run(String[] args, PrintWriter out, PrintWriter err, Supplier<RoundTrip> roundTrip) {
        Objects.requireNonNull(out, "out must not be null");
        Objects.requireNonNull(err, "err must not be null");
        try {
            if (args == null || args.length == 0) {
                throw new UsageException("missing command");
            }
            final List<String> rest = Arrays.asList(args).subList(1, args.length);
            LOG.fine(() -> "Command " + args[0] + " with " + rest.size() + " argument(s)");
            switch (args[0]) {
                case "parse" -> parse(rest, out);
                case "there" -> there(rest, out, roundTrip);
                case "back" -> back(rest, out, roundTrip);
                case "-h", "--help" -> out.println(USAGE_TEXT);
                default -> throw new UsageException("unknown command '" + args[0] + "'");
            }
            out.flush();
            return OK;
        } catch (UsageException e) {
            err.println("asttab: " + e.getMessage());
            err.println(USAGE_TEXT);
            err.flush();
            return USAGE;
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.FINE, "Command failed", e);
            err.println("asttab: " + e.getMessage());
            err.flush();
            return FAILED;
        }
    }

    private static void parse(List<String> args, PrintWriter out) throws IOException {
        String dumpFile = null;
        boolean pretty = false;
        for (String arg : args) {
            if (arg.equals("--pretty")) {
                pretty = true;
            } else if (arg.startsWith("-")) {
                throw new UsageException("parse: unknown option '" + arg + "'");
            } else if (dumpFile == null) {
                dumpFile = arg;
            } else {
                throw new UsageException("parse: unexpected argument '" + arg + "'");
            }
        }
        if (dumpFile == null) {
            throw new UsageException("parse: missing <dump_file>");
        }
        final String builder = AstTab.parse(Files.readString(Path.of(dumpFile), StandardCharsets.UTF_8), pretty);
        out.println("import ast");
        out.println();
        out.println("node = " + builder);
        out.println();
        out.println("print(ast.dump(node, indent=4))  # validation");
    }

    private static void there(List<String> args, PrintWriter out, Supplier<RoundTrip> roundTrip) throws IOException {
        final var options = new Options("there", args);
        final String code = options.value("--code", "-c");
        final String file = options.value("--file", "-f");
        final String indentText = options.value("--indent", "-i");
        options.finish();
        final String source = exactlyOne("there", "--code", code, "--file", file);
        int indent = RoundTrip.DEFAULT_INDENT;
        if (indentText != null) {
            try {
                indent = Integer.parseInt(indentText);
            } catch (NumberFormatException e) {
                throw new UsageException("there: --indent expects a number, got '" + indentText + "'");
            }
            if (indent < 0) {
                throw new UsageException("there: --indent must not be negative");
            }
        }
        final String text = code != null ? source : Files.readString(Path.of(source), StandardCharsets.UTF_8);
        out.println(roundTrip.get().there(text, indent));
    }

    private static void back(List<String> args, PrintWriter out, Supplier<RoundTrip> roundTrip) throws IOException {
        final var options = new Options("back", args);
        final String builder = options.value("--builder", "-b");
        final String file = options.value("--file", "-f");
        final boolean callable = options.flag("--callable");
        options.finish();
        final String source = exactlyOne("back", "--builder", builder, "--file", file);
        final String text = builder != null ? source : Files.readString(Path.of(source), StandardCharsets.UTF_8);
        if (callable) {
            final ReconstructedCallable result = roundTrip.get().backToCallable(text, Bindings.standard());
            out.println("Callable reconstructed: " + result.name());
        } else {
            out.println(roundTrip.get().back(text));
        }
    }

    private static String exactlyOne(String command, String firstName, String first, String secondName, String second) {
        if ((first == null) == (second == null)) {
            throw new UsageException(command + ": exactly one of " + firstName + " or " + secondName + " is required");
        }
        return first != null ? first : second;
    }

    /// Options of one sub-command; each is consumed once and leftovers are errors.
    private static final class Options {
        private final String command;
        private final String[] args;
        private final boolean[] used;

        Options(String command, List<String> args) {
            this.command = command;
            this.args = args.toArray(new String[0]);
            this.used = new boolean[this.args.length];
        }

        String value(String longName, String shortName) {
            String found = null;
            for (int i = 0; i < args.length; i++) {
                if (used[i] || !(args[i].equals(longName) || args[i].equals(shortName))) {
                    continue;
                }
                if (found != null) {
                    throw new UsageException(command + ": " + longName + " given more than once");
                }
                if (i + 1 >= args.length) {
                    throw new UsageException(command + ": " + longName + " expects a value");
                }
                used[i] = true;
                used[i + 1] = true;
                found = args[i + 1];
            }
            return found;
        }

        boolean flag(String name) {
            boolean found = false;
            for (int i = 0; i < args.length; i++) {
                if (!used[i] && args[i].equals(name)) {
                    used[i] = true;
                    found = true;
                }
            }
            return found;
        }

        void finish() {
            for (int i = 0; i < args.length; i++) {
                if (!used[i]) {
                    throw new UsageException(command + ": unexpected argument '" + args[i] + "'");
                }
            }
        }
    }

    private static final class UsageException extends RuntimeException {
        @java.io.Serial
        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }
}

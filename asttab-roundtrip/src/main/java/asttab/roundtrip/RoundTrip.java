package asttab.roundtrip;

import asttab.tree.TreeBuilder;
import asttab.tree.TreeDumper;
import asttab.tree.TreeLocations;
import asttab.tree.TreeNode;
import asttab.tree.TreeConstant;
import asttab.tree.TreeSequence;
import asttab.tree.TreeValue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// There and back: Python source to `ast.dump` text, and builder expressions back to
/// source or to an executed function.
///
/// Usage:
/// ```java
/// RoundTrip roundTrip = RoundTrip.standard();
/// String dump = roundTrip.there("x = 1");
/// String builder = AstTab.parse(dump, false);
/// String source = roundTrip.back(builder); // "x = 1"
/// ```
public final class RoundTrip {

    private static final Logger LOG = Logger.getLogger(RoundTrip.class.getName());

    public static final int DEFAULT_INDENT = 4;

    private final TreeServices services;
    private final TreeBuilder builder;

    public RoundTrip(TreeServices services) {
        this(services, TreeBuilder.standard());
    }

    public RoundTrip(TreeServices services, TreeBuilder builder) {
        this.services = Objects.requireNonNull(services, "services must not be null");
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
    }

    /// A round trip through the Python interpreter configured by `asttab.python.executable`.
    public static RoundTrip standard() {
        return new RoundTrip(new PythonProcessServices());
    }

    public String there(String source) {
        return there(source, DEFAULT_INDENT);
    }

    /// Parses source and dumps its tree.
    /// @param indent spaces per level
    /// @throws SourceSyntaxException if the source is not valid Python
    public String there(String source, int indent) {
        Objects.requireNonNull(source, "source must not be null");
        final TreeNode tree = services.parseSource(source);
        LOG.fine(() -> "Parsed " + source.length() + " chars of source into a " + tree.type());
        return new TreeDumper(builder.schema(), indent, false).render(tree);
    }

    public String there(Path file) {
        return there(file, DEFAULT_INDENT);
    }

    /// @throws SourceUnavailableException if the file cannot be read
    public String there(Path file, int indent) {
        Objects.requireNonNull(file, "file must not be null");
        final String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceUnavailableException("Cannot read source file " + file, e);
        }
        return there(source, indent);
    }

    public String there(CallableHandle callable) {
        return there(callable, DEFAULT_INDENT);
    }

    /// @throws SourceUnavailableException if the callable's source cannot be retrieved
    public String there(CallableHandle callable, int indent) {
        Objects.requireNonNull(callable, "callable must not be null");
        final String source = callable.sourceText().orElseThrow(() ->
                new SourceUnavailableException("Callable source unavailable: " + callable.name()));
        return there(source, indent);
    }

    /// Rebuilds a tree from builder text and unparses it.
    /// @throws asttab.tree.EvaluationException if the text does not build a tree
    /// @throws asttab.tree.NotATreeException if it builds something other than a node
    public String back(String builderText) {
        return services.unparse(rebuild(builderText));
    }

    public ReconstructedCallable backToCallable(String builderText) {
        return backToCallable(builderText, Bindings.standard());
    }

    /// Rebuilds a module holding exactly one top-level function and executes it with
    /// only `bindings` in scope.
    /// @throws ReconstructionException if the tree is not a module
    /// @throws NoCallableException if the module defines no function
    /// @throws AmbiguousCallableException if it defines more than one
    public ReconstructedCallable backToCallable(String builderText, Bindings bindings) {
        Objects.requireNonNull(bindings, "bindings must not be null");
        final TreeNode module = rebuild(builderText);
        if (!module.type().equals("Module")) {
            throw new ReconstructionException("Callable reconstruction requires a Module tree, got " + module.type());
        }
        final List<String> names = functionNames(module);
        if (names.isEmpty()) {
            throw new NoCallableException("Module defines no function");
        }
        if (names.size() > 1) {
            throw new AmbiguousCallableException(names);
        }
        final String name = names.get(0);
        LOG.fine(() -> "Reconstructing callable " + name + " with " + bindings);
        return services.compileAndExecute(module, name, bindings);
    }

    private TreeNode rebuild(String builderText) {
        Objects.requireNonNull(builderText, "builderText must not be null");
        return TreeLocations.fixMissing(builder.build(builderText), builder.schema());
    }

    private static List<String> functionNames(TreeNode module) {
        final List<String> names = new ArrayList<>();
        if (!(module.field("body") instanceof TreeSequence body)) {
            return names;
        }
        for (TreeValue statement : body.elements()) {
            if (statement instanceof TreeNode node
                    && (node.type().equals("FunctionDef") || node.type().equals("AsyncFunctionDef"))
                    && node.field("name") instanceof TreeConstant name) {
                names.add(name.value());
            }
        }
        return names;
    }
}

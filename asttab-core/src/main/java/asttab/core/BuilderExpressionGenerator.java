package asttab.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Turns a parsed [DumpValue] into the builder expression that reconstructs it.
///
/// Node types are qualified with a namespace prefix, `ast` by default, so
/// `Name(id='x')` becomes `ast.Name(id='x')`. The default prefix can be changed with
/// the system property {@code asttab.builder.namespace}; a dotted prefix such as
/// `py.ast` is allowed, and an empty prefix emits bare constructor names.
public final class BuilderExpressionGenerator {

    private static final Logger LOG = Logger.getLogger(BuilderExpressionGenerator.class.getName());

    /// System property key for the constructor namespace prefix
    public static final String NAMESPACE_PROPERTY = "asttab.builder.namespace";

    /// Namespace used when the property is not set
    public static final String DEFAULT_NAMESPACE = "ast";

    private static final BuilderExpressionGenerator STANDARD;

    static {
        final String configured = System.getProperty(NAMESPACE_PROPERTY);
        final String namespace = configured == null ? DEFAULT_NAMESPACE : configured.trim();
        LOG.config(() -> "Builder namespace prefix: '" + namespace + "'");
        STANDARD = new BuilderExpressionGenerator(namespace);
    }

    private final String namespace;
    private final BuilderAst namespaceExpression;

    /// Creates a generator that qualifies node constructors with `namespace`.
    /// @param namespace dotted prefix, or empty for unqualified names
    public BuilderExpressionGenerator(String namespace) {
        Objects.requireNonNull(namespace, "namespace must not be null");
        this.namespace = namespace;
        this.namespaceExpression = namespace.isEmpty() ? null : dotted(namespace);
    }

    /// Returns the generator configured from system properties.
    public static BuilderExpressionGenerator standard() {
        return STANDARD;
    }

    public String namespace() {
        return namespace;
    }

    /// Renders `value` as compact builder expression text.
    public String render(DumpValue value) {
        return BuilderExpressionPrinter.compact(generate(value));
    }

    /// Maps `value` onto the builder expression tree.
    public BuilderAst generate(DumpValue value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof DumpValue.Node node) {
            final List<BuilderAst.KeywordArgument> keywords = new ArrayList<>(node.fields().size());
            for (DumpValue.Field field : node.fields()) {
                keywords.add(new BuilderAst.KeywordArgument(field.name(), generate(field.value())));
            }
            return new BuilderAst.Call(constructor(node.typeName()), List.of(), keywords);
        }
        if (value instanceof DumpValue.Sequence sequence) {
            final List<BuilderAst> elements = sequence.elements().stream().map(this::generate).toList();
            return sequence.kind() == DumpValue.SequenceKind.LIST
                    ? new BuilderAst.ListLiteral(elements)
                    : new BuilderAst.TupleLiteral(elements);
        }
        if (value instanceof DumpValue.StringLiteral string) {
            return new BuilderAst.Literal(
                    string.bytes() ? BuilderAst.LiteralKind.BYTES : BuilderAst.LiteralKind.STRING,
                    string.rawContent());
        }
        final DumpValue.Atom atom = (DumpValue.Atom) value;
        return switch (atom.kind()) {
            case BOOLEAN -> new BuilderAst.Literal(BuilderAst.LiteralKind.BOOLEAN, atom.text());
            case NONE -> new BuilderAst.Literal(BuilderAst.LiteralKind.NONE, atom.text());
            case INTEGER -> new BuilderAst.Literal(BuilderAst.LiteralKind.INTEGER, atom.text());
            case FLOAT -> new BuilderAst.Literal(BuilderAst.LiteralKind.FLOAT, atom.text());
            case IMAGINARY -> new BuilderAst.Literal(BuilderAst.LiteralKind.IMAGINARY, atom.text());
            case ELLIPSIS -> new BuilderAst.Identifier(atom.text());
        };
    }

    private BuilderAst constructor(String typeName) {
        return namespaceExpression == null
                ? new BuilderAst.Identifier(typeName)
                : new BuilderAst.MemberAccess(namespaceExpression, typeName);
    }

    private static BuilderAst dotted(String path) {
        final String[] parts = path.split("\\.", -1);
        BuilderAst expr = new BuilderAst.Identifier(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            expr = new BuilderAst.MemberAccess(expr, parts[i]);
        }
        return expr;
    }
}

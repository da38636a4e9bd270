package asttab.tree;

import asttab.core.BuilderAst;
import asttab.core.BuilderAst.*;
import asttab.core.BuilderExpressionGenerator;
import asttab.core.BuilderExpressionParser;
import asttab.core.BuilderSyntaxException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Evaluates builder expressions into syntax trees without running any code.
///
/// A call whose callee is `<namespace>.<Type>` builds a node of that type. Positional
/// arguments bind to the type's fields in schema order, keywords bind to a field or a
/// location attribute by name. Anything a real `ast` constructor would reject is
/// rejected here with an {@link EvaluationException}.
///
/// Usage:
/// ```java
/// TreeNode module = TreeBuilder.standard().build(
///     "ast.Module(body=[ast.Pass()], type_ignores=[])");
/// ```
public final class TreeBuilder {

    private static final Logger LOG = Logger.getLogger(TreeBuilder.class.getName());

    private final NodeSchema schema;
    private final String namespace;
    private final List<String> namespacePath;

    /// @param schema the node types that may be constructed
    /// @param namespace dotted alias the node types are reached through; empty for bare names
    public TreeBuilder(NodeSchema schema, String namespace) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.namespacePath = namespace.isEmpty() ? List.of() : List.of(namespace.split("\\."));
    }

    public static TreeBuilder standard() {
        return new TreeBuilder(NodeSchema.standard(), BuilderExpressionGenerator.standard().namespace());
    }

    public NodeSchema schema() {
        return schema;
    }

    /// Parses and evaluates builder text, requiring a node.
    /// @throws EvaluationException if the text is not a valid builder expression
    /// @throws NotATreeException if it evaluates to something other than a node
    public TreeNode build(String builderText) {
        Objects.requireNonNull(builderText, "builderText must not be null");
        final BuilderAst expr;
        try {
            expr = BuilderExpressionParser.parse(builderText);
        } catch (BuilderSyntaxException e) {
            throw new EvaluationException("Invalid builder expression: " + e.getMessage(), e);
        }
        return build(expr);
    }

    /// Evaluates an expression, requiring a node.
    /// @throws NotATreeException if it evaluates to something other than a node
    public TreeNode build(BuilderAst expr) {
        final TreeValue value = evaluate(expr);
        if (value instanceof TreeNode node) {
            LOG.fine(() -> "Built " + node.type() + " tree");
            return node;
        }
        throw new NotATreeException("Expression evaluates to " + describe(value) + ", not a syntax tree node");
    }

    /// Evaluates any expression to a tree value.
    public TreeValue evaluate(BuilderAst expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        if (expr instanceof Literal literal) {
            return constant(literal);
        }
        if (expr instanceof Identifier identifier) {
            return identifier(identifier);
        }
        if (expr instanceof Call call) {
            return call(call);
        }
        if (expr instanceof ListLiteral list) {
            return new TreeSequence(TreeSequence.Kind.LIST, evaluateAll(list.elements()));
        }
        if (expr instanceof TupleLiteral tuple) {
            return new TreeSequence(TreeSequence.Kind.TUPLE, evaluateAll(tuple.elements()));
        }
        if (expr instanceof UnaryOperation unary) {
            return unary(unary);
        }
        if (expr instanceof MemberAccess access) {
            final String path = dotted(access);
            throw new EvaluationException("'" + path + "' is not a value; call it to build a node");
        }
        if (expr instanceof MappingLiteral) {
            throw new EvaluationException("Mapping literals cannot appear in a syntax tree");
        }
        throw new EvaluationException("Unsupported expression: " + expr.getClass().getSimpleName());
    }

    private List<TreeValue> evaluateAll(List<BuilderAst> elements) {
        final List<TreeValue> values = new ArrayList<>(elements.size());
        for (BuilderAst element : elements) {
            values.add(evaluate(element));
        }
        return values;
    }

    private static TreeConstant constant(Literal literal) {
        return switch (literal.kind()) {
            case STRING -> new TreeConstant(TreeConstant.Kind.STRING, literal.text());
            case BYTES -> new TreeConstant(TreeConstant.Kind.BYTES, literal.text());
            case INTEGER -> new TreeConstant(TreeConstant.Kind.INTEGER, literal.repr());
            case FLOAT -> new TreeConstant(TreeConstant.Kind.FLOAT, literal.text());
            case IMAGINARY -> new TreeConstant(TreeConstant.Kind.IMAGINARY, literal.text());
            case BOOLEAN -> new TreeConstant(TreeConstant.Kind.BOOLEAN, literal.text());
            case NONE -> TreeConstant.NONE;
        };
    }

    private TreeValue identifier(Identifier identifier) {
        if (identifier.name().equals("Ellipsis")) {
            return TreeConstant.ELLIPSIS;
        }
        if (!namespacePath.isEmpty() && identifier.name().equals(namespacePath.get(0))) {
            throw new EvaluationException("'" + identifier.name() + "' is a module, not a value");
        }
        throw new EvaluationException("name '" + identifier.name() + "' is not defined");
    }

    private TreeConstant unary(UnaryOperation unary) {
        final TreeValue operand = evaluate(unary.operand());
        if (!(operand instanceof TreeConstant constant) || !constant.isNumber()) {
            throw new EvaluationException("bad operand type for unary " + unary.operator() + ": " + describe(operand));
        }
        if (unary.operator() == '+') {
            return constant;
        }
        if (constant.kind() == TreeConstant.Kind.INTEGER) {
            return new TreeConstant(TreeConstant.Kind.INTEGER, new BigInteger(constant.value()).negate().toString());
        }
        final String text = constant.value();
        return new TreeConstant(constant.kind(), text.startsWith("-") ? text.substring(1) : "-" + text);
    }

    private TreeNode call(Call call) {
        final String typeName = constructorName(call.callee());
        final NodeSchema.NodeType type = schema.type(typeName).orElseThrow(() ->
                new EvaluationException("module '" + namespace + "' has no attribute '" + typeName + "'"));
        final List<NodeSchema.FieldSpec> fieldSpecs = type.fields();
        final List<NodeSchema.FieldSpec> attributeSpecs = schema.attributes(type.category());

        if (call.positional().size() > fieldSpecs.size()) {
            throw new EvaluationException(typeName + " constructor takes at most " + fieldSpecs.size()
                    + " positional argument" + (fieldSpecs.size() == 1 ? "" : "s")
                    + " (" + call.positional().size() + " given)");
        }
        final Map<String, TreeValue> fields = new LinkedHashMap<>();
        final Map<String, TreeValue> attributes = new LinkedHashMap<>();
        for (int i = 0; i < call.positional().size(); i++) {
            fields.put(fieldSpecs.get(i).name(), evaluate(call.positional().get(i)));
        }
        for (KeywordArgument keyword : call.keywords()) {
            final String name = keyword.name();
            if (name == null) {
                throw new EvaluationException(typeName + " does not accept ** arguments");
            }
            final Map<String, TreeValue> target;
            if (type.field(name).isPresent()) {
                target = fields;
            } else if (attributeSpecs.stream().anyMatch(a -> a.name().equals(name))) {
                target = attributes;
            } else {
                throw new EvaluationException(typeName + " got an unexpected keyword argument '" + name + "'");
            }
            if (target.containsKey(name)) {
                throw new EvaluationException(typeName + " got multiple values for argument '" + name + "'");
            }
            target.put(name, evaluate(keyword.value()));
        }
        LOG.finer(() -> "Node " + typeName + " with fields " + fields.keySet());
        return new TreeNode(typeName, ordered(fields, fieldSpecs), attributes);
    }

    /// Reorders bound fields into schema order.
    private static Map<String, TreeValue> ordered(Map<String, TreeValue> fields, List<NodeSchema.FieldSpec> specs) {
        final Map<String, TreeValue> result = new LinkedHashMap<>();
        for (NodeSchema.FieldSpec spec : specs) {
            final TreeValue value = fields.get(spec.name());
            if (value != null) {
                result.put(spec.name(), value);
            }
        }
        return result;
    }

    private String constructorName(BuilderAst callee) {
        final Optional<List<String>> path = path(callee);
        if (path.isEmpty()) {
            throw new EvaluationException("Only node constructors can be called, not " + callee.getClass().getSimpleName());
        }
        final List<String> parts = path.get();
        if (parts.size() != namespacePath.size() + 1 || !parts.subList(0, namespacePath.size()).equals(namespacePath)) {
            throw new EvaluationException("'" + String.join(".", parts) + "' is not a node type under '"
                    + namespace + "'");
        }
        return parts.get(parts.size() - 1);
    }

    private static Optional<List<String>> path(BuilderAst expr) {
        if (expr instanceof Identifier identifier) {
            final List<String> parts = new ArrayList<>();
            parts.add(identifier.name());
            return Optional.of(parts);
        }
        if (expr instanceof MemberAccess access) {
            return path(access.base()).map(parts -> {
                parts.add(access.name());
                return parts;
            });
        }
        return Optional.empty();
    }

    private static String dotted(MemberAccess access) {
        return path(access).map(parts -> String.join(".", parts)).orElse(access.name());
    }

    private static String describe(TreeValue value) {
        if (value instanceof TreeSequence sequence) {
            return sequence.kind() == TreeSequence.Kind.LIST ? "a list" : "a tuple";
        }
        if (value instanceof TreeConstant constant) {
            return "the constant " + constant.repr();
        }
        return "a node";
    }
}

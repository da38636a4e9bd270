package asttab.tree;

import asttab.core.BuilderAst;
import asttab.core.BuilderAst.*;
import asttab.core.BuilderExpressionGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Converts trees back into builder expressions.
public final class TreeExpressions {

    private TreeExpressions() {}

    public static BuilderAst toBuilder(TreeValue value) {
        return toBuilder(value, BuilderExpressionGenerator.standard().namespace(), false);
    }

    /// @param namespace dotted alias to prefix node types with; empty for bare names
    /// @param includeAttributes whether location attributes become keyword arguments
    public static BuilderAst toBuilder(TreeValue value, String namespace, boolean includeAttributes) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(namespace, "namespace must not be null");
        if (value instanceof TreeNode node) {
            final List<KeywordArgument> keywords = new ArrayList<>();
            node.fields().forEach((name, field) ->
                    keywords.add(new KeywordArgument(name, toBuilder(field, namespace, includeAttributes))));
            if (includeAttributes) {
                node.attributes().forEach((name, attribute) ->
                        keywords.add(new KeywordArgument(name, toBuilder(attribute, namespace, true))));
            }
            return new Call(callee(namespace, node.type()), List.of(), keywords);
        }
        if (value instanceof TreeSequence sequence) {
            final List<BuilderAst> elements = sequence.elements().stream()
                    .map(element -> toBuilder(element, namespace, includeAttributes))
                    .toList();
            return sequence.kind() == TreeSequence.Kind.LIST ? new ListLiteral(elements) : new TupleLiteral(elements);
        }
        final TreeConstant constant = (TreeConstant) value;
        return switch (constant.kind()) {
            case STRING -> new Literal(LiteralKind.STRING, constant.value());
            case BYTES -> new Literal(LiteralKind.BYTES, constant.value());
            case INTEGER -> new Literal(LiteralKind.INTEGER, constant.value());
            case FLOAT -> new Literal(LiteralKind.FLOAT, constant.value());
            case IMAGINARY -> new Literal(LiteralKind.IMAGINARY, constant.value());
            case BOOLEAN -> new Literal(LiteralKind.BOOLEAN, constant.value());
            case NONE -> new Literal(LiteralKind.NONE, "None");
            case ELLIPSIS -> new Identifier("Ellipsis");
        };
    }

    private static BuilderAst callee(String namespace, String type) {
        if (namespace.isEmpty()) {
            return new Identifier(type);
        }
        BuilderAst base = null;
        for (String part : namespace.split("\\.")) {
            base = base == null ? new Identifier(part) : new MemberAccess(base, part);
        }
        return new MemberAccess(base, type);
    }
}

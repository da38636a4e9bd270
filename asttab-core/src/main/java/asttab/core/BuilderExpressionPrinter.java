package asttab.core;

import java.util.List;
import java.util.StringJoiner;

/// Single-line rendering of a [BuilderAst].
///
/// Numeric and keyword literals keep their original lexeme; strings and bytes are
/// printed with Python `repr` quoting. A one-element tuple keeps its trailing comma
/// so it is not read back as a parenthesised scalar.
public final class BuilderExpressionPrinter {

    private BuilderExpressionPrinter() {}

    public static String compact(BuilderAst expr) {
        final var sb = new StringBuilder(256);
        print(expr, sb);
        return sb.toString();
    }

    private static void print(BuilderAst expr, StringBuilder sb) {
        if (expr instanceof BuilderAst.Identifier id) {
            sb.append(id.name());
        } else if (expr instanceof BuilderAst.MemberAccess access) {
            print(access.base(), sb);
            sb.append('.').append(access.name());
        } else if (expr instanceof BuilderAst.Literal literal) {
            switch (literal.kind()) {
                case STRING -> sb.append(PythonLiterals.repr(literal.text()));
                case BYTES -> sb.append(PythonLiterals.bytesRepr(literal.text()));
                default -> sb.append(literal.text());
            }
        } else if (expr instanceof BuilderAst.ListLiteral list) {
            sb.append('[');
            joined(list.elements(), sb);
            sb.append(']');
        } else if (expr instanceof BuilderAst.TupleLiteral tuple) {
            sb.append('(');
            joined(tuple.elements(), sb);
            if (tuple.elements().size() == 1) {
                sb.append(',');
            }
            sb.append(')');
        } else if (expr instanceof BuilderAst.MappingLiteral mapping) {
            final var joiner = new StringJoiner(", ", "{", "}");
            for (BuilderAst.MappingEntry entry : mapping.entries()) {
                joiner.add(entry.key() == null
                        ? "**" + compact(entry.value())
                        : compact(entry.key()) + ": " + compact(entry.value()));
            }
            sb.append(joiner);
        } else if (expr instanceof BuilderAst.Call call) {
            print(call.callee(), sb);
            final var joiner = new StringJoiner(", ", "(", ")");
            for (BuilderAst arg : call.positional()) {
                joiner.add(compact(arg));
            }
            for (BuilderAst.KeywordArgument keyword : call.keywords()) {
                joiner.add(keyword.name() == null
                        ? "**" + compact(keyword.value())
                        : keyword.name() + "=" + compact(keyword.value()));
            }
            sb.append(joiner);
        } else if (expr instanceof BuilderAst.UnaryOperation unary) {
            sb.append(unary.operator());
            print(unary.operand(), sb);
        }
    }

    private static void joined(List<BuilderAst> elements, StringBuilder sb) {
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            print(elements.get(i), sb);
        }
    }
}

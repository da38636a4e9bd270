package asttab.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Pretty-printer for builder expressions.
///
/// Every non-empty list, tuple, dict or call is exploded one element per line, one
/// indent unit deeper than its opener, each line ending with a comma, and the closer
/// back at the opener's level:
/// ```
/// ast.Name(
///     id='x',
///     ctx=ast.Load(),
/// )
/// ```
/// Empty containers and argument-less calls stay inline. The layout depends only on
/// the tree, so formatting already formatted text gives the same text again.
public final class ExpressionFormatter {

    private static final Logger LOG = Logger.getLogger(ExpressionFormatter.class.getName());

    /// System property key for the indent width in spaces
    public static final String INDENT_PROPERTY = "asttab.format.indent";

    /// Indent width used when the property is not set
    public static final int DEFAULT_INDENT = 4;

    private static final String CONFIGURED_INDENT_UNIT;

    static {
        final String propertyValue = System.getProperty(INDENT_PROPERTY);
        int width = DEFAULT_INDENT;
        if (propertyValue != null) {
            try {
                width = Integer.parseInt(propertyValue.trim());
            } catch (NumberFormatException ex) {
                LOG.warning(() -> "Invalid indent width: " + propertyValue + ". Using default: " + DEFAULT_INDENT);
            }
            if (width < 0) {
                LOG.warning(() -> "Negative indent width: " + propertyValue + ". Using default: " + DEFAULT_INDENT);
                width = DEFAULT_INDENT;
            }
        }
        CONFIGURED_INDENT_UNIT = " ".repeat(width);
    }

    private final String indentUnit;

    public ExpressionFormatter(String indentUnit) {
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit must not be null");
    }

    /// Returns a formatter using the configured indent width.
    public static ExpressionFormatter standard() {
        return new ExpressionFormatter(CONFIGURED_INDENT_UNIT);
    }

    /// Formats `expr` with `indentUnit` per nesting level.
    /// @throws UnsupportedExpressionException if `expr` contains a shape with no layout
    public static String format(BuilderAst expr, String indentUnit) {
        return new ExpressionFormatter(indentUnit).format(expr);
    }

    public String format(BuilderAst expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        return format(expr, 0);
    }

    private String format(BuilderAst expr, int level) {
        if (expr instanceof BuilderAst.Identifier id) {
            return id.name();
        }
        if (expr instanceof BuilderAst.MemberAccess access) {
            return format(access.base(), level) + "." + access.name();
        }
        if (expr instanceof BuilderAst.Literal literal) {
            return literal.repr();
        }
        if (expr instanceof BuilderAst.ListLiteral list) {
            if (list.elements().isEmpty()) {
                return "[]";
            }
            return "[" + newlineJoin(formatAll(list.elements(), level + 1), level) + "]";
        }
        if (expr instanceof BuilderAst.TupleLiteral tuple) {
            if (tuple.elements().isEmpty()) {
                return "()";
            }
            return "(" + newlineJoin(formatAll(tuple.elements(), level + 1), level) + ")";
        }
        if (expr instanceof BuilderAst.MappingLiteral mapping) {
            if (mapping.entries().isEmpty()) {
                return "{}";
            }
            final List<String> items = new ArrayList<>(mapping.entries().size());
            for (BuilderAst.MappingEntry entry : mapping.entries()) {
                final String key = entry.key() == null ? "None" : format(entry.key(), level + 1);
                items.add(key + ": " + format(entry.value(), level + 1));
            }
            return "{" + newlineJoin(items, level) + "}";
        }
        if (expr instanceof BuilderAst.Call call) {
            final String callee = format(call.callee(), level);
            final List<String> parts = formatAll(call.positional(), level + 1);
            for (BuilderAst.KeywordArgument keyword : call.keywords()) {
                final String value = format(keyword.value(), level + 1);
                parts.add(keyword.name() == null ? "**" + value : keyword.name() + "=" + value);
            }
            if (parts.isEmpty()) {
                return callee + "()";
            }
            return callee + "(" + newlineJoin(parts, level) + ")";
        }
        throw new UnsupportedExpressionException(expr.getClass().getSimpleName());
    }

    private List<String> formatAll(List<BuilderAst> exprs, int level) {
        final List<String> parts = new ArrayList<>(exprs.size());
        for (BuilderAst expr : exprs) {
            parts.add(format(expr, level));
        }
        return parts;
    }

    private String newlineJoin(List<String> parts, int level) {
        final String inner = indentUnit.repeat(level + 1);
        final String outer = indentUnit.repeat(level);
        return "\n" + inner + String.join(",\n" + inner, parts) + ",\n" + outer;
    }
}

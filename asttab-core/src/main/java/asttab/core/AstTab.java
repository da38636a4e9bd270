package asttab.core;

import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for turning `ast.dump` text into builder expressions.
///
/// Usage:
/// ```java
/// String dump = "Module(body=[Pass()], type_ignores=[])";
/// String compact = AstTab.parse(dump, false); // ast.Module(body=[ast.Pass()], type_ignores=[])
/// String pretty = AstTab.parse(dump, true);
/// ```
public final class AstTab {

    private static final Logger LOG = Logger.getLogger(AstTab.class.getName());

    private AstTab() {}

    /// Parses dump text into a builder expression.
    /// @param dumpText text produced by `ast.dump`
    /// @param pretty whether to lay the expression out over multiple lines
    /// @return the builder expression; the compact form if pretty printing is not possible
    /// @throws DumpParseException if the dump text is malformed
    public static String parse(String dumpText, boolean pretty) {
        return parse(dumpText, pretty, BuilderExpressionGenerator.standard(), ExpressionFormatter.standard());
    }

    public static String parse(String dumpText, boolean pretty,
                               BuilderExpressionGenerator generator, ExpressionFormatter formatter) {
        Objects.requireNonNull(generator, "generator must not be null");
        Objects.requireNonNull(formatter, "formatter must not be null");
        final String compact = generator.render(DumpParser.parseValue(dumpText));
        return pretty ? prettyPrint(compact, formatter) : compact;
    }

    /// Re-parses builder expression text and formats it.
    /// Falls back to `builderText` unchanged, logging a warning, if the text cannot be
    /// parsed or contains a shape the formatter does not lay out.
    public static String prettyPrint(String builderText) {
        return prettyPrint(builderText, ExpressionFormatter.standard());
    }

    public static String prettyPrint(String builderText, ExpressionFormatter formatter) {
        Objects.requireNonNull(builderText, "builderText must not be null");
        final BuilderAst expr;
        try {
            expr = BuilderExpressionParser.parse(builderText);
        } catch (BuilderSyntaxException e) {
            LOG.warning(() -> "Builder expression is not re-parseable, keeping compact form: " + e.getMessage());
            return builderText;
        }
        try {
            return formatter.format(expr);
        } catch (UnsupportedExpressionException e) {
            LOG.warning(() -> "Formatting not possible, keeping compact form: " + e.getMessage());
            return builderText;
        }
    }
}

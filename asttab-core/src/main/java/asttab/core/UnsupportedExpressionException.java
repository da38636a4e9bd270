package asttab.core;

/// Exception thrown when the [ExpressionFormatter] meets an expression shape it has no layout for.
/// Callers that format optionally fall back to the unformatted builder expression.
public class UnsupportedExpressionException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String variant;

    /// Creates a new exception naming the unsupported expression variant.
    /// @param variant simple name of the expression type, e.g. `UnaryOperation`
    public UnsupportedExpressionException(String variant) {
        super("Unsupported expression node: " + variant);
        this.variant = variant;
    }

    public String variant() {
        return variant;
    }
}

package asttab.core;

/// Exception thrown when `ast.dump` text is malformed.
/// No partial builder expression is ever returned alongside it.
public class DumpParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// What went wrong.
    public enum Reason {
        /// The text ended in the middle of a value.
        UNEXPECTED_END,
        /// A required delimiter or keyword was absent.
        EXPECTED_TOKEN,
        /// A quoted string was never closed.
        UNTERMINATED_STRING,
        /// A bare word was not `True`, `False`, `None` or a number.
        UNKNOWN_ATOM
    }

    private final Reason reason;
    private final int position;
    private final String detail;

    /// Creates a new parse exception.
    /// @param reason the error category
    /// @param detail the expected token or the offending lexeme, may be null
    /// @param text the full dump text
    /// @param position UTF-16 char offset into `text`
    public DumpParseException(Reason reason, String detail, String text, int position) {
        super(formatMessage(reason, detail, text, position));
        this.reason = reason;
        this.position = position;
        this.detail = detail;
    }

    public Reason reason() {
        return reason;
    }

    /// Returns the UTF-16 char offset into the dump text where the error was detected.
    /// A code point outside the Basic Multilingual Plane counts as two chars.
    public int position() {
        return position;
    }

    /// Returns the expected token for [Reason#EXPECTED_TOKEN], the lexeme for
    /// [Reason#UNKNOWN_ATOM], or null.
    public String detail() {
        return detail;
    }

    private static String formatMessage(Reason reason, String detail, String text, int position) {
        final var sb = new StringBuilder();
        switch (reason) {
            case UNEXPECTED_END -> sb.append("Unexpected end of input");
            case EXPECTED_TOKEN -> sb.append("Expected ").append(detail);
            case UNTERMINATED_STRING -> sb.append("Unterminated string");
            case UNKNOWN_ATOM -> sb.append("Unknown atom: '").append(detail).append("'");
        }
        sb.append(" at position ").append(position);
        if (text != null && position >= 0 && position < text.length()) {
            sb.append(" (near '").append(text.charAt(position)).append("')");
        }
        return sb.toString();
    }
}

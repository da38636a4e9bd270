package asttab.core;

/// Exception thrown when builder expression text cannot be parsed.
public class BuilderSyntaxException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int position;
    private final String text;

    /// Creates a new syntax exception with position information.
    public BuilderSyntaxException(String message, String text, int position) {
        super(formatMessage(message, text, position));
        this.position = position;
        this.text = text;
    }

    /// Returns the offset in the text where the error occurred.
    public int position() {
        return position;
    }

    /// Returns the text that was being parsed.
    public String text() {
        return text;
    }

    private static String formatMessage(String message, String text, int position) {
        if (text == null || position < 0) {
            return message;
        }
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at position ").append(position);
        if (position < text.length()) {
            sb.append(" (near '").append(text.charAt(position)).append("')");
        }
        return sb.toString();
    }
}

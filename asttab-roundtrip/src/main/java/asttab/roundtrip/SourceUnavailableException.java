package asttab.roundtrip;

/// Thrown when the source of a callable or file cannot be retrieved.
public class SourceUnavailableException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

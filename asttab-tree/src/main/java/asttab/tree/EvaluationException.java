package asttab.tree;

/// Exception thrown when a builder expression does not describe a valid syntax tree.
public class EvaluationException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package asttab.tree;

/// Thrown when a builder expression evaluates to something other than a node,
/// for example a bare list or a constant.
public class NotATreeException extends EvaluationException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public NotATreeException(String message) {
        super(message);
    }
}

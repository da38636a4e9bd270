package asttab.roundtrip;

/// Thrown when a callable cannot be rebuilt from a builder expression.
public class ReconstructionException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public ReconstructionException(String message) {
        super(message);
    }
}

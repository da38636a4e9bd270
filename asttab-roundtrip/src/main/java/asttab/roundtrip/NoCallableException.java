package asttab.roundtrip;

/// The module defines no function at its top level.
public class NoCallableException extends ReconstructionException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public NoCallableException(String message) {
        super(message);
    }
}

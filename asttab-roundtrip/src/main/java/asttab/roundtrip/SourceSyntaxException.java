package asttab.roundtrip;

/// The source handed to the host is not valid Python.
public class SourceSyntaxException extends HostServiceException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public SourceSyntaxException(String hostOutput) {
        super("Source is not valid Python", hostOutput);
    }
}

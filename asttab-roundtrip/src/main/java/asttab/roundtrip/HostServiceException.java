package asttab.roundtrip;

/// Thrown when the Python host fails to carry out a request.
public class HostServiceException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String hostOutput;

    public HostServiceException(String message, String hostOutput) {
        super(hostOutput == null || hostOutput.isBlank() ? message : message + ": " + hostOutput.strip());
        this.hostOutput = hostOutput == null ? "" : hostOutput;
    }

    public HostServiceException(String message, Throwable cause) {
        super(message, cause);
        this.hostOutput = "";
    }

    /// What the host wrote to its error stream.
    public String hostOutput() {
        return hostOutput;
    }
}

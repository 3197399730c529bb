package no.cantara.cargo.bridge;

/**
 * Thrown when the external metadata tool cannot be started, exits with a non-zero
 * status, or produces no usable output.
 */
public class ExternalToolException extends RuntimeException {

    private final int exitCode;

    public ExternalToolException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ExternalToolException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public ExternalToolException(String message) {
        this(message, -1);
    }

    /** The process exit status, or -1 when the process did not exit normally. */
    public int exitCode() {
        return exitCode;
    }
}

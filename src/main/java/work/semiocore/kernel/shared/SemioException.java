package work.semiocore.kernel.shared;

/**
 * Root of the toolchain's failures. The code names the violated invariant so callers can fix the
 * program, world or manifest instead of retrying.
 */
public class SemioException extends RuntimeException {
    private final String code;

    public SemioException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SemioException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}

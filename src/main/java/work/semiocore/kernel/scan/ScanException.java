package work.semiocore.kernel.scan;

import work.semiocore.kernel.shared.SemioException;

/**
 * A permutation's run failed; the whole scan is aborted.
 */
public final class ScanException extends SemioException {
    private final int permutationIndex;
    private final String ctx;

    public ScanException(int permutationIndex, String ctx, SemioException cause) {
        super(cause.code(), "Permutation " + permutationIndex + " (" + ctx + ") failed: " + cause.getMessage(), cause);
        this.permutationIndex = permutationIndex;
        this.ctx = ctx;
    }

    public int permutationIndex() {
        return permutationIndex;
    }

    public String ctx() {
        return ctx;
    }
}

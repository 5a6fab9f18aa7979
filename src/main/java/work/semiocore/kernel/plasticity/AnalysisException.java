package work.semiocore.kernel.plasticity;

import work.semiocore.kernel.shared.SemioException;

/**
 * Invalid analyzer input, raised before any metric is computed.
 */
public final class AnalysisException extends SemioException {
    public AnalysisException(String code, String message) {
        super(code, message);
    }
}

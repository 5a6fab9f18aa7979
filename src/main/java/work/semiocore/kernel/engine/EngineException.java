package work.semiocore.kernel.engine;

import work.semiocore.kernel.shared.SemioException;

/**
 * Execution failure; the run is aborted and no trace is produced.
 */
public final class EngineException extends SemioException {
    public EngineException(String code, String message) {
        super(code, message);
    }
}

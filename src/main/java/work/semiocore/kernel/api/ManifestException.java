package work.semiocore.kernel.api;

import work.semiocore.kernel.shared.SemioException;

public final class ManifestException extends SemioException {
    public ManifestException(String message) {
        super("invalid_manifest", message);
    }

    public ManifestException(String message, Throwable cause) {
        super("invalid_manifest", message, cause);
    }
}

package work.semiocore.kernel.world;

import work.semiocore.kernel.shared.SemioException;

/**
 * World document that cannot be flattened into {@code name -> number} channels.
 */
public final class WorldFormatException extends SemioException {
    public WorldFormatException(String message) {
        super("invalid_world", message);
    }

    public WorldFormatException(String message, Throwable cause) {
        super("invalid_world", message, cause);
    }
}

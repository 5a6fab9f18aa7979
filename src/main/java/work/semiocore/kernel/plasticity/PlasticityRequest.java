package work.semiocore.kernel.plasticity;

import java.util.Objects;
import java.util.Optional;

/**
 * What to analyze: one context/channel pair under a fixed windowing.
 */
public record PlasticityRequest(
    String ctx,
    String channel,
    int windowSize,
    int windowStep,
    String protocol,
    Optional<String> programFile
) {
    public PlasticityRequest {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(programFile, "programFile");
    }

    public static PlasticityRequest of(String ctx, String channel, int windowSize, int windowStep) {
        return new PlasticityRequest(ctx, channel, windowSize, windowStep, "Strict", Optional.empty());
    }
}

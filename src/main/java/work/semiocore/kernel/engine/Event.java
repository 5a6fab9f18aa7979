package work.semiocore.kernel.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One committed observation. {@code noise} is present only when jitter was applied; such events
 * keep full precision, all others carry values rounded to 10 decimals.
 */
public record Event(
    int step,
    double t,
    String ctx,
    String channel,
    double s,
    double rRaw,
    Double noise,
    double rEff,
    Outcome obj,
    Outcome expectedObj,
    double kappaLoc
) {
    public Event {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(obj, "obj");
        Objects.requireNonNull(expectedObj, "expectedObj");
    }

    public boolean jittered() {
        return noise != null;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("step", step);
        map.put("t", t);
        map.put("ctx", ctx);
        map.put("ch", channel);
        map.put("s", s);
        map.put("r_raw", rRaw);
        if (noise != null) {
            map.put("noise", noise);
        }
        map.put("r_eff", rEff);
        map.put("obj", obj.name());
        map.put("expected_obj", expectedObj.name());
        map.put("kappa_loc", kappaLoc);
        return map;
    }
}

package work.semiocore.kernel.engine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate statistics of a run, rounded to 10 decimals.
 */
public record Summary(int n, double deltaT, double rho, double kappa) {
    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("N", n);
        map.put("deltaT", deltaT);
        map.put("rho", rho);
        map.put("kappa", kappa);
        return map;
    }
}

package work.semiocore.kernel.plasticity;

import work.semiocore.kernel.engine.Event;

/**
 * The fields of a trace event the analyzer reads. Labels stay textual because traces from other
 * producers may carry labels such as {@code UNDETERMINED}; absent numeric fields are {@code null}.
 */
public record ObservedEvent(String ctx, String channel, double t, int step, String obj, Double rRaw, Double s, Double kappaLoc) {
    public static ObservedEvent from(Event event) {
        return new ObservedEvent(
            event.ctx(),
            event.channel(),
            event.t(),
            event.step(),
            event.obj().name(),
            event.rRaw(),
            event.s(),
            event.kappaLoc()
        );
    }

    /** Physical signal used for sensitivity: {@code r_raw}, else {@code s}, else 0. */
    double signal() {
        if (rRaw != null) {
            return rRaw;
        }
        return s != null ? s : 0.0;
    }
}

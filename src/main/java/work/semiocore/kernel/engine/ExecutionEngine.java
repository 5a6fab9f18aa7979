package work.semiocore.kernel.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.semiocore.kernel.model.Program;
import work.semiocore.kernel.model.Stmt;
import work.semiocore.kernel.model.World;
import work.semiocore.kernel.shared.Decimals;

/**
 * Deterministic interpreter. All state (time, bias, sensed bindings, generator state, step
 * counter) is local to one {@link #run} call, so concurrent runs never interfere.
 */
public final class ExecutionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEngine.class);

    private ExecutionEngine() {}

    public static Trace run(Program program, World world, String programFile) {
        double t = 0.0;
        double bias = 0.0;
        Long rngState = program.seed().map(Lcg32::seed).orElse(null);
        String ctx = program.context().canonical();
        Map<String, Sensed> sensed = new HashMap<>();
        List<Event> events = new ArrayList<>();
        int step = 0;

        for (Stmt stmt : program.body()) {
            if (stmt instanceof Stmt.Tick tick) {
                if (tick.dt() <= 0.0) {
                    throw new EngineException("non_positive_tick", "tick dt must be > 0");
                }
                t += tick.dt();
            } else if (stmt instanceof Stmt.Sense sense) {
                if (!world.hasChannel(sense.channel())) {
                    throw new EngineException("unknown_channel", "Unknown channel in world: " + sense.channel());
                }
                sensed.put(sense.var(), new Sensed(sense.channel(), world.value(sense.channel())));
            } else if (stmt instanceof Stmt.DoAddBias doBias) {
                bias = doBias.value();
            } else if (stmt instanceof Stmt.Commit commit) {
                Sensed binding = sensed.get(commit.var());
                if (binding == null) {
                    throw new EngineException("commit_before_sense", "commit " + commit.var() + " before sensing it");
                }
                double s = binding.value();
                double rRaw = s + bias;
                ContextPipeline.Result result = ContextPipeline.apply(rRaw, program.context(), rngState);
                rngState = result.rngState();

                Outcome obj = Outcome.of(result.value());
                Outcome expected = Outcome.of(s);
                double kappaLoc = obj == expected ? 1.0 : 0.0;
                step++;
                events.add(result.jittered()
                    ? new Event(step, t, ctx, binding.channel(), s, rRaw, result.noise(), result.value(), obj, expected, kappaLoc)
                    : new Event(
                        step,
                        Decimals.round10(t),
                        ctx,
                        binding.channel(),
                        Decimals.round10(s),
                        Decimals.round10(rRaw),
                        null,
                        Decimals.round10(result.value()),
                        obj,
                        expected,
                        Decimals.round10(kappaLoc)
                    ));
            } else if (!(stmt instanceof Stmt.OutSummarize)) {
                throw new EngineException("unknown_statement", "Unknown stmt kind: " + stmt.getClass().getSimpleName());
            }
        }

        if (t <= 0.0) {
            throw new EngineException("non_positive_elapsed_time", "Total time (t) must be > 0 to compute rho.");
        }
        int n = events.size();
        double rho = n > 0 ? n / t : 0.0;
        double kappa = 0.0;
        if (n > 0) {
            double sum = 0.0;
            for (Event event : events) {
                sum += event.kappaLoc();
            }
            kappa = sum / n;
        }
        var summary = new Summary(n, Decimals.round10(t), Decimals.round10(rho), Decimals.round10(kappa));
        LOG.debug("Ran {} under {}: N={} deltaT={} kappa={}", programFile, ctx, n, summary.deltaT(), summary.kappa());
        return new Trace(programFile, events, summary);
    }

    private record Sensed(String channel, double value) {}
}

package work.semiocore.kernel.scan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.semiocore.kernel.engine.ExecutionEngine;
import work.semiocore.kernel.engine.Outcome;
import work.semiocore.kernel.engine.Trace;
import work.semiocore.kernel.model.CanonicalContext;
import work.semiocore.kernel.model.Context;
import work.semiocore.kernel.model.Op;
import work.semiocore.kernel.model.Program;
import work.semiocore.kernel.model.World;
import work.semiocore.kernel.shared.SemioException;

/**
 * Re-executes a program under every distinct ordering of its context operators and reports
 * whether the outcome sequence depends on that order.
 *
 * <p>Runs may execute on a worker pool, but results are always folded in permutation index order,
 * so the reported witness never depends on which run finished first.
 */
public final class ContextScanner {
    private static final Logger LOG = LoggerFactory.getLogger(ContextScanner.class);

    private ContextScanner() {}

    public static CtxScanReport scan(Program program, World world, ScanOptions options) {
        List<List<Op>> perms = PermutationEnumerator.scanOrder(program.context().ops(), options.maxPermutations());
        LOG.debug("Scanning {} permutation(s) of {} with parallelism {}", perms.size(), program.context(), options.parallelism());

        List<Trace> traces = execute(program, world, perms, options);

        Trace baseline = traces.get(0);
        List<Outcome> baselineSignature = baseline.outcomeSignature();
        double baselineKappa = baseline.summary().kappa();

        var entries = new ArrayList<CtxScanReport.PermutationResult>(perms.size());
        CtxScanReport.Witness witness = null;
        double dkappaMax = 0.0;
        for (int i = 0; i < perms.size(); i++) {
            Trace trace = traces.get(i);
            String ctx = CanonicalContext.render(perms.get(i));
            double dkappa = Math.abs(trace.summary().kappa() - baselineKappa);
            dkappaMax = Math.max(dkappaMax, dkappa);
            entries.add(new CtxScanReport.PermutationResult(i, ctx, trace.summary(), dkappa, persist(options, i, trace)));

            List<Outcome> signature = trace.outcomeSignature();
            if (witness == null && !signature.equals(baselineSignature)) {
                witness = witnessFor(i, ctx, baselineSignature, signature);
                LOG.debug("Witness at permutation {} ({}), step {}", i, ctx, witness.diffStep());
            }
        }

        return new CtxScanReport(
            options.programFile(),
            options.worldFile(),
            options.protocol(),
            program.context().canonical(),
            baseline.summary(),
            witness == null,
            dkappaMax,
            Optional.ofNullable(witness),
            entries
        );
    }

    // Compares overlapping positions only; when the signatures differ in length alone the last
    // shared position is reported.
    private static CtxScanReport.Witness witnessFor(int index, String ctx, List<Outcome> baseline, List<Outcome> candidate) {
        int shared = Math.min(baseline.size(), candidate.size());
        int j = 0;
        for (; j < shared; j++) {
            if (baseline.get(j) != candidate.get(j)) {
                break;
            }
        }
        if (j == shared && shared > 0) {
            j = shared - 1;
        }
        String baselineObj = j < baseline.size() ? baseline.get(j).name() : null;
        String obj = j < candidate.size() ? candidate.get(j).name() : null;
        return new CtxScanReport.Witness(index, ctx, j + 1, baselineObj, obj);
    }

    private static List<Trace> execute(Program program, World world, List<List<Op>> perms, ScanOptions options) {
        if (options.parallelism() <= 1 || perms.size() <= 1) {
            var traces = new ArrayList<Trace>(perms.size());
            for (int i = 0; i < perms.size(); i++) {
                traces.add(runPermutation(program, world, perms, i, options));
            }
            return traces;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.parallelism(), perms.size()));
        try {
            var futures = new ArrayList<Future<Trace>>(perms.size());
            for (int i = 0; i < perms.size(); i++) {
                int index = i;
                futures.add(pool.submit(() -> runPermutation(program, world, perms, index, options)));
            }
            var traces = new ArrayList<Trace>(perms.size());
            for (Future<Trace> future : futures) {
                traces.add(future.get());
            }
            return traces;
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Permutation run failed", ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while scanning permutations", ex);
        } finally {
            pool.shutdownNow();
        }
    }

    private static Trace runPermutation(Program program, World world, List<List<Op>> perms, int index, ScanOptions options) {
        Program permuted = program.withContext(new Context(perms.get(index)));
        try {
            return ExecutionEngine.run(permuted, world, options.programFile());
        } catch (SemioException ex) {
            throw new ScanException(index, permuted.context().canonical(), ex);
        }
    }

    private static Optional<String> persist(ScanOptions options, int index, Trace trace) {
        if (options.traceSink().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(options.traceSink().get().persist(index, trace));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to persist trace for permutation " + index, ex);
        }
    }
}

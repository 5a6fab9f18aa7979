package work.semiocore.kernel.scan;

import java.io.IOException;
import work.semiocore.kernel.engine.Trace;

/**
 * Persists a permutation's trace and returns the location recorded as {@code trace_file}.
 */
@FunctionalInterface
public interface TraceSink {
    String persist(int index, Trace trace) throws IOException;
}

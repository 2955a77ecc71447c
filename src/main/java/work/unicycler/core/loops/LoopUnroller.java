package work.unicycler.core.loops;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.unicycler.core.error.RunawayExpansionException;
import work.unicycler.core.model.Loop;
import work.unicycler.core.model.Step;
import work.unicycler.core.resolve.ResolvedSequence;

/**
 * Expands a resolved, nesting-checked sequence into the flat list of steps a cycler would actually run.
 *
 * <p>Simulates a program counter. A loop whose section has not yet run {@code cycle_count} times jumps back to
 * its target; before jumping, the counters of every loop inside the re-entered section are reset so inner loops
 * run their full count on each outer iteration.
 */
public final class LoopUnroller {
    public static final int DEFAULT_MAX_ITERATIONS = 10_000;

    private static final Logger log = LoggerFactory.getLogger(LoopUnroller.class);

    private LoopUnroller() {}

    public static ExecutionTrace unroll(ResolvedSequence sequence) {
        return unroll(sequence, DEFAULT_MAX_ITERATIONS);
    }

    public static ExecutionTrace unroll(ResolvedSequence sequence, int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        List<Step> steps = sequence.steps();
        int[] goneBack = new int[steps.size()];
        var trace = new ArrayList<Integer>();
        long taken = 0;
        int i = 0;

        while (i < steps.size()) {
            Step step = steps.get(i);
            if (step instanceof Loop loop && goneBack[i] < loop.cycleCount() - 1) {
                int start = loop.loopTo().positionValue() - 1;
                for (int k = start; k < i; k++) {
                    if (steps.get(k) instanceof Loop) {
                        goneBack[k] = 0;
                    }
                }
                goneBack[i]++;
                i = start;
            } else {
                if (!(step instanceof Loop)) {
                    trace.add(i);
                }
                i++;
            }
            taken++;
            if (taken > maxIterations) {
                throw new RunawayExpansionException(taken, maxIterations);
            }
        }

        log.debug("Unrolled {} step(s) into a trace of {} in {} iteration(s)", steps.size(), trace.size(), taken);
        return new ExecutionTrace(trace, (int) taken);
    }
}

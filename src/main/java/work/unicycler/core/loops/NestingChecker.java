package work.unicycler.core.loops;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.unicycler.core.error.IntersectingLoopsException;
import work.unicycler.core.resolve.ResolvedSequence;

/**
 * Verifies that the loop intervals of a resolved sequence form a laminar family: any two are disjoint or one
 * contains the other.
 */
public final class NestingChecker {
    private static final Logger log = LoggerFactory.getLogger(NestingChecker.class);

    private NestingChecker() {}

    public static void check(ResolvedSequence sequence) {
        check(sequence.loopIntervals());
    }

    public static void check(List<LoopInterval> intervals) {
        var sorted = new ArrayList<>(intervals);
        sorted.sort(LoopInterval.BY_START_THEN_END);

        for (int i = 0; i < sorted.size(); i++) {
            LoopInterval current = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                LoopInterval later = sorted.get(j);
                // sorted by start: nothing further along can overlap current
                if (later.start() > current.end()) {
                    break;
                }
                if (current.crosses(later)) {
                    throw new IntersectingLoopsException(current.start(), current.end(), later.start(), later.end());
                }
            }
        }
        log.debug("{} loop interval(s) are properly nested", sorted.size());
    }
}

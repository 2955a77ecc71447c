package work.unicycler.core.loops;

import java.util.Comparator;

/**
 * Closed interval {@code [start, end]} of 1-based positions covered by a loop: its target and its own position.
 */
public record LoopInterval(int start, int end) {
    static final Comparator<LoopInterval> BY_START_THEN_END =
        Comparator.comparingInt(LoopInterval::start).thenComparingInt(LoopInterval::end);

    public LoopInterval {
        if (start > end) {
            throw new IllegalArgumentException("Loop interval start " + start + " is after its end " + end);
        }
    }

    /** True when the two intervals overlap without one containing the other. */
    public boolean crosses(LoopInterval other) {
        return (start < other.start && end < other.end && other.start <= end)
            || (start > other.start && end > other.end && start <= other.end);
    }
}

package work.unicycler.core.resolve;

import java.util.ArrayList;
import java.util.List;
import work.unicycler.core.loops.LoopInterval;
import work.unicycler.core.model.Loop;
import work.unicycler.core.model.Step;
import work.unicycler.core.model.StepKind;

/**
 * Tag-free step sequence whose loops all target 1-based positions strictly before themselves.
 */
public record ResolvedSequence(List<Step> steps) {
    public ResolvedSequence {
        steps = List.copyOf(steps);
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step.kind() == StepKind.TAG) {
                throw new IllegalArgumentException("Resolved sequence cannot contain tags (index " + i + ")");
            }
            if (step instanceof Loop loop) {
                if (loop.loopTo().symbolic()) {
                    throw new IllegalArgumentException("Loop at position " + (i + 1) + " still targets tag " + loop.loopTo());
                }
                if (loop.loopTo().positionValue() > i) {
                    throw new IllegalArgumentException(
                        "Loop at position " + (i + 1) + " must target an earlier position, got " + loop.loopTo()
                    );
                }
            }
        }
    }

    public int size() {
        return steps.size();
    }

    /** Step at a 1-based position. */
    public Step at(int position) {
        return steps.get(position - 1);
    }

    /** Loop intervals {@code [target, position]}, in sequence order. */
    public List<LoopInterval> loopIntervals() {
        var intervals = new ArrayList<LoopInterval>();
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) instanceof Loop loop) {
                intervals.add(new LoopInterval(loop.loopTo().positionValue(), i + 1));
            }
        }
        return intervals;
    }
}

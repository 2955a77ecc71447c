package work.unicycler.core.loops;

import java.util.List;
import work.unicycler.core.model.Step;
import work.unicycler.core.resolve.ResolvedSequence;

/**
 * One fully unrolled run: 0-based indices into the resolved sequence, loop steps excluded.
 */
public record ExecutionTrace(List<Integer> indices, int stepsTaken) {
    public ExecutionTrace {
        indices = List.copyOf(indices);
    }

    public int size() {
        return indices.size();
    }

    public List<Step> steps(ResolvedSequence sequence) {
        return indices.stream().map(sequence.steps()::get).toList();
    }
}

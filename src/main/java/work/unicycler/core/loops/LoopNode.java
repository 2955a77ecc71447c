package work.unicycler.core.loops;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import work.unicycler.core.model.Step;

/**
 * Node of a loop tree: a plain step, or a section repeated a number of times.
 */
public sealed interface LoopNode {

    /**
     * Plain step; {@code index} is its 0-based index in the resolved sequence.
     */
    record Leaf(@JsonProperty("index") int index, @JsonProperty("step") Step step) implements LoopNode {}

    /**
     * Section run {@code count} times in total.
     */
    record Repeat(@JsonProperty("count") int count, @JsonProperty("body") List<LoopNode> body) implements LoopNode {
        public Repeat {
            body = List.copyOf(body);
        }
    }

    /** Leaf indices in document order, ignoring repetition. */
    static List<Integer> leafIndices(List<LoopNode> nodes) {
        var indices = new ArrayList<Integer>();
        collect(nodes, indices);
        return indices;
    }

    private static void collect(List<LoopNode> nodes, List<Integer> out) {
        for (LoopNode node : nodes) {
            if (node instanceof Leaf leaf) {
                out.add(leaf.index());
            } else if (node instanceof Repeat repeat) {
                collect(repeat.body(), out);
            }
        }
    }
}

package work.unicycler.core.loops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;
import work.unicycler.core.model.Loop;
import work.unicycler.core.model.Step;
import work.unicycler.core.resolve.ResolvedSequence;

/**
 * Groups a resolved, nesting-checked sequence into a tree of plain steps and repeated sections.
 *
 * <p>Walks each range backwards: a loop claims the range from its target up to itself, which is grouped
 * recursively, and everything at or above the loop's start is then skipped at the current depth. Callers must
 * run {@link NestingChecker} first; with crossing loops the start of a section is not well defined.
 */
public final class LoopTreeBuilder {
    private LoopTreeBuilder() {}

    public static List<LoopNode> build(ResolvedSequence sequence) {
        List<Integer> indices = IntStream.range(0, sequence.size()).boxed().toList();
        return group(sequence.steps(), indices);
    }

    private static List<LoopNode> group(List<Step> steps, List<Integer> indices) {
        var nodes = new ArrayList<LoopNode>();
        Integer skipAbove = null;

        for (int i = steps.size() - 1; i >= 0; i--) {
            int index = indices.get(i);
            if (skipAbove != null && index >= skipAbove) {
                continue;
            }
            if (steps.get(i) instanceof Loop loop) {
                int start = loop.loopTo().positionValue() - 1;
                int startAt = indices.indexOf(start);
                if (startAt < 0 || startAt >= i) {
                    throw new IllegalStateException(
                        "Loop at position " + (index + 1) + " targets " + (start + 1) + " outside its enclosing section"
                    );
                }
                nodes.add(new LoopNode.Repeat(
                    loop.cycleCount(),
                    group(steps.subList(startAt, i), indices.subList(startAt, i))
                ));
                skipAbove = start;
            } else {
                nodes.add(new LoopNode.Leaf(index, steps.get(i)));
            }
        }
        Collections.reverse(nodes);
        return nodes;
    }
}

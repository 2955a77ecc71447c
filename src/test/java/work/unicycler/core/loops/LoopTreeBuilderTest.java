package work.unicycler.core.loops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.unicycler.core.support.ProtocolTestSupport.protocol;
import static work.unicycler.core.support.ProtocolTestSupport.rest;

import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import work.unicycler.core.api.ProtocolEngine;
import work.unicycler.core.model.Loop;
import work.unicycler.core.model.Tag;
import work.unicycler.core.resolve.ResolvedSequence;

class LoopTreeBuilderTest {
    @Test
    void groupsSingleLoop() {
        var resolved = ProtocolEngine.resolveAndCheck(protocol(Tag.named("a"), rest(1), rest(2), Loop.toTag("a", 3)));

        var tree = LoopTreeBuilder.build(resolved);

        assertEquals(List.of(new LoopNode.Repeat(3, List.of(
            new LoopNode.Leaf(0, rest(1)),
            new LoopNode.Leaf(1, rest(2))
        ))), tree);
    }

    @Test
    void nestsLoopsSharingAStart() {
        var resolved = ProtocolEngine.resolveAndCheck(protocol(
            Tag.named("A"), Tag.named("B"), rest(1), Loop.toTag("B", 12), Loop.toTag("A", 34)
        ));

        var tree = LoopTreeBuilder.build(resolved);

        assertEquals(List.of(new LoopNode.Repeat(34, List.of(
            new LoopNode.Repeat(12, List.of(new LoopNode.Leaf(0, rest(1))))
        ))), tree);
    }

    @Test
    void keepsStepsAroundTheLoop() {
        var resolved = ProtocolEngine.resolveAndCheck(protocol(
            rest(1), Tag.named("a"), rest(2), rest(3), Loop.toTag("a", 2), rest(5)
        ));

        var tree = LoopTreeBuilder.build(resolved);

        assertEquals(List.of(
            new LoopNode.Leaf(0, rest(1)),
            new LoopNode.Repeat(2, List.of(new LoopNode.Leaf(1, rest(2)), new LoopNode.Leaf(2, rest(3)))),
            new LoopNode.Leaf(4, rest(5))
        ), tree);
    }

    @Test
    void siblingLoopsInsideAnOuterLoop() {
        var resolved = new ResolvedSequence(List.of(
            rest(1), rest(2), Loop.toPosition(2, 3), rest(4), Loop.toPosition(4, 5), Loop.toPosition(1, 2)
        ));

        var tree = LoopTreeBuilder.build(resolved);

        assertEquals(List.of(new LoopNode.Repeat(2, List.of(
            new LoopNode.Leaf(0, rest(1)),
            new LoopNode.Repeat(3, List.of(new LoopNode.Leaf(1, rest(2)))),
            new LoopNode.Repeat(5, List.of(new LoopNode.Leaf(3, rest(4))))
        ))), tree);
    }

    @Test
    void leavesFollowSequenceOrder() {
        var resolved = new ResolvedSequence(List.of(
            rest(1), rest(2), rest(3), Loop.toPosition(3, 2), rest(5), Loop.toPosition(2, 4), rest(7)
        ));

        var leaves = LoopNode.leafIndices(LoopTreeBuilder.build(resolved));

        var expected = IntStream.range(0, resolved.size())
            .filter(i -> !(resolved.steps().get(i) instanceof Loop))
            .boxed()
            .toList();
        assertEquals(expected, leaves);
    }
}

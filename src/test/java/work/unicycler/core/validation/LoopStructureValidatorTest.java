package work.unicycler.core.validation;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.unicycler.core.support.ProtocolTestSupport.protocol;
import static work.unicycler.core.support.ProtocolTestSupport.rest;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.unicycler.core.error.MissingTagException;
import work.unicycler.core.error.StructuralException;
import work.unicycler.core.model.Loop;
import work.unicycler.core.model.Step;
import work.unicycler.core.model.Tag;

class LoopStructureValidatorTest {
    @Test
    void acceptsBackwardLoops() {
        assertDoesNotThrow(() -> LoopStructureValidator.validate(List.of(rest(1), rest(2), Loop.toPosition(1, 2))));
        assertDoesNotThrow(() -> LoopStructureValidator.validate(
            List.of(Tag.named("a"), rest(1), Loop.toTag("a", 3))
        ));
    }

    @Test
    void loopCannotTargetItself() {
        var ex = assertThrows(StructuralException.class,
            () -> protocol(rest(1), rest(1), Loop.toPosition(3, 2)));
        assertEquals("loop_target_not_before_loop", ex.code());
        assertTrue(ex.getMessage().contains("cannot be on or after the loop index"));
    }

    @Test
    void loopCannotTargetLaterPosition() {
        var ex = assertThrows(StructuralException.class,
            () -> LoopStructureValidator.validate(List.of(rest(1), Loop.toPosition(4, 2), rest(1), rest(1))));
        assertEquals("Loop start index 4 cannot be on or after the loop index 2.", ex.getMessage());
    }

    @Test
    void loopCannotStartImmediatelyAfterItsTag() {
        var ex = assertThrows(StructuralException.class,
            () -> protocol(rest(1), Tag.named("a"), Loop.toTag("a", 2)));
        assertEquals("loop_empty_body", ex.code());
        assertEquals("Loop 'a' cannot start immediately after its tag.", ex.getMessage());
    }

    @Test
    void bodyOfOnlyTagsIsEmpty() {
        List<Step> steps = List.of(rest(1), Tag.named("a"), Tag.named("b"), Loop.toTag("a", 2));
        var ex = assertThrows(StructuralException.class, () -> LoopStructureValidator.validate(steps));
        assertEquals("loop_empty_body", ex.code());
    }

    @Test
    void numericTargetOnTagWithEmptyBody() {
        List<Step> steps = List.of(rest(1), Tag.named("t"), Loop.toPosition(2, 3));
        var ex = assertThrows(StructuralException.class, () -> LoopStructureValidator.validate(steps));
        assertEquals("Loop start index 2 at 3 has an empty body.", ex.getMessage());
    }

    @Test
    void reportsDuplicateTagsSorted() {
        List<Step> steps = List.of(
            Tag.named("b"), Tag.named("a"), rest(1), Tag.named("a"), Tag.named("b"), rest(1), Loop.toTag("a", 2)
        );
        var ex = assertThrows(StructuralException.class, () -> LoopStructureValidator.validate(steps));
        assertEquals("duplicate_tag", ex.code());
        assertEquals("Duplicate tags: 'a', 'b'", ex.getMessage());
    }

    @Test
    void reportsMissingTag() {
        var ex = assertThrows(MissingTagException.class, () -> protocol(rest(1), Loop.toTag("x", 2)));
        assertEquals("x", ex.tag());
        assertEquals("missing_tag", ex.code());
        assertEquals("Tag 'x' is missing.", ex.getMessage());
    }

    @Test
    void loopsMustGoBackwards() {
        List<Step> steps = List.of(rest(1), Loop.toTag("a", 2), Tag.named("a"), rest(1));
        var ex = assertThrows(StructuralException.class, () -> LoopStructureValidator.validate(steps));
        assertEquals("Loops must go backwards, 'a' goes forwards (2->3).", ex.getMessage());
    }
}

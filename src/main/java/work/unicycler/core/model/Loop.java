package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import work.unicycler.core.error.StepValidationException;

/**
 * Goes back to {@code loop_to} until the looped section has run {@code cycle_count} times in total.
 * A cycle count of 1 runs the section once and never goes back.
 */
public record Loop(
    @JsonProperty("id") String id,
    @JsonProperty("loop_to") LoopTarget loopTo,
    @JsonProperty("cycle_count") Integer cycleCount
) implements Step {
    public Loop {
        loopTo = loopTo == null ? LoopTarget.position(1) : loopTo;
        if (cycleCount == null) {
            throw StepValidationException.step(StepKind.LOOP.wireName(), "cycle_count is required");
        }
        if (cycleCount <= 0) {
            throw StepValidationException.step(StepKind.LOOP.wireName(), "cycle_count must be greater than 0");
        }
    }

    public static Loop toTag(String tag, int cycleCount) {
        return new Loop(null, LoopTarget.tag(tag), cycleCount);
    }

    public static Loop toPosition(int position, int cycleCount) {
        return new Loop(null, LoopTarget.position(position), cycleCount);
    }

    public Loop withTarget(int position) {
        return new Loop(id, LoopTarget.position(position), cycleCount);
    }

    @Override
    public StepKind kind() {
        return StepKind.LOOP;
    }
}

package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.util.Objects;
import work.unicycler.core.error.StepValidationException;

/**
 * Target of a loop: either a 1-based step position or the name of a tag. Serialized as the bare number or string.
 */
public final class LoopTarget {
    private final Integer position;
    private final String tag;

    private LoopTarget(Integer position, String tag) {
        this.position = position;
        this.tag = tag;
    }

    public static LoopTarget position(int position) {
        if (position <= 0) {
            throw StepValidationException.step(StepKind.LOOP.wireName(), "Start step must be positive integer or a string");
        }
        return new LoopTarget(position, null);
    }

    public static LoopTarget tag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw StepValidationException.step(StepKind.LOOP.wireName(), "Start step cannot be empty");
        }
        return new LoopTarget(null, tag);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static LoopTarget from(Object raw) {
        if (raw instanceof String text) {
            return tag(text);
        }
        if (raw instanceof Number number) {
            BigDecimal decimal = new BigDecimal(number.toString());
            if (decimal.stripTrailingZeros().scale() > 0) {
                throw StepValidationException.step(StepKind.LOOP.wireName(), "loop_to must be an integer or a tag name, got " + raw);
            }
            return position(decimal.intValueExact());
        }
        throw StepValidationException.step(StepKind.LOOP.wireName(), "loop_to must be an integer or a tag name");
    }

    public boolean symbolic() {
        return tag != null;
    }

    /** 1-based position; only valid when the target is not symbolic. */
    public int positionValue() {
        if (position == null) {
            throw new IllegalStateException("Loop target '" + tag + "' has not been resolved to a position");
        }
        return position;
    }

    /** Tag name; only valid when the target is symbolic. */
    public String tagName() {
        if (tag == null) {
            throw new IllegalStateException("Loop target " + position + " is not a tag");
        }
        return tag;
    }

    @JsonValue
    public Object toJson() {
        return position != null ? position : tag;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LoopTarget that)) {
            return false;
        }
        return Objects.equals(position, that.position) && Objects.equals(tag, that.tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, tag);
    }

    @Override
    public String toString() {
        return position != null ? position.toString() : "'" + tag + "'";
    }
}

package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import work.unicycler.core.error.StepValidationException;

/**
 * Named anchor for loops. Marks the position of the next executable step; tags are removed when the
 * sequence is resolved, so vendor formats never see them.
 */
public record Tag(
    @JsonProperty("id") String id,
    @JsonProperty("tag") String tag
) implements Step {
    public Tag {
        if (tag == null || tag.isBlank()) {
            throw StepValidationException.step(StepKind.TAG.wireName(), "Tag must not be empty");
        }
    }

    public static Tag named(String tag) {
        return new Tag(null, tag);
    }

    @Override
    public StepKind kind() {
        return StepKind.TAG;
    }
}

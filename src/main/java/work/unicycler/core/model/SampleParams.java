package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import work.unicycler.core.error.StepValidationException;

/**
 * Sample details. The capacity is needed to turn C-rates into currents.
 */
public record SampleParams(
    @JsonProperty("name") String name,
    @JsonProperty("capacity_mAh") Double capacityMah
) {
    public static final String NAME_PLACEHOLDER = "$NAME";

    public SampleParams {
        name = name == null ? NAME_PLACEHOLDER : name;
        if (capacityMah != null && !(capacityMah > 0)) {
            throw StepValidationException.parameters("sample", "capacity_mAh must be greater than 0");
        }
    }

    public static SampleParams unnamed() {
        return new SampleParams(NAME_PLACEHOLDER, null);
    }

    public boolean hasRealName() {
        return !name.isBlank() && !NAME_PLACEHOLDER.equals(name);
    }
}

package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Open circuit voltage step: no current is applied for a fixed duration.
 */
public record Rest(
    @JsonProperty("id") String id,
    @JsonProperty("until_time_s") Double untilTimeS
) implements Step {
    public Rest {
        StepChecks.requirePositive(StepKind.REST, "until_time_s", untilTimeS);
    }

    public static Rest of(double seconds) {
        return new Rest(null, seconds);
    }

    @Override
    public StepKind kind() {
        return StepKind.REST;
    }
}

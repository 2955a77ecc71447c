package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import work.unicycler.core.error.StepValidationException;

/**
 * Limits which cancel the whole experiment once exceeded for longer than {@code delay_s}.
 */
public record SafetyParams(
    @JsonProperty("max_voltage_V") Double maxVoltageV,
    @JsonProperty("min_voltage_V") Double minVoltageV,
    @JsonProperty("max_current_mA") Double maxCurrentMa,
    @JsonProperty("min_current_mA") Double minCurrentMa,
    @JsonProperty("max_capacity_mAh") Double maxCapacityMah,
    @JsonProperty("delay_s") Double delayS
) {
    public SafetyParams {
        if (maxVoltageV != null && minVoltageV != null && maxVoltageV <= minVoltageV) {
            throw StepValidationException.parameters("safety", "Max voltage must be larger than min voltage");
        }
        if (maxCurrentMa != null && minCurrentMa != null && maxCurrentMa <= minCurrentMa) {
            throw StepValidationException.parameters("safety", "Max current must be larger than min current");
        }
        if (maxCapacityMah != null && maxCapacityMah < 0) {
            throw StepValidationException.parameters("safety", "max_capacity_mAh must not be negative");
        }
        if (delayS != null && delayS < 0) {
            throw StepValidationException.parameters("safety", "delay_s must not be negative");
        }
    }

    public static SafetyParams none() {
        return new SafetyParams(null, null, null, null, null, null);
    }
}

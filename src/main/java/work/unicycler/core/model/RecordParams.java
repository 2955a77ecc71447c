package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import work.unicycler.core.error.StepValidationException;

/**
 * Data recording triggers: a change in current or voltage, or a fixed time interval.
 */
public record RecordParams(
    @JsonProperty("current_mA") Double currentMa,
    @JsonProperty("voltage_V") Double voltageV,
    @JsonProperty("time_s") Double timeS
) {
    public RecordParams {
        if (timeS == null) {
            throw StepValidationException.parameters("record", "time_s is required");
        }
        requirePositive("time_s", timeS);
        if (currentMa != null) {
            requirePositive("current_mA", currentMa);
        }
        if (voltageV != null) {
            requirePositive("voltage_V", voltageV);
        }
    }

    public static RecordParams every(double seconds) {
        return new RecordParams(null, null, seconds);
    }

    private static void requirePositive(String field, double value) {
        if (!(value > 0)) {
            throw StepValidationException.parameters("record", field + ": Input should be greater than 0");
        }
    }
}

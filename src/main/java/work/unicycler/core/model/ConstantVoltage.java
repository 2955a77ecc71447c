package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import work.unicycler.core.error.StepValidationException;
import work.unicycler.core.shared.CRateDeserializer;

/**
 * Constant voltage step. Ends when any of the {@code until_*} conditions is met; {@code until_rate_C} takes
 * priority over {@code until_current_mA} when both are set.
 */
public record ConstantVoltage(
    @JsonProperty("id") String id,
    @JsonProperty("voltage_V") Double voltageV,
    @JsonProperty("until_time_s") Double untilTimeS,
    @JsonProperty("until_rate_C") @JsonDeserialize(using = CRateDeserializer.class) Double untilRateC,
    @JsonProperty("until_current_mA") Double untilCurrentMa
) implements Step {
    public ConstantVoltage {
        if (voltageV == null) {
            throw StepValidationException.step(StepKind.CONSTANT_VOLTAGE.wireName(), "voltage_V is required");
        }
        if (!StepChecks.nonZero(untilTimeS) && !StepChecks.nonZero(untilRateC) && !StepChecks.nonZero(untilCurrentMa)) {
            throw StepValidationException.step(
                StepKind.CONSTANT_VOLTAGE.wireName(),
                "Either until_time_s, until_rate_C, or until_current_mA must be set and non-zero."
            );
        }
    }

    public static ConstantVoltage hold(double voltageV, Double untilTimeS, Double untilRateC) {
        return new ConstantVoltage(null, voltageV, untilTimeS, untilRateC, null);
    }

    @Override
    public StepKind kind() {
        return StepKind.CONSTANT_VOLTAGE;
    }
}

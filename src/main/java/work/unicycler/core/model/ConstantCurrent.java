package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import work.unicycler.core.error.StepValidationException;
import work.unicycler.core.shared.CRateDeserializer;

/**
 * Constant current step.
 *
 * <p>At least one of {@code rate_C} or {@code current_mA} must be set. When {@code rate_C} is used the protocol
 * needs a sample capacity, and the rate takes priority over {@code current_mA}. The {@code until_*} conditions
 * are OR conditions: the step ends when any one of them is met.
 */
public record ConstantCurrent(
    @JsonProperty("id") String id,
    @JsonProperty("rate_C") @JsonDeserialize(using = CRateDeserializer.class) Double rateC,
    @JsonProperty("current_mA") Double currentMa,
    @JsonProperty("until_time_s") Double untilTimeS,
    @JsonProperty("until_voltage_V") Double untilVoltageV
) implements Step {
    public ConstantCurrent {
        if (!StepChecks.nonZero(rateC) && !StepChecks.nonZero(currentMa)) {
            throw StepValidationException.step(
                StepKind.CONSTANT_CURRENT.wireName(),
                "Either rate_C or current_mA must be set and non-zero."
            );
        }
        if (!StepChecks.nonZero(untilTimeS) && !StepChecks.nonZero(untilVoltageV)) {
            throw StepValidationException.step(
                StepKind.CONSTANT_CURRENT.wireName(),
                "Either until_time_s or until_voltage_V must be set and non-zero."
            );
        }
    }

    public static ConstantCurrent atRate(double rateC, Double untilTimeS, Double untilVoltageV) {
        return new ConstantCurrent(null, rateC, null, untilTimeS, untilVoltageV);
    }

    public static ConstantCurrent atCurrent(double currentMa, Double untilTimeS, Double untilVoltageV) {
        return new ConstantCurrent(null, null, currentMa, untilTimeS, untilVoltageV);
    }

    @Override
    public StepKind kind() {
        return StepKind.CONSTANT_CURRENT;
    }
}

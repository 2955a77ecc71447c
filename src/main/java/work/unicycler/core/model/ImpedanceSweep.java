package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import work.unicycler.core.error.StepValidationException;

/**
 * Electrochemical impedance spectroscopy sweep. Exactly one of {@code amplitude_V} (potentiostatic) or
 * {@code amplitude_mA} (galvanostatic) is set.
 */
public record ImpedanceSweep(
    @JsonProperty("id") String id,
    @JsonProperty("amplitude_V") Double amplitudeV,
    @JsonProperty("amplitude_mA") Double amplitudeMa,
    @JsonProperty("start_frequency_Hz") Double startFrequencyHz,
    @JsonProperty("end_frequency_Hz") Double endFrequencyHz,
    @JsonProperty("points_per_decade") Integer pointsPerDecade,
    @JsonProperty("measures_per_point") Integer measuresPerPoint,
    @JsonProperty("drift_correction") Boolean driftCorrection
) implements Step {
    public static final double MIN_FREQUENCY_HZ = 1e-5;
    public static final double MAX_FREQUENCY_HZ = 1e5;

    public ImpedanceSweep {
        if (amplitudeV != null && amplitudeMa != null) {
            throw StepValidationException.step(
                StepKind.IMPEDANCE_SWEEP.wireName(),
                "Cannot set both amplitude_V and amplitude_mA."
            );
        }
        if (amplitudeV == null && amplitudeMa == null) {
            throw StepValidationException.step(
                StepKind.IMPEDANCE_SWEEP.wireName(),
                "Either amplitude_V or amplitude_mA must be set."
            );
        }
        StepChecks.requireRange(StepKind.IMPEDANCE_SWEEP, "start_frequency_Hz", startFrequencyHz, MIN_FREQUENCY_HZ, MAX_FREQUENCY_HZ);
        StepChecks.requireRange(StepKind.IMPEDANCE_SWEEP, "end_frequency_Hz", endFrequencyHz, MIN_FREQUENCY_HZ, MAX_FREQUENCY_HZ);
        pointsPerDecade = StepChecks.requirePositive(StepKind.IMPEDANCE_SWEEP, "points_per_decade", pointsPerDecade, 10);
        measuresPerPoint = StepChecks.requirePositive(StepKind.IMPEDANCE_SWEEP, "measures_per_point", measuresPerPoint, 1);
        driftCorrection = driftCorrection != null && driftCorrection;
    }

    public static ImpedanceSweep potentiostatic(double amplitudeV, double startFrequencyHz, double endFrequencyHz) {
        return new ImpedanceSweep(null, amplitudeV, null, startFrequencyHz, endFrequencyHz, null, null, null);
    }

    @Override
    public StepKind kind() {
        return StepKind.IMPEDANCE_SWEEP;
    }
}

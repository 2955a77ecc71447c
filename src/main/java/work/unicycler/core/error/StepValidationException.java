package work.unicycler.core.error;

import java.util.Map;

/**
 * Field-level validation failure of a single step or of the protocol parameters.
 */
public final class StepValidationException extends ProtocolException {
    public StepValidationException(String code, String message, Map<String, Object> data) {
        super(code, message, data);
    }

    public static StepValidationException step(String kind, String message) {
        return new StepValidationException("invalid_step", message, Map.of("step", kind));
    }

    public static StepValidationException parameters(String section, String message) {
        return new StepValidationException("invalid_parameters", message, Map.of("section", section));
    }
}

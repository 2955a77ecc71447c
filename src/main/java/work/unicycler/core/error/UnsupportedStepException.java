package work.unicycler.core.error;

import java.util.Map;

/**
 * Raised by an exporter for a step kind it cannot render.
 */
public final class UnsupportedStepException extends ProtocolException {
    public UnsupportedStepException(String exporter, String stepType) {
        super(
            "unsupported_step",
            exporter + " does not support step type: " + stepType,
            Map.of("exporter", exporter, "step", stepType)
        );
    }
}

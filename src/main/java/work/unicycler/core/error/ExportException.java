package work.unicycler.core.error;

import java.util.Map;

/**
 * Exporter pre-flight failure that is not about the step sequence itself.
 */
public final class ExportException extends ProtocolException {
    public ExportException(String code, String message) {
        super(code, message, Map.of());
    }
}

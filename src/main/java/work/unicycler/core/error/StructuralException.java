package work.unicycler.core.error;

import java.util.Map;

/**
 * Raised when a step sequence violates a structural invariant (tags, loop targets).
 */
public class StructuralException extends ProtocolException {
    public StructuralException(String code, String message, Map<String, Object> data) {
        super(code, message, data);
    }
}

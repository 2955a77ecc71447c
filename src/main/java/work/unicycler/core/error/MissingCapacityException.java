package work.unicycler.core.error;

import java.util.Map;

public final class MissingCapacityException extends ProtocolException {
    public MissingCapacityException() {
        super("missing_capacity", "Sample capacity must be set if using C-rate steps.", Map.of());
    }
}

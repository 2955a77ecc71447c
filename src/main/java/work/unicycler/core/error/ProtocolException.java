package work.unicycler.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception carrying a stable error code and diagnostic data for malformed protocols.
 */
public class ProtocolException extends RuntimeException {
    private final String code;
    private final Map<String, Object> data;

    public ProtocolException(String code, String message, Map<String, Object> data) {
        super(message);
        this.code = code;
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public String code() {
        return code;
    }

    public Map<String, Object> data() {
        return data;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", getMessage());
        if (!data.isEmpty()) {
            map.put("data", data);
        }
        return map;
    }
}

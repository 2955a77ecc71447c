package work.unicycler.core.shared;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import java.io.IOException;

/**
 * Binds {@code rate_C}-style fields from either a JSON number or a fraction string.
 */
public final class CRateDeserializer extends JsonDeserializer<Double> {
    @Override
    public Double deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return parser.getDoubleValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            String text = parser.getText();
            try {
                return CRateParser.parse(text).orElse(null);
            } catch (IllegalArgumentException ex) {
                throw ctxt.weirdStringException(text, Double.class, ex.getMessage());
            }
        }
        return (Double) ctxt.handleUnexpectedToken(Double.class, parser);
    }

    @Override
    public Double getNullValue(DeserializationContext ctxt) {
        return null;
    }
}

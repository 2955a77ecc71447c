package work.unicycler.core.shared;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses C-rates written as plain numbers or fractions (e.g. {@code 0.2}, {@code 1/5}, {@code C/5}, {@code D/2}).
 * A leading {@code C} in the numerator means charge, {@code D} means discharge (negative rate).
 */
public final class CRateParser {
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private CRateParser() {}

    public static Optional<Double> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (NUMBER.matcher(trimmed).matches()) {
            return Optional.of(Double.parseDouble(trimmed));
        }
        String compact = trimmed.replace(" ", "");
        String[] parts = compact.split("/", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid rate_C value: " + raw);
        }
        String numerator = parts[0];
        long markers = numerator.chars().filter(c -> c == 'C' || c == 'D').count();
        if (markers > 1) {
            throw new IllegalArgumentException("Invalid C-rate format: " + compact);
        }
        double nominal;
        if (numerator.indexOf('C') >= 0) {
            String rest = numerator.replace("C", "");
            nominal = rest.isEmpty() ? 1.0 : number(rest, raw);
        } else if (numerator.indexOf('D') >= 0) {
            String rest = numerator.replace("D", "");
            nominal = rest.isEmpty() ? -1.0 : -number(rest, raw);
        } else {
            nominal = number(numerator, raw);
        }
        double denominator = number(parts[1], raw);
        if (denominator == 0.0) {
            throw new IllegalArgumentException("Invalid rate_C value: " + raw + " (division by zero)");
        }
        return Optional.of(nominal / denominator);
    }

    private static double number(String text, String raw) {
        if (!NUMBER.matcher(text).matches()) {
            throw new IllegalArgumentException("Invalid rate_C value: " + raw);
        }
        return Double.parseDouble(text);
    }
}

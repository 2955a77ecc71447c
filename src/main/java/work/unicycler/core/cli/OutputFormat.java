package work.unicycler.core.cli;

import java.util.Locale;

/**
 * What the CLI prints for a protocol.
 */
enum OutputFormat {
    RESOLVED,
    TREE,
    TRACE,
    PYBAMM,
    TOMATO;

    static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return RESOLVED;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + value);
        }
    }
}

package work.unicycler.core.model;

import java.util.Locale;

/**
 * Discriminator of the step variants; the wire name is the {@code step} property in protocol documents.
 */
public enum StepKind {
    REST("open_circuit_voltage"),
    CONSTANT_CURRENT("constant_current"),
    CONSTANT_VOLTAGE("constant_voltage"),
    IMPEDANCE_SWEEP("impedance_spectroscopy"),
    LOOP("loop"),
    TAG("tag");

    private final String wireName;

    StepKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static StepKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Step type must not be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StepKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported step type: " + value);
    }
}

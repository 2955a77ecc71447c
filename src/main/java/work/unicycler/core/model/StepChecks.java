package work.unicycler.core.model;

import work.unicycler.core.error.StepValidationException;

final class StepChecks {
    private StepChecks() {}

    static boolean nonZero(Double value) {
        return value != null && value != 0.0;
    }

    static double requirePositive(StepKind kind, String field, Double value) {
        if (value == null) {
            throw StepValidationException.step(kind.wireName(), field + " is required");
        }
        if (!(value > 0)) {
            throw StepValidationException.step(kind.wireName(), field + " must be greater than 0");
        }
        return value;
    }

    static int requirePositive(StepKind kind, String field, Integer value, int fallback) {
        int effective = value == null ? fallback : value;
        if (effective <= 0) {
            throw StepValidationException.step(kind.wireName(), field + " must be greater than 0");
        }
        return effective;
    }

    static void requireRange(StepKind kind, String field, Double value, double min, double max) {
        if (value == null) {
            throw StepValidationException.step(kind.wireName(), field + " is required");
        }
        if (value < min || value > max) {
            throw StepValidationException.step(
                kind.wireName(),
                field + " must be between " + min + " and " + max + ", got " + value
            );
        }
    }
}

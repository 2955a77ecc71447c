package work.unicycler.core.config;

import java.util.Objects;
import java.util.Optional;
import work.unicycler.core.loops.LoopUnroller;

/**
 * Immutable settings for the command line front end.
 */
public record UnicyclerConfig(
    int maxIterations,
    Optional<String> sampleName,
    Optional<Double> capacityMah,
    boolean prettyPrint
) {
    public UnicyclerConfig {
        Objects.requireNonNull(sampleName, "sampleName");
        Objects.requireNonNull(capacityMah, "capacityMah");
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("max_iterations must be positive, got " + maxIterations);
        }
        if (capacityMah.isPresent() && !(capacityMah.get() > 0)) {
            throw new IllegalArgumentException("capacity_mAh must be greater than 0, got " + capacityMah.get());
        }
    }

    public static UnicyclerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxIterations(maxIterations)
            .sampleName(sampleName.orElse(null))
            .capacityMah(capacityMah.orElse(null))
            .prettyPrint(prettyPrint);
    }

    public static final class Builder {
        private int maxIterations = LoopUnroller.DEFAULT_MAX_ITERATIONS;
        private String sampleName;
        private Double capacityMah;
        private boolean prettyPrint = true;

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder sampleName(String sampleName) {
            this.sampleName = sampleName;
            return this;
        }

        public Builder capacityMah(Double capacityMah) {
            this.capacityMah = capacityMah;
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public UnicyclerConfig build() {
            return new UnicyclerConfig(
                maxIterations,
                Optional.ofNullable(sampleName).filter(name -> !name.isBlank()),
                Optional.ofNullable(capacityMah),
                prettyPrint
            );
        }
    }
}

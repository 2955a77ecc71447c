package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.unicycler.core.error.StepValidationException;
import work.unicycler.core.error.StructuralException;
import work.unicycler.core.validation.LoopStructureValidator;

/**
 * A battery cycling protocol: sample, recording and safety parameters plus the ordered method steps.
 *
 * <p>Instances are immutable. Construction validates the loop/tag structure of the method, so a protocol
 * that exists is structurally sound; nesting of loop intervals is checked later, on the resolved sequence.
 */
@JsonIgnoreProperties({"unicycler"})
public record Protocol(
    @JsonProperty("sample") SampleParams sample,
    @JsonProperty("record") RecordParams recording,
    @JsonProperty("safety") SafetyParams safety,
    @JsonProperty("method") List<Step> method
) {
    public Protocol {
        sample = sample == null ? SampleParams.unnamed() : sample;
        safety = safety == null ? SafetyParams.none() : safety;
        if (recording == null) {
            throw StepValidationException.parameters("record", "record parameters are required");
        }
        if (method == null || method.isEmpty()) {
            throw new StructuralException("empty_method", "Protocol method must contain at least one step.", Map.of());
        }
        for (int i = 0; i < method.size(); i++) {
            if (method.get(i) == null) {
                throw new StructuralException(
                    "incomplete_step",
                    "Step at index " + i + " is incomplete, needs a 'step' type.",
                    Map.of("index", i)
                );
            }
        }
        method = List.copyOf(method);
        LoopStructureValidator.validate(method);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Protocol withMethod(List<Step> steps) {
        return new Protocol(sample, recording, safety, steps);
    }

    public Protocol withSampleName(String name) {
        Objects.requireNonNull(name, "name");
        return new Protocol(new SampleParams(name, sample.capacityMah()), recording, safety, method);
    }

    public Protocol withSampleCapacity(double capacityMah) {
        return new Protocol(new SampleParams(sample.name(), capacityMah), recording, safety, method);
    }

    public static final class Builder {
        private SampleParams sample = SampleParams.unnamed();
        private RecordParams recording;
        private SafetyParams safety = SafetyParams.none();
        private final List<Step> method = new ArrayList<>();

        public Builder sample(String name, Double capacityMah) {
            this.sample = new SampleParams(name, capacityMah);
            return this;
        }

        public Builder sample(SampleParams sample) {
            this.sample = sample;
            return this;
        }

        public Builder recordEvery(double seconds) {
            this.recording = RecordParams.every(seconds);
            return this;
        }

        public Builder recording(RecordParams recording) {
            this.recording = recording;
            return this;
        }

        public Builder safety(SafetyParams safety) {
            this.safety = safety;
            return this;
        }

        public Builder step(Step step) {
            this.method.add(step);
            return this;
        }

        public Builder steps(List<? extends Step> steps) {
            this.method.addAll(steps);
            return this;
        }

        public Protocol build() {
            return new Protocol(sample, recording, safety, method);
        }
    }
}

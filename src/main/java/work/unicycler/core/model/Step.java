package work.unicycler.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One unit of a cycling protocol. The set of variants is closed; consumers dispatch on {@link #kind()}
 * with a switch expression so that a new variant fails to compile until every consumer handles it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "step")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Rest.class, name = "open_circuit_voltage"),
    @JsonSubTypes.Type(value = ConstantCurrent.class, name = "constant_current"),
    @JsonSubTypes.Type(value = ConstantVoltage.class, name = "constant_voltage"),
    @JsonSubTypes.Type(value = ImpedanceSweep.class, name = "impedance_spectroscopy"),
    @JsonSubTypes.Type(value = Loop.class, name = "loop"),
    @JsonSubTypes.Type(value = Tag.class, name = "tag")
})
public sealed interface Step permits Rest, ConstantCurrent, ConstantVoltage, ImpedanceSweep, Loop, Tag {
    /** Optional user-supplied identifier. */
    String id();

    @JsonIgnore
    StepKind kind();

    /** Tags only anchor positions; every other step occupies a slot in the resolved sequence. */
    @JsonIgnore
    default boolean executable() {
        return kind() != StepKind.TAG;
    }
}

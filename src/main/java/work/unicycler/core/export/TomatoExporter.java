package work.unicycler.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.unicycler.core.api.ProtocolEngine;
import work.unicycler.core.error.ExportException;
import work.unicycler.core.error.UnsupportedStepException;
import work.unicycler.core.model.ConstantCurrent;
import work.unicycler.core.model.ConstantVoltage;
import work.unicycler.core.model.Loop;
import work.unicycler.core.model.Protocol;
import work.unicycler.core.model.RecordParams;
import work.unicycler.core.model.Rest;
import work.unicycler.core.model.Step;
import work.unicycler.core.resolve.ResolvedSequence;

/**
 * Renders a protocol as a tomato 0.2 job for an MPG2 device. Loops stay index based: {@code goto} is the
 * 0-based target and {@code n_gotos} the number of jumps, one less than the cycle count.
 */
public final class TomatoExporter {
    static final String NAME = "to_tomato_mpg2";

    private static final ObjectMapper JSON = new ObjectMapper();

    private TomatoExporter() {}

    public static String export(Protocol protocol) {
        return export(protocol, TomatoOptions.defaults());
    }

    public static String export(Protocol protocol, TomatoOptions options) {
        ObjectNode document = toTree(protocol, options);
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize tomato payload: " + ex.getOriginalMessage(), ex);
        }
    }

    public static ObjectNode toTree(Protocol protocol, TomatoOptions options) {
        Protocol effective = protocol;
        if (options.sampleName() != null && !options.sampleName().isBlank()) {
            effective = effective.withSampleName(options.sampleName());
        }
        if (options.capacityMah() != null) {
            effective = effective.withSampleCapacity(options.capacityMah());
        }
        if (!effective.sample().hasRealName()) {
            throw new ExportException(
                "missing_sample_name",
                "If using blank sample name or $NAME placeholder, a sample name must be provided in this function."
            );
        }
        ProtocolEngine.requireCapacityIfRateUsed(effective);
        ResolvedSequence resolved = ProtocolEngine.resolveAndCheck(effective);

        ObjectNode root = JSON.createObjectNode();
        root.put("version", "0.1");
        ObjectNode sample = root.putObject("sample");
        sample.put("name", effective.sample().name());
        if (effective.sample().capacityMah() != null) {
            sample.put("capacity_mAh", effective.sample().capacityMah());
        } else {
            sample.putNull("capacity_mAh");
        }
        ArrayNode method = root.putArray("method");
        for (Step step : resolved.steps()) {
            method.add(render(step, effective.recording()));
        }
        ObjectNode tomato = root.putObject("tomato");
        tomato.put("unlock_when_done", true);
        tomato.put("verbosity", "DEBUG");
        ObjectNode output = tomato.putObject("output");
        output.put("path", options.outputPath());
        output.put("prefix", effective.sample().name());
        return root;
    }

    private static ObjectNode render(Step step, RecordParams record) {
        ObjectNode node = JSON.createObjectNode();
        node.put("device", "MPG2");
        node.put("technique", step.kind().wireName());
        switch (step.kind()) {
            case REST -> {
                measurement(node, record);
                node.put("time", ((Rest) step).untilTimeS());
            }
            case CONSTANT_CURRENT -> {
                measurement(node, record);
                constantCurrent(node, (ConstantCurrent) step);
            }
            case CONSTANT_VOLTAGE -> {
                measurement(node, record);
                constantVoltage(node, (ConstantVoltage) step);
            }
            case LOOP -> {
                Loop loop = (Loop) step;
                node.put("goto", loop.loopTo().positionValue() - 1);
                node.put("n_gotos", loop.cycleCount() - 1);
            }
            case IMPEDANCE_SWEEP, TAG -> throw new UnsupportedStepException(NAME, step.kind().wireName());
        }
        return node;
    }

    private static void measurement(ObjectNode node, RecordParams record) {
        node.put("measure_every_dt", record.timeS());
        if (record.currentMa() != null) {
            node.put("measure_every_dI", record.currentMa());
        }
        if (record.voltageV() != null) {
            node.put("measure_every_dE", record.voltageV());
        }
        node.put("I_range", "10 mA");
        node.put("E_range", "+-5.0 V");
    }

    private static void constantCurrent(ObjectNode node, ConstantCurrent step) {
        boolean charging;
        if (nonZero(step.rateC())) {
            charging = step.rateC() > 0;
            node.put("current", Math.abs(step.rateC()) + (charging ? "C" : "D"));
        } else {
            charging = step.currentMa() > 0;
            node.put("current", step.currentMa() / 1000);
        }
        if (nonZero(step.untilTimeS())) {
            node.put("time", step.untilTimeS());
        }
        if (nonZero(step.untilVoltageV())) {
            node.put(charging ? "limit_voltage_max" : "limit_voltage_min", step.untilVoltageV());
        }
    }

    private static void constantVoltage(ObjectNode node, ConstantVoltage step) {
        node.put("voltage", step.voltageV());
        if (nonZero(step.untilTimeS())) {
            node.put("time", step.untilTimeS());
        }
        if (nonZero(step.untilRateC())) {
            if (step.untilRateC() > 0) {
                node.put("limit_current_min", step.untilRateC() + "C");
            } else {
                node.put("limit_current_max", Math.abs(step.untilRateC()) + "D");
            }
        }
    }

    private static boolean nonZero(Double value) {
        return value != null && value != 0.0;
    }
}

package work.unicycler.core.export;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.unicycler.core.api.ProtocolEngine;
import work.unicycler.core.error.UnsupportedStepException;
import work.unicycler.core.loops.ExecutionTrace;
import work.unicycler.core.loops.LoopUnroller;
import work.unicycler.core.model.ConstantCurrent;
import work.unicycler.core.model.ConstantVoltage;
import work.unicycler.core.model.Protocol;
import work.unicycler.core.model.Rest;
import work.unicycler.core.model.Step;
import work.unicycler.core.resolve.ResolvedSequence;

/**
 * Renders a protocol as a PyBaMM experiment: one string per executed step, loops fully unrolled.
 */
public final class PybammExporter {
    static final String NAME = "to_pybamm_experiment";

    private static final Logger log = LoggerFactory.getLogger(PybammExporter.class);

    private PybammExporter() {}

    public static List<String> export(Protocol protocol) {
        return export(protocol, LoopUnroller.DEFAULT_MAX_ITERATIONS);
    }

    public static List<String> export(Protocol protocol, int maxIterations) {
        ResolvedSequence resolved = ProtocolEngine.resolveAndCheck(protocol);
        var rendered = new ArrayList<String>(resolved.size());
        for (Step step : resolved.steps()) {
            rendered.add(render(step));
        }
        ExecutionTrace trace = ProtocolEngine.unroll(resolved, maxIterations);
        log.debug("PyBaMM experiment has {} step(s)", trace.size());
        return trace.indices().stream().map(rendered::get).toList();
    }

    static String render(Step step) {
        return switch (step.kind()) {
            case REST -> "Rest for " + ((Rest) step).untilTimeS() + " seconds";
            case CONSTANT_CURRENT -> constantCurrent((ConstantCurrent) step);
            case CONSTANT_VOLTAGE -> constantVoltage((ConstantVoltage) step);
            // only control flow, never part of the trace
            case LOOP -> "";
            case IMPEDANCE_SWEEP, TAG -> throw new UnsupportedStepException(NAME, step.kind().wireName());
        };
    }

    private static String constantCurrent(ConstantCurrent step) {
        var text = new StringBuilder();
        if (nonZero(step.rateC())) {
            text.append(step.rateC() > 0 ? "Charge at " : "Discharge at ").append(Math.abs(step.rateC())).append('C');
        } else if (nonZero(step.currentMa())) {
            text.append(step.currentMa() > 0 ? "Charge at " : "Discharge at ").append(Math.abs(step.currentMa())).append(" mA");
        }
        if (nonZero(step.untilTimeS())) {
            text.append(' ').append(duration(step.untilTimeS()));
        }
        if (nonZero(step.untilVoltageV())) {
            text.append(" until ").append(step.untilVoltageV()).append(" V");
        }
        return text.toString();
    }

    private static String constantVoltage(ConstantVoltage step) {
        var text = new StringBuilder("Hold at ").append(step.voltageV()).append(" V");
        var conditions = new ArrayList<String>();
        if (nonZero(step.untilTimeS())) {
            double seconds = step.untilTimeS();
            if (seconds % 60 == 0) {
                text.append(' ').append(duration(seconds));
            } else {
                conditions.add(duration(seconds));
            }
        }
        if (nonZero(step.untilRateC())) {
            conditions.add("until " + step.untilRateC() + "C");
        }
        if (nonZero(step.untilCurrentMa())) {
            conditions.add("until " + step.untilCurrentMa() + " mA");
        }
        if (!conditions.isEmpty()) {
            text.append(' ').append(String.join(" or ", conditions));
        }
        return text.toString();
    }

    private static String duration(double seconds) {
        if (seconds % 3600 == 0) {
            return "for " + (long) (seconds / 3600) + " hours";
        }
        if (seconds % 60 == 0) {
            return "for " + (long) (seconds / 60) + " minutes";
        }
        return "for " + seconds + " seconds";
    }

    private static boolean nonZero(Double value) {
        return value != null && value != 0.0;
    }
}

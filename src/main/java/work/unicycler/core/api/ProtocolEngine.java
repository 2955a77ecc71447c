package work.unicycler.core.api;

import java.util.List;
import work.unicycler.core.error.MissingCapacityException;
import work.unicycler.core.loops.ExecutionTrace;
import work.unicycler.core.loops.LoopNode;
import work.unicycler.core.loops.LoopTreeBuilder;
import work.unicycler.core.loops.LoopUnroller;
import work.unicycler.core.loops.NestingChecker;
import work.unicycler.core.model.ConstantCurrent;
import work.unicycler.core.model.ConstantVoltage;
import work.unicycler.core.model.Protocol;
import work.unicycler.core.model.Step;
import work.unicycler.core.resolve.ResolvedSequence;
import work.unicycler.core.resolve.TagResolver;

/**
 * Public entry point used by exporters: tag resolution, nesting check, loop tree and unrolling.
 *
 * <p>Every operation is a pure function of its input; the caller's protocol is never modified.
 */
public final class ProtocolEngine {
    private ProtocolEngine() {}

    public static ResolvedSequence resolveTags(Protocol protocol) {
        return TagResolver.resolve(protocol);
    }

    public static void checkNesting(ResolvedSequence sequence) {
        NestingChecker.check(sequence);
    }

    /** Resolves tags and checks nesting; the usual first step of every exporter. */
    public static ResolvedSequence resolveAndCheck(Protocol protocol) {
        var resolved = resolveTags(protocol);
        checkNesting(resolved);
        return resolved;
    }

    public static List<LoopNode> buildLoopTree(ResolvedSequence sequence) {
        return LoopTreeBuilder.build(sequence);
    }

    public static List<LoopNode> buildLoopTree(Protocol protocol) {
        return buildLoopTree(resolveAndCheck(protocol));
    }

    public static ExecutionTrace unroll(ResolvedSequence sequence) {
        return LoopUnroller.unroll(sequence);
    }

    public static ExecutionTrace unroll(ResolvedSequence sequence, int maxIterations) {
        return LoopUnroller.unroll(sequence, maxIterations);
    }

    public static ExecutionTrace unroll(Protocol protocol, int maxIterations) {
        return unroll(resolveAndCheck(protocol), maxIterations);
    }

    /**
     * Fails when any step uses a C-rate and {@code capacityMah} is missing or not positive.
     */
    public static void requireCapacityIfRateUsed(Protocol protocol, Double capacityMah) {
        boolean hasCapacity = capacityMah != null && capacityMah > 0;
        if (!hasCapacity && usesCRates(protocol.method())) {
            throw new MissingCapacityException();
        }
    }

    public static void requireCapacityIfRateUsed(Protocol protocol) {
        requireCapacityIfRateUsed(protocol, protocol.sample().capacityMah());
    }

    static boolean usesCRates(List<Step> steps) {
        for (Step step : steps) {
            if (step instanceof ConstantCurrent cc && isNonZero(cc.rateC())) {
                return true;
            }
            if (step instanceof ConstantVoltage cv && isNonZero(cv.untilRateC())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNonZero(Double value) {
        return value != null && value != 0.0;
    }
}

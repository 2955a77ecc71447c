package work.unicycler.core.error;

import java.util.Map;

/**
 * Unrolling took more steps than the configured ceiling, most likely a malformed loop.
 */
public final class RunawayExpansionException extends ProtocolException {
    private final long stepsTaken;
    private final int limit;

    public RunawayExpansionException(long stepsTaken, int limit) {
        super(
            "runaway_expansion",
            "Over " + limit + " steps while unrolling the protocol, likely a loop definition error.",
            Map.of("stepsTaken", stepsTaken, "limit", limit)
        );
        this.stepsTaken = stepsTaken;
        this.limit = limit;
    }

    public long stepsTaken() {
        return stepsTaken;
    }

    public int limit() {
        return limit;
    }
}

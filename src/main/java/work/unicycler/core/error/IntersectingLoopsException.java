package work.unicycler.core.error;

import java.util.List;
import java.util.Map;

/**
 * Two loop intervals partially overlap, so no nesting of the loops exists.
 */
public final class IntersectingLoopsException extends ProtocolException {
    public IntersectingLoopsException(int firstStart, int firstEnd, int secondStart, int secondEnd) {
        super(
            "intersecting_loops",
            "Protocol has intersecting loops: [" + firstStart + ", " + firstEnd + "] and ["
                + secondStart + ", " + secondEnd + "].",
            Map.of(
                "first", List.of(firstStart, firstEnd),
                "second", List.of(secondStart, secondEnd)
            )
        );
    }
}

package work.unicycler.core.resolve;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.unicycler.core.error.MissingTagException;
import work.unicycler.core.error.StructuralException;
import work.unicycler.core.model.Loop;
import work.unicycler.core.model.Protocol;
import work.unicycler.core.model.Step;
import work.unicycler.core.model.Tag;

/**
 * Removes tag steps and rewrites every loop target to a 1-based position in the new numbering.
 *
 * <p>Numeric targets refer to the original numbering, so they are translated through the old-to-new position
 * map built during the same forward scan; a target always precedes its loop, so its mapping is already known.
 * The input is never modified. Resolving an already resolved sequence returns an equal sequence.
 */
public final class TagResolver {
    private static final Logger log = LoggerFactory.getLogger(TagResolver.class);

    private TagResolver() {}

    public static ResolvedSequence resolve(Protocol protocol) {
        return resolve(protocol.method());
    }

    public static ResolvedSequence resolve(List<Step> steps) {
        int[] newPositions = new int[steps.size()];
        Map<String, Integer> tags = new HashMap<>();
        List<Step> resolved = new ArrayList<>(steps.size());
        int executed = 0;

        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step instanceof Tag tag) {
                newPositions[i] = executed + 1;
                tags.put(tag.tag(), executed + 1);
                continue;
            }
            executed++;
            newPositions[i] = executed;
            if (step instanceof Loop loop) {
                resolved.add(loop.withTarget(targetOf(loop, i, tags, newPositions)));
            } else {
                resolved.add(step);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Resolved {} tag(s), {} executable step(s) remain", steps.size() - executed, executed);
        }
        return new ResolvedSequence(resolved);
    }

    private static int targetOf(Loop loop, int index, Map<String, Integer> tags, int[] newPositions) {
        if (loop.loopTo().symbolic()) {
            String name = loop.loopTo().tagName();
            Integer position = tags.get(name);
            if (position == null) {
                throw new MissingTagException(name, "Loop step with tag " + name + " does not have a corresponding tag step.");
            }
            return position;
        }
        int target = loop.loopTo().positionValue();
        if (target > index) {
            throw new StructuralException(
                "loop_target_not_before_loop",
                "Loop start index " + target + " cannot be on or after the loop index " + (index + 1) + ".",
                Map.of("target", target, "position", index + 1)
            );
        }
        return newPositions[target - 1];
    }
}

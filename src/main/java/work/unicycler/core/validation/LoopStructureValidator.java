package work.unicycler.core.validation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import work.unicycler.core.error.MissingTagException;
import work.unicycler.core.error.StructuralException;
import work.unicycler.core.model.Loop;
import work.unicycler.core.model.Step;
import work.unicycler.core.model.Tag;

/**
 * Checks tags and loop targets of a method in its original numbering (before tags are resolved).
 *
 * <p>Rules: tag names are unique; numeric targets lie strictly before the loop; symbolic targets name an
 * earlier tag; and a loop body contains at least one executable step once tags are removed.
 */
public final class LoopStructureValidator {
    private LoopStructureValidator() {}

    public static void validate(List<Step> steps) {
        Map<String, Integer> tagIndex = indexTags(steps);
        int[] anchors = resolvedAnchors(steps);

        for (int i = 0; i < steps.size(); i++) {
            if (!(steps.get(i) instanceof Loop loop)) {
                continue;
            }
            int position = i + 1;
            if (loop.loopTo().symbolic()) {
                checkSymbolic(loop.loopTo().tagName(), i, tagIndex, anchors);
            } else {
                checkNumeric(loop.loopTo().positionValue(), position, anchors);
            }
        }
    }

    private static Map<String, Integer> indexTags(List<Step> steps) {
        Map<String, Integer> tagIndex = new LinkedHashMap<>();
        Set<String> duplicates = new TreeSet<>();
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) instanceof Tag tag && tagIndex.putIfAbsent(tag.tag(), i) != null) {
                duplicates.add(tag.tag());
            }
        }
        if (!duplicates.isEmpty()) {
            String names = duplicates.stream().map(name -> "'" + name + "'").collect(Collectors.joining(", "));
            throw new StructuralException("duplicate_tag", "Duplicate tags: " + names, Map.of("tags", List.copyOf(duplicates)));
        }
        return tagIndex;
    }

    /**
     * Position each original entry occupies after resolution; a tag takes the position of the next executable step.
     */
    private static int[] resolvedAnchors(List<Step> steps) {
        int[] anchors = new int[steps.size()];
        int executed = 0;
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).executable()) {
                executed++;
                anchors[i] = executed;
            } else {
                anchors[i] = executed + 1;
            }
        }
        return anchors;
    }

    private static void checkNumeric(int target, int position, int[] anchors) {
        if (target >= position) {
            throw new StructuralException(
                "loop_target_not_before_loop",
                "Loop start index " + target + " cannot be on or after the loop index " + position + ".",
                Map.of("target", target, "position", position)
            );
        }
        if (anchors[target - 1] >= anchors[position - 1]) {
            throw new StructuralException(
                "loop_empty_body",
                "Loop start index " + target + " at " + position + " has an empty body.",
                Map.of("target", target, "position", position)
            );
        }
    }

    private static void checkSymbolic(String name, int loopIndex, Map<String, Integer> tagIndex, int[] anchors) {
        Integer tagAt = tagIndex.get(name);
        if (tagAt == null) {
            throw new MissingTagException(name, "Tag '" + name + "' is missing.");
        }
        if (tagAt > loopIndex) {
            throw new StructuralException(
                "loop_goes_forwards",
                "Loops must go backwards, '" + name + "' goes forwards (" + (loopIndex + 1) + "->" + (tagAt + 1) + ").",
                Map.of("tag", name, "position", loopIndex + 1, "tagPosition", tagAt + 1)
            );
        }
        if (anchors[tagAt] >= anchors[loopIndex]) {
            throw new StructuralException(
                "loop_empty_body",
                "Loop '" + name + "' cannot start immediately after its tag.",
                Map.of("tag", name, "position", loopIndex + 1)
            );
        }
    }
}

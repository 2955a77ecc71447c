package work.unicycler.core.error;

import java.util.Map;

/**
 * A loop refers to a tag that does not exist earlier in the sequence.
 */
public final class MissingTagException extends StructuralException {
    private final String tag;

    public MissingTagException(String tag, String message) {
        super("missing_tag", message, Map.of("tag", tag));
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

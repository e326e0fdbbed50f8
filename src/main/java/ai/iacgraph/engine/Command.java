package ai.iacgraph.engine;

import java.util.Locale;
import java.util.Optional;

/**
 * Operations offered by the engine, each running a prefix of the stage chain.
 */
public enum Command {
    ANALYZE,
    GENERATE,
    VALIDATE,
    OPTIMIZE,
    CONVERT;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Command> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        for (Command c : values()) {
            if (c.tag().equals(tag.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}

package ai.iacgraph.engine;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One command as received from a caller. Dialects are tags ({@code terraform}, {@code k8s}, ...)
 * resolved by the orchestrator; a null source dialect is inferred from the tree.
 */
public record InvocationRequest(Command command, Path sourcePath, String sourceDialect, String targetDialect) {

    public InvocationRequest {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(sourcePath, "sourcePath");
    }
}

package ai.iacgraph.emit;

/**
 * Per-emission settings.
 *
 * @param errorFindings number of unresolved error-level findings on the graph; any makes every
 *                      artifact start with a warning banner
 */
public record EmitOptions(int errorFindings) {

    public static final EmitOptions DEFAULT = new EmitOptions(0);

    public boolean banner() {
        return errorFindings > 0;
    }
}

package ai.iacgraph.model;

/**
 * A dialect-native expression kept as its source text (e.g. an unquoted HCL expression).
 * Used inside raw dialect values stored in the metadata bag.
 */
public record RawExpression(String text) {

    @Override
    public String toString() {
        return text;
    }
}

package ai.iacgraph.normalize.schema;

/**
 * Expected shape of a property value.
 */
public enum ValueKind {
    STRING,
    NUMBER,
    BOOLEAN,
    LIST,
    MAP,
    /** Key/value tags: a map canonically, a list of {@code Key}/{@code Value} pairs in CloudFormation. */
    TAGS,
    ANY
}

package ai.iacgraph.parse.yaml;

import java.util.List;

/**
 * Documents read from one file and the syntax errors of the documents that had to be dropped.
 */
public record YamlStream(List<YamlDocument> documents, List<YamlError> errors) {

    public YamlStream {
        documents = List.copyOf(documents);
        errors = List.copyOf(errors);
    }

    public record YamlError(int line, String message) {
    }
}

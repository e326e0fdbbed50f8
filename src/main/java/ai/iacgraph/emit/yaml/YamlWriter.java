package ai.iacgraph.emit.yaml;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Serializes plain maps and lists as block-style YAML documents.
 */
public final class YamlWriter {

    public static final String DOCUMENT_SEPARATOR = "---\n";

    private final ObjectMapper mapper;

    public YamlWriter() {
        final YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .build();
        this.mapper = new ObjectMapper(factory);
    }

    public String document(Object root) {
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize YAML document: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Header text followed by the documents separated by {@code ---} lines.
     */
    public String documents(String header, List<?> roots) {
        final StringBuilder sb = new StringBuilder(header == null ? "" : header);
        for (int i = 0; i < roots.size(); i++) {
            if (i > 0) {
                sb.append(DOCUMENT_SEPARATOR);
            }
            sb.append(document(roots.get(i)));
        }
        return sb.toString();
    }
}

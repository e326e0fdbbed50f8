package ai.iacgraph.parse;

import java.util.List;
import java.util.Map;
import java.util.Set;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.parse.yaml.YamlDocument;
import ai.iacgraph.scan.SourceFile;

/**
 * Reads multi-document manifests, one object per document. {@code kind: List} documents are
 * expanded into their items.
 */
public final class KubernetesParser extends YamlDialectParser {

    public KubernetesParser() {
        super(false);
    }

    @Override
    public Dialect dialect() {
        return Dialect.KUBERNETES;
    }

    @Override
    void readDocument(SourceFile file, YamlDocument doc, List<SourceBlock> blocks, List<ParseError> errors) {
        final Map<String, Object> root = asMap(doc.root());
        if (root == null) {
            errors.add(new ParseError(file.path(), doc.line(), null, "manifest document is not a mapping"));
            return;
        }
        if ("List".equals(root.get("kind")) && root.get("items") instanceof List<?> items) {
            for (Object item : items) {
                object(file, doc, asMap(item), item, blocks, errors);
            }
            return;
        }
        object(file, doc, root, root, blocks, errors);
    }

    private static void object(SourceFile file, YamlDocument doc, Map<String, Object> obj, Object node,
                               List<SourceBlock> blocks, List<ParseError> errors) {
        final int line = doc.lineOf(node, doc.line());
        if (obj == null) {
            errors.add(new ParseError(file.path(), line, null, "list item is not a mapping"));
            return;
        }
        final String kind = text(obj.get("kind"));
        if (kind == null || kind.isBlank() || obj.get("apiVersion") == null) {
            errors.add(new ParseError(file.path(), line, null, "object needs apiVersion and kind"));
            return;
        }
        final Map<String, Object> metadata = asMap(obj.get("metadata"));
        final String name = metadata == null ? null : text(metadata.get("name"));
        if (name == null || name.isBlank()) {
            errors.add(new ParseError(file.path(), line, kind, "object has no metadata.name"));
            return;
        }
        final String namespace = text(metadata.get("namespace"));
        blocks.add(new SourceBlock(BlockKind.RESOURCE, kind, name, obj, Set.of(), namespace,
                at(file, doc, node)));
    }
}

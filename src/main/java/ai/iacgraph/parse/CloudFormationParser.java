package ai.iacgraph.parse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.parse.yaml.YamlDocument;
import ai.iacgraph.scan.SourceFile;

/**
 * Reads CloudFormation templates in YAML or JSON, short-form intrinsic tags included.
 */
public final class CloudFormationParser extends YamlDialectParser {

    static final Set<String> SECTIONS = Set.of("Parameters", "Resources", "Outputs");

    public CloudFormationParser() {
        super(true);
    }

    @Override
    public Dialect dialect() {
        return Dialect.CLOUDFORMATION;
    }

    @Override
    public boolean accepts(SourceFile file) {
        return file.isYaml() || file.isJson();
    }

    @Override
    void readDocument(SourceFile file, YamlDocument doc, List<SourceBlock> blocks, List<ParseError> errors) {
        final Map<String, Object> root = asMap(doc.root());
        if (root == null) {
            errors.add(new ParseError(file.path(), doc.line(), null, "template root is not a mapping"));
            return;
        }
        final Map<String, Object> header = new LinkedHashMap<>();
        for (var e : root.entrySet()) {
            if (!SECTIONS.contains(e.getKey())) {
                header.put(e.getKey(), e.getValue());
            }
        }
        if (!header.isEmpty()) {
            blocks.add(new SourceBlock(BlockKind.EXTENSION, "template", file.path(), header, at(file, doc, root)));
        }
        section(file, doc, root, "Parameters", BlockKind.VARIABLE, blocks, errors);
        section(file, doc, root, "Resources", BlockKind.RESOURCE, blocks, errors);
        section(file, doc, root, "Outputs", BlockKind.OUTPUT, blocks, errors);
    }

    private static void section(SourceFile file, YamlDocument doc, Map<String, Object> root, String name,
                                BlockKind kind, List<SourceBlock> blocks, List<ParseError> errors) {
        final Object raw = root.get(name);
        if (raw == null) {
            return;
        }
        final Map<String, Object> entries = asMap(raw);
        if (entries == null) {
            errors.add(new ParseError(file.path(), doc.lineOf(raw, doc.line()), null, name + " is not a mapping"));
            return;
        }
        for (var e : entries.entrySet()) {
            final Map<String, Object> body = asMap(e.getValue());
            if (body == null) {
                errors.add(new ParseError(file.path(), doc.line(), e.getKey(), name + " entry is not a mapping"));
                continue;
            }
            final String nativeType = switch (kind) {
                case RESOURCE -> text(body.get("Type"));
                case VARIABLE -> "parameter";
                default -> "output";
            };
            if (nativeType == null || nativeType.isBlank()) {
                errors.add(new ParseError(file.path(), doc.lineOf(body, doc.line()), e.getKey(), "resource has no Type"));
                continue;
            }
            blocks.add(new SourceBlock(kind, nativeType, e.getKey(), body, at(file, doc, body)));
        }
    }
}

package ai.iacgraph.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.iacgraph.model.SourceLocation;
import ai.iacgraph.parse.yaml.YamlDocument;
import ai.iacgraph.parse.yaml.YamlReader;
import ai.iacgraph.parse.yaml.YamlStream;
import ai.iacgraph.scan.SourceFile;

/**
 * Shared document loop of the YAML based dialects.
 */
abstract class YamlDialectParser implements DialectParser {

    /**
     * Rename record written by the YAML emitters at the top of a file: {@code # moved: old -> new}.
     */
    static final Pattern MOVED = Pattern.compile("^#\\s*moved:\\s*(\\S+)\\s*->\\s*(\\S+)\\s*$");

    private final YamlReader reader;

    YamlDialectParser(boolean intrinsicTags) {
        this.reader = new YamlReader(intrinsicTags);
    }

    @Override
    public boolean accepts(SourceFile file) {
        return file.isYaml();
    }

    @Override
    public FileAst parseFile(SourceFile file) {
        final YamlStream stream = reader.read(file.content());
        final List<SourceBlock> blocks = new ArrayList<>();
        final List<ParseError> errors = new ArrayList<>();
        for (YamlStream.YamlError e : stream.errors()) {
            errors.add(new ParseError(file.path(), e.line(), null, e.message()));
        }
        movedHeader(file, blocks);
        for (YamlDocument doc : stream.documents()) {
            readDocument(file, doc, blocks, errors);
        }
        return new FileAst(file.path(), blocks, errors);
    }

    /**
     * Reads the rename records from the comment lines that open the file.
     */
    static void movedHeader(SourceFile file, List<SourceBlock> blocks) {
        final String[] rows = file.content().split("\n", -1);
        for (int r = 0; r < rows.length; r++) {
            final String row = rows[r].strip();
            if (row.isEmpty()) {
                continue;
            }
            if (!row.startsWith("#")) {
                return;
            }
            final Matcher m = MOVED.matcher(row);
            if (m.matches()) {
                final Map<String, Object> body = new LinkedHashMap<>();
                body.put("from", m.group(1));
                body.put("to", m.group(2));
                blocks.add(new SourceBlock(BlockKind.MOVED, "moved", "", body, new SourceLocation(file.path(), r + 1)));
            }
        }
    }

    abstract void readDocument(SourceFile file, YamlDocument doc, List<SourceBlock> blocks, List<ParseError> errors);

    static SourceLocation at(SourceFile file, YamlDocument doc, Object node) {
        return new SourceLocation(file.path(), doc.lineOf(node, doc.line()));
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object o) {
        return o instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
    }

    static String text(Object o) {
        return o == null ? null : String.valueOf(o);
    }
}

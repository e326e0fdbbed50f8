package ai.iacgraph.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.RawExpression;
import ai.iacgraph.model.SourceLocation;
import ai.iacgraph.parse.hcl.HclBlock;
import ai.iacgraph.parse.hcl.HclDocument;
import ai.iacgraph.parse.hcl.HclParser;
import ai.iacgraph.parse.hcl.HclStrings;
import ai.iacgraph.parse.hcl.HclSyntaxError;
import ai.iacgraph.scan.SourceFile;

/**
 * Reads {@code *.tf} files.
 */
public final class TerraformParser implements DialectParser {

    private static final Logger log = LoggerFactory.getLogger(TerraformParser.class);

    @Override
    public Dialect dialect() {
        return Dialect.TERRAFORM;
    }

    @Override
    public boolean accepts(SourceFile file) {
        return file.extension().equals("tf");
    }

    @Override
    public FileAst parseFile(SourceFile file) {
        final HclDocument doc = new HclParser().parse(file.content());
        final List<SourceBlock> blocks = new ArrayList<>();
        final List<ParseError> errors = new ArrayList<>();
        for (HclSyntaxError e : doc.errors()) {
            errors.add(new ParseError(file.path(), e.line(), null, e.message()));
        }
        for (HclBlock b : doc.blocks()) {
            final SourceLocation at = new SourceLocation(file.path(), b.line());
            switch (b.type()) {
                case "resource", "data" -> {
                    if (b.labels().size() != 2) {
                        errors.add(new ParseError(file.path(), b.line(), b.type(),
                                b.type() + " block needs a type and a name label"));
                        continue;
                    }
                    blocks.add(new SourceBlock(b.type().equals("data") ? BlockKind.DATA : BlockKind.RESOURCE,
                            b.label(0), b.label(1), b.body(), b.nestedBlocks(), null, at));
                }
                case "variable", "output", "module" -> {
                    if (b.labels().size() != 1) {
                        errors.add(new ParseError(file.path(), b.line(), b.type(),
                                b.type() + " block needs exactly one name label"));
                        continue;
                    }
                    final BlockKind kind = switch (b.type()) {
                        case "variable" -> BlockKind.VARIABLE;
                        case "output" -> BlockKind.OUTPUT;
                        default -> BlockKind.MODULE;
                    };
                    blocks.add(new SourceBlock(kind, b.type(), b.label(0), b.body(), b.nestedBlocks(), null, at));
                }
                case "locals" -> {
                    for (var e : b.body().entrySet()) {
                        final Map<String, Object> body = new LinkedHashMap<>();
                        body.put("value", e.getValue());
                        blocks.add(new SourceBlock(BlockKind.LOCAL, "local", e.getKey(), body, at));
                    }
                }
                case "moved" -> blocks.add(new SourceBlock(BlockKind.MOVED, "moved", "", b.body(), at));
                default -> blocks.add(new SourceBlock(BlockKind.EXTENSION, b.type(), extensionKey(b),
                        b.body(), b.nestedBlocks(), null, at));
            }
        }
        log.debug("{}: {} blocks, {} errors", file.path(), blocks.size(), errors.size());
        return new FileAst(file.path(), blocks, errors);
    }

    /**
     * Key of a graph-level block: its labels quoted and space separated, plus the provider alias,
     * the import target, or the line of an unlabeled block. The labels can be read back with
     * {@link #extensionLabels}.
     */
    static String extensionKey(HclBlock b) {
        final StringBuilder sb = new StringBuilder();
        for (String label : b.labels()) {
            sb.append(sb.length() > 0 ? " " : "").append(HclStrings.quote(label));
        }
        if (b.body().get("alias") instanceof String alias) {
            sb.append(sb.length() > 0 ? " " : "").append("alias=").append(alias);
        }
        if (sb.length() == 0) {
            if (b.body().get("to") instanceof RawExpression to) {
                sb.append("to=").append(to.text());
            } else if (!b.type().equals("terraform")) {
                sb.append("line=").append(b.line());
            }
        }
        return sb.toString();
    }

    /**
     * Block labels encoded in an extension key.
     */
    public static List<String> extensionLabels(String key) {
        final List<String> labels = new ArrayList<>();
        int i = 0;
        while (i < key.length() && key.charAt(i) == '"') {
            final StringBuilder label = new StringBuilder();
            i++;
            while (i < key.length() && key.charAt(i) != '"') {
                if (key.charAt(i) == '\\' && i + 1 < key.length()) {
                    i++;
                }
                label.append(key.charAt(i));
                i++;
            }
            labels.add(label.toString());
            i += 2;
        }
        return labels;
    }
}

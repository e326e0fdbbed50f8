package ai.iacgraph.parse.yaml;

import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;

/**
 * Streaming YAML (and JSON) reader built on the Jackson YAML parser.
 * <p>
 * The text is split on document markers first and every document is parsed on its own, so a
 * syntax error drops one document rather than the rest of the file. With intrinsic tags enabled,
 * CloudFormation short forms are rewritten to their long form: {@code !Ref X} becomes
 * {@code {Ref: X}}, {@code !GetAtt A.B} becomes {@code {Fn::GetAtt: [A, B]}} and any other
 * {@code !Tag v} becomes {@code {Fn::Tag: v}}. Without them, tags are ignored.
 */
public final class YamlReader {

    private final YAMLFactory factory = new YAMLFactory();
    private final boolean intrinsicTags;

    public YamlReader(boolean intrinsicTags) {
        this.intrinsicTags = intrinsicTags;
    }

    public YamlStream read(String text) {
        final List<YamlDocument> docs = new ArrayList<>();
        final List<YamlStream.YamlError> errors = new ArrayList<>();
        for (Chunk chunk : split(text == null ? "" : text)) {
            readChunk(chunk, docs, errors);
        }
        return new YamlStream(docs, errors);
    }

    private void readChunk(Chunk chunk, List<YamlDocument> docs, List<YamlStream.YamlError> errors) {
        final IdentityHashMap<Object, Integer> lines = new IdentityHashMap<>();
        try (YAMLParser p = factory.createParser(chunk.text())) {
            JsonToken t = p.nextToken();
            while (t != null) {
                final int line = chunk.lineOffset() + lineNr(p.currentTokenLocation());
                final Object root = read(p, t, lines, chunk.lineOffset());
                if (root != null) {
                    docs.add(new YamlDocument(docs.size(), line, root, lines));
                }
                t = p.nextToken();
            }
        } catch (JsonProcessingException ex) {
            final JsonLocation loc = ex.getLocation();
            final int line = loc != null ? chunk.lineOffset() + lineNr(loc) : chunk.lineOffset() + 1;
            errors.add(new YamlStream.YamlError(line, ex.getOriginalMessage()));
        } catch (IOException | RuntimeException ex) {
            errors.add(new YamlStream.YamlError(chunk.lineOffset() + 1, String.valueOf(ex.getMessage())));
        }
    }

    private Object read(JsonParser p, JsonToken t, IdentityHashMap<Object, Integer> lines, int offset)
            throws IOException {
        final String tag = intrinsicTags ? tagOf(p) : null;
        final int line = offset + lineNr(p.currentTokenLocation());
        final Object value = switch (t) {
            case START_OBJECT -> {
                final Map<String, Object> map = new LinkedHashMap<>();
                lines.put(map, line);
                JsonToken n;
                while ((n = p.nextToken()) != JsonToken.END_OBJECT && n != null) {
                    final String key = p.currentName();
                    map.put(key, read(p, p.nextToken(), lines, offset));
                }
                yield map;
            }
            case START_ARRAY -> {
                final List<Object> list = new ArrayList<>();
                lines.put(list, line);
                JsonToken n;
                while ((n = p.nextToken()) != JsonToken.END_ARRAY && n != null) {
                    list.add(read(p, n, lines, offset));
                }
                yield list;
            }
            case VALUE_STRING -> p.getText();
            case VALUE_NUMBER_INT -> p.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                    ? (Object) p.getBigIntegerValue()
                    : (Object) p.getLongValue();
            case VALUE_NUMBER_FLOAT -> p.getDecimalValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_EMBEDDED_OBJECT -> String.valueOf(p.getEmbeddedObject());
            default -> null;
        };
        if (tag == null) {
            return value;
        }
        final Object wrapped = intrinsic(tag, value);
        lines.put(wrapped, line);
        return wrapped;
    }

    private static String tagOf(JsonParser p) throws IOException {
        final Object typeId = p.getTypeId();
        final String tag = typeId == null ? null : typeId.toString();
        if (tag == null || tag.isBlank() || tag.startsWith("tag:yaml.org")) {
            return null;
        }
        return tag;
    }

    static Map<String, Object> intrinsic(String tag, Object value) {
        final Map<String, Object> out = new LinkedHashMap<>();
        switch (tag) {
            case "Ref", "Condition" -> out.put(tag, value == null ? "" : value);
            case "GetAtt" -> {
                if (value instanceof String s && s.indexOf('.') > 0) {
                    final int dot = s.indexOf('.');
                    out.put("Fn::GetAtt", new ArrayList<>(List.of(s.substring(0, dot), s.substring(dot + 1))));
                } else {
                    out.put("Fn::GetAtt", value);
                }
            }
            default -> out.put("Fn::" + tag, value);
        }
        return out;
    }

    private static int lineNr(JsonLocation loc) {
        return loc == null ? 1 : Math.max(1, loc.getLineNr());
    }

    /**
     * Cuts the text at column-one {@code ---} markers; each chunk keeps its marker line.
     */
    static List<Chunk> split(String text) {
        final List<Chunk> out = new ArrayList<>();
        final String[] rows = text.split("\n", -1);
        StringBuilder current = new StringBuilder();
        int start = 0;
        for (int r = 0; r < rows.length; r++) {
            final String row = rows[r];
            if (r > 0 && isDocumentStart(row)) {
                out.add(new Chunk(current.toString(), start));
                current = new StringBuilder();
                start = r;
            }
            current.append(row);
            if (r < rows.length - 1) {
                current.append('\n');
            }
        }
        out.add(new Chunk(current.toString(), start));
        out.removeIf(c -> c.text().isBlank());
        return out;
    }

    private static boolean isDocumentStart(String row) {
        final String r = row.stripTrailing();
        return r.equals("---") || r.startsWith("--- ") || r.startsWith("---\t");
    }

    record Chunk(String text, int lineOffset) {
    }
}

package ai.iacgraph.emit.hcl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.RawExpression;
import ai.iacgraph.parse.hcl.HclStrings;

/**
 * Indenting HCL text builder. Consecutive single-line attributes of a block have their {@code =}
 * aligned as {@code terraform fmt} does.
 */
public final class HclWriter {

    public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");
    private static final Pattern LABELED_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*( \"[^\"]*\")+");

    private static final String INDENT = "  ";

    private final List<Line> lines = new ArrayList<>();
    private int depth;

    public HclWriter comment(String text) {
        line(text.isEmpty() ? "#" : "# " + text);
        return this;
    }

    public HclWriter blank() {
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isBlank()) {
            lines.add(new Line(0, null, "", true));
        }
        return this;
    }

    /**
     * Opens {@code type "label" ... {}}.
     */
    public HclWriter block(String type, List<String> labels) {
        final StringBuilder head = new StringBuilder(type);
        for (String l : labels) {
            head.append(' ').append(HclStrings.quote(l));
        }
        return open(head.toString());
    }

    public HclWriter open(String header) {
        line(header + " {");
        depth++;
        return this;
    }

    public HclWriter close() {
        if (depth == 0) {
            throw new IllegalStateException("no open block");
        }
        depth--;
        line("}");
        return this;
    }

    /**
     * {@code name = expression}; a multi-line expression continues at the current indentation.
     */
    public HclWriter attribute(String name, String expression) {
        final String key = IDENTIFIER.matcher(name).matches() ? name : HclStrings.quote(name);
        final String[] parts = expression.split("\n", -1);
        lines.add(new Line(depth, key, parts[0], parts.length > 1));
        for (int i = 1; i < parts.length; i++) {
            line(parts[i]);
        }
        return this;
    }

    public int depth() {
        return depth;
    }

    public String text() {
        final StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < lines.size()) {
            final Line first = lines.get(i);
            if (first.key() == null) {
                out.append(first.render(0)).append('\n');
                i++;
                continue;
            }
            int end = i + 1;
            while (!lines.get(end - 1).endsRun() && end < lines.size()
                    && lines.get(end).key() != null && lines.get(end).depth() == first.depth()) {
                end++;
            }
            int width = 0;
            for (int j = i; j < end; j++) {
                width = Math.max(width, lines.get(j).key().length());
            }
            for (int j = i; j < end; j++) {
                out.append(lines.get(j).render(width)).append('\n');
            }
            i = end;
        }
        return out.toString();
    }

    /**
     * Writes a raw dialect body. A list of maps under a block-like key becomes repeated nested
     * blocks; everything else is an attribute.
     */
    public HclWriter body(Map<String, Object> body) {
        for (var e : body.entrySet()) {
            rawEntry(e.getKey(), e.getValue());
        }
        return this;
    }

    public HclWriter rawEntry(String key, Object value) {
        if (isBlockList(key, value)) {
            for (Object item : (List<?>) value) {
                open(key);
                body(asBody(item));
                close();
            }
        } else {
            attribute(key, raw(value, 0));
        }
        return this;
    }

    public static boolean isBlockList(String key, Object value) {
        if (!(IDENTIFIER.matcher(key).matches() || LABELED_KEY.matcher(key).matches())) {
            return false;
        }
        if (!(value instanceof List<?> l) || l.isEmpty()) {
            return false;
        }
        return l.stream().allMatch(i -> i instanceof Map<?, ?>);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asBody(Object item) {
        return (Map<String, Object>) item;
    }

    /**
     * HCL text of a raw dialect value. Strings are written with their template sequences intact.
     */
    public static String raw(Object value, int depth) {
        if (value == null) {
            return "null";
        }
        if (value instanceof RawExpression r) {
            return r.text();
        }
        if (value instanceof String s) {
            return HclStrings.quote(s);
        }
        if (value instanceof Number n) {
            return PropertyValue.Scalar.numberText(n);
        }
        if (value instanceof Boolean) {
            return String.valueOf(value);
        }
        if (value instanceof List<?> l) {
            final StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < l.size(); i++) {
                sb.append(i > 0 ? ", " : "").append(raw(l.get(i), depth));
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?> m) {
            if (m.isEmpty()) {
                return "{}";
            }
            final String pad = INDENT.repeat(depth + 1);
            final List<String> keys = new ArrayList<>();
            final List<String> values = new ArrayList<>();
            for (var e : m.entrySet()) {
                keys.add(key(String.valueOf(e.getKey())));
                values.add(raw(e.getValue(), depth + 1));
            }
            final StringBuilder sb = new StringBuilder("{\n");
            int start = 0;
            while (start < keys.size()) {
                int end = start + 1;
                while (end < keys.size() && !values.get(end - 1).contains("\n")) {
                    end++;
                }
                int width = 0;
                for (int j = start; j < end; j++) {
                    width = Math.max(width, keys.get(j).length());
                }
                for (int j = start; j < end; j++) {
                    sb.append(pad).append(padRight(keys.get(j), width)).append(" = ").append(values.get(j)).append('\n');
                }
                start = end;
            }
            return sb.append(INDENT.repeat(depth)).append('}').toString();
        }
        return HclStrings.quote(String.valueOf(value));
    }

    static String key(String k) {
        return IDENTIFIER.matcher(k).matches() ? k : HclStrings.quote(k);
    }

    private void line(String text) {
        lines.add(new Line(depth, null, text, true));
    }

    private static String padRight(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }

    /**
     * One output line. Attribute lines carry their key so runs of them can share an {@code =} column.
     *
     * @param endsRun whether the next attribute starts a new alignment run
     */
    private record Line(int depth, String key, String text, boolean endsRun) {

        boolean isBlank() {
            return key == null && text.isEmpty();
        }

        String render(int width) {
            if (isBlank()) {
                return "";
            }
            final String body = key == null ? text : padRight(key, width) + " = " + text;
            return INDENT.repeat(depth) + body;
        }
    }
}

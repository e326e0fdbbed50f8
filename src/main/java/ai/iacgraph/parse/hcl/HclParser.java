package ai.iacgraph.parse.hcl;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import ai.iacgraph.model.RawExpression;

/**
 * Best-effort parser for HCL native syntax.
 * <p>
 * Literals, lists and objects are decoded; anything else (function calls, traversals, operators,
 * {@code for} expressions) is kept as a {@link RawExpression} of its source text. A syntax error
 * abandons the enclosing top-level block only: the error is recorded and parsing resumes at the
 * next line that starts with an identifier in column one.
 */
public final class HclParser {

    private String src;
    private List<HclToken> tokens;
    private List<HclSyntaxError> errors;
    private int i;

    public HclDocument parse(String text) {
        this.src = text == null ? "" : text;
        this.errors = new ArrayList<>();
        this.tokens = new HclLexer(src, errors).tokenize();
        this.i = 0;

        final List<HclBlock> blocks = new ArrayList<>();
        while (true) {
            skipNewlines();
            if (peek().is(HclTokenType.EOF)) {
                break;
            }
            final int startLine = peek().line();
            try {
                blocks.add(topLevelBlock());
            } catch (HclSyntaxException ex) {
                errors.add(new HclSyntaxError(ex.line() > 0 ? ex.line() : startLine, ex.getMessage()));
                recover();
            }
        }
        errors.sort((a, b) -> Integer.compare(a.line(), b.line()));
        return new HclDocument(blocks, errors);
    }

    private HclBlock topLevelBlock() {
        final HclToken head = next();
        if (!head.is(HclTokenType.IDENT)) {
            throw new HclSyntaxException("expected block type but found '" + head.text() + "'", head.line());
        }
        final List<String> labels = new ArrayList<>();
        while (peek().is(HclTokenType.STRING) || peek().is(HclTokenType.IDENT)) {
            final HclToken t = next();
            labels.add(t.is(HclTokenType.STRING) ? (String) t.value() : t.text());
        }
        if (peek().is(HclTokenType.EQUALS)) {
            throw new HclSyntaxException("unexpected attribute '" + head.text() + "' outside of a block", head.line());
        }
        expect(HclTokenType.LBRACE, describe(head.text(), labels));
        final Map<String, Object> body = new LinkedHashMap<>();
        final Set<String> nested = new LinkedHashSet<>();
        try {
            blockBody(body, nested);
        } catch (HclSyntaxException ex) {
            throw new HclSyntaxException(describe(head.text(), labels) + ": " + ex.getMessage(), ex.line());
        }
        return new HclBlock(head.text(), labels, body, nested, head.line());
    }

    /**
     * Reads attributes and nested blocks up to and including the closing brace.
     */
    private void blockBody(Map<String, Object> body, Set<String> nested) {
        while (true) {
            skipNewlines();
            final HclToken t = peek();
            if (t.is(HclTokenType.RBRACE)) {
                i++;
                return;
            }
            if (t.is(HclTokenType.EOF)) {
                throw new HclSyntaxException("unclosed block", t.line());
            }
            if (!t.is(HclTokenType.IDENT)) {
                throw new HclSyntaxException("expected attribute or block name but found '" + t.text() + "'", t.line());
            }
            i++;
            if (peek().is(HclTokenType.EQUALS) || peek().is(HclTokenType.COLON)) {
                i++;
                final int end = scanSpan(i, tokens.size() - 1);
                body.put(t.text(), value(i, end));
                i = end;
                if (peek().is(HclTokenType.COMMA)) {
                    i++;
                }
                continue;
            }
            final StringBuilder key = new StringBuilder(t.text());
            while (peek().is(HclTokenType.STRING) || peek().is(HclTokenType.IDENT)) {
                final HclToken label = next();
                key.append(" \"").append(label.is(HclTokenType.STRING) ? label.value() : label.text()).append('"');
            }
            expect(HclTokenType.LBRACE, t.text());
            final Map<String, Object> inner = new LinkedHashMap<>();
            blockBody(inner, new LinkedHashSet<>());
            appendBlock(body, key.toString(), inner);
            nested.add(key.toString());
        }
    }

    @SuppressWarnings("unchecked")
    private static void appendBlock(Map<String, Object> body, String key, Map<String, Object> inner) {
        final Object existing = body.get(key);
        final List<Object> list = new ArrayList<>();
        if (existing instanceof List<?> l) {
            list.addAll((List<Object>) l);
        } else if (existing != null) {
            list.add(existing);
        }
        list.add(inner);
        body.put(key, list);
    }

    /**
     * End (exclusive) of the expression starting at {@code from}: the first newline, comma or
     * unmatched closing bracket at nesting depth zero.
     */
    private int scanSpan(int from, int limit) {
        int depth = 0;
        for (int k = from; k < limit; k++) {
            final HclToken t = tokens.get(k);
            switch (t.type()) {
                case LBRACE, LBRACKET, LPAREN -> depth++;
                case RBRACE, RBRACKET, RPAREN -> {
                    if (depth == 0) {
                        return k;
                    }
                    depth--;
                }
                case NEWLINE, COMMA -> {
                    if (depth == 0) {
                        return k;
                    }
                }
                case EOF -> {
                    return k;
                }
                default -> {
                }
            }
        }
        return limit;
    }

    private Object value(int from, int to) {
        int a = from;
        int b = to;
        while (a < b && tokens.get(a).is(HclTokenType.NEWLINE)) {
            a++;
        }
        while (b > a && tokens.get(b - 1).is(HclTokenType.NEWLINE)) {
            b--;
        }
        if (a >= b) {
            throw new HclSyntaxException("expected value", tokens.get(Math.min(from, tokens.size() - 1)).line());
        }
        final HclToken first = tokens.get(a);
        if (b - a == 1) {
            return literal(first);
        }
        if (b - a == 2 && first.text().equals("-") && tokens.get(a + 1).is(HclTokenType.NUMBER)) {
            final Object n = tokens.get(a + 1).value();
            return n instanceof Long l && l != Long.MIN_VALUE ? (Object) (-l) : (Object) negate((Number) n);
        }
        final HclToken last = tokens.get(b - 1);
        if (first.is(HclTokenType.LBRACKET) && last.is(HclTokenType.RBRACKET) && closes(a, b - 1)) {
            if (!tokens.get(skipNl(a + 1, b)).isIdent("for")) {
                try {
                    return list(a + 1, b - 1);
                } catch (HclSyntaxException ex) {
                    return raw(a, b);
                }
            }
        }
        if (first.is(HclTokenType.LBRACE) && last.is(HclTokenType.RBRACE) && closes(a, b - 1)) {
            if (!tokens.get(skipNl(a + 1, b)).isIdent("for")) {
                try {
                    return object(a + 1, b - 1);
                } catch (HclSyntaxException ex) {
                    return raw(a, b);
                }
            }
        }
        return raw(a, b);
    }

    private static BigDecimal negate(Number n) {
        return (n instanceof BigDecimal bd ? bd : BigDecimal.valueOf(n.longValue())).negate();
    }

    private Object literal(HclToken t) {
        return switch (t.type()) {
            case STRING, NUMBER -> t.value();
            case IDENT -> switch (t.text()) {
                case "true" -> Boolean.TRUE;
                case "false" -> Boolean.FALSE;
                case "null" -> null;
                default -> new RawExpression(t.text());
            };
            default -> throw new HclSyntaxException("unexpected '" + t.text() + "'", t.line());
        };
    }

    private List<Object> list(int from, int to) {
        final List<Object> out = new ArrayList<>();
        int k = from;
        while (true) {
            k = skipSeparators(k, to);
            if (k >= to) {
                return out;
            }
            final int end = Math.min(scanSpan(k, to), to);
            if (end == k) {
                throw new HclSyntaxException("unexpected '" + tokens.get(k).text() + "'", tokens.get(k).line());
            }
            out.add(value(k, end));
            k = end;
        }
    }

    private Map<String, Object> object(int from, int to) {
        final Map<String, Object> out = new LinkedHashMap<>();
        int k = from;
        while (true) {
            k = skipSeparators(k, to);
            if (k >= to) {
                return out;
            }
            final HclToken key = tokens.get(k);
            final String name = switch (key.type()) {
                case IDENT -> key.text();
                case STRING -> (String) key.value();
                default -> throw new HclSyntaxException("unsupported object key '" + key.text() + "'", key.line());
            };
            k++;
            if (k >= to || !(tokens.get(k).is(HclTokenType.EQUALS) || tokens.get(k).is(HclTokenType.COLON))) {
                throw new HclSyntaxException("expected '=' after '" + name + "'", key.line());
            }
            k++;
            final int end = Math.min(scanSpan(k, to), to);
            out.put(name, value(k, end));
            k = end;
        }
    }

    private int skipSeparators(int k, int to) {
        while (k < to && (tokens.get(k).is(HclTokenType.NEWLINE) || tokens.get(k).is(HclTokenType.COMMA))) {
            k++;
        }
        return k;
    }

    private int skipNl(int k, int to) {
        while (k < to - 1 && tokens.get(k).is(HclTokenType.NEWLINE)) {
            k++;
        }
        return k;
    }

    /**
     * Whether the bracket at {@code open} is matched exactly by the one at {@code close}.
     */
    private boolean closes(int open, int close) {
        int depth = 0;
        for (int k = open; k <= close; k++) {
            switch (tokens.get(k).type()) {
                case LBRACE, LBRACKET, LPAREN -> depth++;
                case RBRACE, RBRACKET, RPAREN -> {
                    depth--;
                    if (depth == 0 && k < close) {
                        return false;
                    }
                }
                default -> {
                }
            }
        }
        return depth == 0;
    }

    private RawExpression raw(int from, int to) {
        return new RawExpression(src.substring(tokens.get(from).start(), tokens.get(to - 1).end()).strip());
    }

    private void recover() {
        if (i > 0 && tokens.get(i - 1).is(HclTokenType.NEWLINE) && peek().is(HclTokenType.IDENT) && atLineStart(peek())) {
            return;
        }
        while (!peek().is(HclTokenType.EOF)) {
            final HclToken t = next();
            if (t.is(HclTokenType.NEWLINE) && peek().is(HclTokenType.IDENT) && atLineStart(peek())) {
                return;
            }
        }
    }

    private boolean atLineStart(HclToken t) {
        return t.start() == 0 || src.charAt(t.start() - 1) == '\n';
    }

    private void skipNewlines() {
        while (peek().is(HclTokenType.NEWLINE)) {
            i++;
        }
    }

    private HclToken expect(HclTokenType type, String context) {
        final HclToken t = next();
        if (!t.is(type)) {
            throw new HclSyntaxException(context + ": expected " + type.name().toLowerCase(Locale.ROOT) + " but found '"
                    + (t.is(HclTokenType.NEWLINE) ? "\\n" : t.text()) + "'", t.line());
        }
        return t;
    }

    private HclToken peek() {
        return tokens.get(Math.min(i, tokens.size() - 1));
    }

    private HclToken next() {
        final HclToken t = peek();
        if (i < tokens.size() - 1) {
            i++;
        }
        return t;
    }

    private static String describe(String type, List<String> labels) {
        final StringBuilder sb = new StringBuilder(type);
        for (String l : labels) {
            sb.append(" \"").append(l).append('"');
        }
        return sb.toString();
    }
}

package ai.iacgraph.parse.hcl;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for HCL native syntax. Comments are dropped; newlines are significant and kept.
 * <p>
 * String tokens carry their decoded text with template sequences ({@code ${...}}, {@code %{...}})
 * copied through verbatim, including the {@code $${} escape.
 */
final class HclLexer {

    private final String src;
    private final List<HclSyntaxError> errors;
    private final List<HclToken> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;

    HclLexer(String src, List<HclSyntaxError> errors) {
        this.src = src;
        this.errors = errors;
    }

    List<HclToken> tokenize() {
        while (pos < src.length()) {
            final char c = src.charAt(pos);
            if (c == '\n') {
                add(HclTokenType.NEWLINE, pos, pos + 1, null);
                line++;
                pos++;
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\r' || c == '﻿') {
                pos++;
                continue;
            }
            if (c == '#' || (c == '/' && peek(1) == '/')) {
                while (pos < src.length() && src.charAt(pos) != '\n') {
                    pos++;
                }
                continue;
            }
            if (c == '/' && peek(1) == '*') {
                skipBlockComment();
                continue;
            }
            if (c == '"') {
                readString();
                continue;
            }
            if (c == '<' && peek(1) == '<' && heredocAhead()) {
                readHeredoc();
                continue;
            }
            if (Character.isDigit(c)) {
                readNumber();
                continue;
            }
            if (isIdentStart(c)) {
                readIdent();
                continue;
            }
            readPunctuation(c);
        }
        add(HclTokenType.EOF, src.length(), src.length(), null);
        return tokens;
    }

    private void readPunctuation(char c) {
        final int start = pos;
        switch (c) {
            case '{' -> single(HclTokenType.LBRACE);
            case '}' -> single(HclTokenType.RBRACE);
            case '[' -> single(HclTokenType.LBRACKET);
            case ']' -> single(HclTokenType.RBRACKET);
            case '(' -> single(HclTokenType.LPAREN);
            case ')' -> single(HclTokenType.RPAREN);
            case ',' -> single(HclTokenType.COMMA);
            case ':' -> single(HclTokenType.COLON);
            case '.' -> {
                if (peek(1) == '.' && peek(2) == '.') {
                    pos += 3;
                    add(HclTokenType.OPERATOR, start, pos, null);
                } else {
                    single(HclTokenType.DOT);
                }
            }
            case '=' -> {
                if (peek(1) == '=' || peek(1) == '>') {
                    pos += 2;
                    add(HclTokenType.OPERATOR, start, pos, null);
                } else {
                    single(HclTokenType.EQUALS);
                }
            }
            default -> {
                final char n = peek(1);
                final boolean twoChar = (c == '!' && n == '=') || (c == '<' && n == '=') || (c == '>' && n == '=')
                        || (c == '&' && n == '&') || (c == '|' && n == '|');
                pos += twoChar ? 2 : 1;
                add(HclTokenType.OPERATOR, start, pos, null);
            }
        }
    }

    private void single(HclTokenType type) {
        add(type, pos, pos + 1, null);
        pos++;
    }

    private void readIdent() {
        final int start = pos;
        while (pos < src.length()) {
            final char c = src.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
                pos++;
            } else {
                break;
            }
        }
        add(HclTokenType.IDENT, start, pos, null);
    }

    private void readNumber() {
        final int start = pos;
        while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
            pos++;
        }
        boolean decimal = false;
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            decimal = true;
            pos++;
            while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                pos++;
            }
        }
        if ((peek(0) == 'e' || peek(0) == 'E')
                && (Character.isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
            decimal = true;
            pos += 2;
            while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                pos++;
            }
        }
        final String text = src.substring(start, pos);
        Object value;
        try {
            value = decimal ? (Object) new BigDecimal(text) : (Object) Long.parseLong(text);
        } catch (NumberFormatException ex) {
            value = new BigDecimal(text);
        }
        add(HclTokenType.NUMBER, start, pos, value);
    }

    private void readString() {
        final int start = pos;
        final int startLine = line;
        final StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < src.length()) {
            final char c = src.charAt(pos);
            if (c == '"') {
                pos++;
                add(HclTokenType.STRING, start, pos, sb.toString(), startLine);
                return;
            }
            if (c == '\n') {
                errors.add(new HclSyntaxError(startLine, "unterminated string"));
                add(HclTokenType.STRING, start, pos, sb.toString(), startLine);
                return;
            }
            if (c == '\\') {
                readEscape(sb);
                continue;
            }
            if (c == '$' && peek(1) == '$' && peek(2) == '{') {
                sb.append("$${");
                pos += 3;
                continue;
            }
            if (c == '%' && peek(1) == '%' && peek(2) == '{') {
                sb.append("%%{");
                pos += 3;
                continue;
            }
            if ((c == '$' || c == '%') && peek(1) == '{') {
                copyTemplateSequence(sb);
                continue;
            }
            sb.append(c);
            pos++;
        }
        errors.add(new HclSyntaxError(startLine, "unterminated string"));
        add(HclTokenType.STRING, start, pos, sb.toString(), startLine);
    }

    private void readEscape(StringBuilder sb) {
        final char n = peek(1);
        switch (n) {
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            case '"' -> sb.append('"');
            case '\\' -> sb.append('\\');
            case 'u' -> {
                if (pos + 6 <= src.length()) {
                    try {
                        sb.append((char) Integer.parseInt(src.substring(pos + 2, pos + 6), 16));
                        pos += 6;
                        return;
                    } catch (NumberFormatException ex) {
                        errors.add(new HclSyntaxError(line, "invalid unicode escape"));
                    }
                }
                sb.append('\\').append(n);
            }
            default -> sb.append('\\').append(n);
        }
        pos += 2;
    }

    /**
     * Copies {@code ${ ... }} or {@code %{ ... }} verbatim, honoring nested braces and quoted strings.
     */
    private void copyTemplateSequence(StringBuilder sb) {
        sb.append(src, pos, pos + 2);
        pos += 2;
        int depth = 1;
        while (pos < src.length() && depth > 0) {
            final char c = src.charAt(pos);
            if (c == '"') {
                final int end = skipQuoted(pos);
                sb.append(src, pos, end);
                pos = end;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == '\n') {
                line++;
            }
            sb.append(c);
            pos++;
        }
        if (depth > 0) {
            errors.add(new HclSyntaxError(line, "unterminated template sequence"));
        }
    }

    private int skipQuoted(int from) {
        int i = from + 1;
        while (i < src.length()) {
            final char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"' || c == '\n') {
                return c == '"' ? i + 1 : i;
            }
            i++;
        }
        return i;
    }

    private boolean heredocAhead() {
        int i = pos + 2;
        if (i < src.length() && src.charAt(i) == '-') {
            i++;
        }
        return i < src.length() && isIdentStart(src.charAt(i));
    }

    private void readHeredoc() {
        final int start = pos;
        final int startLine = line;
        pos += 2;
        boolean indented = false;
        if (peek(0) == '-') {
            indented = true;
            pos++;
        }
        final int markerStart = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        final String marker = src.substring(markerStart, pos);
        while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
        }
        if (pos >= src.length()) {
            errors.add(new HclSyntaxError(startLine, "unterminated heredoc " + marker));
            add(HclTokenType.STRING, start, pos, "", startLine);
            return;
        }
        pos++;
        line++;
        final List<String> lines = new ArrayList<>();
        boolean closed = false;
        while (pos < src.length()) {
            int eol = src.indexOf('\n', pos);
            if (eol < 0) {
                eol = src.length();
            }
            final String l = src.substring(pos, eol).replace("\r", "");
            pos = Math.min(eol, src.length());
            if (l.trim().equals(marker)) {
                closed = true;
                break;
            }
            lines.add(l);
            if (pos < src.length()) {
                pos++;
                line++;
            }
        }
        if (!closed) {
            errors.add(new HclSyntaxError(startLine, "unterminated heredoc " + marker));
        }
        final List<String> body = indented ? stripIndent(lines) : lines;
        final StringBuilder sb = new StringBuilder();
        for (String l : body) {
            sb.append(l).append('\n');
        }
        add(HclTokenType.STRING, start, pos, sb.toString(), startLine);
    }

    private static List<String> stripIndent(List<String> lines) {
        int min = Integer.MAX_VALUE;
        for (String l : lines) {
            if (l.isBlank()) {
                continue;
            }
            int i = 0;
            while (i < l.length() && (l.charAt(i) == ' ' || l.charAt(i) == '\t')) {
                i++;
            }
            min = Math.min(min, i);
        }
        if (min == Integer.MAX_VALUE || min == 0) {
            return lines;
        }
        final List<String> out = new ArrayList<>(lines.size());
        for (String l : lines) {
            out.add(l.length() >= min ? l.substring(min) : l.strip());
        }
        return out;
    }

    private void skipBlockComment() {
        final int startLine = line;
        pos += 2;
        while (pos < src.length()) {
            if (src.charAt(pos) == '*' && peek(1) == '/') {
                pos += 2;
                return;
            }
            if (src.charAt(pos) == '\n') {
                line++;
            }
            pos++;
        }
        errors.add(new HclSyntaxError(startLine, "unterminated comment"));
    }

    private char peek(int offset) {
        final int i = pos + offset;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private void add(HclTokenType type, int start, int end, Object value) {
        add(type, start, end, value, line);
    }

    private void add(HclTokenType type, int start, int end, Object value, int tokenLine) {
        tokens.add(new HclToken(type, src.substring(start, end), value, start, end, tokenLine));
    }
}

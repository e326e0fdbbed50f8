package ai.iacgraph.parse.hcl;

/**
 * HCL string literal helpers.
 */
public final class HclStrings {

    private HclStrings() {
    }

    /**
     * Quoted literal with backslash escapes applied to the literal text only. Template sequences
     * such as {@code ${upper("x")}} are copied through unchanged; escaped ones such as {@code $${x}}
     * stay escaped.
     */
    public static String quote(String s) {
        final StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        int i = 0;
        while (i < s.length()) {
            if (s.startsWith("$${", i) || s.startsWith("%%{", i)) {
                sb.append(s, i, i + 3);
                i += 3;
                continue;
            }
            if (s.startsWith("${", i) || s.startsWith("%{", i)) {
                final int end = closingBrace(s, i + 2);
                if (end >= 0) {
                    sb.append(s, i, end + 1);
                    i = end + 1;
                    continue;
                }
            }
            escape(s.charAt(i), sb);
            i++;
        }
        return sb.append('"').toString();
    }

    private static void escape(char c, StringBuilder sb) {
        switch (c) {
            case '"' -> sb.append("\\\"");
            case '\\' -> sb.append("\\\\");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            default -> sb.append(c);
        }
    }

    /**
     * Escapes literal text so no part of it is read as a template sequence.
     */
    public static String escapeTemplates(String literal) {
        return literal.replace("${", "$${").replace("%{", "%%{");
    }

    /**
     * Index of the brace closing the sequence opened just before {@code from}, or -1. Quoted
     * strings inside the sequence are skipped.
     */
    public static int closingBrace(String s, int from) {
        int depth = 1;
        for (int i = from; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c == '"') {
                i++;
                while (i < s.length() && s.charAt(i) != '"') {
                    if (s.charAt(i) == '\\') {
                        i++;
                    }
                    i++;
                }
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }
}

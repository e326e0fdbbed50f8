package ai.iacgraph.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Node id conventions and name sanitizing shared by normalizers and emitters.
 */
public final class Ids {

    private Ids() {
    }

    public static String resourceId(String nativeType, String name) {
        Objects.requireNonNull(nativeType, "nativeType");
        Objects.requireNonNull(name, "name");
        return nativeType + "." + name;
    }

    public static String dataId(String nativeType, String name) {
        return "data." + resourceId(nativeType, name);
    }

    public static String variableId(String name) {
        Objects.requireNonNull(name, "name");
        return "var." + name;
    }

    public static String localId(String name) {
        Objects.requireNonNull(name, "name");
        return "local." + name;
    }

    public static String outputId(String name) {
        Objects.requireNonNull(name, "name");
        return "output." + name;
    }

    public static String moduleId(String name) {
        Objects.requireNonNull(name, "name");
        return "module." + name;
    }

    public static String manifestId(String kind, String namespace, String name) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        final String k = kind.toLowerCase(Locale.ROOT);
        if (namespace == null || namespace.isBlank()) {
            return k + "/" + name;
        }
        return namespace + "/" + k + "/" + name;
    }

    public static String taskId(String slug) {
        return "task." + slug;
    }

    public static String handlerId(String slug) {
        return "handler." + slug;
    }

    /**
     * Last segment of an id: {@code web} for {@code aws_instance.web}, {@code api} for
     * {@code prod/deployment/api}.
     */
    public static String localName(String id) {
        if (id == null || id.isEmpty()) {
            return "";
        }
        final int slash = id.lastIndexOf('/');
        final String tail = slash >= 0 ? id.substring(slash + 1) : id;
        if (slash >= 0) {
            return tail;
        }
        final int dot = tail.lastIndexOf('.');
        return dot >= 0 && dot < tail.length() - 1 ? tail.substring(dot + 1) : tail;
    }

    /**
     * Lowercase words joined by underscores: {@code "Install nginx!"} -> {@code install_nginx}.
     */
    public static String slug(String text) {
        if (text == null) {
            return "";
        }
        final StringBuilder sb = new StringBuilder(text.length());
        boolean pendingSep = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (Character.isLetterOrDigit(c) && c < 128) {
                if (pendingSep && sb.length() > 0) {
                    sb.append('_');
                }
                pendingSep = false;
                sb.append(Character.toLowerCase(c));
            } else {
                pendingSep = true;
            }
        }
        return sb.toString();
    }

    /**
     * Terraform identifier: letters, digits, underscore and dash, not starting with a digit.
     */
    public static String terraformName(String raw) {
        final String s = slug(camelToWords(raw));
        if (s.isEmpty()) {
            return "resource";
        }
        return Character.isDigit(s.charAt(0)) ? "r_" + s : s;
    }

    /**
     * CloudFormation logical id: alphanumeric PascalCase.
     */
    public static String logicalId(String raw) {
        final StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (Character.isLetterOrDigit(c) && c < 128) {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            } else {
                upper = true;
            }
        }
        if (sb.length() == 0) {
            return "Resource";
        }
        return Character.isDigit(sb.charAt(0)) ? "R" + sb : sb.toString();
    }

    /**
     * Kubernetes object name (RFC 1123 label).
     */
    public static String dnsLabel(String raw) {
        final String s = slug(camelToWords(raw)).replace('_', '-');
        if (s.isEmpty()) {
            return "resource";
        }
        final String trimmed = s.length() > 63 ? s.substring(0, 63) : s;
        return trimmed.replaceAll("^-+|-+$", "");
    }

    /**
     * Appends {@code _2}, {@code _3} ... until the candidate is not in {@code taken}.
     */
    public static String unique(String candidate, Set<String> taken, String separator) {
        if (!taken.contains(candidate)) {
            return candidate;
        }
        int i = 2;
        while (taken.contains(candidate + separator + i)) {
            i++;
        }
        return candidate + separator + i;
    }

    private static String camelToWords(String raw) {
        if (raw == null) {
            return "";
        }
        final StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (i > 0 && Character.isUpperCase(c) && Character.isLowerCase(raw.charAt(i - 1))) {
                sb.append(' ');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}

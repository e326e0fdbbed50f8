package ai.iacgraph.normalize.schema;

import java.util.Locale;

import ai.iacgraph.model.Dialect;

/**
 * Property name conventions: snake_case for Terraform and Ansible, PascalCase for CloudFormation,
 * camelCase (canonical already) for Kubernetes.
 */
public final class PropertyNaming {

    private PropertyNaming() {
    }

    public static String toCanonical(Dialect dialect, String nativeName) {
        return switch (dialect) {
            case TERRAFORM, ANSIBLE -> snakeToCamel(nativeName);
            case CLOUDFORMATION -> pascalToCamel(nativeName);
            case KUBERNETES -> nativeName;
        };
    }

    public static String toNative(Dialect dialect, String canonicalName) {
        return switch (dialect) {
            case TERRAFORM, ANSIBLE -> camelToSnake(canonicalName);
            case CLOUDFORMATION -> camelToPascal(canonicalName);
            case KUBERNETES -> canonicalName;
        };
    }

    /**
     * Whether {@code nativeName} comes back unchanged through the canonical name.
     */
    public static boolean roundTrips(Dialect dialect, String nativeName) {
        return toNative(dialect, toCanonical(dialect, nativeName)).equals(nativeName);
    }

    static String snakeToCamel(String s) {
        final StringBuilder sb = new StringBuilder(s.length());
        boolean upper = false;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c == '_' && sb.length() > 0) {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }

    static String camelToSnake(String s) {
        final StringBuilder sb = new StringBuilder(s.length() + 4);
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * {@code CidrBlock} -> {@code cidrBlock}, {@code VPCId} -> {@code vpcId}, {@code ACL} -> {@code acl}.
     */
    static String pascalToCamel(String s) {
        int run = 0;
        while (run < s.length() && Character.isUpperCase(s.charAt(run))) {
            run++;
        }
        if (run == 0) {
            return s;
        }
        if (run == s.length()) {
            return s.toLowerCase(Locale.ROOT);
        }
        final int lower = run == 1 ? 1 : run - 1;
        return s.substring(0, lower).toLowerCase(Locale.ROOT) + s.substring(lower);
    }

    static String camelToPascal(String s) {
        if (s.isEmpty()) {
            return s;
        }
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}

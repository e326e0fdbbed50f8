package ai.iacgraph.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.RawExpression;
import ai.iacgraph.parse.hcl.HclStrings;

/**
 * Terraform values: {@code ${...}} interpolation in strings, traversals such as
 * {@code aws_vpc.main.id}, {@code var.x}, {@code data.aws_ami.ubuntu.id} and
 * {@code module.net.vpc_id} inside expressions.
 */
final class TerraformValues extends ValueConverter {

    static final Pattern TRAVERSAL = Pattern.compile(
            "[A-Za-z_][\\w-]*(?:\\.[A-Za-z_*][\\w-]*|\\.\\d+|\\[[^\\]\\[]*\\])*");
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_][\\w-]*");
    private static final Pattern RESOURCE_TYPE = Pattern.compile("[a-z][a-z0-9]*_[a-z0-9_]+");
    private static final Set<String> NOT_A_RESOURCE = Set.of(
            "count", "each", "self", "path", "terraform", "true", "false", "null");

    private final SymbolTable symbols;

    TerraformValues(SymbolTable symbols) {
        this.symbols = symbols;
    }

    /**
     * Reference named by a traversal, empty when the traversal does not name a declaration kind
     * (a function name, {@code each.value}, a {@code for} variable).
     */
    Optional<PropertyValue.Reference> reference(String traversal) {
        final Matcher root = IDENT.matcher(traversal);
        if (!root.lookingAt() || root.end() >= traversal.length() || traversal.charAt(root.end()) != '.') {
            return Optional.empty();
        }
        final String first = root.group();
        final Matcher second = IDENT.matcher(traversal).region(root.end() + 1, traversal.length());
        if (!second.lookingAt()) {
            return Optional.empty();
        }
        final String name = second.group();
        final String rest = traversal.substring(second.end());
        switch (first) {
            case "var", "local", "module" -> {
                return Optional.of(new PropertyValue.Reference(first + "." + name, attribute(rest)));
            }
            case "data" -> {
                if (!rest.startsWith(".")) {
                    return Optional.empty();
                }
                final Matcher third = IDENT.matcher(rest).region(1, rest.length());
                if (!third.lookingAt()) {
                    return Optional.empty();
                }
                return Optional.of(new PropertyValue.Reference("data." + name + "." + third.group(),
                        attribute(rest.substring(third.end()))));
            }
            default -> {
                if (NOT_A_RESOURCE.contains(first)) {
                    return Optional.empty();
                }
                final String id = first + "." + name;
                if (RESOURCE_TYPE.matcher(first).matches() || symbols.isDeclared(id)) {
                    return Optional.of(new PropertyValue.Reference(id, attribute(rest)));
                }
                return Optional.empty();
            }
        }
    }

    private static String attribute(String rest) {
        if (rest.isEmpty()) {
            return null;
        }
        return rest.startsWith(".") ? rest.substring(1) : rest;
    }

    @Override
    protected PropertyValue expression(RawExpression e) {
        return expressionText(e.text());
    }

    private PropertyValue expressionText(String t) {
        if (TRAVERSAL.matcher(t).matches()) {
            final Optional<PropertyValue.Reference> ref = reference(t);
            if (ref.isPresent()) {
                return ref.get();
            }
            return new PropertyValue.Expression(List.of(PropertyValue.Scalar.of(t)));
        }
        final List<PropertyValue> parts = new ArrayList<>();
        final StringBuilder lit = new StringBuilder();
        boolean anyRef = false;
        int i = 0;
        while (i < t.length()) {
            final char c = t.charAt(i);
            if (c == '"') {
                final int end = skipString(t, i);
                lit.append(t, i, end);
                i = end;
                continue;
            }
            final char prev = i > 0 ? t.charAt(i - 1) : ' ';
            if ((Character.isLetter(c) || c == '_') && !(Character.isLetterOrDigit(prev) || prev == '_'
                    || prev == '.' || prev == '-')) {
                final Matcher m = TRAVERSAL.matcher(t).region(i, t.length());
                if (m.lookingAt()) {
                    final Optional<PropertyValue.Reference> ref = reference(m.group());
                    if (ref.isPresent()) {
                        if (lit.length() > 0) {
                            parts.add(PropertyValue.Scalar.of(lit.toString()));
                            lit.setLength(0);
                        }
                        parts.add(ref.get());
                        anyRef = true;
                    } else {
                        lit.append(m.group());
                    }
                    i = m.end();
                    continue;
                }
            }
            lit.append(c);
            i++;
        }
        if (!anyRef) {
            return new PropertyValue.Expression(List.of(PropertyValue.Scalar.of(t)));
        }
        if (lit.length() > 0) {
            parts.add(PropertyValue.Scalar.of(lit.toString()));
        }
        return new PropertyValue.Expression(parts);
    }

    private static int skipString(String t, int open) {
        int i = open + 1;
        while (i < t.length() && t.charAt(i) != '"') {
            if (t.charAt(i) == '\\') {
                i++;
            }
            i++;
        }
        return Math.min(i + 1, t.length());
    }

    @Override
    protected PropertyValue string(String s) {
        if (!s.contains("{")) {
            return PropertyValue.Scalar.of(s);
        }
        final List<PropertyValue> parts = new ArrayList<>();
        final StringBuilder lit = new StringBuilder();
        int i = 0;
        while (i < s.length()) {
            if (s.startsWith("$${", i) || s.startsWith("%%{", i)) {
                lit.append(s.charAt(i)).append('{');
                i += 3;
                continue;
            }
            if (s.startsWith("%{", i)) {
                // template directives are kept as the raw quoted string
                return new PropertyValue.Expression(List.of(PropertyValue.Scalar.of(HclStrings.quote(s))));
            }
            if (s.startsWith("${", i)) {
                final int end = HclStrings.closingBrace(s, i + 2);
                if (end < 0) {
                    lit.append(s.substring(i));
                    break;
                }
                String inner = s.substring(i + 2, end).strip();
                if (inner.startsWith("~")) {
                    inner = inner.substring(1).strip();
                }
                if (inner.endsWith("~")) {
                    inner = inner.substring(0, inner.length() - 1).strip();
                }
                if (lit.length() > 0) {
                    parts.add(PropertyValue.Scalar.of(lit.toString()));
                    lit.setLength(0);
                }
                parts.add(expressionText(inner));
                i = end + 1;
                continue;
            }
            lit.append(s.charAt(i));
            i++;
        }
        if (lit.length() > 0) {
            parts.add(PropertyValue.Scalar.of(lit.toString()));
        }
        if (parts.size() == 1 && !(parts.get(0) instanceof PropertyValue.Scalar)) {
            return parts.get(0);
        }
        return template(parts);
    }
}

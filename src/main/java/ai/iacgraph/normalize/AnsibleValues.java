package ai.iacgraph.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.iacgraph.model.PropertyValue;

/**
 * Jinja expressions in task arguments. {@code {{ name }}} and {@code {{ name.path }}} resolve when
 * {@code name} is a play variable or a registered task result; everything else (filters, loop
 * variables, facts) stays literal text.
 */
final class AnsibleValues extends ValueConverter {

    static final Pattern PATH = Pattern.compile("([A-Za-z_]\\w*)((?:\\.[A-Za-z_]\\w*|\\[[^\\]]*\\])*)");

    private final SymbolTable symbols;
    private final String play;

    AnsibleValues(SymbolTable symbols, String play) {
        this.symbols = symbols;
        this.play = play;
    }

    @Override
    protected PropertyValue string(String s) {
        if (!s.contains("{{")) {
            return PropertyValue.Scalar.of(s);
        }
        final List<PropertyValue> parts = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            final int open = s.indexOf("{{", i);
            final int close = open < 0 ? -1 : s.indexOf("}}", open + 2);
            if (open < 0 || close < 0) {
                parts.add(PropertyValue.Scalar.of(s.substring(i)));
                break;
            }
            if (open > i) {
                parts.add(PropertyValue.Scalar.of(s.substring(i, open)));
            }
            final PropertyValue.Reference ref = resolve(s.substring(open + 2, close).strip());
            parts.add(ref != null ? ref : PropertyValue.Scalar.of(s.substring(open, close + 2)));
            i = close + 2;
        }
        if (parts.size() == 1 && parts.get(0) instanceof PropertyValue.Reference r) {
            return r;
        }
        return template(parts);
    }

    private PropertyValue.Reference resolve(String expression) {
        final Matcher m = PATH.matcher(expression);
        if (!m.matches()) {
            return null;
        }
        final String name = m.group(1);
        String target = symbols.lookup(AnsibleMapper.VARS, play + ":" + name);
        if (target == null) {
            target = symbols.lookup(AnsibleMapper.VARS, name);
        }
        if (target == null) {
            target = symbols.lookup(AnsibleMapper.REGISTERED, name);
        }
        if (target == null) {
            return null;
        }
        final String rest = m.group(2);
        return new PropertyValue.Reference(target, rest.startsWith(".") ? rest.substring(1) : rest);
    }
}

package ai.iacgraph.parse;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import ai.iacgraph.model.Dialect;

/**
 * Parser per dialect.
 */
public final class ParserRegistry {

    private final Map<Dialect, DialectParser> parsers = new EnumMap<>(Dialect.class);

    public ParserRegistry(List<DialectParser> parsers) {
        parsers.forEach(p -> this.parsers.put(p.dialect(), p));
    }

    public static ParserRegistry defaults() {
        return new ParserRegistry(List.of(
                new TerraformParser(),
                new CloudFormationParser(),
                new KubernetesParser(),
                new AnsibleParser()));
    }

    public Optional<DialectParser> forDialect(Dialect dialect) {
        return Optional.ofNullable(parsers.get(dialect));
    }
}

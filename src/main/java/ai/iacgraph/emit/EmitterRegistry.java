package ai.iacgraph.emit;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import ai.iacgraph.model.Dialect;

/**
 * Emitter per dialect.
 */
public final class EmitterRegistry {

    private final Map<Dialect, DialectEmitter> emitters = new EnumMap<>(Dialect.class);

    public EmitterRegistry(List<DialectEmitter> emitters) {
        emitters.forEach(e -> this.emitters.put(e.dialect(), e));
    }

    public static EmitterRegistry defaults() {
        return new EmitterRegistry(List.of(
                new TerraformEmitter(),
                new CloudFormationEmitter(),
                new KubernetesEmitter(),
                new AnsibleEmitter()));
    }

    public Optional<DialectEmitter> forDialect(Dialect dialect) {
        return Optional.ofNullable(emitters.get(dialect));
    }
}

package ai.iacgraph.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.model.ResourceGraph;

/**
 * Runs every registered rule over a graph. Rules run concurrently; findings are collected in one
 * place and sorted, so the result does not depend on scheduling.
 */
public final class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    public static final String RULE_FAILED = "engine.rule-failed";

    private final RuleRegistry registry;
    private final ExecutorService executor;

    public GraphValidator(RuleRegistry registry, ExecutorService executor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public List<ValidationFinding> validate(ResourceGraph graph) {
        Objects.requireNonNull(graph, "graph");
        final List<CompletableFuture<List<ValidationFinding>>> futures = new ArrayList<>();
        for (ValidationRule rule : registry.rules()) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(rule, graph), executor));
        }
        final List<ValidationFinding> findings = new ArrayList<>();
        futures.forEach(f -> findings.addAll(f.join()));
        findings.sort(ValidationFinding.ORDER);
        log.info("Validated {} nodes with {} rules: {} findings", graph.nodeCount(), futures.size(), findings.size());
        return findings;
    }

    /**
     * A rule that throws yields a single rule-failed finding instead of its results.
     */
    private static List<ValidationFinding> evaluate(ValidationRule rule, ResourceGraph graph) {
        try {
            final List<ValidationFinding> out = rule.evaluate(graph);
            return out == null ? List.of() : out;
        } catch (RuntimeException ex) {
            log.warn("Rule {} failed: {}", rule.id(), ex.toString());
            log.debug("Rule failure", ex);
            return List.of(ValidationFinding.warning(RULE_FAILED, rule.id(),
                    "rule " + rule.id() + " failed: " + ex.getClass().getSimpleName()
                            + (ex.getMessage() == null ? "" : ": " + ex.getMessage())));
        }
    }
}

package ai.iacgraph.validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.validate.rules.ContainmentCycleRule;
import ai.iacgraph.validate.rules.DanglingReferenceRule;
import ai.iacgraph.validate.rules.DependencyCycleRule;
import ai.iacgraph.validate.rules.HardcodedSecretRule;
import ai.iacgraph.validate.rules.MissingDescriptionRule;
import ai.iacgraph.validate.rules.MissingHealthProbesRule;
import ai.iacgraph.validate.rules.MissingRequiredPropertyRule;
import ai.iacgraph.validate.rules.MissingResourceLimitsRule;
import ai.iacgraph.validate.rules.MissingTagsRule;
import ai.iacgraph.validate.rules.MultipleParentsRule;
import ai.iacgraph.validate.rules.NonIdempotentCommandRule;
import ai.iacgraph.validate.rules.OpaquePropertyRule;
import ai.iacgraph.validate.rules.OpenIngressRule;
import ai.iacgraph.validate.rules.PrivilegedContainerRule;
import ai.iacgraph.validate.rules.PublicAccessRule;
import ai.iacgraph.validate.rules.ServiceWithoutSelectorRule;
import ai.iacgraph.validate.rules.UnencryptedStorageRule;
import ai.iacgraph.validate.rules.UnknownTypeRule;
import ai.iacgraph.validate.rules.UnnamedTaskRule;
import ai.iacgraph.validate.rules.UnpinnedImageRule;
import ai.iacgraph.validate.rules.WildcardPolicyRule;

/**
 * Rules by id. New rules are added by registering them; the validator does not know any rule.
 */
public final class RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<String, ValidationRule> rules = new TreeMap<>();

    public static RuleRegistry defaults() {
        final RuleRegistry r = new RuleRegistry();
        // structural
        r.register(new DanglingReferenceRule());
        r.register(new DependencyCycleRule());
        r.register(new ContainmentCycleRule());
        r.register(new MultipleParentsRule());
        r.register(new MissingRequiredPropertyRule());
        r.register(new OpaquePropertyRule());
        r.register(new UnknownTypeRule());
        // security
        r.register(new OpenIngressRule());
        r.register(new UnencryptedStorageRule());
        r.register(new PublicAccessRule());
        r.register(new WildcardPolicyRule());
        r.register(new PrivilegedContainerRule());
        // best practice
        r.register(new MissingTagsRule());
        r.register(new HardcodedSecretRule());
        r.register(new UnpinnedImageRule());
        r.register(new MissingResourceLimitsRule());
        r.register(new MissingHealthProbesRule());
        r.register(new MissingDescriptionRule());
        r.register(new UnnamedTaskRule());
        r.register(new NonIdempotentCommandRule());
        r.register(new ServiceWithoutSelectorRule());
        return r;
    }

    public RuleRegistry register(ValidationRule rule) {
        final ValidationRule previous = rules.put(rule.id(), rule);
        if (previous != null) {
            log.debug("Rule {} replaced by {}", rule.id(), rule.getClass().getSimpleName());
        }
        return this;
    }

    /**
     * Copy without the given rule ids. Unknown ids are ignored with a warning.
     */
    public RuleRegistry without(Collection<String> disabled) {
        final RuleRegistry copy = new RuleRegistry();
        copy.rules.putAll(rules);
        for (String id : disabled) {
            if (copy.rules.remove(id) == null) {
                log.warn("Cannot disable unknown rule '{}'", id);
            }
        }
        return copy;
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public List<ValidationRule> rules() {
        return new ArrayList<>(rules.values());
    }
}

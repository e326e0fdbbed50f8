package ai.iacgraph.validate.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.validate.Severity;
import ai.iacgraph.validate.ValidationFinding;
import ai.iacgraph.validate.ValidationRule;

/**
 * Security group ingress open to the whole internet. Error when SSH, RDP or every port is
 * exposed, warning otherwise.
 */
public final class OpenIngressRule implements ValidationRule {

    public static final String ID = "security.open-ingress";

    private static final Set<String> ANYWHERE = Set.of("0.0.0.0/0", "::/0");
    private static final int[] SENSITIVE_PORTS = {22, 3389};

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceGraph graph) {
        final List<ValidationFinding> out = new ArrayList<>();
        for (ResourceNode n : graph.nodes()) {
            if (!n.type().equals("network.securitygroup")) {
                continue;
            }
            final List<PropertyValue> rules = RuleSupport.items(n.properties().get("ingress"));
            for (int i = 0; i < rules.size(); i++) {
                final PropertyValue rule = rules.get(i);
                if (!openToWorld(rule)) {
                    continue;
                }
                final List<int[]> ranges = ranges(rule);
                final boolean all = ranges.isEmpty();
                boolean sensitive = all;
                for (int[] r : ranges) {
                    for (int p : SENSITIVE_PORTS) {
                        sensitive |= r[0] <= p && p <= r[1];
                    }
                }
                final String ports = all ? "all ports" : describe(ranges);
                out.add(new ValidationFinding(sensitive ? Severity.ERROR : Severity.WARNING, ID, n.id(),
                        "ingress rule " + (i + 1) + " allows " + ports + " from anywhere"));
            }
        }
        return out;
    }

    private static boolean openToWorld(PropertyValue rule) {
        for (String key : List.of("cidr_blocks", "ipv6_cidr_blocks", "CidrIp", "CidrIpv6", "cidr_ip", "cidr_ipv6")) {
            for (PropertyValue v : RuleSupport.items(RuleSupport.field(rule, key).orElse(null))) {
                if (ANYWHERE.contains(RuleSupport.text(v))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Port ranges of the rule; empty means every port.
     */
    static List<int[]> ranges(PropertyValue rule) {
        final String protocol = RuleSupport.text(RuleSupport.field(rule, "protocol", "IpProtocol", "proto"));
        if ("-1".equals(protocol) || "all".equalsIgnoreCase(protocol)) {
            return List.of();
        }
        final List<int[]> out = new ArrayList<>();
        final Integer from = port(RuleSupport.text(RuleSupport.field(rule, "from_port", "FromPort")));
        final Integer to = port(RuleSupport.text(RuleSupport.field(rule, "to_port", "ToPort")));
        if (from != null || to != null) {
            final int a = from == null ? to : from;
            final int b = to == null ? a : to;
            if (a <= 0 && (b <= 0 || b >= 65535)) {
                return List.of();
            }
            out.add(new int[]{Math.max(a, 0), b});
        }
        for (PropertyValue p : RuleSupport.items(RuleSupport.field(rule, "ports").orElse(null))) {
            final String t = RuleSupport.text(p);
            if (t == null) {
                continue;
            }
            final int dash = t.indexOf('-');
            final Integer a = port(dash > 0 ? t.substring(0, dash) : t);
            final Integer b = port(dash > 0 ? t.substring(dash + 1) : t);
            if (a != null && b != null) {
                out.add(new int[]{a, b});
            }
        }
        return out;
    }

    private static Integer port(String s) {
        if (s == null) {
            return null;
        }
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String describe(List<int[]> ranges) {
        final List<String> parts = new ArrayList<>();
        for (int[] r : ranges) {
            parts.add(r[0] == r[1] ? "port " + r[0] : "ports " + r[0] + "-" + r[1]);
        }
        return String.join(", ", parts);
    }
}

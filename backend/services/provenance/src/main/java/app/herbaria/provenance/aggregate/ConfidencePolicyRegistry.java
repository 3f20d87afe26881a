package app.herbaria.provenance.aggregate;

import app.herbaria.provenance.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Confidence policies keyed by {@link ConfidencePolicy#id()}. The aggregator resolves
 * {@code app.provenance.aggregation.confidence-policy} here once at startup, so an unknown or
 * ambiguous id fails the context instead of the first recompute.
 */
@Component
public class ConfidencePolicyRegistry {

    private final Map<String, ConfidencePolicy> policiesById;

    public ConfidencePolicyRegistry(List<ConfidencePolicy> policies) {
        Map<String, ConfidencePolicy> byId = new TreeMap<>();
        for (ConfidencePolicy policy : policies) {
            ConfidencePolicy clash = byId.putIfAbsent(key(policy.id()), policy);
            if (clash != null) {
                throw new ConfigurationException("Confidence policy id '" + policy.id() + "' is claimed by both "
                        + clash.getClass().getSimpleName() + " and " + policy.getClass().getSimpleName());
            }
        }
        this.policiesById = byId;
    }

    public ConfidencePolicy require(String id) {
        ConfidencePolicy policy = id == null ? null : policiesById.get(key(id));
        if (policy == null) {
            throw new ConfigurationException("Unsupported confidence policy: " + id
                    + " (known: " + String.join(", ", policiesById.keySet()) + ")");
        }
        return policy;
    }

    private static String key(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}

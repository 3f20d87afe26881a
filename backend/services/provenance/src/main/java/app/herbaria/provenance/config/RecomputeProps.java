package app.herbaria.provenance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.provenance.recompute")
public record RecomputeProps(
        boolean enabled,
        Integer batchSize,
        Long pollIntervalMs
) {
    public RecomputeProps {
        batchSize = (batchSize == null || batchSize < 1) ? 100 : batchSize;
        pollIntervalMs = (pollIntervalMs == null || pollIntervalMs < 1) ? 30_000L : pollIntervalMs;
    }
}

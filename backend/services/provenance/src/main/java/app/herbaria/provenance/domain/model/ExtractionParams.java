package app.herbaria.provenance.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything that decides what an extraction produces. Bumping any of it yields a new
 * dedup key, so an upgraded prompt or model is re-extracted without invalidating old attempts.
 */
public record ExtractionParams(
        String provider,
        String model,
        String promptVersion,
        Map<String, Object> settings
) {
    public ExtractionParams {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider is required");
        }
        settings = settings == null ? Map.of() : new LinkedHashMap<>(settings);
    }

    public static ExtractionParams of(String provider, String model, String promptVersion) {
        return new ExtractionParams(provider, model, promptVersion, Map.of());
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("provider", provider);
        map.put("model", model);
        map.put("promptVersion", promptVersion);
        map.put("settings", settings);
        return map;
    }
}

package app.herbaria.provenance.dedup;

import app.herbaria.provenance.domain.model.ExtractionParams;

/**
 * A text/field extraction provider. Implementations live outside this service.
 *
 * <p>Transport failures, timeouts and rate limits are reported as
 * {@link app.herbaria.provenance.exception.TransientEngineException}; missing credentials as
 * {@link app.herbaria.provenance.exception.ConfigurationException}. The engine never retries on
 * the caller's behalf.
 */
public interface ExtractionEngine {
    String provider();

    EngineResponse extract(ImageRef image, ExtractionParams params);
}

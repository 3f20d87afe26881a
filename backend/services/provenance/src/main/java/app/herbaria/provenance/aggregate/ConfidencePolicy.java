package app.herbaria.provenance.aggregate;

import java.util.List;

/**
 * How agreeing, independent attempts combine into one field confidence.
 */
public interface ConfidencePolicy {

    String id();

    /**
     * @param confidences per-attempt confidences of candidates that agree on one value, never empty
     * @return combined confidence within [0,1]
     */
    double combine(List<Double> confidences);
}

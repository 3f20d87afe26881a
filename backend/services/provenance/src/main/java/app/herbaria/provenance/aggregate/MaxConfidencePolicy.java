package app.herbaria.provenance.aggregate;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Agreement adds no boost; the strongest single attempt wins.
 */
@Component
public class MaxConfidencePolicy implements ConfidencePolicy {

    public static final String ID = "max";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public double combine(List<Double> confidences) {
        double max = 0.0;
        for (double c : confidences) {
            max = Math.max(max, c);
        }
        return Math.min(1.0, max);
    }
}

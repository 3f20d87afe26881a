package app.herbaria.provenance.aggregate;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@code 1 - prod(1 - c)}: each agreeing attempt counts as independent evidence.
 */
@Component
public class NoisyOrConfidencePolicy implements ConfidencePolicy {

    public static final String ID = "noisy-or";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public double combine(List<Double> confidences) {
        double miss = 1.0;
        for (double c : confidences) {
            miss *= 1.0 - clamp(c);
        }
        return Math.min(1.0, 1.0 - miss);
    }

    private static double clamp(double c) {
        if (c < 0.0) return 0.0;
        if (c > 1.0) return 1.0;
        return c;
    }
}

package app.herbaria.provenance.service;

import app.herbaria.provenance.config.RecomputeProps;
import app.herbaria.provenance.index.SpecimenIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks up specimens whose stored snapshot lags behind their attempts (a recompute that was
 * lost or failed) and recomputes them.
 */
@Service
@ConditionalOnProperty(prefix = "app.provenance.recompute", name = "enabled", havingValue = "true")
public class RecomputeWorker {

    private static final Logger log = LoggerFactory.getLogger(RecomputeWorker.class);

    private final SpecimenIndex index;
    private final SpecimenRecordService recordService;
    private final int batchSize;

    public RecomputeWorker(SpecimenIndex index, SpecimenRecordService recordService, RecomputeProps props) {
        this.index = index;
        this.recordService = recordService;
        this.batchSize = props.batchSize();
    }

    @Scheduled(fixedDelayString = "${app.provenance.recompute.poll-interval-ms:30000}")
    public void poll() {
        int done = runOnce();
        if (done > 0) {
            log.info("Recompute sweep finished recomputed={}", done);
        }
    }

    public int runOnce() {
        List<String> stale = index.findStaleSpecimens(batchSize);
        int done = 0;
        for (String identity : stale) {
            try {
                recordService.recompute(identity);
                done++;
            } catch (RuntimeException ex) {
                log.warn("Recompute failed specimen={} errorType={} message={}",
                        identity, ex.getClass().getSimpleName(), safeMessage(ex));
            }
        }
        return done;
    }

    private static String safeMessage(Exception ex) {
        String message = ex.getMessage();
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }
}

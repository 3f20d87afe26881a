package app.herbaria.provenance.lineage;

import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.model.ReviewDecisionRef;
import app.herbaria.provenance.domain.model.SourceFile;
import app.herbaria.provenance.domain.model.Specimen;
import app.herbaria.provenance.domain.model.Transformation;

import java.util.List;

/**
 * Full chain for one specimen: source files, derived images, every attempt (failed ones included),
 * the record computed from them and the latest review decision, if any.
 */
public record LineageView(
        Specimen specimen,
        List<SourceFile> sources,
        List<Transformation> transformations,
        List<ExtractionAttempt> attempts,
        AggregatedRecord record,
        List<QualityFlag> flags,
        ReviewDecisionRef review
) {
    public LineageView {
        sources = sources == null ? List.of() : List.copyOf(sources);
        transformations = transformations == null ? List.of() : List.copyOf(transformations);
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    /**
     * Attempts that ran against the given image, original or derived.
     */
    public List<ExtractionAttempt> attemptsOn(String imageHash) {
        return attempts.stream()
                .filter(a -> imageHash.equals(a.imageHash() == null ? specimen.identity() : a.imageHash()))
                .toList();
    }
}

package app.herbaria.provenance.lineage;

import app.herbaria.provenance.aggregate.CandidateAggregator;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.model.Specimen;
import app.herbaria.provenance.index.SpecimenIndex;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lineage queries. The aggregated record in a view is recomputed from the attempts it lists,
 * never read from the stored snapshot.
 */
@Component
public class ProvenanceTracker {

    private final SpecimenIndex index;
    private final CandidateAggregator aggregator;

    public ProvenanceTracker(SpecimenIndex index, CandidateAggregator aggregator) {
        this.index = index;
        this.aggregator = aggregator;
    }

    public Optional<LineageView> lineage(String identity) {
        return index.findSpecimen(identity).map(this::build);
    }

    public List<LineageView> lineageByCatalogNumber(String catalogNumber) {
        List<LineageView> views = new ArrayList<>();
        for (String identity : index.queryByCatalogNumber(catalogNumber)) {
            lineage(identity).ifPresent(views::add);
        }
        return views;
    }

    private LineageView build(Specimen specimen) {
        String identity = specimen.identity();
        List<ExtractionAttempt> attempts = index.findAttempts(identity);
        return new LineageView(
                specimen,
                index.findSourceFiles(identity),
                index.findTransformations(identity),
                attempts,
                aggregator.aggregate(identity, attempts),
                index.findFlags(identity),
                index.findLatestReviewDecision(identity).orElse(null)
        );
    }
}

package app.herbaria.provenance.service;

import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.lineage.LineageView;

/**
 * One exported specimen. {@code cursor} resumes the sequence right after this item.
 */
public record ExportItem(
        String cursor,
        AggregatedRecord record,
        LineageView provenance
) {
}

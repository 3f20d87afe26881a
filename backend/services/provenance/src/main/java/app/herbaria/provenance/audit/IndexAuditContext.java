package app.herbaria.provenance.audit;

import app.herbaria.provenance.domain.model.SourceFile;
import app.herbaria.provenance.index.SpecimenIndex;

import java.util.List;

public class IndexAuditContext implements AuditContext {

    private final SpecimenIndex index;

    public IndexAuditContext(SpecimenIndex index) {
        this.index = index;
    }

    @Override
    public List<String> specimensWithCatalogNumber(String catalogNumber) {
        return index.queryByCatalogNumber(catalogNumber);
    }

    @Override
    public List<SourceFile> sourceFiles(String specimenIdentity) {
        return index.findSourceFiles(specimenIdentity);
    }
}

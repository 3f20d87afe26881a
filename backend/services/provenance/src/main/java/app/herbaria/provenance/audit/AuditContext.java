package app.herbaria.provenance.audit;

import app.herbaria.provenance.domain.model.SourceFile;

import java.util.List;

/**
 * Cross-specimen facts a rule may need beyond the record itself.
 */
public interface AuditContext {

    /**
     * Identities whose stored snapshot carries the same catalog number after normalization.
     */
    List<String> specimensWithCatalogNumber(String catalogNumber);

    List<SourceFile> sourceFiles(String specimenIdentity);
}

package app.herbaria.provenance.controller;

import app.herbaria.provenance.controller.dto.SpecimenRecordResponse;
import app.herbaria.provenance.domain.model.DuplicateGroup;
import app.herbaria.provenance.domain.model.SpecimenFilter;
import app.herbaria.provenance.domain.model.SpecimenSummary;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.lineage.LineageView;
import app.herbaria.provenance.lineage.ProvenanceTracker;
import app.herbaria.provenance.service.SpecimenRecordService;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/specimens")
public class SpecimenController {

    private final SpecimenRecordService recordService;
    private final ProvenanceTracker tracker;

    public SpecimenController(SpecimenRecordService recordService, ProvenanceTracker tracker) {
        this.recordService = recordService;
        this.tracker = tracker;
    }

    // GET /specimens?flagKind=duplicate_catalog_number&reviewStatus=&catalogNumber=&page=1&limit=50
    @GetMapping
    public Page<SpecimenSummary> listSpecimens(
            @RequestParam(required = false) FlagKind flagKind,
            @RequestParam(required = false) String reviewStatus,
            @RequestParam(required = false) String catalogNumber,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit
    ) {
        return recordService.listSpecimens(new SpecimenFilter(flagKind, reviewStatus, catalogNumber), page, limit);
    }

    // GET /specimens/duplicates
    @GetMapping("/duplicates")
    public List<DuplicateGroup> listDuplicates() {
        return recordService.listDuplicates();
    }

    // GET /specimens/{identity}
    @GetMapping("/{identity}")
    public SpecimenRecordResponse getSpecimen(@PathVariable String identity) {
        return SpecimenRecordResponse.from(recordService.getAggregatedRecord(identity));
    }

    // GET /specimens/{identity}/lineage
    @GetMapping("/{identity}/lineage")
    public LineageView getLineage(@PathVariable String identity) {
        return tracker.lineage(identity)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Specimen not found: " + identity));
    }
}

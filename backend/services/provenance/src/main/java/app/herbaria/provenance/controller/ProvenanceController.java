package app.herbaria.provenance.controller;

import app.herbaria.provenance.domain.model.IndexStats;
import app.herbaria.provenance.domain.model.SpecimenFilter;
import app.herbaria.provenance.index.SpecimenIndex;
import app.herbaria.provenance.lineage.LineageView;
import app.herbaria.provenance.lineage.ProvenanceTracker;
import app.herbaria.provenance.service.ExportPage;
import app.herbaria.provenance.service.SpecimenExportService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
public class ProvenanceController {

    private final ProvenanceTracker tracker;
    private final SpecimenExportService exportService;
    private final SpecimenIndex index;

    public ProvenanceController(ProvenanceTracker tracker,
                                SpecimenExportService exportService,
                                SpecimenIndex index) {
        this.tracker = tracker;
        this.exportService = exportService;
        this.index = index;
    }

    // GET /lineage?catalogNumber=1073
    @GetMapping("/lineage")
    public List<LineageView> lineageByCatalogNumber(@RequestParam String catalogNumber) {
        if (catalogNumber.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "catalogNumber is required");
        }
        return tracker.lineageByCatalogNumber(catalogNumber);
    }

    // GET /export?reviewStatus=approved&after=<cursor>&limit=100
    @GetMapping("/export")
    public ExportPage export(
            @RequestParam(required = false) String reviewStatus,
            @RequestParam(required = false) String after,
            @RequestParam(defaultValue = "100") int limit
    ) {
        return exportService.slice(SpecimenFilter.reviewStatus(reviewStatus), after, limit);
    }

    // GET /index/stats
    @GetMapping("/index/stats")
    public IndexStats stats() {
        return index.stats();
    }
}

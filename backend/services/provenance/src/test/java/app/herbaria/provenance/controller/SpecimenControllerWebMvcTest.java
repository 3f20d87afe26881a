package app.herbaria.provenance.controller;

import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.DuplicateGroup;
import app.herbaria.provenance.domain.model.FieldValue;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.model.SpecimenFilter;
import app.herbaria.provenance.domain.model.SpecimenSummary;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;
import app.herbaria.provenance.lineage.ProvenanceTracker;
import app.herbaria.provenance.service.SpecimenRecordService;
import app.herbaria.provenance.service.SpecimenRecordView;
import app.herbaria.provenance.support.Fixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SpecimenController.class)
@ActiveProfiles("test")
class SpecimenControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    SpecimenRecordService recordService;

    @MockitoBean
    ProvenanceTracker tracker;

    @Test
    void listSpecimens_passesFilterAndPaging() throws Exception {
        SpecimenSummary summary = new SpecimenSummary("specimen-a", Fixtures.T0, "1073", 2, 1, null);
        SpecimenFilter filter = new SpecimenFilter(FlagKind.duplicate_catalog_number, null, null);
        when(recordService.listSpecimens(eq(filter), eq(2), eq(10)))
                .thenReturn(new PageImpl<>(List.of(summary), PageRequest.of(1, 10), 11));

        mockMvc.perform(get("/specimens")
                        .with(jwt().jwt(j -> j.claim("sub", "curator-1")))
                        .param("flagKind", "duplicate_catalog_number")
                        .param("page", "2")
                        .param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.length()").value(1))
                .andExpect(jsonPath("$.content[0].identity").value("specimen-a"))
                .andExpect(jsonPath("$.content[0].catalogNumber").value("1073"));
    }

    @Test
    void listSpecimens_requiresAuthentication() throws Exception {
        mockMvc.perform(get("/specimens"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void getSpecimen_returnsRecordWithFlags() throws Exception {
        AggregatedRecord record = Fixtures.aggregator().aggregate("specimen-a", List.of(
                Fixtures.completed("specimen-a", "gpt", 0, Map.of(DwcTerm.catalogNumber, new FieldValue("1073", 0.9)))
        ));
        QualityFlag flag = QualityFlag.of("specimen-a", FlagKind.missing_core_field, "scientificName",
                FlagSeverity.high, "Core field scientificName has no candidate value");
        when(recordService.getAggregatedRecord("specimen-a"))
                .thenReturn(new SpecimenRecordView(record, List.of(flag), null));

        mockMvc.perform(get("/specimens/specimen-a")
                        .with(jwt().jwt(j -> j.claim("sub", "curator-1"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.identity").value("specimen-a"))
                .andExpect(jsonPath("$.record.fields.catalogNumber.value").value("1073"))
                .andExpect(jsonPath("$.flags[0].kind").value("missing_core_field"))
                .andExpect(jsonPath("$.flags[0].severity").value("high"));
    }

    @Test
    void getSpecimen_unknownIsNotFound() throws Exception {
        when(recordService.getAggregatedRecord("nope"))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Specimen not found: nope"));

        mockMvc.perform(get("/specimens/nope")
                        .with(jwt().jwt(j -> j.claim("sub", "curator-1"))))
                .andExpect(status().isNotFound());
    }

    @Test
    void getLineage_unknownIsNotFound() throws Exception {
        when(tracker.lineage("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/specimens/nope/lineage")
                        .with(jwt().jwt(j -> j.claim("sub", "curator-1"))))
                .andExpect(status().isNotFound());
    }

    @Test
    void listDuplicates_returnsGroups() throws Exception {
        when(recordService.listDuplicates())
                .thenReturn(List.of(new DuplicateGroup("1073", List.of("specimen-a", "specimen-b"))));

        mockMvc.perform(get("/specimens/duplicates")
                        .with(jwt().jwt(j -> j.claim("sub", "curator-1"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].catalogNumber").value("1073"))
                .andExpect(jsonPath("$[0].specimenIdentities.length()").value(2));
    }
}

package com.treeroll.controller.rest;

import com.treeroll.service.core.catalog.CatalogEntry;
import com.treeroll.service.core.catalog.MetricCatalog;
import com.treeroll.service.core.fact.FactSource;
import com.treeroll.service.core.fact.FactRow;
import com.treeroll.service.core.hierarchy.HierarchySpec;
import com.treeroll.service.core.model.ReportRow;
import com.treeroll.service.core.rollup.RollupService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping(path = "/api/rollup", produces = MediaType.APPLICATION_JSON_VALUE)
public class RollupController {
    private static final String AD_HOC_ID = "adhoc";

    private final RollupService rollupService;
    private final MetricCatalog catalog;
    private final ObjectProvider<FactSource> factSource;

    public RollupController(RollupService rollupService, MetricCatalog catalog, ObjectProvider<FactSource> factSource) {
        this.rollupService = rollupService;
        this.catalog = catalog;
        this.factSource = factSource;
    }

    @GetMapping("/{hierarchyId}")
    public ReportRow configured(@PathVariable("hierarchyId") String hierarchyId) {
        FactSource source = factSource.getIfAvailable();
        if (source == null) {
            throw new IllegalStateException("No fact source configured; set treeroll.facts.location");
        }
        return rollupService.rollup(hierarchyId, source);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ReportRow adHoc(@Valid @RequestBody AdHocRollupRequest request) {
        if (request == null || request.hierarchy() == null) {
            throw new IllegalArgumentException("hierarchy is required");
        }
        HierarchySpec hierarchy = request.hierarchy();
        if (hierarchy.id() == null || hierarchy.id().isBlank()) {
            hierarchy = new HierarchySpec(AD_HOC_ID, hierarchy.label(), hierarchy.levels(), hierarchy.tieBreak());
        }
        List<FactRow> rows = request.factRows();
        log.debug("Ad-hoc rollup {} over {} facts", hierarchy.id(), rows.size());
        return rollupService.rollupRows(hierarchy, rows);
    }

    @GetMapping("/catalog/{id}")
    public CatalogEntry catalogEntry(@PathVariable("id") String id) {
        return catalog.lookup(id).orElseThrow(() -> new IllegalArgumentException("Unknown catalog id: " + id));
    }
}

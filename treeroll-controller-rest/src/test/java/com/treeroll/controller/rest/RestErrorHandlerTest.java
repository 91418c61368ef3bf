package com.treeroll.controller.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.treeroll.service.core.catalog.MetricCatalog;
import com.treeroll.service.core.fact.FactSchemaException;
import com.treeroll.service.core.fact.FactSource;
import com.treeroll.service.core.hierarchy.HierarchyConfigurationException;
import com.treeroll.service.core.rollup.RollupService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class RestErrorHandlerTest {

    private final RollupService rollupService = mock(RollupService.class);
    private final FactSource source = mock(FactSource.class);
    private MockMvc mvc;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ObjectProvider<FactSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(source);
        RollupController controller = new RollupController(rollupService, mock(MetricCatalog.class), provider);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new RestErrorHandler())
                .build();
    }

    @Test
    void configurationErrorListsEveryProblem() throws Exception {
        when(rollupService.rollup(eq("broken"), any(FactSource.class)))
                .thenThrow(new HierarchyConfigurationException(
                        "broken", List.of("level 0 references unknown metric 'x'", "the root level cannot be limited")));

        mvc.perform(get("/api/rollup/broken"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Invalid hierarchy configuration"))
                .andExpect(jsonPath("$.path").value("/api/rollup/broken"))
                .andExpect(jsonPath("$.details.length()").value(2))
                .andExpect(jsonPath("$.details[1]").value("the root level cannot be limited"));
    }

    @Test
    void schemaErrorNamesMissingColumns() throws Exception {
        when(rollupService.rollup(eq("titles"), any(FactSource.class)))
                .thenThrow(new FactSchemaException(List.of("rating"), List.of()));

        mvc.perform(get("/api/rollup/titles"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value("missing dimension column: rating"));
    }

    @Test
    void unknownHierarchyIsABadRequestWithoutDetails() throws Exception {
        when(rollupService.rollup(eq("nope"), any(FactSource.class)))
                .thenThrow(new IllegalArgumentException("Unknown hierarchy: nope"));

        mvc.perform(get("/api/rollup/nope"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message").value("Unknown hierarchy: nope"))
                .andExpect(jsonPath("$.details").doesNotExist());
    }

    @Test
    void missingHierarchyFailsValidation() throws Exception {
        mvc.perform(post("/api/rollup").contentType(MediaType.APPLICATION_JSON).content("{\"facts\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request body"))
                .andExpect(jsonPath("$.details[0]").value("hierarchy: hierarchy is required"));
    }

    @Test
    void malformedBodyIsABadRequest() throws Exception {
        mvc.perform(post("/api/rollup").contentType(MediaType.APPLICATION_JSON).content("{\"hierarchy\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }
}

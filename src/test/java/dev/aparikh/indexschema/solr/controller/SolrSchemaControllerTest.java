package dev.aparikh.indexschema.solr.controller;

import dev.aparikh.indexschema.solr.SolrSchemaService;
import dev.aparikh.indexschema.solr.model.SchemaApplyResponse;
import dev.aparikh.indexschema.solr.model.SolrFieldDefinition;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for SolrSchemaController using @WebMvcTest.
 * Tests the REST API layer in isolation without starting the full application.
 */
@WebMvcTest(SolrSchemaController.class)
class SolrSchemaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SolrSchemaService solrSchemaService;

    @Test
    void shouldPreviewDefinitions() throws Exception {
        // Given
        when(solrSchemaService.previewDefinitions()).thenReturn(List.of(
                new SolrFieldDefinition("title", "text_general", true, true, false, false, false),
                new SolrFieldDefinition("id", "string", true, true, false, false, true)));

        // When/Then
        mockMvc.perform(get("/api/v1/solr/schema/definitions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("title"))
                .andExpect(jsonPath("$[0].type").value("text_general"))
                .andExpect(jsonPath("$[1].required").value(true));
    }

    @Test
    void shouldApplySchemaToCollection() throws Exception {
        // Given
        String collection = "books";
        SchemaApplyResponse mockResponse = new SchemaApplyResponse(
                3,
                1,
                List.of("title", "body", "views", "id"),
                true,
                "Applied 4 fields to collection 'books'"
        );
        when(solrSchemaService.applySchema(collection)).thenReturn(mockResponse);

        // When/Then
        mockMvc.perform(post("/api/v1/solr/schema/{collection}", collection))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.added").value(3))
                .andExpect(jsonPath("$.replaced").value(1))
                .andExpect(jsonPath("$.fieldNames[3]").value("id"))
                .andExpect(jsonPath("$.success").value(true));

        verify(solrSchemaService).applySchema(collection);
    }

    @Test
    void shouldReturnFailureReportedByService() throws Exception {
        // Given
        when(solrSchemaService.applySchema("missing"))
                .thenReturn(SchemaApplyResponse.failed("Failed to apply schema: Collection not found"));

        // When/Then
        mockMvc.perform(post("/api/v1/solr/schema/{collection}", "missing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Failed to apply schema: Collection not found"));
    }
}

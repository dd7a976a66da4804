package dev.aparikh.indexschema.solr.controller;

import dev.aparikh.indexschema.solr.SolrSchemaService;
import dev.aparikh.indexschema.solr.model.SchemaApplyResponse;
import dev.aparikh.indexschema.solr.model.SolrFieldDefinition;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for pushing the index schema into Solr.
 */
@RestController
@RequestMapping("/api/v1/solr/schema")
@Tag(name = "Solr schema", description = "API for applying the index schema to Solr collections")
class SolrSchemaController {

    private final SolrSchemaService solrSchemaService;

    SolrSchemaController(SolrSchemaService solrSchemaService) {
        this.solrSchemaService = solrSchemaService;
    }

    @GetMapping("/definitions")
    @Operation(summary = "Preview Solr field definitions",
            description = "Shows the Solr fields the schema translates to, without contacting Solr.")
    public List<SolrFieldDefinition> definitions() {
        return solrSchemaService.previewDefinitions();
    }

    /**
     * Applies the schema to a collection.
     *
     * @param collection the Solr collection to update
     * @return counts of added and replaced fields
     */
    @PostMapping("/{collection}")
    @Operation(summary = "Apply the schema to a collection",
            description = "Adds missing fields and replaces existing ones in a single Schema API request.")
    public SchemaApplyResponse apply(
            @Parameter(description = "Collection name", required = true, example = "books")
            @PathVariable String collection) {
        return solrSchemaService.applySchema(collection);
    }
}

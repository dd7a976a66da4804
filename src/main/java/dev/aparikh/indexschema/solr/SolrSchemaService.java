package dev.aparikh.indexschema.solr;

import dev.aparikh.indexschema.schema.Schema;
import dev.aparikh.indexschema.solr.model.SchemaApplyResponse;
import dev.aparikh.indexschema.solr.model.SolrFieldDefinition;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.request.schema.SchemaRequest;
import org.apache.solr.client.solrj.response.schema.SchemaResponse;
import org.apache.solr.common.SolrException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service for pushing the index schema into Solr collections.
 *
 * <p>This service handles:
 * <ul>
 *   <li>Deriving Solr field definitions from the application's {@link Schema}</li>
 *   <li>Adding fields the collection does not have yet and replacing the ones it has</li>
 *   <li>Sending all changes as one Schema API request</li>
 *   <li>Reporting failures in the response instead of throwing</li>
 * </ul>
 */
@Service
public class SolrSchemaService {

    private static final Logger log = LoggerFactory.getLogger(SolrSchemaService.class);

    private static final String NAME_ATTRIBUTE = "name";
    private static final String ERRORS_KEY = "errors";

    private final SolrClient solrClient;
    private final SolrFieldDefinitions fieldDefinitions;
    private final Schema schema;

    public SolrSchemaService(SolrClient solrClient, SolrFieldDefinitions fieldDefinitions, Schema schema) {
        this.solrClient = solrClient;
        this.fieldDefinitions = fieldDefinitions;
        this.schema = schema;
    }

    /**
     * Returns the Solr field definitions for the application's schema without touching Solr.
     */
    public List<SolrFieldDefinition> previewDefinitions() {
        return fieldDefinitions.definitionsFor(schema);
    }

    /**
     * Applies the application's schema to a collection.
     *
     * @param collection the Solr collection to update
     * @return counts of added and replaced fields, or a failed response with the reason
     * @throws IllegalArgumentException if collection is null or blank
     */
    public SchemaApplyResponse applySchema(String collection) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Collection name cannot be null or blank");
        }

        List<SolrFieldDefinition> definitions = fieldDefinitions.definitionsFor(schema);
        log.debug("Applying {} field definitions to collection: {}", definitions.size(), collection);

        try {
            Set<String> existing = existingFieldNames(collection);

            List<SchemaRequest.Update> updates = new ArrayList<>();
            List<String> fieldNames = new ArrayList<>();
            int added = 0;
            int replaced = 0;

            for (SolrFieldDefinition definition : definitions) {
                Map<String, Object> attributes = definition.toAttributes();
                if (existing.contains(definition.name())) {
                    updates.add(new SchemaRequest.ReplaceField(attributes));
                    replaced++;
                } else {
                    updates.add(new SchemaRequest.AddField(attributes));
                    added++;
                }
                fieldNames.add(definition.name());
            }

            SchemaResponse.UpdateResponse response = new SchemaRequest.MultiUpdate(updates)
                    .process(solrClient, collection);

            Object errors = response.getResponse() != null ? response.getResponse().get(ERRORS_KEY) : null;
            if (errors != null) {
                log.error("Solr rejected schema update for collection '{}': {}", collection, errors);
                return SchemaApplyResponse.failed("Solr rejected schema update: " + errors);
            }

            log.info("Applied schema to collection '{}': {} added, {} replaced", collection, added, replaced);
            return new SchemaApplyResponse(
                    added,
                    replaced,
                    fieldNames,
                    true,
                    "Applied " + fieldNames.size() + " fields to collection '" + collection + "'"
            );
        } catch (SolrServerException | IOException | SolrException e) {
            log.error("Failed to apply schema to collection '{}'", collection, e);
            return SchemaApplyResponse.failed("Failed to apply schema: " + e.getMessage());
        }
    }

    private Set<String> existingFieldNames(String collection) throws SolrServerException, IOException {
        SchemaResponse.FieldsResponse response = new SchemaRequest.Fields().process(solrClient, collection);
        Set<String> names = new HashSet<>();
        if (response.getFields() != null) {
            for (Map<String, Object> field : response.getFields()) {
                Object name = field.get(NAME_ATTRIBUTE);
                if (name != null) {
                    names.add(name.toString());
                }
            }
        }
        log.debug("Collection '{}' has {} explicit fields", collection, names.size());
        return names;
    }
}

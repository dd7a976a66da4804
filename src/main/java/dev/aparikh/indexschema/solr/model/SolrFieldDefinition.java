package dev.aparikh.indexschema.solr.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Solr field definition as sent to the Schema API.
 *
 * @param name        field name
 * @param type        Solr field type name
 * @param indexed     whether the field is searchable
 * @param stored      whether the original value is retrievable
 * @param docValues   whether column-oriented values are kept for sorting and faceting
 * @param multiValued whether the field holds several values per document
 * @param required    whether every document must carry the field
 */
@Schema(description = "Solr field definition derived from the index schema")
public record SolrFieldDefinition(
        @Schema(description = "Field name", example = "title")
        String name,

        @Schema(description = "Solr field type", example = "text_general")
        String type,

        boolean indexed,

        boolean stored,

        boolean docValues,

        boolean multiValued,

        boolean required
) {

    /**
     * Attribute map in the shape expected by {@code SchemaRequest.AddField} and
     * {@code SchemaRequest.ReplaceField}.
     */
    public Map<String, Object> toAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        attributes.put("type", type);
        attributes.put("indexed", indexed);
        attributes.put("stored", stored);
        attributes.put("docValues", docValues);
        attributes.put("multiValued", multiValued);
        if (required) {
            attributes.put("required", true);
        }
        return attributes;
    }
}

package dev.aparikh.indexschema.solr.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Response model for applying the index schema to a Solr collection.
 *
 * @param added      number of fields newly added to the collection
 * @param replaced   number of existing fields that were redefined
 * @param fieldNames names of the fields that were sent, in schema order
 * @param success    whether Solr accepted the update
 * @param message    status message
 */
@Schema(description = "Response for applying the index schema to a Solr collection")
public record SchemaApplyResponse(
        @Schema(description = "Number of fields added", example = "3")
        int added,

        @Schema(description = "Number of existing fields replaced", example = "1")
        int replaced,

        @Schema(description = "Names of the fields sent to Solr")
        List<String> fieldNames,

        @Schema(description = "Whether Solr accepted the schema update", example = "true")
        boolean success,

        @Schema(description = "Status message", example = "Applied 4 fields to collection 'books'")
        String message
) {

    public static SchemaApplyResponse failed(String message) {
        return new SchemaApplyResponse(0, 0, List.of(), false, message);
    }
}

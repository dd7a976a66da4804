package dev.aparikh.indexschema.schema.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * JSON view of the whole index schema.
 *
 * @param defaultTokenizer tokenizer used by text fields without their own
 * @param idField          unique key field
 * @param fields           declared fields, in declaration order
 */
@Schema(description = "The index schema")
public record SchemaDescription(
        @Schema(description = "Default tokenizer", example = "standard")
        String defaultTokenizer,

        @Schema(description = "Unique key field", example = "id")
        String idField,

        @Schema(description = "Declared fields in declaration order")
        List<FieldDescription> fields
) {
}

package dev.aparikh.indexschema.schema.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * @param key       field key
 * @param tokenizer tokenizer used to write and query the field
 */
@Schema(description = "Tokenizer resolved for a text field")
public record TokenizerResponse(
        @Schema(description = "Field key", example = "body")
        String key,

        @Schema(description = "Resolved tokenizer", example = "raw")
        String tokenizer
) {
}

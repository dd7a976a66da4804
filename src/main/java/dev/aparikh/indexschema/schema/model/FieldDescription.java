package dev.aparikh.indexschema.schema.model;

import dev.aparikh.indexschema.schema.Field;
import dev.aparikh.indexschema.schema.FieldType;
import dev.aparikh.indexschema.schema.TextField;
import io.swagger.v3.oas.annotations.media.Schema;
import org.jspecify.annotations.Nullable;

/**
 * JSON view of a declared field.
 *
 * @param key       field key
 * @param type      field type
 * @param stored    whether the original value is retained
 * @param tokenizer explicit tokenizer of a text field, {@code null} otherwise
 */
@Schema(description = "A declared document field")
public record FieldDescription(
        @Schema(description = "Field key", example = "title")
        String key,

        @Schema(description = "Field type", example = "TEXT")
        FieldType type,

        @Schema(description = "Whether the original value is retained", example = "false")
        boolean stored,

        @Schema(description = "Explicit tokenizer, only present on text fields that set one", example = "raw")
        @Nullable String tokenizer
) {

    public static FieldDescription of(Field field) {
        String tokenizer = field instanceof TextField text ? text.tokenizer() : null;
        return new FieldDescription(field.key(), field.type(), field.stored(), tokenizer);
    }
}

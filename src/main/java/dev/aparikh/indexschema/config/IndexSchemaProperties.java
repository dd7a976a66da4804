package dev.aparikh.indexschema.config;

import dev.aparikh.indexschema.schema.DuplicateFieldPolicy;
import dev.aparikh.indexschema.schema.FieldType;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Externalized schema declaration.
 *
 * <pre>{@code
 * index-schema.default-tokenizer=standard
 * index-schema.id-field=isbn
 * index-schema.duplicate-fields=replace
 * index-schema.fields[0].key=title
 * index-schema.fields[0].type=text
 * index-schema.fields[1].key=body
 * index-schema.fields[1].type=text
 * index-schema.fields[1].tokenizer=raw
 * index-schema.fields[1].stored=true
 * }</pre>
 *
 * @param defaultTokenizer tokenizer for text fields without their own (default: "standard")
 * @param idField          unique key field, or {@code null} to keep the schema default
 * @param duplicateFields  policy for keys declared more than once (default: replace)
 * @param fields           field declarations, in order
 */
@ConfigurationProperties(prefix = "index-schema")
public record IndexSchemaProperties(
        @Nullable String defaultTokenizer,
        @Nullable String idField,
        @Nullable DuplicateFieldPolicy duplicateFields,
        @Nullable List<FieldProperties> fields
) {

    public static final String DEFAULT_TOKENIZER = "standard";

    public IndexSchemaProperties {
        if (defaultTokenizer == null || defaultTokenizer.isBlank()) {
            defaultTokenizer = DEFAULT_TOKENIZER;
        }
        if (idField != null && idField.isBlank()) {
            idField = null;
        }
        if (duplicateFields == null) {
            duplicateFields = DuplicateFieldPolicy.REPLACE;
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * A single field declaration.
     *
     * @param key       field key
     * @param type      field type
     * @param stored    whether the original value is retained
     * @param tokenizer tokenizer override, only honoured for text fields
     */
    public record FieldProperties(String key, FieldType type, boolean stored, @Nullable String tokenizer) {
    }
}

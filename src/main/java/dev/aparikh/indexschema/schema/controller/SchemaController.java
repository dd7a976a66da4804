package dev.aparikh.indexschema.schema.controller;

import dev.aparikh.indexschema.schema.Field;
import dev.aparikh.indexschema.schema.FieldType;
import dev.aparikh.indexschema.schema.Schema;
import dev.aparikh.indexschema.schema.model.FieldDescription;
import dev.aparikh.indexschema.schema.model.SchemaDescription;
import dev.aparikh.indexschema.schema.model.TokenizerResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.jspecify.annotations.Nullable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;
import java.util.List;

/**
 * Read-only REST view of the index schema.
 *
 * <p>Provides endpoints to:</p>
 * <ul>
 *   <li>Describe the whole schema</li>
 *   <li>List fields, optionally of a single type</li>
 *   <li>Resolve the tokenizer of a text field</li>
 *   <li>List explicitly configured tokenizers</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/schema")
@Tag(name = "Schema", description = "API for inspecting the index schema")
class SchemaController {

    private final Schema schema;

    SchemaController(Schema schema) {
        this.schema = schema;
    }

    @GetMapping
    @Operation(summary = "Describe the schema",
            description = "Returns the default tokenizer, the id field and every field in declaration order.")
    public SchemaDescription describe() {
        return new SchemaDescription(schema.defaultTokenizer(), schema.idField(), describe(schema.fields().values()));
    }

    @GetMapping("/fields")
    @Operation(summary = "List fields",
            description = "Lists declared fields in declaration order, optionally restricted to one type.")
    public List<FieldDescription> fields(
            @Parameter(description = "Only return fields of this type", example = "TEXT")
            @RequestParam(required = false) @Nullable FieldType type) {
        if (type == null) {
            return describe(schema.fields().values());
        }
        return describe(schema.fieldsOfType(type));
    }

    /**
     * Resolves the tokenizer for a field.
     *
     * @param key the field key
     * @return the tokenizer, or 404 when the key is unknown or not a text field
     */
    @GetMapping("/fields/{key}/tokenizer")
    @Operation(summary = "Resolve the tokenizer of a field",
            description = "Returns the field's own tokenizer or the default one. " +
                    "Responds 404 for unknown keys and for fields that are not text.")
    public ResponseEntity<TokenizerResponse> tokenizer(
            @Parameter(description = "Field key", required = true, example = "body")
            @PathVariable String key) {
        return schema.tokenizerFor(key)
                .map(tokenizer -> ResponseEntity.ok(new TokenizerResponse(key, tokenizer)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/tokenizers")
    @Operation(summary = "List explicit tokenizers",
            description = "Tokenizers named by text fields, in declaration order. Fields using the default are skipped.")
    public List<String> tokenizers() {
        return schema.fieldTokenizers();
    }

    private static List<FieldDescription> describe(Collection<? extends Field> fields) {
        return fields.stream().map(FieldDescription::of).toList();
    }
}

package dev.aparikh.indexschema.schema;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declaration surface handed to the caller while a {@link Schema} is being defined.
 *
 * <p>Instances are created by {@link Schema#define(String, java.util.function.Consumer)} and
 * passed to the caller's declaration function. Every declaration method registers one field
 * under its key, keeping declaration order. When the declaration function returns the builder
 * is sealed, and any later call on a retained reference fails.</p>
 *
 * <pre>{@code
 * Schema schema = Schema.define("standard", s -> s
 *         .id("isbn")
 *         .text("title")
 *         .text("body", "raw")
 *         .integer("views", true));
 * }</pre>
 */
public final class SchemaBuilder {

    private static final Logger log = LoggerFactory.getLogger(SchemaBuilder.class);

    private final DuplicateFieldPolicy duplicatePolicy;
    private final Map<String, Field> fields = new LinkedHashMap<>();
    private String idField = Schema.DEFAULT_ID_FIELD;
    private boolean sealed;

    SchemaBuilder(DuplicateFieldPolicy duplicatePolicy) {
        this.duplicatePolicy = duplicatePolicy;
    }

    /**
     * Names the field acting as the document's unique key. The key does not have to be a
     * declared field.
     */
    public SchemaBuilder id(String key) {
        checkOpen();
        this.idField = Field.requireKey(key);
        return this;
    }

    public SchemaBuilder text(String key) {
        return text(key, null, false);
    }

    public SchemaBuilder text(String key, boolean stored) {
        return text(key, null, stored);
    }

    public SchemaBuilder text(String key, @Nullable String tokenizer) {
        return text(key, tokenizer, false);
    }

    /**
     * Declares a full-text field.
     *
     * @param key       the field key
     * @param tokenizer tokenizer to use instead of the schema default, or {@code null}
     * @param stored    whether the original value is retained
     * @return this builder
     */
    public SchemaBuilder text(String key, @Nullable String tokenizer, boolean stored) {
        return register(new TextField(key, stored, tokenizer));
    }

    public SchemaBuilder string(String key) {
        return string(key, false);
    }

    public SchemaBuilder string(String key, boolean stored) {
        return register(new ValueField(FieldType.STRING, key, stored));
    }

    public SchemaBuilder integer(String key) {
        return integer(key, false);
    }

    public SchemaBuilder integer(String key, boolean stored) {
        return register(new ValueField(FieldType.INTEGER, key, stored));
    }

    public SchemaBuilder doubleField(String key) {
        return doubleField(key, false);
    }

    public SchemaBuilder doubleField(String key, boolean stored) {
        return register(new ValueField(FieldType.DOUBLE, key, stored));
    }

    public SchemaBuilder date(String key) {
        return date(key, false);
    }

    public SchemaBuilder date(String key, boolean stored) {
        return register(new ValueField(FieldType.DATE, key, stored));
    }

    public SchemaBuilder facet(String key) {
        return facet(key, false);
    }

    public SchemaBuilder facet(String key, boolean stored) {
        return register(new ValueField(FieldType.FACET, key, stored));
    }

    private SchemaBuilder register(Field field) {
        checkOpen();
        Field existing = fields.get(field.key());
        if (existing != null) {
            if (duplicatePolicy == DuplicateFieldPolicy.REJECT) {
                throw new DuplicateFieldException(field.key(), existing);
            }
            log.debug("Replacing field '{}' ({} -> {})", field.key(), existing.type(), field.type());
        }
        // LinkedHashMap keeps the original slot when an existing key is put again
        fields.put(field.key(), field);
        return this;
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("Schema is already built; declarations are closed");
        }
    }

    Schema build(String defaultTokenizer) {
        checkOpen();
        sealed = true;
        return new Schema(defaultTokenizer, idField, fields);
    }
}

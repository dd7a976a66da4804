package dev.aparikh.indexschema.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The declared shape of the documents in an index.
 *
 * <p>A schema maps field keys to {@link Field}s in declaration order, names the id field, and
 * holds the tokenizer used by any text field that does not pick its own. It is built once by
 * {@link #define(String, Consumer)} and never changes afterwards, so it can be shared between
 * threads without synchronization.</p>
 *
 * <p>Lookups never fail: unknown keys resolve to {@link Optional#empty()} and type filters with
 * no matching fields return empty lists.</p>
 */
public final class Schema {

    private static final Logger log = LoggerFactory.getLogger(Schema.class);

    /**
     * Id field used when the declarations never call {@link SchemaBuilder#id(String)}.
     */
    public static final String DEFAULT_ID_FIELD = "id";

    private final String defaultTokenizer;
    private final String idField;
    private final Map<String, Field> fields;

    Schema(String defaultTokenizer, String idField, Map<String, Field> fields) {
        this.defaultTokenizer = defaultTokenizer;
        this.idField = idField;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Defines a schema. A key declared twice is replaced in place by its later declaration.
     *
     * @param defaultTokenizer tokenizer for text fields that do not name one
     * @param declarations     function declaring the fields on the supplied builder
     * @return the built schema
     * @throws IllegalArgumentException if the default tokenizer is blank or a declaration is invalid
     */
    public static Schema define(String defaultTokenizer, Consumer<SchemaBuilder> declarations) {
        return define(defaultTokenizer, DuplicateFieldPolicy.REPLACE, declarations);
    }

    /**
     * Defines a schema with an explicit policy for repeated keys.
     *
     * @param defaultTokenizer tokenizer for text fields that do not name one
     * @param duplicatePolicy  how a repeated key is handled
     * @param declarations     function declaring the fields on the supplied builder
     * @return the built schema
     */
    public static Schema define(String defaultTokenizer,
                                DuplicateFieldPolicy duplicatePolicy,
                                Consumer<SchemaBuilder> declarations) {
        if (defaultTokenizer == null || defaultTokenizer.isBlank()) {
            throw new IllegalArgumentException("Default tokenizer cannot be null or blank");
        }
        Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        Objects.requireNonNull(declarations, "declarations");

        SchemaBuilder builder = new SchemaBuilder(duplicatePolicy);
        declarations.accept(builder);
        Schema schema = builder.build(defaultTokenizer);

        log.debug("Defined schema with {} fields (default tokenizer '{}', id field '{}')",
                schema.fields.size(), defaultTokenizer, schema.idField);
        return schema;
    }

    /**
     * Resolves the tokenizer used to write and query a field.
     *
     * @param key the field key
     * @return the field's own tokenizer, else the default tokenizer; empty when the key is not
     * declared or does not name a text field
     */
    public Optional<String> tokenizerFor(String key) {
        Field field = fields.get(key);
        if (field instanceof TextField text) {
            return Optional.of(text.explicitTokenizer().orElse(defaultTokenizer));
        }
        return Optional.empty();
    }

    public Optional<Field> field(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public boolean hasField(String key) {
        return fields.containsKey(key);
    }

    /**
     * Returns every field of the given type, in declaration order.
     */
    public List<Field> fieldsOfType(FieldType type) {
        List<Field> result = new ArrayList<>();
        for (Field field : fields.values()) {
            if (field.type() == type) {
                result.add(field);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public List<TextField> textFields() {
        List<TextField> result = new ArrayList<>();
        for (Field field : fields.values()) {
            if (field instanceof TextField text) {
                result.add(text);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public List<ValueField> stringFields() {
        return valueFields(FieldType.STRING);
    }

    public List<ValueField> integerFields() {
        return valueFields(FieldType.INTEGER);
    }

    public List<ValueField> doubleFields() {
        return valueFields(FieldType.DOUBLE);
    }

    public List<ValueField> dateFields() {
        return valueFields(FieldType.DATE);
    }

    public List<ValueField> facetFields() {
        return valueFields(FieldType.FACET);
    }

    /**
     * Returns the explicit tokenizer of every text field that names one, in declaration order.
     * Fields relying on the default tokenizer are skipped.
     */
    public List<String> fieldTokenizers() {
        List<String> result = new ArrayList<>();
        for (TextField text : textFields()) {
            text.explicitTokenizer().ifPresent(result::add);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * All fields keyed by field key, in declaration order. The map is unmodifiable.
     */
    public Map<String, Field> fields() {
        return fields;
    }

    public String defaultTokenizer() {
        return defaultTokenizer;
    }

    public String idField() {
        return idField;
    }

    private List<ValueField> valueFields(FieldType type) {
        List<ValueField> result = new ArrayList<>();
        for (Field field : fields.values()) {
            if (field instanceof ValueField value && value.type() == type) {
                result.add(value);
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "Schema{defaultTokenizer='" + defaultTokenizer + "', idField='" + idField
                + "', fields=" + fields.keySet() + "}";
    }
}

package dev.aparikh.indexschema.schema;

/**
 * One declared document attribute.
 *
 * <p>Only {@link TextField} carries a tokenizer, so a tokenizer on a non-text field cannot be
 * expressed.</p>
 */
public sealed interface Field permits TextField, ValueField {

    String key();

    FieldType type();

    /**
     * Whether the original value is kept for retrieval rather than only indexed.
     */
    boolean stored();

    default boolean isText() {
        return type() == FieldType.TEXT;
    }

    static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Field key cannot be null or blank");
        }
        return key;
    }
}

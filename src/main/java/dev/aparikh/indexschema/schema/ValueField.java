package dev.aparikh.indexschema.schema;

/**
 * A field of any non-text type. These are never tokenized.
 *
 * @param type   the field type, anything but {@link FieldType#TEXT}
 * @param key    the field key
 * @param stored whether the original value is retained
 */
public record ValueField(FieldType type, String key, boolean stored) implements Field {

    public ValueField {
        if (type == null) {
            throw new IllegalArgumentException("Field type cannot be null");
        }
        if (type == FieldType.TEXT) {
            throw new IllegalArgumentException("Text fields must be declared as TextField, got key: " + key);
        }
        Field.requireKey(key);
    }
}

package dev.aparikh.indexschema.schema;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * A full-text field.
 *
 * @param key       the field key
 * @param stored    whether the original value is retained
 * @param tokenizer tokenizer overriding the schema default, or {@code null} to use the default
 */
public record TextField(String key, boolean stored, @Nullable String tokenizer) implements Field {

    public TextField {
        Field.requireKey(key);
        if (tokenizer != null && tokenizer.isBlank()) {
            tokenizer = null;
        }
    }

    @Override
    public FieldType type() {
        return FieldType.TEXT;
    }

    public Optional<String> explicitTokenizer() {
        return Optional.ofNullable(tokenizer);
    }
}

package dev.aparikh.indexschema.config;

import dev.aparikh.indexschema.config.IndexSchemaProperties.FieldProperties;
import dev.aparikh.indexschema.schema.FieldType;
import dev.aparikh.indexschema.schema.Schema;
import dev.aparikh.indexschema.schema.SchemaBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the application's {@link Schema} from {@link IndexSchemaProperties}.
 *
 * <p>Each configured field is replayed through the matching {@link SchemaBuilder} declaration, so
 * a schema built from properties goes through exactly the same checks as one declared in code.
 * A tokenizer configured on a non-text field has no meaning and is ignored with a warning.</p>
 */
@Configuration
@EnableConfigurationProperties(IndexSchemaProperties.class)
public class SchemaConfig {

    private static final Logger log = LoggerFactory.getLogger(SchemaConfig.class);

    @Bean
    Schema indexSchema(IndexSchemaProperties properties) {
        Schema schema = Schema.define(properties.defaultTokenizer(), properties.duplicateFields(), builder -> {
            if (properties.idField() != null) {
                builder.id(properties.idField());
            }
            for (FieldProperties field : properties.fields()) {
                declare(builder, field);
            }
        });

        log.info("Index schema ready: {} fields, default tokenizer '{}', id field '{}'",
                schema.fields().size(), schema.defaultTokenizer(), schema.idField());
        return schema;
    }

    static void declare(SchemaBuilder builder, FieldProperties field) {
        if (field.type() == null) {
            throw new IllegalArgumentException("Field '" + field.key() + "' has no type");
        }
        if (field.tokenizer() != null && field.type() != FieldType.TEXT) {
            log.warn("Ignoring tokenizer '{}' on {} field '{}'; only text fields are tokenized",
                    field.tokenizer(), field.type(), field.key());
        }
        switch (field.type()) {
            case TEXT -> builder.text(field.key(), field.tokenizer(), field.stored());
            case STRING -> builder.string(field.key(), field.stored());
            case INTEGER -> builder.integer(field.key(), field.stored());
            case DOUBLE -> builder.doubleField(field.key(), field.stored());
            case DATE -> builder.date(field.key(), field.stored());
            case FACET -> builder.facet(field.key(), field.stored());
        }
    }
}

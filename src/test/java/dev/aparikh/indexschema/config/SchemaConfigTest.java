package dev.aparikh.indexschema.config;

import dev.aparikh.indexschema.config.IndexSchemaProperties.FieldProperties;
import dev.aparikh.indexschema.schema.DuplicateFieldException;
import dev.aparikh.indexschema.schema.DuplicateFieldPolicy;
import dev.aparikh.indexschema.schema.Field;
import dev.aparikh.indexschema.schema.FieldType;
import dev.aparikh.indexschema.schema.Schema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for building the Schema bean from properties.
 */
class SchemaConfigTest {

    private final SchemaConfig config = new SchemaConfig();

    @Test
    void testBuildsSchemaFromProperties() {
        IndexSchemaProperties properties = new IndexSchemaProperties(
                "standard",
                "isbn",
                null,
                List.of(
                        new FieldProperties("title", FieldType.TEXT, true, null),
                        new FieldProperties("body", FieldType.TEXT, false, "raw"),
                        new FieldProperties("isbn", FieldType.STRING, true, null),
                        new FieldProperties("views", FieldType.INTEGER, false, null),
                        new FieldProperties("price", FieldType.DOUBLE, false, null),
                        new FieldProperties("published", FieldType.DATE, true, null),
                        new FieldProperties("genre", FieldType.FACET, false, null)
                ));

        Schema schema = config.indexSchema(properties);

        assertThat(schema.defaultTokenizer()).isEqualTo("standard");
        assertThat(schema.idField()).isEqualTo("isbn");
        assertThat(schema.fields().keySet())
                .containsExactly("title", "body", "isbn", "views", "price", "published", "genre");
        assertThat(schema.tokenizerFor("title")).contains("standard");
        assertThat(schema.tokenizerFor("body")).contains("raw");
        assertThat(schema.fieldTokenizers()).containsExactly("raw");
        assertThat(schema.field("published")).map(Field::stored).contains(true);
    }

    @Test
    void testDefaultsApplyWhenPropertiesMissing() {
        IndexSchemaProperties properties = new IndexSchemaProperties(null, " ", null, null);

        Schema schema = config.indexSchema(properties);

        assertThat(schema.defaultTokenizer()).isEqualTo(IndexSchemaProperties.DEFAULT_TOKENIZER);
        assertThat(schema.idField()).isEqualTo(Schema.DEFAULT_ID_FIELD);
        assertThat(schema.fields()).isEmpty();
        assertThat(properties.duplicateFields()).isEqualTo(DuplicateFieldPolicy.REPLACE);
    }

    @Test
    void testTokenizerOnNonTextFieldIsIgnored() {
        IndexSchemaProperties properties = new IndexSchemaProperties("standard", null, null, List.of(
                new FieldProperties("views", FieldType.INTEGER, false, "raw")));

        Schema schema = config.indexSchema(properties);

        assertThat(schema.tokenizerFor("views")).isEmpty();
        assertThat(schema.fieldTokenizers()).isEmpty();
        assertThat(schema.integerFields()).hasSize(1);
    }

    @Test
    void testDuplicatePolicyIsHonoured() {
        List<FieldProperties> fields = List.of(
                new FieldProperties("title", FieldType.TEXT, false, null),
                new FieldProperties("title", FieldType.STRING, true, null));

        Schema replaced = config.indexSchema(new IndexSchemaProperties("standard", null, null, fields));
        assertThat(replaced.fields()).containsOnlyKeys("title");
        assertThat(replaced.stringFields()).extracting(Field::key).containsExactly("title");
        assertThat(replaced.textFields()).isEmpty();

        assertThatThrownBy(() -> config.indexSchema(
                new IndexSchemaProperties("standard", null, DuplicateFieldPolicy.REJECT, fields)))
                .isInstanceOf(DuplicateFieldException.class);
    }

    @Test
    void testMissingTypeRejected() {
        IndexSchemaProperties properties = new IndexSchemaProperties("standard", null, null, List.of(
                new FieldProperties("title", null, false, null)));

        assertThatThrownBy(() -> config.indexSchema(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("title");
    }
}

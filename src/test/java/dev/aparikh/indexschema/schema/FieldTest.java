package dev.aparikh.indexschema.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldTest {

    @Test
    void testValueFieldRejectsTextType() {
        assertThatThrownBy(() -> new ValueField(FieldType.TEXT, "title", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TextField");
    }

    @Test
    void testTextFieldReportsTextType() {
        TextField field = new TextField("title", false, null);

        assertThat(field.type()).isEqualTo(FieldType.TEXT);
        assertThat(field.isText()).isTrue();
        assertThat(field.explicitTokenizer()).isEmpty();
    }

    @Test
    void testBlankTokenizerTreatedAsUnset() {
        TextField field = new TextField("title", false, "  ");

        assertThat(field.tokenizer()).isNull();
    }

    @Test
    void testValueFieldIsNotText() {
        assertThat(new ValueField(FieldType.FACET, "genre", true).isText()).isFalse();
    }
}

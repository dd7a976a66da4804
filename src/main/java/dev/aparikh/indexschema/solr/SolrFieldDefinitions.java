package dev.aparikh.indexschema.solr;

import dev.aparikh.indexschema.config.SolrConfigurationProperties;
import dev.aparikh.indexschema.schema.Field;
import dev.aparikh.indexschema.schema.FieldType;
import dev.aparikh.indexschema.schema.Schema;
import dev.aparikh.indexschema.solr.model.SolrFieldDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates a {@link Schema} into Solr field definitions.
 *
 * <p>Type mapping:</p>
 * <ul>
 *   <li>TEXT → the Solr type configured for the field's effective tokenizer, else {@code text_<tokenizer>}</li>
 *   <li>STRING → {@code string}</li>
 *   <li>INTEGER → {@code plong}, DOUBLE → {@code pdouble}, DATE → {@code pdate}, all with docValues</li>
 *   <li>FACET → {@code string} with docValues, always stored</li>
 * </ul>
 *
 * <p>The schema's id field is always sent as a stored, required {@code string} field, since Solr
 * needs an untokenized unique key. A declared id field keeps its slot but not its declared type;
 * when it is not declared it is appended last.</p>
 */
@Component
public class SolrFieldDefinitions {

    private static final Logger log = LoggerFactory.getLogger(SolrFieldDefinitions.class);

    static final String STRING_TYPE = "string";
    static final String LONG_TYPE = "plong";
    static final String DOUBLE_TYPE = "pdouble";
    static final String DATE_TYPE = "pdate";
    static final String TEXT_TYPE_PREFIX = "text_";

    private final Map<String, String> tokenizerFieldTypes;

    public SolrFieldDefinitions(SolrConfigurationProperties properties) {
        this.tokenizerFieldTypes = properties.tokenizerFieldTypes();
    }

    /**
     * Returns one definition per schema field, in declaration order, followed by the id field
     * when the schema does not declare it.
     */
    public List<SolrFieldDefinition> definitionsFor(Schema schema) {
        List<SolrFieldDefinition> definitions = new ArrayList<>();
        for (Field field : schema.fields().values()) {
            SolrFieldDefinition definition = definitionFor(schema, field);
            log.debug("Field '{}' ({}) -> Solr type '{}'", field.key(), field.type(), definition.type());
            definitions.add(definition);
        }
        if (!schema.hasField(schema.idField())) {
            definitions.add(idDefinition(schema.idField()));
        }
        return definitions;
    }

    /**
     * Solr field type used for text analysed with the given tokenizer.
     */
    public String textTypeFor(String tokenizer) {
        return tokenizerFieldTypes.getOrDefault(tokenizer, TEXT_TYPE_PREFIX + tokenizer);
    }

    private SolrFieldDefinition definitionFor(Schema schema, Field field) {
        if (field.key().equals(schema.idField())) {
            if (field.type() != FieldType.STRING) {
                log.warn("Id field '{}' is declared as {}; sending it to Solr as {}",
                        field.key(), field.type(), STRING_TYPE);
            }
            return idDefinition(field.key());
        }
        return switch (field.type()) {
            case TEXT -> {
                // tokenizerFor always resolves for a declared text field
                String tokenizer = schema.tokenizerFor(field.key()).orElse(schema.defaultTokenizer());
                yield new SolrFieldDefinition(field.key(), textTypeFor(tokenizer),
                        true, field.stored(), false, false, false);
            }
            case STRING -> new SolrFieldDefinition(field.key(), STRING_TYPE,
                    true, field.stored(), false, false, false);
            case INTEGER -> new SolrFieldDefinition(field.key(), LONG_TYPE,
                    true, field.stored(), true, false, false);
            case DOUBLE -> new SolrFieldDefinition(field.key(), DOUBLE_TYPE,
                    true, field.stored(), true, false, false);
            case DATE -> new SolrFieldDefinition(field.key(), DATE_TYPE,
                    true, field.stored(), true, false, false);
            case FACET -> new SolrFieldDefinition(field.key(), STRING_TYPE,
                    true, true, true, false, false);
        };
    }

    private static SolrFieldDefinition idDefinition(String key) {
        return new SolrFieldDefinition(key, STRING_TYPE, true, true, false, false, true);
    }
}

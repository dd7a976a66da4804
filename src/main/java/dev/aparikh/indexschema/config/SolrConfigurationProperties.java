package dev.aparikh.indexschema.config;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Solr connection and field type settings.
 *
 * @param url                 base Solr URL, e.g. {@code http://localhost:8983}
 * @param tokenizerFieldTypes Solr field type to use for each tokenizer name; tokenizers not
 *                            listed map to {@code text_<tokenizer>}
 */
@ConfigurationProperties(prefix = "solr")
public record SolrConfigurationProperties(
        @Nullable String url,
        @Nullable Map<String, String> tokenizerFieldTypes
) {

    public static final String DEFAULT_URL = "http://localhost:8983";

    public SolrConfigurationProperties {
        if (url == null || url.isBlank()) {
            url = DEFAULT_URL;
        }
        tokenizerFieldTypes = tokenizerFieldTypes == null ? Map.of() : Map.copyOf(tokenizerFieldTypes);
    }
}

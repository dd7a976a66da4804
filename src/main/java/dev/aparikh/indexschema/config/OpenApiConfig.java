package dev.aparikh.indexschema.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * API metadata. The tag names match the {@code @Tag} annotations on the controllers, so the
 * descriptions here are the ones Swagger UI shows for each group.
 */
@Configuration
public class OpenApiConfig {

    static final String SCHEMA_TAG = "Schema";
    static final String SOLR_SCHEMA_TAG = "Solr schema";

    @Bean
    public OpenAPI indexSchemaOpenAPI(IndexSchemaProperties schemaProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Index Schema API")
                        .description("Inspect the declared document schema (default tokenizer "
                                + schemaProperties.defaultTokenizer() + ", "
                                + schemaProperties.fields().size() + " configured fields) "
                                + "and apply it to Solr collections")
                        .version("v1.0.0")
                        .contact(new Contact()
                                .name("Index Schema Team")
                                .url("https://github.com/aparikh/index-schema"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .tags(List.of(
                        new Tag()
                                .name(SCHEMA_TAG)
                                .description("Read-only view of field declarations, tokenizer resolution and the id field"),
                        new Tag()
                                .name(SOLR_SCHEMA_TAG)
                                .description("Preview Solr field definitions and push them through the Schema API")
                                .externalDocs(new ExternalDocumentation()
                                        .description("Solr Schema API")
                                        .url("https://solr.apache.org/guide/solr/latest/indexing-guide/schema-api.html"))));
    }
}

package dev.aparikh.indexschema;

import dev.aparikh.indexschema.schema.Schema;
import org.apache.solr.client.solrj.SolrClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class IndexSchemaApplicationTests {

    @MockitoBean
    private SolrClient solrClient;

    @Autowired
    private Schema schema;

    @Test
    void contextLoads() {
        assertThat(schema.defaultTokenizer()).isEqualTo("standard");
        assertThat(schema.textFields()).extracting(f -> f.key()).containsExactly("title", "body");
        assertThat(schema.tokenizerFor("body")).contains("english");
        assertThat(schema.fieldTokenizers()).containsExactly("english");
    }

}

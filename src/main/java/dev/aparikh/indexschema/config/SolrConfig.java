package dev.aparikh.indexschema.config;

import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.Http2SolrClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the SolrJ client used to push schemas into Solr collections.
 *
 * <p>The configured URL is normalized so that it always ends with {@code /solr/}:</p>
 *
 * <ul>
 *   <li>{@code http://localhost:8983} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/solr} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/solr/} → unchanged
 * </ul>
 *
 * @see SolrConfigurationProperties
 */
@Configuration
@EnableConfigurationProperties(SolrConfigurationProperties.class)
public class SolrConfig {

    private static final int CONNECTION_TIMEOUT_MS = 10000;
    private static final int SOCKET_TIMEOUT_MS = 60000;
    private static final String SOLR_PATH = "solr/";

    @Bean(destroyMethod = "close")
    SolrClient solrClient(SolrConfigurationProperties properties) {
        return new Http2SolrClient.Builder(normalizeUrl(properties.url()))
                .withConnectionTimeout(CONNECTION_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .withIdleTimeout(SOCKET_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .withRequestTimeout(SOCKET_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .build();
    }

    static String normalizeUrl(String url) {
        if (!url.endsWith("/")) {
            url = url + "/";
        }
        if (!url.contains("/" + SOLR_PATH)) {
            url = url + SOLR_PATH;
        }
        return url;
    }
}

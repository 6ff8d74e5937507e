package dev.jobmatch.index;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to talk to the Elasticsearch REST API.
 *
 * <p>Base URL and timeouts come from {@code jobmatch.elasticsearch.*}. The client defaults to JSON
 * content type and is qualified as {@code "elasticsearchRestClient"}.
 */
@Configuration
public class ElasticsearchConfig {

    /**
     * Creates a pre-configured {@link RestClient} targeting the Elasticsearch cluster.
     *
     * @param builder    Spring-provided builder with the application's Jackson converters
     * @param properties connection settings
     * @return a named REST client bean for injection into {@link ElasticsearchIndexClient}
     */
    @Bean
    public RestClient elasticsearchRestClient(
            RestClient.Builder builder, ElasticsearchProperties properties) {

        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        return builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}

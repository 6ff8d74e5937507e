package dev.jobmatch.index;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jobmatch.elasticsearch")
public record ElasticsearchProperties(
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        String jobsIndex,
        String candidatesIndex,
        Retry retry
) {
    public record Retry(int maxAttempts, long delayMs, double multiplier) {}

    /** Physical index name of a logical collection. */
    public String indexName(IndexCollection collection) {
        return switch (collection) {
            case JOBS -> jobsIndex;
            case CANDIDATES -> candidatesIndex;
        };
    }
}

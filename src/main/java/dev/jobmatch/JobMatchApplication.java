package dev.jobmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the JobMatch service.
 *
 * <p>Serves the matching HTTP API on port 8080 against the Elasticsearch cluster configured under
 * {@code jobmatch.elasticsearch}.
 */
@SpringBootApplication
@EnableRetry
@ConfigurationPropertiesScan
public class JobMatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(JobMatchApplication.class, args);
    }
}

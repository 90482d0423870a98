package dev.sitegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the SiteGraph crawler.
 *
 * <p>Serves the crawl and link-map JSON API on port 8080.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SitegraphApplication {
    public static void main(String[] args) {
        SpringApplication.run(SitegraphApplication.class, args);
    }
}

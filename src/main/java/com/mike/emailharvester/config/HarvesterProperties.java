package com.mike.emailharvester.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {

    private Crawl crawl = new Crawl();
    private Fetch fetch = new Fetch();

    @Data
    public static class Crawl {
        /**
         * Default link-hop limit when a crawl request does not set one.
         */
        private int maxDepth = 2;

        /**
         * Default page budget (fetched + failed + skipped external pages).
         */
        private int maxPages = 50;

        /**
         * How many pages of one batch are fetched in parallel.
         */
        private int concurrency = 4;

        /**
         * Politeness pause between two batches.
         */
        private Duration interBatchDelay = Duration.ofMillis(500);

        /**
         * How many log lines a crawl job keeps for the status endpoint.
         */
        private int jobLogCapacity = 200;

        /**
         * How many finished crawl jobs stay queryable; older ones are dropped. Running jobs are always kept.
         */
        private int finishedJobRetention = 100;
    }

    @Data
    public static class Fetch {
        private String userAgent =
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) " +
                        "AppleWebKit/537.36 (KHTML, like Gecko) " +
                        "Chrome/129.0.0.0 Safari/537.36";

        private String referrer = "https://www.google.com";

        /** per request, applies to every access route */
        private Duration timeout = Duration.ofSeconds(10);

        /** 0 = unlimited */
        private int maxBodySizeBytes = 5 * 1024 * 1024;

        /**
         * Access routes in the order they are tried.
         */
        private List<Route> routes = new ArrayList<>(List.of(new Route("direct", "{rawUrl}")));
    }

    @Data
    public static class Route {
        private String name;
        private String template;

        public Route() {
        }

        public Route(String name, String template) {
            this.name = name;
            this.template = template;
        }
    }
}

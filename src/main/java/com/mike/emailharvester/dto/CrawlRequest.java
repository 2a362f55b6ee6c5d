package com.mike.emailharvester.dto;

/**
 * Body of POST /api/crawls. Null values fall back to harvester.crawl.* defaults.
 */
public record CrawlRequest(
        String startUrl,
        Integer maxDepth,
        Integer maxPages,
        Integer concurrency,
        Long interBatchDelayMs
) {
}

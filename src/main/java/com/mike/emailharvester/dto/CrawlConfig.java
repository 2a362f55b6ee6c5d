package com.mike.emailharvester.dto;

import lombok.Builder;

import java.time.Duration;

/**
 * Settings of one crawl; fixed for its whole lifetime.
 */
@Builder
public record CrawlConfig(
        String startUrl,
        int maxDepth,
        int maxPages,
        int concurrency,
        Duration interBatchDelay
) {
    public CrawlConfig {
        if (startUrl == null || startUrl.isBlank()) {
            throw new IllegalArgumentException("startUrl is required");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, was " + maxDepth);
        }
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be >= 1, was " + maxPages);
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, was " + concurrency);
        }
        if (interBatchDelay == null) {
            interBatchDelay = Duration.ZERO;
        }
        if (interBatchDelay.isNegative()) {
            throw new IllegalArgumentException("interBatchDelay must not be negative, was " + interBatchDelay);
        }
    }
}

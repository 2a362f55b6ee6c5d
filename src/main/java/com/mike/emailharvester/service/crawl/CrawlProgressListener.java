package com.mike.emailharvester.service.crawl;

import java.util.Set;

/**
 * Crawl events for whoever displays progress. All callbacks arrive on the crawl's control thread.
 */
public interface CrawlProgressListener {

    CrawlProgressListener NOOP = new CrawlProgressListener() {
    };

    default void onPageFetched(String url, int depth, Set<String> emails) {
    }

    default void onPageFailed(String url, String reason) {
    }

    default void onPageSkipped(String url, String reason) {
    }

    /**
     * @param percent 0-100
     */
    default void onProgress(int percent, int pagesVisited) {
    }

    default void onBatchCompleted(int batchNumber, int pagesVisited) {
    }
}

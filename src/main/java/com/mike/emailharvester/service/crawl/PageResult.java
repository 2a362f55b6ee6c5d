package com.mike.emailharvester.service.crawl;

import java.util.List;
import java.util.Set;

/**
 * What one worker found on one page. Merged into {@link CrawlState} by the control thread.
 */
record PageResult(FrontierEntry entry, boolean fetched, Set<String> emails, List<String> links, String failureReason) {

    static PageResult fetched(FrontierEntry entry, Set<String> emails, List<String> links) {
        return new PageResult(entry, true, Set.copyOf(emails), List.copyOf(links), null);
    }

    static PageResult failed(FrontierEntry entry, String reason) {
        return new PageResult(entry, false, Set.of(), List.of(), reason);
    }
}

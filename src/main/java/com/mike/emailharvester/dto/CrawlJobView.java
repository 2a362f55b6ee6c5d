package com.mike.emailharvester.dto;

import com.mike.emailharvester.service.crawl.CrawlJob;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

public record CrawlJobView(
        String id,
        String startUrl,
        String state,
        int percent,
        int pagesVisited,
        Set<String> emails,
        List<String> log,
        String error,
        LocalDateTime createdAt,
        CrawlSummary summary
) {
    public static CrawlJobView from(CrawlJob job) {
        return new CrawlJobView(
                job.getId(),
                job.getConfig().startUrl(),
                job.getState().name(),
                job.getPercent(),
                job.getPagesVisited(),
                job.getEmails(),
                job.getLogLines(),
                job.getError(),
                job.getCreatedAt(),
                job.getSummary()
        );
    }
}

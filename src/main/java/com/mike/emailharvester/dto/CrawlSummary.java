package com.mike.emailharvester.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Set;

@Value
@Builder
public class CrawlSummary {
    String startUrl;
    CrawlStatus status;

    @Singular
    Set<String> emails;

    int pagesVisited;
    int pagesFetched;
    int pagesFailed;
    int externalSkipped;
    int batches;

    LocalDateTime startedAt;
    LocalDateTime finishedAt;

    public boolean isCancelled() {
        return status == CrawlStatus.CANCELLED;
    }

    public String toLogLine() {
        return "status=" + status +
                " startUrl=" + startUrl +
                " emails=" + emails.size() +
                " pagesVisited=" + pagesVisited +
                " pagesFetched=" + pagesFetched +
                " pagesFailed=" + pagesFailed +
                " externalSkipped=" + externalSkipped +
                " batches=" + batches;
    }
}

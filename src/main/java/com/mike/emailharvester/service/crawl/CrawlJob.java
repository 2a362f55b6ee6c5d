package com.mike.emailharvester.service.crawl;

import com.mike.emailharvester.dto.CrawlConfig;
import com.mike.emailharvester.dto.CrawlSummary;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A crawl started through the API. Records the crawl's events so that its status can be polled.
 */
@Getter
public class CrawlJob implements CrawlProgressListener {

    public enum State {
        RUNNING, COMPLETED, CANCELLED, FAILED
    }

    private final String id;
    private final CrawlConfig config;
    private final LocalDateTime createdAt = LocalDateTime.now();

    @Getter(AccessLevel.NONE)
    private final CancellationToken token = new CancellationToken();

    @Getter(AccessLevel.NONE)
    private final Set<String> emails = Collections.synchronizedSet(new LinkedHashSet<>());

    @Getter(AccessLevel.NONE)
    private final Deque<String> logLines = new ArrayDeque<>();

    @Getter(AccessLevel.NONE)
    private final int logCapacity;

    private volatile State state = State.RUNNING;
    private volatile int percent;
    private volatile int pagesVisited;
    private volatile CrawlSummary summary;
    private volatile String error;

    public CrawlJob(String id, CrawlConfig config, int logCapacity) {
        this.id = id;
        this.config = config;
        this.logCapacity = Math.max(1, logCapacity);
    }

    CancellationToken token() {
        return token;
    }

    public void cancel() {
        token.cancel();
        appendLog("Cancellation requested");
    }

    public boolean isCancellationRequested() {
        return token.isCancelled();
    }

    public Set<String> getEmails() {
        synchronized (emails) {
            return Set.copyOf(emails);
        }
    }

    public List<String> getLogLines() {
        synchronized (logLines) {
            return List.copyOf(logLines);
        }
    }

    void finish(CrawlSummary summary) {
        this.summary = summary;
        this.emails.addAll(summary.getEmails());
        this.state = summary.isCancelled() ? State.CANCELLED : State.COMPLETED;
        appendLog(summary.isCancelled()
                ? "Crawl cancelled, " + summary.getEmails().size() + " emails found so far"
                : "Crawl completed, " + summary.getEmails().size() + " emails found");
    }

    void fail(Exception e) {
        this.error = e.getMessage();
        this.state = State.FAILED;
        appendLog("Crawl failed: " + e.getMessage());
    }

    @Override
    public void onPageFetched(String url, int depth, Set<String> found) {
        emails.addAll(found);
        appendLog("Fetched " + url + " (depth " + depth + "): " + found.size() + " emails");
    }

    @Override
    public void onPageFailed(String url, String reason) {
        appendLog("Error on " + url + ": " + reason);
    }

    @Override
    public void onPageSkipped(String url, String reason) {
        appendLog("Skipped " + url + " (" + reason + ")");
    }

    @Override
    public void onProgress(int percent, int pagesVisited) {
        this.percent = percent;
        this.pagesVisited = pagesVisited;
    }

    private void appendLog(String line) {
        synchronized (logLines) {
            logLines.addLast(line);
            while (logLines.size() > logCapacity) {
                logLines.pollFirst();
            }
        }
    }
}

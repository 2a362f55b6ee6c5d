package com.mike.emailharvester.service.crawl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Frontier, visited set and collected emails of one crawl. Not thread-safe: owned by the crawl's control thread.
 */
public class CrawlState {

    private final String startHost;
    private final int maxDepth;

    private final Deque<FrontierEntry> frontier = new ArrayDeque<>();
    private final Set<String> queued = new HashSet<>();
    private final Set<String> visited = new LinkedHashSet<>();
    private final Set<String> emails = new LinkedHashSet<>();

    private int pagesFetched;
    private int pagesFailed;
    private int externalSkipped;

    public CrawlState(String startUrl, String startHost, int maxDepth) {
        this.startHost = startHost;
        this.maxDepth = maxDepth;
        enqueue(startUrl, 0);
    }

    /**
     * @return false when the URL was already visited or queued, or lies beyond maxDepth
     */
    public boolean enqueue(String normalizedUrl, int depth) {
        if (depth > maxDepth) return false;
        if (visited.contains(normalizedUrl) || queued.contains(normalizedUrl)) return false;

        queued.add(normalizedUrl);
        frontier.addLast(new FrontierEntry(normalizedUrl, depth));
        return true;
    }

    public List<FrontierEntry> pollBatch(int size) {
        List<FrontierEntry> batch = new ArrayList<>(size);
        while (batch.size() < size && !frontier.isEmpty()) {
            FrontierEntry entry = frontier.pollFirst();
            queued.remove(entry.url());
            batch.add(entry);
        }
        return batch;
    }

    public boolean hasPending() {
        return !frontier.isEmpty();
    }

    public int pendingCount() {
        return frontier.size();
    }

    public boolean isVisited(String url) {
        return visited.contains(url);
    }

    public void markFetched(String url) {
        if (visited.add(url)) pagesFetched++;
    }

    public void markFailed(String url) {
        if (visited.add(url)) pagesFailed++;
    }

    public void markSkippedExternal(String url) {
        if (visited.add(url)) externalSkipped++;
    }

    /**
     * @return how many of the given emails were new
     */
    public int addEmails(Collection<String> found) {
        int before = emails.size();
        emails.addAll(found);
        return emails.size() - before;
    }

    public int visitedCount() {
        return visited.size();
    }

    public Set<String> getEmails() {
        return Collections.unmodifiableSet(emails);
    }

    public String getStartHost() {
        return startHost;
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    public int getPagesFailed() {
        return pagesFailed;
    }

    public int getExternalSkipped() {
        return externalSkipped;
    }
}

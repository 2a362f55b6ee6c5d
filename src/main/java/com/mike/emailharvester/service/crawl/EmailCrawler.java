package com.mike.emailharvester.service.crawl;

import com.mike.emailharvester.dto.CrawlConfig;
import com.mike.emailharvester.dto.CrawlStatus;
import com.mike.emailharvester.dto.CrawlSummary;
import com.mike.emailharvester.exception.InvalidUrlException;
import com.mike.emailharvester.exception.TransportExhaustedException;
import com.mike.emailharvester.service.EmailExtractor;
import com.mike.emailharvester.service.LinkExtractor;
import com.mike.emailharvester.service.fetch.PageFetcher;
import com.mike.emailharvester.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Breadth-first crawl of one host in batches of {@code concurrency} pages.
 * <p>
 * Workers only fetch and extract; the control thread alone decides what to fetch and merges
 * the per-page results into the {@link CrawlState} after each batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailCrawler {

    private static final AtomicInteger CRAWL_SEQ = new AtomicInteger(1);

    private final PageFetcher pageFetcher;
    private final EmailExtractor emailExtractor;
    private final LinkExtractor linkExtractor;

    public Set<String> crawl(CrawlConfig config) {
        return crawl(config, new CancellationToken(), CrawlProgressListener.NOOP).getEmails();
    }

    /**
     * @throws InvalidUrlException when the start URL is not a usable http(s) URL; nothing is fetched then
     */
    public CrawlSummary crawl(CrawlConfig config, CancellationToken token, CrawlProgressListener listener) {
        String startUrl = UrlNormalizer.normalizeStartUrl(config.startUrl());
        String startHost = UrlNormalizer.hostOf(startUrl);

        CrawlState state = new CrawlState(startUrl, startHost, config.maxDepth());
        LocalDateTime startedAt = LocalDateTime.now();

        log.info("EmailCrawler: starting crawl of {} (maxDepth={}, maxPages={}, concurrency={}, interBatchDelay={})",
                startUrl, config.maxDepth(), config.maxPages(), config.concurrency(), config.interBatchDelay());

        ExecutorService executor = Executors.newFixedThreadPool(config.concurrency(), workerThreadFactory());
        int batches = 0;
        boolean cancelled = false;

        try {
            while (true) {
                if (token.isCancelled()) {
                    cancelled = true;
                    break;
                }
                if (!state.hasPending() || state.visitedCount() >= config.maxPages()) {
                    break;
                }

                List<FrontierEntry> batch = state.pollBatch(config.concurrency());
                batches++;
                runBatch(batch, config, state, executor, token, listener);
                listener.onBatchCompleted(batches, state.visitedCount());

                log.debug("EmailCrawler: batch {} done, visited={}, pending={}, emails={}",
                        batches, state.visitedCount(), state.pendingCount(), state.getEmails().size());

                boolean moreWork = state.hasPending() && state.visitedCount() < config.maxPages();
                if (moreWork && !token.isCancelled() && !pause(config.interBatchDelay())) {
                    token.cancel();
                }
            }
        } finally {
            executor.shutdownNow();
        }

        listener.onProgress(100, state.visitedCount());

        CrawlSummary summary = CrawlSummary.builder()
                .startUrl(startUrl)
                .status(cancelled ? CrawlStatus.CANCELLED : CrawlStatus.COMPLETED)
                .emails(state.getEmails())
                .pagesVisited(state.visitedCount())
                .pagesFetched(state.getPagesFetched())
                .pagesFailed(state.getPagesFailed())
                .externalSkipped(state.getExternalSkipped())
                .batches(batches)
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now())
                .build();

        if (cancelled) {
            log.info("EmailCrawler: crawl CANCELLED, partial result: {}", summary.toLogLine());
        } else {
            log.info("EmailCrawler: crawl finished: {}", summary.toLogLine());
        }
        return summary;
    }

    private void runBatch(List<FrontierEntry> batch,
                          CrawlConfig config,
                          CrawlState state,
                          ExecutorService executor,
                          CancellationToken token,
                          CrawlProgressListener listener) {

        // fan-out: decide on the control thread, reserve budget, submit
        List<FrontierEntry> submitted = new ArrayList<>();
        List<Future<PageResult>> futures = new ArrayList<>();

        for (FrontierEntry entry : batch) {
            if (state.isVisited(entry.url())) {
                log.debug("EmailCrawler: {} already visited, skipping", entry.url());
                reportProgress(state, config, listener);
                continue;
            }
            if (state.visitedCount() + submitted.size() >= config.maxPages()) {
                log.debug("EmailCrawler: page budget used up, dropping {}", entry.url());
                reportProgress(state, config, listener);
                continue;
            }
            if (!UrlNormalizer.isSameHost(entry.url(), state.getStartHost())) {
                state.markSkippedExternal(entry.url());
                log.info("EmailCrawler: external link {} recorded as skipped", entry.url());
                listener.onPageSkipped(entry.url(), "external host");
                reportProgress(state, config, listener);
                continue;
            }

            submitted.add(entry);
            futures.add(executor.submit(() -> processPage(entry, config.maxDepth())));
        }

        // fan-in: wait for the whole batch
        List<PageResult> results = new ArrayList<>(submitted.size());
        for (int i = 0; i < submitted.size(); i++) {
            results.add(await(futures.get(i), submitted.get(i), token));
        }

        for (PageResult result : results) {
            String url = result.entry().url();
            if (result.fetched()) {
                state.markFetched(url);
                int newEmails = state.addEmails(result.emails());
                log.info("EmailCrawler: {} (depth={}) -> {} emails ({} new), {} links",
                        url, result.entry().depth(), result.emails().size(), newEmails, result.links().size());
                listener.onPageFetched(url, result.entry().depth(), result.emails());
            } else {
                state.markFailed(url);
                listener.onPageFailed(url, result.failureReason());
            }
            reportProgress(state, config, listener);
        }

        for (PageResult result : results) {
            enqueueLinks(result, state);
        }
    }

    private PageResult processPage(FrontierEntry entry, int maxDepth) {
        String html;
        try {
            html = pageFetcher.fetch(entry.url());
        } catch (TransportExhaustedException e) {
            log.warn("EmailCrawler: giving up on {}: {}", entry.url(), e.getMessage());
            return PageResult.failed(entry, e.getMessage());
        }

        Set<String> emails = emailExtractor.extractEmails(html, entry.url());
        List<String> links = entry.depth() < maxDepth
                ? linkExtractor.extractLinks(html, entry.url())
                : List.of();

        return PageResult.fetched(entry, emails, links);
    }

    private PageResult await(Future<PageResult> future, FrontierEntry entry, CancellationToken token) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("EmailCrawler: unexpected failure while processing {}", entry.url(), e.getCause());
            return PageResult.failed(entry, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            future.cancel(true);
            return PageResult.failed(entry, "interrupted");
        }
    }

    private void enqueueLinks(PageResult result, CrawlState state) {
        int nextDepth = result.entry().depth() + 1;
        int added = 0;

        for (String link : result.links()) {
            String normalized;
            try {
                normalized = UrlNormalizer.normalize(link);
            } catch (InvalidUrlException e) {
                log.debug("EmailCrawler: dropping link {}: {}", link, e.getMessage());
                continue;
            }
            if (state.enqueue(normalized, nextDepth)) {
                added++;
            }
        }

        if (added > 0) {
            log.debug("EmailCrawler: {} new frontier entries from {}", added, result.entry().url());
        }
    }

    private void reportProgress(CrawlState state, CrawlConfig config, CrawlProgressListener listener) {
        int visited = state.visitedCount();
        int percent = (int) Math.min(visited * 100L / config.maxPages(), 100);
        listener.onProgress(percent, visited);
    }

    /**
     * @return false when interrupted
     */
    private boolean pause(Duration delay) {
        if (delay.isZero()) return true;
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("EmailCrawler: interrupted during inter-batch delay, stopping");
            return false;
        }
    }

    private static ThreadFactory workerThreadFactory() {
        int crawlId = CRAWL_SEQ.getAndIncrement();
        AtomicInteger idx = new AtomicInteger(1);
        ThreadFactory defaults = Executors.defaultThreadFactory();
        return r -> {
            Thread t = defaults.newThread(r);
            t.setName("crawl-" + crawlId + "-worker-" + idx.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}

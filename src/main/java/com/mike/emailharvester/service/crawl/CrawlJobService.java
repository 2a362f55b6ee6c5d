package com.mike.emailharvester.service.crawl;

import com.mike.emailharvester.config.HarvesterProperties;
import com.mike.emailharvester.dto.CrawlConfig;
import com.mike.emailharvester.dto.CrawlRequest;
import com.mike.emailharvester.dto.CrawlSummary;
import com.mike.emailharvester.util.UrlNormalizer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs crawls in the background and keeps them in memory for status polling and cancellation.
 */
@Service
@Slf4j
public class CrawlJobService {

    private final EmailCrawler emailCrawler;
    private final HarvesterProperties properties;
    private final Executor executor;
    private final Map<String, CrawlJob> jobs = new ConcurrentHashMap<>();
    private final Queue<String> finishedJobIds = new ConcurrentLinkedQueue<>();

    @Autowired
    public CrawlJobService(EmailCrawler emailCrawler, HarvesterProperties properties) {
        this(emailCrawler, properties, Executors.newCachedThreadPool(jobThreadFactory()));
    }

    CrawlJobService(EmailCrawler emailCrawler, HarvesterProperties properties, Executor executor) {
        this.emailCrawler = emailCrawler;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * @throws IllegalArgumentException for an invalid start URL or out-of-range settings
     */
    public CrawlJob start(CrawlRequest request) {
        CrawlConfig config = toConfig(request);

        // fail fast on a bad start URL instead of inside the background job
        UrlNormalizer.normalizeStartUrl(config.startUrl());

        CrawlJob job = new CrawlJob(UUID.randomUUID().toString(), config, properties.getCrawl().getJobLogCapacity());
        jobs.put(job.getId(), job);

        log.info("CrawlJobService: job {} created for {}", job.getId(), config.startUrl());
        executor.execute(() -> run(job));
        return job;
    }

    public Optional<CrawlJob> find(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public Optional<CrawlJob> cancel(String id) {
        return find(id).map(job -> {
            job.cancel();
            log.info("CrawlJobService: cancellation requested for job {}", id);
            return job;
        });
    }

    private void run(CrawlJob job) {
        try {
            CrawlSummary summary = emailCrawler.crawl(job.getConfig(), job.token(), job);
            job.finish(summary);
            log.info("CrawlJobService: job {} finished: {}", job.getId(), summary.toLogLine());
        } catch (Exception e) {
            job.fail(e);
            log.warn("CrawlJobService: job {} failed: {}", job.getId(), e.getMessage(), e);
        } finally {
            finishedJobIds.add(job.getId());
            evictFinishedJobs();
        }
    }

    private void evictFinishedJobs() {
        int retention = Math.max(0, properties.getCrawl().getFinishedJobRetention());
        while (finishedJobIds.size() > retention) {
            String id = finishedJobIds.poll();
            if (id == null) break;
            jobs.remove(id);
            log.debug("CrawlJobService: evicted finished job {}", id);
        }
    }

    CrawlConfig toConfig(CrawlRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        HarvesterProperties.Crawl defaults = properties.getCrawl();

        return CrawlConfig.builder()
                .startUrl(request.startUrl())
                .maxDepth(request.maxDepth() != null ? request.maxDepth() : defaults.getMaxDepth())
                .maxPages(request.maxPages() != null ? request.maxPages() : defaults.getMaxPages())
                .concurrency(request.concurrency() != null ? request.concurrency() : defaults.getConcurrency())
                .interBatchDelay(request.interBatchDelayMs() != null
                        ? Duration.ofMillis(request.interBatchDelayMs())
                        : defaults.getInterBatchDelay())
                .build();
    }

    @PreDestroy
    void shutdown() {
        jobs.values().forEach(CrawlJob::cancel);
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    private static ThreadFactory jobThreadFactory() {
        AtomicInteger idx = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, "crawl-job-" + idx.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}

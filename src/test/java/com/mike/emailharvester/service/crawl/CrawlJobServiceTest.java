package com.mike.emailharvester.service.crawl;

import com.mike.emailharvester.config.HarvesterProperties;
import com.mike.emailharvester.dto.CrawlConfig;
import com.mike.emailharvester.dto.CrawlRequest;
import com.mike.emailharvester.dto.CrawlStatus;
import com.mike.emailharvester.dto.CrawlSummary;
import com.mike.emailharvester.exception.InvalidUrlException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CrawlJobServiceTest {

    private EmailCrawler emailCrawler;
    private HarvesterProperties properties;
    private CrawlJobService service;

    @BeforeEach
    void setUp() {
        emailCrawler = mock(EmailCrawler.class);
        properties = new HarvesterProperties();
        // jobs run on the calling thread
        service = new CrawlJobService(emailCrawler, properties, Runnable::run);
    }

    private static CrawlSummary summary(CrawlStatus status, String... emails) {
        return CrawlSummary.builder()
                .startUrl("https://shop.test/")
                .status(status)
                .emails(Set.of(emails))
                .pagesVisited(3)
                .build();
    }

    @Test
    @DisplayName("missing request values come from harvester.crawl defaults")
    void defaults_applied() {
        //Arrange
        properties.getCrawl().setMaxPages(7);
        when(emailCrawler.crawl(any(CrawlConfig.class), any(CancellationToken.class), any(CrawlProgressListener.class)))
                .thenReturn(summary(CrawlStatus.COMPLETED));
        //Act
        CrawlJob job = service.start(new CrawlRequest("shop.test", 1, null, null, null));
        //Assert
        CrawlConfig config = job.getConfig();
        assertEquals(1, config.maxDepth());
        assertEquals(7, config.maxPages());
        assertEquals(4, config.concurrency());
        assertEquals(Duration.ofMillis(500), config.interBatchDelay());
    }

    @Test
    @DisplayName("finished crawl -> COMPLETED with its emails, findable by id")
    void completed_job() {
        //Arrange
        when(emailCrawler.crawl(any(CrawlConfig.class), any(CancellationToken.class), any(CrawlProgressListener.class)))
                .thenReturn(summary(CrawlStatus.COMPLETED, "info@shop.test"));
        //Act
        CrawlJob job = service.start(new CrawlRequest("https://shop.test", null, null, null, 0L));
        //Assert
        assertEquals(CrawlJob.State.COMPLETED, job.getState());
        assertEquals(Set.of("info@shop.test"), job.getEmails());
        assertEquals(job, service.find(job.getId()).orElseThrow());
    }

    @Test
    @DisplayName("cancelled crawl is reported distinctly")
    void cancelled_job() {
        when(emailCrawler.crawl(any(CrawlConfig.class), any(CancellationToken.class), any(CrawlProgressListener.class)))
                .thenReturn(summary(CrawlStatus.CANCELLED, "info@shop.test"));

        CrawlJob job = service.start(new CrawlRequest("https://shop.test", null, null, null, null));

        assertEquals(CrawlJob.State.CANCELLED, job.getState());
        assertTrue(job.getLogLines().get(job.getLogLines().size() - 1).startsWith("Crawl cancelled"));
    }

    @Test
    @DisplayName("crawler blowing up -> FAILED with message")
    void failed_job() {
        when(emailCrawler.crawl(any(CrawlConfig.class), any(CancellationToken.class), any(CrawlProgressListener.class)))
                .thenThrow(new IllegalStateException("boom"));

        CrawlJob job = service.start(new CrawlRequest("https://shop.test", null, null, null, null));

        assertEquals(CrawlJob.State.FAILED, job.getState());
        assertEquals("boom", job.getError());
    }

    @Test
    @DisplayName("invalid start URL is rejected before a job exists")
    void invalid_start_url() {
        assertThrows(InvalidUrlException.class,
                () -> service.start(new CrawlRequest("http://", null, null, null, null)));
        verifyNoInteractions(emailCrawler);
    }

    @Test
    @DisplayName("out-of-range settings are rejected")
    void invalid_settings() {
        assertThrows(IllegalArgumentException.class,
                () -> service.start(new CrawlRequest("shop.test", null, 0, null, null)));
        assertThrows(IllegalArgumentException.class,
                () -> service.start(new CrawlRequest("shop.test", -1, null, null, null)));
        assertThrows(IllegalArgumentException.class,
                () -> service.start(new CrawlRequest("shop.test", null, null, 0, null)));
    }

    @Test
    @DisplayName("cancel raises the job's token; unknown id -> empty")
    void cancel() {
        when(emailCrawler.crawl(any(CrawlConfig.class), any(CancellationToken.class), any(CrawlProgressListener.class)))
                .thenReturn(summary(CrawlStatus.COMPLETED));
        CrawlJob job = service.start(new CrawlRequest("shop.test", null, null, null, null));

        assertTrue(service.cancel(job.getId()).orElseThrow().isCancellationRequested());
        assertTrue(service.cancel("nope").isEmpty());
    }

    @Test
    @DisplayName("only the newest finished jobs are kept; running jobs are never evicted")
    void finished_jobs_beyond_retention_are_evicted() {
        //Arrange
        properties.getCrawl().setFinishedJobRetention(1);
        List<Runnable> pending = new ArrayList<>();
        CrawlJobService deferred = new CrawlJobService(emailCrawler, properties, pending::add);
        when(emailCrawler.crawl(any(CrawlConfig.class), any(CancellationToken.class), any(CrawlProgressListener.class)))
                .thenReturn(summary(CrawlStatus.COMPLETED));

        CrawlJob running = deferred.start(new CrawlRequest("shop.test", null, null, null, null));
        CrawlJob older = deferred.start(new CrawlRequest("shop.test", null, null, null, null));
        CrawlJob newer = deferred.start(new CrawlRequest("shop.test", null, null, null, null));

        //Act
        pending.get(1).run();
        pending.get(2).run();

        //Assert
        assertEquals(CrawlJob.State.RUNNING, running.getState());
        assertTrue(deferred.find(running.getId()).isPresent());
        assertFalse(deferred.find(older.getId()).isPresent());
        assertEquals(newer, deferred.find(newer.getId()).orElseThrow());
    }
}

package com.mike.emailharvester.controller;

import com.mike.emailharvester.dto.CrawlJobView;
import com.mike.emailharvester.dto.CrawlRequest;
import com.mike.emailharvester.service.crawl.CrawlJob;
import com.mike.emailharvester.service.crawl.CrawlJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class CrawlController {

    private final CrawlJobService crawlJobService;

    @PostMapping("/api/crawls")
    public ResponseEntity<CrawlJobView> start(@RequestBody CrawlRequest request) {
        CrawlJob job = crawlJobService.start(request);
        return ResponseEntity.accepted().body(CrawlJobView.from(job));
    }

    @GetMapping("/api/crawls/{id}")
    public ResponseEntity<CrawlJobView> status(@PathVariable String id) {
        return crawlJobService.find(id)
                .map(job -> ResponseEntity.ok(CrawlJobView.from(job)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/api/crawls/{id}")
    public ResponseEntity<CrawlJobView> cancel(@PathVariable String id) {
        return crawlJobService.cancel(id)
                .map(job -> ResponseEntity.accepted().body(CrawlJobView.from(job)))
                .orElse(ResponseEntity.notFound().build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.info("CrawlController: rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}

package com.mike.emailharvester.service;

import com.mike.emailharvester.service.emailextractor.EmailSourceExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Unions the candidates of every {@link EmailSourceExtractor} for one page.
 * Never throws: a failing strategy only loses its own remaining candidates.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailExtractor {

    private final List<EmailSourceExtractor> extractors;

    public Set<String> extractEmails(String html, String pageUrl) {
        Set<String> results = new LinkedHashSet<>();

        if (html == null || html.isBlank()) {
            return results;
        }

        Document document = parse(html, pageUrl);

        for (EmailSourceExtractor extractor : extractors) {
            try {
                extractor.extractCandidates(html, document).forEach(results::add);
            } catch (RuntimeException e) {
                log.debug("EmailExtractor: {} failed on {}: {}",
                        extractor.getClass().getSimpleName(), pageUrl, e.toString());
            }
        }

        log.debug("EmailExtractor: {} emails on {}", results.size(), pageUrl);
        return results;
    }

    private Document parse(String html, String pageUrl) {
        try {
            return Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        } catch (RuntimeException e) {
            log.debug("EmailExtractor: cannot parse {}, raw scan only: {}", pageUrl, e.toString());
            return null;
        }
    }
}

package com.mike.emailharvester.service.emailextractor;

import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Raw scan of the unparsed markup. Also the only strategy that works when parsing failed.
 */
@Component
public class RegexTextExtractor implements EmailSourceExtractor {

    @Override
    public Stream<String> extractCandidates(String html, Document document) {
        return EmailPattern.findAll(html);
    }
}

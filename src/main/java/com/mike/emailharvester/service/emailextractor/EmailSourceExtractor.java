package com.mike.emailharvester.service.emailextractor;

import org.jsoup.nodes.Document;

import java.util.stream.Stream;

/**
 * One surface of a page mined for addresses. Candidates are lowercased.
 *
 * @param document parsed form of {@code html}, or null when the markup could not be parsed
 */
public interface EmailSourceExtractor {
    Stream<String> extractCandidates(String html, Document document);
}

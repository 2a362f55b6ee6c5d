package com.mike.emailharvester.service.emailextractor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Every attribute of every element. mailto: hrefs are taken as they are, everything else is scanned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AttributeExtractor implements EmailSourceExtractor {

    private static final String MAILTO = "mailto:";

    private final CandidateTextScanner scanner;

    @Override
    public Stream<String> extractCandidates(String html, Document document) {
        if (document == null) return Stream.empty();

        Stream.Builder<String> builder = Stream.builder();
        for (Element element : document.getAllElements()) {
            for (Attribute attribute : element.attributes()) {
                String value = attribute.getValue();
                if (value == null || value.isBlank()) continue;

                if (isMailtoHref(attribute)) {
                    mailtoTargets(value).forEach(builder::add);
                } else {
                    scanner.scan(value).forEach(builder::add);
                }
            }
        }
        return builder.build();
    }

    private boolean isMailtoHref(Attribute attribute) {
        return "href".equalsIgnoreCase(attribute.getKey())
                && attribute.getValue().trim().toLowerCase(Locale.ROOT).startsWith(MAILTO);
    }

    /**
     * mailto:a@x.de,b@x.de?subject=Hi -> [a@x.de, b@x.de]. Targets that are no plain address
     * (e.g. mailto:info(at)x(dot)de) go through the scanner instead.
     */
    private Stream<String> mailtoTargets(String href) {
        String raw = href.trim().substring(MAILTO.length());

        int q = raw.indexOf('?');
        if (q >= 0) raw = raw.substring(0, q);

        if (raw.indexOf('%') >= 0) {
            try {
                raw = URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException ex) {
                log.debug("URL decode failed for mailto target: '{}'", raw, ex);
            }
        }

        Stream.Builder<String> builder = Stream.builder();
        for (String target : raw.split("[,;]")) {
            String email = target.trim().toLowerCase(Locale.ROOT);
            if (email.isEmpty()) continue;

            if (EmailPattern.matchesFully(email)) {
                builder.add(email);
            } else {
                scanner.scan(target).forEach(builder::add);
            }
        }
        return builder.build();
    }
}

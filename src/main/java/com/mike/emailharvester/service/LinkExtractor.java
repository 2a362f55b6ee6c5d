package com.mike.emailharvester.service;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Absolute http(s) targets of all anchors, in document order. No host filtering and no de-duplication.
 */
@Component
@Slf4j
public class LinkExtractor {

    public List<String> extractLinks(String html, String baseUrl) {
        List<String> links = new ArrayList<>();
        if (html == null || html.isBlank()) return links;

        Document doc;
        try {
            doc = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        } catch (RuntimeException e) {
            log.debug("LinkExtractor: cannot parse {}: {}", baseUrl, e.toString());
            return links;
        }

        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (href.isEmpty()) continue;

            String hrefLower = href.toLowerCase(Locale.ROOT);
            if (hrefLower.startsWith("mailto:") || hrefLower.startsWith("javascript:")) continue;

            // jsoup leaves literal spaces in place, browsers send them as %20
            String absUrl = a.absUrl("href").trim().replace(" ", "%20");
            if (absUrl.isBlank() || !isAbsoluteHttpUrl(absUrl)) {
                log.debug("LinkExtractor: dropping unresolvable href '{}' on {}", href, baseUrl);
                continue;
            }
            links.add(absUrl);
        }
        return links;
    }

    private boolean isAbsoluteHttpUrl(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}

package com.mike.emailharvester.service.emailextractor;

import com.mike.emailharvester.service.CloudflareEmailDecoder;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Cloudflare email protection: {@code data-cfemail="<hex>"} and
 * {@code href="/cdn-cgi/l/email-protection#<hex>"}.
 */
@Component
public class CloudflareCfEmailExtractor implements EmailSourceExtractor {

    private static final String PROTECTION_PATH = "/cdn-cgi/l/email-protection#";

    @Override
    public Stream<String> extractCandidates(String html, Document document) {
        if (document == null) return Stream.empty();

        Stream.Builder<String> builder = Stream.builder();
        for (Element element : document.select("[data-cfemail]")) {
            decodeInto(element.attr("data-cfemail"), builder);
        }
        for (Element link : document.select("a[href]")) {
            String href = link.attr("href");
            int idx = href.indexOf(PROTECTION_PATH);
            if (idx >= 0) {
                decodeInto(href.substring(idx + PROTECTION_PATH.length()), builder);
            }
        }
        return builder.build();
    }

    private void decodeInto(String encoded, Stream.Builder<String> builder) {
        String decoded = CloudflareEmailDecoder.decode(encoded);
        if (decoded != null && !decoded.isBlank()) {
            EmailPattern.findAll(decoded).forEach(builder::add);
        }
    }
}

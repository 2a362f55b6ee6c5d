package com.mike.emailharvester.service.emailextractor;

import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Script bodies, where addresses are often glued together at runtime: "info" + "@" + "example.com".
 */
@Component
@RequiredArgsConstructor
public class InlineScriptExtractor implements EmailSourceExtractor {

    private final TextObfuscationNormalizer normalizer;

    @Override
    public Stream<String> extractCandidates(String html, Document document) {
        if (document == null) return Stream.empty();

        Stream.Builder<String> builder = Stream.builder();
        for (Element script : document.select("script")) {
            String body = script.data();
            if (body.isBlank()) continue;

            EmailPattern.findAll(normalizer.normalize(body)).forEach(builder::add);
            EmailPattern.findAll(normalizer.deobfuscateConcatenation(body)).forEach(builder::add);
        }
        return builder.build();
    }
}

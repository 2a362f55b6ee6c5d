package com.mike.emailharvester.service.emailextractor;

import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Component
@RequiredArgsConstructor
public class TextNodeExtractor implements EmailSourceExtractor {

    private final CandidateTextScanner scanner;

    @Override
    public Stream<String> extractCandidates(String html, Document document) {
        if (document == null) return Stream.empty();

        List<String> texts = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                texts.add(textNode.getWholeText());
            } else if (node instanceof DataNode dataNode) {
                texts.add(dataNode.getWholeData());
            }
        }, document);

        return texts.stream()
                .filter(t -> !t.isBlank())
                .flatMap(scanner::scan);
    }
}

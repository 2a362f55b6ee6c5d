package com.mike.emailharvester.service.emailextractor;

import com.mike.emailharvester.config.EmailExtractorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Runs the email pattern over a piece of text and over its de-obfuscated variants:
 * raw, normalized, concatenation-joined and base64-decoded tokens.
 */
@Component
@RequiredArgsConstructor
public class CandidateTextScanner {

    private static final Pattern BASE64_CANDIDATE =
            Pattern.compile("(?<![A-Za-z0-9+/=])[A-Za-z0-9+/]+={0,2}(?![A-Za-z0-9+/=])");

    private final TextObfuscationNormalizer normalizer;
    private final EmailExtractorProperties props;

    public Stream<String> scan(String text) {
        if (text == null || text.isBlank()) return Stream.empty();

        Stream.Builder<String> builder = Stream.builder();

        EmailPattern.findAll(text).forEach(builder::add);
        EmailPattern.findAll(normalizer.normalize(text)).forEach(builder::add);

        String joined = normalizer.deobfuscateConcatenation(text);
        if (!joined.equals(text)) {
            EmailPattern.findAll(joined).forEach(builder::add);
        }

        Matcher tokens = BASE64_CANDIDATE.matcher(text);
        while (tokens.find()) {
            String token = tokens.group();
            if (token.length() < props.base64MinTokenLength()) continue;

            Optional<String> decoded = normalizer.tryDecodeBase64(token);
            decoded.ifPresent(d -> EmailPattern.findAll(d).forEach(builder::add));
        }

        return builder.build();
    }
}

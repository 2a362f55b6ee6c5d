package com.mike.emailharvester.service.emailextractor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextObfuscationNormalizerTest {

    private final TextObfuscationNormalizer normalizer = new TextObfuscationNormalizer();

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("null -> null")
        void normalize_when_null_returns_null() {
            assertNull(normalizer.normalize(null));
        }

        @Test
        @DisplayName("blank -> unchanged")
        void normalize_when_blank_returns_unchanged() {
            assertEquals(" ", normalizer.normalize(" "));
        }

        @Test
        @DisplayName("(at) and (dot) -> @ and .")
        void normalize_parentheses_at_dot() {
            //Arrange
            String input = "kontakt: info(at)example(dot)de";
            //Act
            String result = normalizer.normalize(input);
            //Assert
            assertEquals("kontakt: info@example.de", result);
        }

        @Test
        @DisplayName("[at] and [dot] with spaces -> @ and .")
        void normalize_square_brackets_with_spaces() {
            //Arrange
            String input = "user [at] example [dot] com";
            //Act
            String result = normalizer.normalize(input);
            //Assert
            assertEquals("user@example.com", result);
        }

        @Test
        @DisplayName("standalone words AT / DOT, case-insensitive")
        void normalize_words_case_insensitive() {
            //Arrange
            String input = "KONTAKT: INFO AT EXAMPLE DOT DE";
            //Act
            String result = normalizer.normalize(input);
            //Assert
            assertEquals("KONTAKT: INFO@EXAMPLE.DE", result);
        }

        @Test
        @DisplayName("non-breaking space entities -> plain spaces")
        void normalize_nbsp() {
            assertEquals("call us now", normalizer.normalize("call&nbsp;us&#160;now"));
        }

        @Test
        @DisplayName("percent-encoded @ is decoded")
        void normalize_percent_decoding() {
            assertEquals("info@example.com", normalizer.normalize("info%40example.com"));
        }

        @Test
        @DisplayName("undecodable percent sign is kept, later steps still run")
        void normalize_bad_percent_is_kept() {
            //Arrange
            String input = "100% sure &amp; info&#64;example.com";
            //Act
            String result = normalizer.normalize(input);
            //Assert
            assertEquals("100% sure & info@example.com", result);
        }

        @Test
        @DisplayName("percent decoding keeps '+' in the local part")
        void normalize_percent_decoding_keeps_plus() {
            //Arrange
            String input = "first+last%40shop.test, 100%25 answered";
            //Act
            String result = normalizer.normalize(input);
            //Assert
            assertEquals("first+last@shop.test, 100% answered", result);
        }

        @Test
        @DisplayName("numeric html entities are decoded")
        void normalize_numeric_entities() {
            assertEquals("info@example.com", normalizer.normalize("info&#64;example&#46;com"));
        }

        @Test
        @DisplayName("should not change normal email")
        void normalize_should_not_change_normal_email() {
            assertEquals("kontakt: info@example.de", normalizer.normalize("kontakt: info@example.de"));
        }
    }

    @Nested
    @DisplayName("deobfuscateConcatenation")
    class DeobfuscateConcatenation {

        @Test
        @DisplayName("double-quoted fragments are joined")
        void joins_double_quoted() {
            assertEquals("a@b.com", normalizer.deobfuscateConcatenation("\"a\" + \"@\" + \"b.com\""));
        }

        @Test
        @DisplayName("single and double quotes can be mixed")
        void joins_mixed_quotes() {
            //Arrange
            String input = "var mail = 'info' + \"@\" + 'shop.test';";
            //Act
            String result = normalizer.deobfuscateConcatenation(input);
            //Assert
            assertEquals("info@shop.test", result);
        }

        @Test
        @DisplayName("fewer than two fragments -> unchanged")
        void single_fragment_unchanged() {
            String input = "var x = \"only\";";
            assertEquals(input, normalizer.deobfuscateConcatenation(input));
        }

        @Test
        @DisplayName("no quotes -> unchanged")
        void no_quotes_unchanged() {
            assertEquals("plain text", normalizer.deobfuscateConcatenation("plain text"));
        }
    }

    @Nested
    @DisplayName("tryDecodeBase64")
    class TryDecodeBase64 {

        @Test
        @DisplayName("payload with '@' is returned")
        void decodes_payload_with_at() {
            Optional<String> result = normalizer.tryDecodeBase64("aW5mb0BleGFtcGxlLmNvbQ==");
            assertEquals(Optional.of("info@example.com"), result);
        }

        @Test
        @DisplayName("payload without '@' -> empty")
        void payload_without_at_is_empty() {
            // "hello world!"
            assertTrue(normalizer.tryDecodeBase64("aGVsbG8gd29ybGQh").isEmpty());
        }

        @Test
        @DisplayName("length not a multiple of 4 -> empty")
        void wrong_length_is_empty() {
            assertTrue(normalizer.tryDecodeBase64("aW5mb0BleGFtcGxlLmNvbQ=").isEmpty());
        }

        @Test
        @DisplayName("characters outside the alphabet -> empty, never throws")
        void invalid_alphabet_is_empty() {
            assertTrue(normalizer.tryDecodeBase64("not base64!!").isEmpty());
            assertTrue(normalizer.tryDecodeBase64("ab=c").isEmpty());
            assertTrue(normalizer.tryDecodeBase64(null).isEmpty());
        }
    }
}

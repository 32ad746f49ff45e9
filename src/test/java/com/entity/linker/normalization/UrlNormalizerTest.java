package com.entity.linker.normalization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UrlNormalizer Tests")
class UrlNormalizerTest {

    private final UrlNormalizer normalizer = new UrlNormalizer();

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "http://www.Example.com:80/Path/, https://example.com/Path",
                "example.com/a#fragment, https://example.com/a",
                "https://m.example.com/, https://example.com",
                "https://mobile.example.com/x?q=1, https://example.com/x?q=1",
                "https://example.com:8080/x, https://example.com:8080/x"
        })
        @DisplayName("Should canonicalize trivially different spellings")
        void canonicalizes(String raw, String expected) {
            assertEquals(Optional.of(expected), normalizer.normalize(raw));
        }

        @Test
        @DisplayName("Should reject input without a host")
        void rejectsInvalid() {
            assertTrue(normalizer.normalize("").isEmpty());
            assertTrue(normalizer.normalize("https://").isEmpty());
            assertTrue(normalizer.normalize("not a url").isEmpty());
        }

        @Test
        @DisplayName("Should return the normalized host")
        void host() {
            assertEquals(Optional.of("discogs.com"), normalizer.host("http://www.discogs.com/artist/1"));
        }
    }

    @Test
    @DisplayName("Should tokenize host, path and query without URL noise")
    void tokens() {
        Set<String> tokens = normalizer.tokens("https://www.discogs.com/artist/12345-Charles-Hartshorne");
        assertEquals(Set.of("discogs", "12345", "charles", "hartshorne"), tokens);
    }

    @Nested
    @DisplayName("extractIdentifier")
    class ExtractIdentifier {

        private static final String FORMATTER = "https://www.wikidata.org/wiki/$1";

        @Test
        @DisplayName("Should extract the identifier of a matching URL")
        void extracts() {
            assertEquals(Optional.of("Q42"), normalizer.extractIdentifier("http://wikidata.org/wiki/Q42", FORMATTER));
        }

        @Test
        @DisplayName("Should return empty for URLs that do not follow the formatter")
        void nonMatching() {
            assertTrue(normalizer.extractIdentifier("https://example.com/wiki/Q42", FORMATTER).isEmpty());
            assertTrue(normalizer.extractIdentifier("https://www.wikidata.org/wiki/Q42/history", FORMATTER).isEmpty());
            assertTrue(normalizer.extractIdentifier("https://www.wikidata.org/wiki", FORMATTER).isEmpty());
        }

        @Test
        @DisplayName("Should reject a formatter without placeholder")
        void rejectsFormatter() {
            assertThrows(IllegalArgumentException.class,
                    () -> normalizer.extractIdentifier("https://www.wikidata.org/wiki/Q42", "https://www.wikidata.org/wiki/"));
        }
    }
}

package com.entity.linker.normalization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Tokenizer Tests")
class TokenizerTest {

    private final Tokenizer tokenizer = Tokenizer.defaults();

    @Test
    @DisplayName("Should drop stop words and name particles")
    void dropsStopWords() {
        assertEquals(Set.of("john", "neumann"), tokenizer.tokens("Dr. John von Neumann"));
        assertEquals(Set.of("art", "fugue"), tokenizer.tokens("The Art of the Fugue"));
    }

    @Test
    @DisplayName("Should drop tokens shorter than the minimum length")
    void dropsShortTokens() {
        assertEquals(Set.of("bach"), tokenizer.tokens("J. S. Bach"));
    }

    @Test
    @DisplayName("Should keep tokens in order of first occurrence without duplicates")
    void orderedDistinct() {
        assertEquals(List.of("new", "york", "city"), List.copyOf(tokenizer.tokens("New York, New York City")));
    }

    @Test
    @DisplayName("Should union the tokens of every value")
    void unionOfValues() {
        assertEquals(Set.of("charles", "hartshorne", "chuck"),
                tokenizer.tokens(List.of("Charles Hartshorne", "Chuck Hartshorne")));
    }

    @Test
    @DisplayName("Tokenizer without stop words should keep particles")
    void withoutStopWords() {
        assertTrue(Tokenizer.withoutStopWords().tokens("Ludwig van Beethoven").contains("van"));
    }

    @Test
    @DisplayName("Should fail on a missing stop word resource")
    void missingResource() {
        assertThrows(IllegalStateException.class, () -> Tokenizer.loadStopWords("/stopwords/missing.txt"));
    }

    @Test
    @DisplayName("Should reject a minimum length below one")
    void rejectsMinLength() {
        assertThrows(IllegalArgumentException.class,
                () -> new Tokenizer(new NormalizationEngine(), Set.of(), 0));
    }
}

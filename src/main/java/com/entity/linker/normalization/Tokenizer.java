package com.entity.linker.normalization;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits text into comparison tokens: normalized, split on anything that is not a
 * letter, digit or mark, with short tokens and stop words removed.
 */
public class Tokenizer {

    public static final String ENGLISH_STOPWORDS = "/stopwords/english.txt";
    public static final String NAME_STOPWORDS = "/stopwords/names.txt";

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}\\p{M}]+");
    private static final int DEFAULT_MIN_LENGTH = 2;

    private final NormalizationEngine engine;
    private final Set<String> stopWords;
    private final int minLength;

    public Tokenizer(NormalizationEngine engine, Set<String> stopWords, int minLength) {
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be >= 1");
        }
        this.engine = engine;
        this.stopWords = Set.copyOf(stopWords);
        this.minLength = minLength;
    }

    /**
     * Tokenizer over the default normalization rules with English and name stop words.
     */
    public static Tokenizer defaults() {
        Set<String> stopWords = new HashSet<>(loadStopWords(ENGLISH_STOPWORDS));
        stopWords.addAll(loadStopWords(NAME_STOPWORDS));
        return new Tokenizer(DefaultNormalizationRules.createDefaultEngine(), stopWords, DEFAULT_MIN_LENGTH);
    }

    /**
     * Tokenizer without stop words.
     */
    public static Tokenizer withoutStopWords() {
        return new Tokenizer(DefaultNormalizationRules.createDefaultEngine(), Set.of(), DEFAULT_MIN_LENGTH);
    }

    /**
     * Returns the distinct tokens of the text in order of first occurrence.
     */
    public Set<String> tokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        String normalized = engine.normalize(text);
        if (normalized.isEmpty()) {
            return tokens;
        }
        for (String token : SEPARATOR.split(normalized)) {
            if (token.codePointCount(0, token.length()) >= minLength && !stopWords.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Returns the union of the tokens of every value.
     */
    public Set<String> tokens(Iterable<String> values) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String value : values) {
            tokens.addAll(tokens(value));
        }
        return tokens;
    }

    public Set<String> getStopWords() {
        return stopWords;
    }

    /**
     * Loads a stop word list from the classpath: one word per line, {@code #} starts a comment.
     */
    public static Set<String> loadStopWords(String resource) {
        InputStream in = Tokenizer.class.getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Stop word list not found on classpath: " + resource);
        }
        Set<String> words = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.strip();
                if (!word.isEmpty() && !word.startsWith("#")) {
                    words.add(word);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stop words: " + resource, e);
        }
        return words;
    }
}

package com.entity.linker.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes URLs so that trivially different spellings of the same link compare equal.
 *
 * <p>Normalization adds a missing scheme, maps {@code http} to {@code https}, lowercases
 * the host, drops {@code www.}, {@code m.} and {@code mobile.} host prefixes, default ports,
 * fragments and trailing slashes. Path and query keep their case.</p>
 */
public class UrlNormalizer {
    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final List<String> HOST_PREFIXES = List.of("www.", "m.", "mobile.");
    private static final String PLACEHOLDER = "$1";
    private static final String PLACEHOLDER_MARKER = "zzlinkeridzz";

    private static final Set<String> TOP_LEVEL_DOMAINS = Set.of(
            "com", "org", "net", "edu", "gov", "info", "biz", "io", "co", "uk", "de", "fr",
            "it", "es", "nl", "be", "ch", "at", "se", "no", "dk", "fi", "pl", "ru", "jp",
            "cn", "br", "ca", "au", "us", "eu", "fm", "tv", "me");

    private static final Set<String> URL_STOPWORDS = Set.of(
            "http", "https", "www", "html", "htm", "php", "aspx", "index", "wiki", "page",
            "id", "en", "artist", "artists", "user", "users", "profile", "people", "person");

    /**
     * Returns the canonical form of a URL, or empty when the input is not a usable URL.
     */
    public Optional<String> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String candidate = raw.strip();
        if (!SCHEME.matcher(candidate).matches()) {
            candidate = "https://" + candidate;
        }

        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            log.debug("url.invalid value='{}' reason={}", raw, e.getMessage());
            return Optional.empty();
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            log.debug("url.invalid value='{}' reason=no host", raw);
            return Optional.empty();
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (scheme.equals("http")) {
            scheme = "https";
        }
        host = stripHostPrefixes(host.toLowerCase(Locale.ROOT));

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        int port = uri.getPort();
        if (port > 0 && port != 80 && port != 443) {
            sb.append(':').append(port);
        }
        String path = uri.getRawPath();
        if (path != null) {
            sb.append(stripTrailingSlashes(path));
        }
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            sb.append('?').append(uri.getRawQuery());
        }
        return Optional.of(sb.toString());
    }

    /**
     * Returns the host of a URL after normalization, or empty for invalid input.
     */
    public Optional<String> host(String raw) {
        return normalize(raw).map(url -> URI.create(url).getHost());
    }

    /**
     * Splits a URL into meaningful tokens: domain labels without top-level domains,
     * path segments and query words, minus common URL noise words.
     */
    public Set<String> tokens(String raw) {
        Set<String> tokens = new LinkedHashSet<>();
        Optional<String> normalized = normalize(raw);
        if (normalized.isEmpty()) {
            return tokens;
        }
        URI uri = URI.create(normalized.get());
        for (String label : uri.getHost().split("\\.")) {
            if (!TOP_LEVEL_DOMAINS.contains(label)) {
                addTokens(tokens, label);
            }
        }
        if (uri.getPath() != null) {
            addTokens(tokens, uri.getPath());
        }
        if (uri.getQuery() != null) {
            addTokens(tokens, uri.getQuery());
        }
        return tokens;
    }

    /**
     * Extracts an identifier from a URL following a formatter pattern in which
     * {@code $1} marks the identifier, e.g. {@code https://www.wikidata.org/wiki/$1}.
     *
     * @return the identifier, or empty when the URL does not follow the formatter
     */
    public Optional<String> extractIdentifier(String raw, String formatterUrl) {
        if (formatterUrl == null || !formatterUrl.contains(PLACEHOLDER)) {
            throw new IllegalArgumentException("formatter URL must contain " + PLACEHOLDER + ": " + formatterUrl);
        }
        Optional<String> url = normalize(raw);
        Optional<String> formatter = normalize(formatterUrl.replace(PLACEHOLDER, PLACEHOLDER_MARKER));
        if (url.isEmpty() || formatter.isEmpty()) {
            return Optional.empty();
        }
        int marker = formatter.get().indexOf(PLACEHOLDER_MARKER);
        if (marker < 0) {
            return Optional.empty();
        }
        String prefix = formatter.get().substring(0, marker);
        String suffix = formatter.get().substring(marker + PLACEHOLDER_MARKER.length());
        String value = url.get();
        if (!value.startsWith(prefix) || !value.endsWith(suffix)
                || value.length() <= prefix.length() + suffix.length()) {
            return Optional.empty();
        }
        String id = value.substring(prefix.length(), value.length() - suffix.length());
        return id.contains("/") ? Optional.empty() : Optional.of(id);
    }

    private static void addTokens(Set<String> tokens, String text) {
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() > 1 && !URL_STOPWORDS.contains(token)) {
                tokens.add(token);
            }
        }
    }

    private static String stripHostPrefixes(String host) {
        for (String prefix : HOST_PREFIXES) {
            if (host.startsWith(prefix) && host.length() > prefix.length()) {
                return host.substring(prefix.length());
            }
        }
        return host;
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }
}

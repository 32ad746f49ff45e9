package com.entity.linker.blocking;

import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.core.model.Entity;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Coarse name blocking with two complementary key types per name value:
 * <ul>
 *   <li><b>Prefix keys</b>: first 3 characters (e.g. {@code pfx:cha})</li>
 *   <li><b>Sorted token keys</b>: first 2 tokens in alphabetical order (e.g. {@code tok:charles|hartshorne}),
 *       which survives given-name/family-name reordering</li>
 * </ul>
 * Higher recall than first-token blocking at the cost of larger blocks. A prefix block
 * still grows with the collection, so on very large collections prefer first-token or
 * token-index blocking.
 */
public class PrefixBlockingKeyStrategy implements BlockingKeyStrategy {

    public static final String NAME = "prefix";

    private final String attribute;

    public PrefixBlockingKeyStrategy() {
        this(AttributeKeys.NAME);
    }

    public PrefixBlockingKeyStrategy(String attribute) {
        this.attribute = attribute;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> keys(Entity entity) {
        Set<String> keys = new LinkedHashSet<>();
        for (String value : entity.values(attribute)) {
            addKeys(keys, value);
        }
        return keys;
    }

    private static void addKeys(Set<String> keys, String value) {
        String cleaned = value.toLowerCase(Locale.ROOT).strip();
        if (cleaned.isEmpty()) {
            return;
        }

        keys.add("pfx:" + cleaned.substring(0, Math.min(3, cleaned.length())));

        String[] tokens = cleaned.split("\\s+");
        if (tokens.length >= 2) {
            String[] sorted = Arrays.copyOf(tokens, tokens.length);
            Arrays.sort(sorted);
            keys.add("tok:" + sorted[0] + "|" + sorted[1]);
        } else {
            keys.add("tok:" + tokens[0]);
        }
    }
}

package com.entity.linker.blocking;

import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.core.model.Entity;
import com.entity.linker.normalization.Tokenizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory full-text lookup: ranks targets by the number of name tokens they share
 * with the source and returns the best {@code limit} of them.
 *
 * <p>Recovers candidates that exact-key blocking misses, e.g. reordered or partially
 * misspelled names. Tokens shared by more than {@code maxPostings} targets are ignored.</p>
 */
public class TokenIndexBlockingFunction implements BlockingFunction {

    public static final String NAME = "token-index";
    public static final int DEFAULT_LIMIT = 5;
    public static final int DEFAULT_MAX_POSTINGS = 10_000;

    private final List<Entity> targets;
    private final Tokenizer tokenizer;
    private final String attribute;
    private final int limit;
    private final int maxPostings;
    private final Map<String, List<Integer>> postings;

    public TokenIndexBlockingFunction(List<Entity> targets, Tokenizer tokenizer) {
        this(targets, tokenizer, AttributeKeys.NAME, DEFAULT_LIMIT, DEFAULT_MAX_POSTINGS);
    }

    public TokenIndexBlockingFunction(List<Entity> targets, Tokenizer tokenizer, String attribute,
                                      int limit, int maxPostings) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (maxPostings <= 0) {
            throw new IllegalArgumentException("maxPostings must be > 0");
        }
        this.targets = List.copyOf(targets);
        this.tokenizer = tokenizer;
        this.attribute = attribute;
        this.limit = limit;
        this.maxPostings = maxPostings;
        this.postings = new HashMap<>();
        for (int i = 0; i < this.targets.size(); i++) {
            for (String token : tokenizer.tokens(this.targets.get(i).values(attribute))) {
                postings.computeIfAbsent(token, k -> new ArrayList<>()).add(i);
            }
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> candidates(Entity source) {
        Map<Integer, Integer> shared = new HashMap<>();
        for (String token : tokenizer.tokens(source.values(attribute))) {
            List<Integer> positions = postings.get(token);
            if (positions == null || positions.size() > maxPostings) {
                continue;
            }
            for (int position : positions) {
                shared.merge(position, 1, Integer::sum);
            }
        }

        Comparator<Map.Entry<Integer, Integer>> byRank = Map.Entry.<Integer, Integer>comparingByValue().reversed();
        return shared.entrySet().stream()
                .sorted(byRank.thenComparing(e -> targets.get(e.getKey()).getId()))
                .limit(limit)
                .map(e -> targets.get(e.getKey()).getId())
                .toList();
    }
}

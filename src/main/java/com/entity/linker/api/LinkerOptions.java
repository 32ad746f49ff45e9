package com.entity.linker.api;

import com.entity.linker.baseline.LinkingRules;
import com.entity.linker.blocking.FirstTokenBlockingKeyStrategy;
import com.entity.linker.blocking.PrefixBlockingKeyStrategy;
import com.entity.linker.blocking.TokenIndexBlockingFunction;
import com.entity.linker.cache.CacheConfig;
import com.entity.linker.classifier.ClassifierOptions;
import com.entity.linker.classifier.ClassifierType;
import com.entity.linker.classifier.CrossValidator;
import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.decision.DecisionEngine;
import com.entity.linker.decision.PostClassificationRules;
import com.entity.linker.features.FeatureSets;

import java.util.List;
import java.util.Set;

/**
 * Options of an {@link EntityLinker} run: blocking, features, classifier, thresholds
 * and execution settings.
 */
public class LinkerOptions {

    /** Prefix of the exact-attribute blocking strategies, e.g. {@code exact-url}. */
    public static final String EXACT_STRATEGY_PREFIX = "exact-";

    private static final List<String> DEFAULT_BLOCKING = List.of(FirstTokenBlockingKeyStrategy.NAME);

    private final List<String> blockingStrategies;
    private final String featureSet;
    private final ClassifierType classifier;
    private final ClassifierOptions classifierOptions;
    private final double matchThreshold;
    private final Double undecidedThreshold;
    private final int folds;
    private final long seed;
    private final int parallelism;
    private final String ruleFastPath;
    private final List<String> postRules;
    private final Set<String> requiredAttributes;
    private final int tokenIndexLimit;
    private final CacheConfig cacheConfig;

    private LinkerOptions(Builder builder) {
        this.blockingStrategies = List.copyOf(builder.blockingStrategies);
        this.featureSet = builder.featureSet;
        this.classifier = builder.classifier;
        this.classifierOptions = builder.classifierOptions;
        this.matchThreshold = builder.matchThreshold;
        this.undecidedThreshold = builder.undecidedThreshold;
        this.folds = builder.folds;
        this.seed = builder.seed;
        this.parallelism = builder.parallelism;
        this.ruleFastPath = builder.ruleFastPath;
        this.postRules = List.copyOf(builder.postRules);
        this.requiredAttributes = Set.copyOf(builder.requiredAttributes);
        this.tokenIndexLimit = builder.tokenIndexLimit;
        this.cacheConfig = builder.cacheConfig;
    }

    public List<String> getBlockingStrategies() {
        return blockingStrategies;
    }

    public String getFeatureSet() {
        return featureSet;
    }

    public ClassifierType getClassifier() {
        return classifier;
    }

    public ClassifierOptions getClassifierOptions() {
        return classifierOptions;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    /**
     * Lower bound of the undecided band, or {@code null} when every score is decided.
     */
    public Double getUndecidedThreshold() {
        return undecidedThreshold;
    }

    public int getFolds() {
        return folds;
    }

    public long getSeed() {
        return seed;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Name of the rule that accepts pairs before the classifier, or {@code null} when disabled.
     */
    public String getRuleFastPath() {
        return ruleFastPath;
    }

    public boolean isRuleFastPathEnabled() {
        return ruleFastPath != null;
    }

    public List<String> getPostRules() {
        return postRules;
    }

    public Set<String> getRequiredAttributes() {
        return requiredAttributes;
    }

    public int getTokenIndexLimit() {
        return tokenIndexLimit;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static LinkerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> blockingStrategies = DEFAULT_BLOCKING;
        private String featureSet = FeatureSets.DEFAULT;
        private ClassifierType classifier = ClassifierType.NAIVE_BAYES;
        private ClassifierOptions classifierOptions = ClassifierOptions.defaults();
        private double matchThreshold = DecisionEngine.DEFAULT_MATCH_THRESHOLD;
        private Double undecidedThreshold;
        private int folds = CrossValidator.DEFAULT_FOLDS;
        private long seed = ClassifierOptions.DEFAULT_SEED;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private String ruleFastPath;
        private List<String> postRules = List.of();
        private Set<String> requiredAttributes = Set.of(AttributeKeys.NAME);
        private int tokenIndexLimit = TokenIndexBlockingFunction.DEFAULT_LIMIT;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        /**
         * Blocking strategies by name: {@code first-token}, {@code prefix},
         * {@code token-index} or {@code exact-<attribute>}.
         */
        public Builder blockingStrategies(List<String> blockingStrategies) {
            if (blockingStrategies == null || blockingStrategies.isEmpty()) {
                throw new IllegalArgumentException("At least one blocking strategy is required");
            }
            for (String strategy : blockingStrategies) {
                if (!isKnownBlockingStrategy(strategy)) {
                    throw new IllegalArgumentException("Unknown blocking strategy: " + strategy);
                }
            }
            this.blockingStrategies = blockingStrategies;
            return this;
        }

        public Builder featureSet(String featureSet) {
            if (!FeatureSets.names().contains(featureSet)) {
                throw new IllegalArgumentException("Unknown feature set: " + featureSet
                        + ", expected one of " + FeatureSets.names());
            }
            this.featureSet = featureSet;
            return this;
        }

        public Builder classifier(ClassifierType classifier) {
            if (classifier == null) {
                throw new IllegalArgumentException("classifier is required");
            }
            this.classifier = classifier;
            return this;
        }

        public Builder classifierOptions(ClassifierOptions classifierOptions) {
            if (classifierOptions == null) {
                throw new IllegalArgumentException("classifierOptions is required");
            }
            this.classifierOptions = classifierOptions;
            return this;
        }

        public Builder matchThreshold(double matchThreshold) {
            validateThreshold(matchThreshold, "matchThreshold");
            this.matchThreshold = matchThreshold;
            return this;
        }

        public Builder undecidedThreshold(Double undecidedThreshold) {
            if (undecidedThreshold != null) {
                validateThreshold(undecidedThreshold, "undecidedThreshold");
            }
            this.undecidedThreshold = undecidedThreshold;
            return this;
        }

        public Builder folds(int folds) {
            if (folds < 2) {
                throw new IllegalArgumentException("folds must be >= 2");
            }
            this.folds = folds;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be > 0");
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Enables the rule fast path with the named rule; {@code null} disables it.
         */
        public Builder ruleFastPath(String ruleName) {
            if (ruleName != null && !LinkingRules.names().contains(ruleName)) {
                throw new IllegalArgumentException("Unknown linking rule: " + ruleName
                        + ", expected one of " + LinkingRules.names());
            }
            this.ruleFastPath = ruleName;
            return this;
        }

        public Builder postRules(List<String> postRules) {
            for (String rule : postRules) {
                if (!PostClassificationRules.names().contains(rule)) {
                    throw new IllegalArgumentException("Unknown post-classification rule: " + rule);
                }
            }
            this.postRules = postRules;
            return this;
        }

        public Builder requiredAttributes(Set<String> requiredAttributes) {
            this.requiredAttributes = requiredAttributes;
            return this;
        }

        public Builder tokenIndexLimit(int tokenIndexLimit) {
            if (tokenIndexLimit <= 0) {
                throw new IllegalArgumentException("tokenIndexLimit must be > 0");
            }
            this.tokenIndexLimit = tokenIndexLimit;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig != null ? cacheConfig : CacheConfig.disabled();
            return this;
        }

        public LinkerOptions build() {
            if (undecidedThreshold != null && undecidedThreshold > matchThreshold) {
                throw new IllegalArgumentException("undecidedThreshold must be <= matchThreshold");
            }
            return new LinkerOptions(this);
        }

        private static boolean isKnownBlockingStrategy(String name) {
            return FirstTokenBlockingKeyStrategy.NAME.equals(name)
                    || PrefixBlockingKeyStrategy.NAME.equals(name)
                    || TokenIndexBlockingFunction.NAME.equals(name)
                    || (name != null && name.startsWith(EXACT_STRATEGY_PREFIX)
                    && name.length() > EXACT_STRATEGY_PREFIX.length());
        }

        private static void validateThreshold(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "LinkerOptions{" +
                "blockingStrategies=" + blockingStrategies +
                ", featureSet='" + featureSet + '\'' +
                ", classifier=" + classifier.id() +
                ", matchThreshold=" + matchThreshold +
                ", undecidedThreshold=" + undecidedThreshold +
                ", folds=" + folds +
                ", seed=" + seed +
                ", parallelism=" + parallelism +
                ", ruleFastPath=" + ruleFastPath +
                ", postRules=" + postRules +
                '}';
    }
}

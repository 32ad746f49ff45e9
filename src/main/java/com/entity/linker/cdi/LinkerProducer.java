package com.entity.linker.cdi;

import com.entity.linker.api.EntityLinker;
import com.entity.linker.api.LinkerOptions;
import com.entity.linker.cache.CacheConfig;
import com.entity.linker.classifier.ClassifierOptions;
import com.entity.linker.classifier.ClassifierType;
import com.entity.linker.classifier.ModelStore;
import com.entity.linker.classifier.VotingMode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * CDI producer that configures the linker from MicroProfile Config properties.
 *
 * <pre>
 * entity-linker:
 *   blocking:
 *     strategies: first-token,token-index
 *   classifier:
 *     algorithm: multi_layer_perceptron
 *   decision:
 *     threshold: 0.5
 * </pre>
 *
 * <p>Every property has a default, so an empty configuration yields a naive Bayes linker
 * with first-token blocking and the default feature set.</p>
 */
@ApplicationScoped
public class LinkerProducer {

    private static final Logger log = LoggerFactory.getLogger(LinkerProducer.class);

    // ── Blocking ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linker.blocking.strategies", defaultValue = "first-token")
    List<String> blockingStrategies;

    @Inject
    @ConfigProperty(name = "entity-linker.blocking.token-index-limit", defaultValue = "5")
    int tokenIndexLimit;

    // ── Features ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linker.features.set", defaultValue = "default")
    String featureSet;

    @Inject
    @ConfigProperty(name = "entity-linker.normalization.required-attributes", defaultValue = "name")
    List<String> requiredAttributes;

    // ── Classifier ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.algorithm", defaultValue = "naive_bayes")
    String algorithm;

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.binarize-threshold", defaultValue = "0.1")
    double binarizeThreshold;

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.epochs", defaultValue = "100")
    int epochs;

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.learning-rate", defaultValue = "0.01")
    double learningRate;

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.regularization", defaultValue = "0.01")
    double regularization;

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.hidden-layers", defaultValue = "128,32")
    List<Integer> hiddenLayers;

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.forest-size", defaultValue = "500")
    int forestSize;

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.max-tree-depth", defaultValue = "12")
    int maxTreeDepth;

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.voting", defaultValue = "soft")
    String votingMode;

    @Inject
    @ConfigProperty(name = "entity-linker.classifier.voting-members",
            defaultValue = "naive_bayes,svm,single_layer_perceptron,multi_layer_perceptron,random_forest")
    List<String> votingMembers;

    // ── Evaluation ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linker.evaluation.folds", defaultValue = "5")
    int folds;

    @Inject
    @ConfigProperty(name = "entity-linker.seed", defaultValue = "1269")
    long seed;

    // ── Decision ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linker.decision.threshold", defaultValue = "0.5")
    double matchThreshold;

    @Inject
    @ConfigProperty(name = "entity-linker.decision.undecided-threshold")
    Optional<Double> undecidedThreshold;

    @Inject
    @ConfigProperty(name = "entity-linker.decision.rule-fast-path")
    Optional<String> ruleFastPath;

    @Inject
    @ConfigProperty(name = "entity-linker.decision.post-rules")
    Optional<List<String>> postRules;

    // ── Execution ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linker.parallelism", defaultValue = "0")
    int parallelism;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linker.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "entity-linker.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "entity-linker.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public LinkerOptions linkerOptions() {
        ClassifierOptions classifierOptions = ClassifierOptions.builder()
                .binarizeThreshold(binarizeThreshold)
                .epochs(epochs)
                .learningRate(learningRate)
                .regularization(regularization)
                .hiddenLayers(hiddenLayers)
                .forestSize(forestSize)
                .maxTreeDepth(maxTreeDepth)
                .votingMode(VotingMode.fromId(votingMode))
                .votingMembers(votingMembers.stream().map(ClassifierType::fromId).toList())
                .seed(seed)
                .build();

        LinkerOptions options = LinkerOptions.builder()
                .blockingStrategies(blockingStrategies)
                .tokenIndexLimit(tokenIndexLimit)
                .featureSet(featureSet)
                .requiredAttributes(Set.copyOf(requiredAttributes))
                .classifier(ClassifierType.fromId(algorithm))
                .classifierOptions(classifierOptions)
                .folds(folds)
                .seed(seed)
                .matchThreshold(matchThreshold)
                .undecidedThreshold(undecidedThreshold.orElse(null))
                .ruleFastPath(ruleFastPath.filter(s -> !s.isBlank()).orElse(null))
                .postRules(postRules.orElse(List.of()))
                .parallelism(parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors())
                .cacheConfig(cacheEnabled ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true) : CacheConfig.disabled())
                .build();
        log.info("linker.options.produced options={}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public EntityLinker entityLinker(LinkerOptions options) {
        return EntityLinker.builder().options(options).build();
    }

    public void closeLinker(@Disposes EntityLinker linker) {
        log.info("linker.closing");
        linker.close();
    }

    @Produces
    @ApplicationScoped
    public ModelStore modelStore() {
        return new ModelStore();
    }
}

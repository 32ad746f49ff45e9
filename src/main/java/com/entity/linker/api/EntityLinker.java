package com.entity.linker.api;

import com.entity.linker.baseline.LinkingRule;
import com.entity.linker.baseline.LinkingRules;
import com.entity.linker.baseline.RuleBasedLinker;
import com.entity.linker.blocking.Blocker;
import com.entity.linker.blocking.BlockingFunction;
import com.entity.linker.blocking.BlockingKeyStrategy;
import com.entity.linker.blocking.BlockingResult;
import com.entity.linker.blocking.ExactAttributeBlockingKeyStrategy;
import com.entity.linker.blocking.FirstTokenBlockingKeyStrategy;
import com.entity.linker.blocking.PrefixBlockingKeyStrategy;
import com.entity.linker.blocking.TokenIndexBlockingFunction;
import com.entity.linker.classifier.Classifier;
import com.entity.linker.classifier.Classifiers;
import com.entity.linker.classifier.CrossValidator;
import com.entity.linker.classifier.EvaluationReport;
import com.entity.linker.classifier.Model;
import com.entity.linker.classifier.Prediction;
import com.entity.linker.classifier.ScoredPair;
import com.entity.linker.classifier.ScoringResult;
import com.entity.linker.classifier.SupervisedLinker;
import com.entity.linker.core.exception.DataException;
import com.entity.linker.core.exception.SchemaMismatchException;
import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.CollectionTag;
import com.entity.linker.core.model.Entity;
import com.entity.linker.core.model.EntityError;
import com.entity.linker.core.model.FeatureSchema;
import com.entity.linker.core.model.FeatureVector;
import com.entity.linker.core.model.LabeledPair;
import com.entity.linker.core.model.LabeledVector;
import com.entity.linker.core.model.LinkDecision;
import com.entity.linker.core.model.PairError;
import com.entity.linker.decision.ConflictResolution;
import com.entity.linker.decision.ConflictResolver;
import com.entity.linker.decision.DecisionEngine;
import com.entity.linker.decision.PostClassificationRule;
import com.entity.linker.decision.PostClassificationRules;
import com.entity.linker.features.CachingOccupationHierarchy;
import com.entity.linker.features.ExtractionResult;
import com.entity.linker.features.FeatureExtractor;
import com.entity.linker.features.FeatureSets;
import com.entity.linker.features.OccupationHierarchy;
import com.entity.linker.logging.LogContext;
import com.entity.linker.metrics.MetricsService;
import com.entity.linker.metrics.NoOpMetricsService;
import com.entity.linker.normalization.EntityNormalizer;
import com.entity.linker.normalization.Tokenizer;
import com.entity.linker.parallel.WorkerPool;
import com.entity.linker.tracing.NoOpTracingService;
import com.entity.linker.tracing.Span;
import com.entity.linker.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point of the linker: normalizes two collections, blocks them into candidate
 * pairs, extracts feature vectors and decides which pairs refer to the same entity,
 * either with a linking rule or with a trained model.
 *
 * <pre>
 * try (EntityLinker linker = EntityLinker.builder()
 *         .options(LinkerOptions.builder().classifier(ClassifierType.NAIVE_BAYES).build())
 *         .build()) {
 *     TrainingSet training = linker.buildTrainingSet(sources, targets, confirmedLinks);
 *     Model model = linker.train(training.examples());
 *     LinkingResult result = linker.link(model, sources, targets);
 * }
 * </pre>
 *
 * <p>Blocking, extraction and scoring run on a worker pool sized by
 * {@link LinkerOptions#getParallelism()}; all calls are synchronous.</p>
 */
public class EntityLinker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntityLinker.class);

    private final LinkerOptions options;
    private final EntityNormalizer normalizer;
    private final Tokenizer tokenizer;
    private final OccupationHierarchy occupationHierarchy;
    private final FeatureExtractor extractor;
    private final DecisionEngine decisionEngine;
    private final ConflictResolver conflictResolver;
    private final List<PostClassificationRule> postRules;
    private final TrainingSetBuilder trainingSetBuilder;
    private final WorkerPool pool;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private EntityLinker(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.normalizer = builder.normalizer != null
                ? builder.normalizer : EntityNormalizer.defaults(options.getRequiredAttributes());
        this.tokenizer = builder.tokenizer != null ? builder.tokenizer : Tokenizer.defaults();

        OccupationHierarchy hierarchy = builder.occupationHierarchy != null
                ? builder.occupationHierarchy : OccupationHierarchy.FLAT;
        this.occupationHierarchy = options.getCacheConfig().enabled()
                ? new CachingOccupationHierarchy(hierarchy, options.getCacheConfig()) : hierarchy;
        this.extractor = new FeatureExtractor(FeatureSets.create(options.getFeatureSet(), occupationHierarchy));

        this.decisionEngine = new DecisionEngine(options.getMatchThreshold(), options.getUndecidedThreshold());
        this.conflictResolver = new ConflictResolver();
        this.postRules = options.getPostRules().stream()
                .map(name -> PostClassificationRules.byName(name, tokenizer))
                .toList();
        this.trainingSetBuilder = new TrainingSetBuilder();
        this.pool = new WorkerPool(options.getParallelism());
        log.info("linker.created options={}", options);
    }

    public LinkerOptions getOptions() {
        return options;
    }

    public FeatureSchema getSchema() {
        return extractor.getSchema();
    }

    public OccupationHierarchy getOccupationHierarchy() {
        return occupationHierarchy;
    }

    // ── Normalization ─────────────────────────────────────────

    /**
     * Normalizes a collection. Entities with a missing required attribute, a wrong
     * collection tag or a duplicate id are excluded and reported.
     */
    public NormalizedEntities normalize(List<Entity> entities, CollectionTag collection) {
        List<Entity> normalized = new ArrayList<>(entities.size());
        List<EntityError> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Entity entity : entities) {
            String error = null;
            if (entity.getCollection() != collection) {
                error = "Entity belongs to " + entity.getCollection() + ", expected " + collection;
            } else if (!seen.add(entity.getId())) {
                error = "Duplicate entity id " + entity.getId();
            } else {
                try {
                    normalized.add(normalizer.normalize(entity));
                } catch (DataException e) {
                    error = e.getMessage();
                }
            }
            if (error != null) {
                log.warn("entity.rejected id={} collection={} reason={}", entity.getId(), collection, error);
                metricsService.recordEntityRejected(collection);
                errors.add(new EntityError(entity.getId(), collection, error));
            }
        }
        log.info("normalization.completed collection={} entities={} rejected={}",
                collection, normalized.size(), errors.size());
        return new NormalizedEntities(normalized, errors);
    }

    // ── Blocking ──────────────────────────────────────────────

    /**
     * Blocks two normalized collections into candidate pairs.
     */
    public BlockingResult block(List<Entity> sources, List<Entity> targets) {
        try (Span span = tracingService.startSpan("linker.block")) {
            span.setAttribute("sources", sources.size());
            span.setAttribute("targets", targets.size());
            BlockingResult result = createBlocker(targets).block(sources, targets, pool);
            result.candidatesPerStrategy().forEach(metricsService::recordCandidates);
            span.setAttribute("candidates", result.size());
            span.setStatus(Span.SpanStatus.OK);
            return result;
        }
    }

    Blocker createBlocker(List<Entity> targets) {
        List<BlockingKeyStrategy> strategies = new ArrayList<>();
        List<BlockingFunction> functions = new ArrayList<>();
        for (String name : options.getBlockingStrategies()) {
            if (FirstTokenBlockingKeyStrategy.NAME.equals(name)) {
                strategies.add(new FirstTokenBlockingKeyStrategy());
            } else if (PrefixBlockingKeyStrategy.NAME.equals(name)) {
                strategies.add(new PrefixBlockingKeyStrategy());
            } else if (TokenIndexBlockingFunction.NAME.equals(name)) {
                functions.add(new TokenIndexBlockingFunction(targets, tokenizer, AttributeKeys.NAME,
                        options.getTokenIndexLimit(), TokenIndexBlockingFunction.DEFAULT_MAX_POSTINGS));
            } else {
                strategies.add(new ExactAttributeBlockingKeyStrategy(
                        name.substring(LinkerOptions.EXACT_STRATEGY_PREFIX.length())));
            }
        }
        return new Blocker(strategies, functions);
    }

    // ── Feature extraction ────────────────────────────────────

    public ExtractionResult extract(List<CandidatePair> pairs, List<Entity> sources, List<Entity> targets) {
        return extract(pairs, index(sources), index(targets));
    }

    private ExtractionResult extract(List<CandidatePair> pairs, Map<String, Entity> sources,
                                     Map<String, Entity> targets) {
        try (Span span = tracingService.startSpan("linker.extract")) {
            span.setAttribute("pairs", pairs.size());
            ExtractionResult result = extractor.extractAll(pairs, sources, targets, pool);
            metricsService.recordFeaturesExtracted(result.vectors().size());
            result.errors().forEach(e -> metricsService.recordPairError(e.stage()));
            span.setStatus(Span.SpanStatus.OK);
            return result;
        }
    }

    // ── Rule-based linking ────────────────────────────────────

    /**
     * Links with the configured fast-path rule, or {@link LinkingRules#perfectName()} when none is set.
     */
    public LinkingResult linkWithRules(List<Entity> sources, List<Entity> targets) {
        LinkingRule rule = options.isRuleFastPathEnabled()
                ? LinkingRules.byName(options.getRuleFastPath()) : LinkingRules.perfectName();
        return linkWithRules(sources, targets, rule);
    }

    /**
     * Links raw collections with a single rule, without any training.
     */
    public LinkingResult linkWithRules(List<Entity> sources, List<Entity> targets, LinkingRule rule) {
        requireRuleFeatures(rule);
        RuleBasedLinker linker = new RuleBasedLinker(rule);
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forLinking(runId).with(LogContext.STRATEGY, linker.strategyId())) {
            Prepared prepared = prepare(sources, targets);
            ExtractionResult extraction = extract(prepared.blocking().pairs(), prepared.sources(), prepared.targets());
            List<LinkDecision> decisions = new ArrayList<>(extraction.vectors().size());
            for (FeatureVector vector : extraction.vectors()) {
                decisions.add(linker.link(vector));
            }
            return finish(decisions, extraction.errors(), prepared.entityErrors());
        }
    }

    // ── Training ──────────────────────────────────────────────

    /**
     * Builds labeled vectors from confirmed links: confirmed pairs are matches, other
     * candidates of the same sources are non-matches.
     *
     * @param confirmed source id to target id
     */
    public TrainingSet buildTrainingSet(List<Entity> sources, List<Entity> targets, Map<String, String> confirmed) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forTraining(runId, options.getClassifier().id())) {
            Prepared prepared = prepare(sources, targets);
            List<LabeledPair> labeled = trainingSetBuilder.label(prepared.blocking().pairs(), confirmed,
                    prepared.sources().keySet(), prepared.targets().keySet());

            Map<CandidatePair, Boolean> labels = new HashMap<>();
            List<CandidatePair> pairs = new ArrayList<>(labeled.size());
            for (LabeledPair pair : labeled) {
                labels.put(pair.pair(), pair.match());
                pairs.add(pair.pair());
            }
            ExtractionResult extraction = extract(pairs, prepared.sources(), prepared.targets());
            List<LabeledVector> examples = new ArrayList<>(extraction.vectors().size());
            for (FeatureVector vector : extraction.vectors()) {
                examples.add(new LabeledVector(vector, labels.get(vector.getPair())));
            }
            return new TrainingSet(examples, extraction.errors(), prepared.entityErrors());
        }
    }

    /**
     * Trains the configured classifier.
     *
     * @throws com.entity.linker.core.exception.TrainingException if the examples cannot be trained on
     */
    public Model train(List<LabeledVector> examples) {
        Classifier classifier = Classifiers.create(options.getClassifier(), options.getClassifierOptions());
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forTraining(runId, classifier.type().id());
             Span span = tracingService.startStage("train", runId)) {
            span.setAttribute("algorithm", classifier.type().id());
            span.setAttribute("examples", examples.size());
            long start = System.nanoTime();
            try {
                Model model = classifier.fit(examples);
                metricsService.recordTrainingDuration(classifier.type(), Duration.ofNanos(System.nanoTime() - start));
                span.setStatus(Span.SpanStatus.OK);
                return model;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    /**
     * Cross-validates the configured classifier with the configured folds and seed.
     */
    public EvaluationReport evaluate(List<LabeledVector> examples) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forEvaluation(runId, options.getClassifier().id(), options.getFolds())) {
            return new CrossValidator(options.getMatchThreshold()).evaluate(options.getClassifier(),
                    options.getClassifierOptions(), examples, options.getFolds(), options.getSeed());
        }
    }

    // ── Supervised linking ────────────────────────────────────

    /**
     * Runs the full pipeline with a trained model.
     *
     * <p>When a rule fast path is configured, pairs accepted by the rule are decided by it
     * and skip the classifier. Post-classification rules adjust the remaining predictions
     * before thresholding. Conflicts are resolved last.</p>
     *
     * @throws SchemaMismatchException if the model was trained on a different feature schema
     */
    public LinkingResult link(Model model, List<Entity> sources, List<Entity> targets) {
        if (!model.getSchema().equals(extractor.getSchema())) {
            throw new SchemaMismatchException("Model features " + model.getSchema().names()
                    + " differ from feature set '" + options.getFeatureSet() + "' " + extractor.getSchema().names(),
                    extractor.getSchema());
        }
        SupervisedLinker supervised = new SupervisedLinker(model);
        RuleBasedLinker fastPath = null;
        if (options.isRuleFastPathEnabled()) {
            LinkingRule rule = LinkingRules.byName(options.getRuleFastPath());
            requireRuleFeatures(rule);
            fastPath = new RuleBasedLinker(rule);
        }

        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forLinking(runId).with(LogContext.STRATEGY, supervised.strategyId())) {
            Prepared prepared = prepare(sources, targets);
            ExtractionResult extraction = extract(prepared.blocking().pairs(), prepared.sources(), prepared.targets());

            List<LinkDecision> decisions = new ArrayList<>(extraction.vectors().size());
            List<FeatureVector> toScore = new ArrayList<>(extraction.vectors().size());
            for (FeatureVector vector : extraction.vectors()) {
                LinkDecision ruleDecision = fastPath != null ? fastPath.link(vector) : null;
                if (ruleDecision != null && ruleDecision.isAccepted()) {
                    decisions.add(ruleDecision);
                } else {
                    toScore.add(vector);
                }
            }

            List<PairError> pairErrors = new ArrayList<>(extraction.errors());
            ScoringResult scoring = score(supervised, toScore, runId);
            pairErrors.addAll(scoring.errors());
            for (ScoredPair scored : scoring.scored()) {
                Prediction prediction = PostClassificationRules.applyAll(postRules,
                        prepared.sources().get(scored.pair().sourceId()),
                        prepared.targets().get(scored.pair().targetId()),
                        scored.prediction());
                decisions.add(decisionEngine.decide(scored.pair(), prediction, supervised.strategyId()));
            }
            return finish(decisions, pairErrors, prepared.entityErrors());
        }
    }

    private ScoringResult score(SupervisedLinker supervised, List<FeatureVector> vectors, String runId) {
        try (Span span = tracingService.startStage("score", runId)) {
            span.setAttribute("vectors", vectors.size());
            long start = System.nanoTime();
            ScoringResult result = supervised.predict(vectors, pool);
            metricsService.recordScoringDuration(Duration.ofNanos(System.nanoTime() - start));
            result.errors().forEach(e -> metricsService.recordPairError(e.stage()));
            span.setStatus(Span.SpanStatus.OK);
            return result;
        }
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private Prepared prepare(List<Entity> sources, List<Entity> targets) {
        NormalizedEntities normalizedSources = normalize(sources, CollectionTag.SOURCE);
        NormalizedEntities normalizedTargets = normalize(targets, CollectionTag.TARGET);
        List<EntityError> entityErrors = new ArrayList<>(normalizedSources.errors());
        entityErrors.addAll(normalizedTargets.errors());
        BlockingResult blocking = block(normalizedSources.entities(), normalizedTargets.entities());
        return new Prepared(index(normalizedSources.entities()), index(normalizedTargets.entities()),
                blocking, entityErrors);
    }

    private LinkingResult finish(List<LinkDecision> decisions, List<PairError> pairErrors,
                                 List<EntityError> entityErrors) {
        ConflictResolution resolution = conflictResolver.resolve(decisions);
        resolution.decisions().forEach(d -> metricsService.recordDecision(d.label()));
        if (!resolution.warnings().isEmpty()) {
            metricsService.recordConflicts(resolution.warnings().size());
        }
        LinkingResult result = new LinkingResult(resolution.decisions(), pairErrors, entityErrors,
                resolution.warnings());
        log.info("linking.completed decisions={} accepted={} pairErrors={} entityErrors={} conflicts={}",
                result.decisions().size(), result.accepted().size(), pairErrors.size(),
                entityErrors.size(), resolution.warnings().size());
        return result;
    }

    private void requireRuleFeatures(LinkingRule rule) {
        for (LinkingRule.Condition condition : rule.getConditions()) {
            if (extractor.getSchema().indexOf(condition.feature()) < 0) {
                throw new SchemaMismatchException("Rule '" + rule.getName() + "' needs feature '"
                        + condition.feature() + "' which feature set '" + options.getFeatureSet()
                        + "' does not produce", extractor.getSchema());
            }
        }
    }

    private static Map<String, Entity> index(List<Entity> entities) {
        Map<String, Entity> byId = new LinkedHashMap<>();
        for (Entity entity : entities) {
            byId.put(entity.getId(), entity);
        }
        return byId;
    }

    private record Prepared(Map<String, Entity> sources, Map<String, Entity> targets,
                            BlockingResult blocking, List<EntityError> entityErrors) {
    }

    @Override
    public void close() {
        pool.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LinkerOptions options = LinkerOptions.defaults();
        private EntityNormalizer normalizer;
        private Tokenizer tokenizer;
        private OccupationHierarchy occupationHierarchy;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder options(LinkerOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom entity normalizer. Defaults to
         * {@link EntityNormalizer#defaults(Set)} with the required attributes of the options.
         */
        public Builder normalizer(EntityNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder tokenizer(Tokenizer tokenizer) {
            this.tokenizer = tokenizer;
            return this;
        }

        /**
         * Sets the occupation hierarchy used by the occupation feature.
         * Defaults to {@link OccupationHierarchy#FLAT}.
         */
        public Builder occupationHierarchy(OccupationHierarchy occupationHierarchy) {
            this.occupationHierarchy = occupationHierarchy;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public EntityLinker build() {
            if (options == null) {
                throw new IllegalStateException("LinkerOptions are required");
            }
            return new EntityLinker(this);
        }
    }
}

package com.entity.linker.classifier;

import com.entity.linker.core.exception.SchemaMismatchException;
import com.entity.linker.core.model.FeatureSchema;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Saves and loads {@link Model}s as JSON artifacts.
 *
 * <p>An artifact records the format version, algorithm, feature names, a hash of the
 * feature schema, the learned parameters and the training metadata. Loading against an
 * expected schema rejects artifacts trained on a different one.</p>
 */
public class ModelStore {
    private static final Logger log = LoggerFactory.getLogger(ModelStore.class);

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public ModelStore() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void save(Model model, Path path) throws IOException {
        ModelMetadata metadata = model.getMetadata();
        ModelArtifact artifact = new ModelArtifact(
                FORMAT_VERSION,
                model.getType().id(),
                model.getSchema().names(),
                model.getSchema().hash(),
                model.getParameters(),
                new ArtifactMetadata(
                        metadata.trainedAt().toString(),
                        metadata.trainingSetId(),
                        metadata.trainingSize(),
                        metadata.positiveCount(),
                        metadata.hyperparameters()));
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), artifact);
        log.info("model.saved algorithm={} path={} schemaHash={}", artifact.algorithm(), path, artifact.schemaHash());
    }

    /**
     * Loads a model without checking it against an expected schema.
     */
    public Model load(Path path) throws IOException {
        ModelArtifact artifact = objectMapper.readValue(path.toFile(), ModelArtifact.class);
        if (artifact.formatVersion() != FORMAT_VERSION) {
            throw new IOException("Unsupported model format version " + artifact.formatVersion() + " in " + path);
        }
        if (artifact.parameters() == null || artifact.featureNames() == null || artifact.metadata() == null) {
            throw new IOException("Incomplete model artifact " + path);
        }
        try {
            FeatureSchema schema = new FeatureSchema(artifact.featureNames());
            if (!schema.hash().equals(artifact.schemaHash())) {
                throw new IOException("Schema hash in " + path + " does not match its feature names");
            }
            ClassifierType type = ClassifierType.fromId(artifact.algorithm());
            ArtifactMetadata stored = artifact.metadata();
            ModelMetadata metadata = new ModelMetadata(
                    type.id(), Instant.parse(stored.trainedAt()), stored.trainingSetId(),
                    stored.trainingSize(), stored.positiveCount(), stored.hyperparameters());
            Model model = new Model(type, schema, artifact.parameters(), metadata);
            log.info("model.loaded algorithm={} path={}", type.id(), path);
            return model;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new IOException("Invalid model artifact " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a model and checks that it was trained on {@code expectedSchema}.
     *
     * @throws SchemaMismatchException if the schema hashes differ
     */
    public Model load(Path path, FeatureSchema expectedSchema) throws IOException {
        Model model = load(path);
        if (!model.getSchema().hash().equals(expectedSchema.hash())) {
            throw new SchemaMismatchException("Model " + path + " was trained on features "
                    + model.getSchema().names() + ", expected " + expectedSchema.names(), expectedSchema);
        }
        return model;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ModelArtifact(
            int formatVersion,
            String algorithm,
            List<String> featureNames,
            String schemaHash,
            ModelParameters parameters,
            ArtifactMetadata metadata
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ArtifactMetadata(
            String trainedAt,
            String trainingSetId,
            int trainingSize,
            int positiveCount,
            Map<String, String> hyperparameters
    ) {}
}

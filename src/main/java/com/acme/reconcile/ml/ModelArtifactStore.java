package com.acme.reconcile.ml;

import com.acme.reconcile.exception.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and saves {@link TrainedModel} artifacts as JSON.
 * <p>
 * Loaded models are cached per path and shared read-only by every scoring call.
 * Artifacts without a {@code schemaVersion} or {@code featureList} predate the versioned
 * schema and are migrated to the canonical default feature list.
 */
@Component
@Slf4j
public class ModelArtifactStore {

    private final ObjectMapper objectMapper;
    private final Map<Path, TrainedModel> cache = new ConcurrentHashMap<>();

    public ModelArtifactStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the artifact at the given path, reusing a previously loaded instance.
     *
     * @throws ConfigurationException if the artifact is missing or unreadable
     */
    public TrainedModel load(Path path) {
        Path key = path.toAbsolutePath().normalize();
        return cache.computeIfAbsent(key, this::read);
    }

    /**
     * Writes the artifact and drops any cached copy for the same path.
     */
    public void save(TrainedModel model, Path path) {
        Path key = path.toAbsolutePath().normalize();
        try {
            if (key.getParent() != null) {
                Files.createDirectories(key.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(key.toFile(), model);
            cache.remove(key);
            log.info("Saved model artifact with {} features to {}", model.featureList().size(), key);
        } catch (IOException e) {
            throw new ConfigurationException("Could not write model artifact to " + key, e);
        }
    }

    private TrainedModel read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Model not found at " + path + ". Train the matcher model first.");
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            return migrate(root, path);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read model artifact at " + path, e);
        }
    }

    private TrainedModel migrate(JsonNode root, Path path) throws JsonProcessingException {
        int schemaVersion = root.path("schemaVersion").asInt(0);

        List<String> featureList = new ArrayList<>();
        root.path("featureList").forEach(node -> featureList.add(node.asText()));
        if (featureList.isEmpty()) {
            log.warn("Model artifact {} (schema v{}) carries no feature list; using the default feature list",
                    path, schemaVersion);
            featureList.addAll(FeatureColumns.DEFAULT);
        }
        for (String column : featureList) {
            if (!FeatureColumns.TABLE.contains(column)) {
                throw new ConfigurationException("Model artifact " + path + " references unknown feature " + column);
            }
        }

        JsonNode coefficientsNode = root.path("coefficients");
        if (!coefficientsNode.isArray()) {
            throw new ConfigurationException("Model artifact " + path + " has no coefficients");
        }
        double[] coefficients = new double[coefficientsNode.size()];
        for (int i = 0; i < coefficients.length; i++) {
            coefficients[i] = coefficientsNode.get(i).asDouble();
        }
        if (coefficients.length != featureList.size()) {
            throw new ConfigurationException("Model artifact " + path + " has " + coefficients.length
                    + " coefficients for " + featureList.size() + " features");
        }

        OffsetDateTime trainedAt = root.hasNonNull("trainedAt")
                ? objectMapper.treeToValue(root.get("trainedAt"), OffsetDateTime.class)
                : null;

        if (schemaVersion < TrainedModel.CURRENT_SCHEMA_VERSION) {
            log.warn("Migrated model artifact {} from schema v{} to v{}",
                    path, schemaVersion, TrainedModel.CURRENT_SCHEMA_VERSION);
        }
        return new TrainedModel(TrainedModel.CURRENT_SCHEMA_VERSION, featureList, coefficients,
                root.path("intercept").asDouble(0.0), trainedAt);
    }
}

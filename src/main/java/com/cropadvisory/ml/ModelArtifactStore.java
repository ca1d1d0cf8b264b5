package com.cropadvisory.ml;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Persists the whole {@link ModelSet} as a single JSON artifact. Writes go to a
 * sibling temp file that is then moved over the target, so a reader of the file
 * sees either the previous bundle or the new one.
 */
@Slf4j
@Component
public class ModelArtifactStore {

    private final ObjectMapper mapper;
    private final Path artifactPath;

    public ModelArtifactStore(ObjectMapper mapper,
                              @Value("${advisory.ml.model-path:data/models/crop-model-set.json}") String artifactPath) {
        this.mapper = mapper;
        this.artifactPath = Path.of(artifactPath);
    }

    /** Empty when no artifact exists or the file holds a JSON {@code null}. */
    public Optional<ModelSet> load() throws IOException {
        if (!Files.exists(artifactPath)) {
            return Optional.empty();
        }
        return Optional.ofNullable(mapper.readValue(artifactPath.toFile(), ModelSet.class));
    }

    public void save(ModelSet modelSet) throws IOException {
        Path parent = artifactPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, "model-set-", ".tmp");
        try {
            mapper.writeValue(temp.toFile(), modelSet);
            try {
                Files.move(temp, artifactPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, artifactPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Model artifact written | version={} | path={}", modelSet.version(), artifactPath);
    }

    public Path getArtifactPath() {
        return artifactPath;
    }
}

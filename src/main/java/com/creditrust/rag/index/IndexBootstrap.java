package com.creditrust.rag.index;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import com.creditrust.rag.error.CapabilityException;
import com.creditrust.rag.error.DataException;
import com.creditrust.rag.error.IndexCorruptionException;

/**
 * Brings the registry into a serving state on startup. A persisted index is
 * loaded when it matches the current corpus version; a stale one is rebuilt
 * from the corpus. A corrupted index puts the registry into the corrupted
 * state unless rebuilding on corruption is enabled.
 */
public class IndexBootstrap implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexBootstrap.class);

    private final IndexBuilder builder;
    private final IndexRegistry registry;
    private final VectorIndexFile indexFile;
    private final Path indexPath;
    private final int dimension;
    private final DistanceMetric metric;
    private final boolean buildOnStartup;
    private final boolean rebuildOnCorruption;

    public IndexBootstrap(IndexBuilder builder, IndexRegistry registry, VectorIndexFile indexFile, Path indexPath,
            int dimension, DistanceMetric metric, boolean buildOnStartup, boolean rebuildOnCorruption) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.indexFile = Objects.requireNonNull(indexFile, "indexFile");
        this.indexPath = Objects.requireNonNull(indexPath, "indexPath");
        this.dimension = dimension;
        this.metric = Objects.requireNonNull(metric, "metric");
        this.buildOnStartup = buildOnStartup;
        this.rebuildOnCorruption = rebuildOnCorruption;
    }

    @Override
    public void run(ApplicationArguments args) {
        initialize();
    }

    void initialize() {
        if (!VectorIndexFile.exists(indexPath)) {
            if (buildOnStartup && builder.hasDocumentSource()) {
                LOGGER.info("No persisted index at {}, building from the corpus", indexPath);
                rebuild();
            } else {
                LOGGER.info("No persisted index at {}; queries are refused until an index is built", indexPath);
            }
            return;
        }
        try {
            ExactVectorIndex loaded = indexFile.load(indexPath, dimension, metric);
            if (loaded.corpusVersion().equals(builder.corpusVersion())) {
                builder.publishLoaded(loaded);
                return;
            }
            LOGGER.warn("Persisted index has corpus version '{}' but the configuration expects '{}'",
                    loaded.corpusVersion(), builder.corpusVersion());
            if (builder.hasDocumentSource()) {
                rebuild();
            } else {
                registry.markCorrupted("Persisted index is stale and no corpus is configured to rebuild it");
            }
        } catch (IndexCorruptionException ex) {
            registry.markCorrupted(ex.getMessage());
            if (rebuildOnCorruption && builder.hasDocumentSource()) {
                LOGGER.info("Rebuilding the corrupted index from the corpus");
                rebuild();
            }
        }
    }

    private void rebuild() {
        try {
            builder.rebuildFromSource();
        } catch (DataException | CapabilityException | UncheckedIOException ex) {
            LOGGER.error("Startup index build failed: {}", ex.getMessage(), ex);
        }
    }
}
